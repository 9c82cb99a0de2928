package com.example.loyaltyhook.webhook.processor;

import com.example.loyaltyhook.client.LoyaltyServiceClient;
import com.example.loyaltyhook.client.dto.ComplianceRequest;
import com.example.loyaltyhook.model.CustomerInfo;
import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.WebhookContext;
import com.example.loyaltyhook.model.WebhookTopic;
import com.example.loyaltyhook.webhook.WebhookPayloadParser;
import com.example.loyaltyhook.webhook.WebhookProcessor;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * customers/data_request：生成客户积分数据的 JSON 导出（GDPR 访问权）。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomersDataRequestProcessor implements WebhookProcessor {

    private final WebhookPayloadParser parser;
    private final LoyaltyServiceClient loyaltyClient;

    @Override
    public WebhookTopic topic() {
        return WebhookTopic.CUSTOMERS_DATA_REQUEST;
    }

    @Override
    public ProcessingResult processWebhook(WebhookContext context) {
        CustomerInfo customer = parser.parseCustomer(context.getPayload());
        if (customer.getCustomerId() == null) {
            return ProcessingResult.failure("No customer ID found in data request");
        }

        String shop = parser.parseShop(context.getPayload(), context.getShopDomain()).getShopDomain();
        JsonNode exportResult = loyaltyClient.exportCustomerData(ComplianceRequest.builder()
                .customerId(customer.getCustomerId())
                .shop(shop)
                .exportFormat("json")
                .requestedAt(Instant.now().toString())
                .referenceId(context.getWebhookId())
                .webhookSource(topic().getValue())
                .build());

        log.info("Data export requested for customer {} of shop {}", customer.getCustomerId(), shop);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("customerId", customer.getCustomerId());
        data.put("customerEmail", customer.getEmail());
        data.put("exportResult", exportResult);
        return ProcessingResult.success(
                "Customer data export generated successfully for customer " + customer.getCustomerId(), data);
    }
}
