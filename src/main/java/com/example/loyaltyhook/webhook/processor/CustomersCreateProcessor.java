package com.example.loyaltyhook.webhook.processor;

import com.example.loyaltyhook.client.LoyaltyServiceClient;
import com.example.loyaltyhook.client.dto.CustomerProfileRequest;
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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * customers/create：为新客户建立零余额的积分档案。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomersCreateProcessor implements WebhookProcessor {

    private final WebhookPayloadParser parser;
    private final LoyaltyServiceClient loyaltyClient;

    @Override
    public WebhookTopic topic() {
        return WebhookTopic.CUSTOMERS_CREATE;
    }

    @Override
    public ProcessingResult processWebhook(WebhookContext context) {
        CustomerInfo customer = parser.parseCustomer(context.getPayload());
        if (customer.getCustomerId() == null) {
            return ProcessingResult.failure("No customer ID found in customer creation request");
        }

        // The customer id doubles as reference id: one profile per customer
        JsonNode profileResult = loyaltyClient.createCustomerProfile(CustomerProfileRequest.builder()
                .customerId(customer.getCustomerId())
                .email(customer.getEmail())
                .firstName(customer.getFirstName())
                .lastName(customer.getLastName())
                .shop(context.getShopDomain())
                .initialPoints(0)
                .createdVia("webhook")
                .referenceId(customer.getCustomerId())
                .webhookSource(topic().getValue())
                .build());

        log.info("Initial loyalty profile created for customer {} (shop {})", customer.getCustomerId(),
                context.getShopDomain());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("customerId", customer.getCustomerId());
        data.put("customerEmail", customer.getEmail());
        data.put("profileResult", profileResult);
        return ProcessingResult.success("Initial loyalty profile created for customer " + customer.getCustomerId(),
                data);
    }
}
