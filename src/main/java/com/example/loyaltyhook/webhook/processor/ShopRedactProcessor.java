package com.example.loyaltyhook.webhook.processor;

import com.example.loyaltyhook.client.LoyaltyServiceClient;
import com.example.loyaltyhook.client.dto.ComplianceRequest;
import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.ShopInfo;
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
 * shop/redact：删除店铺的全部积分数据。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShopRedactProcessor implements WebhookProcessor {

    private final WebhookPayloadParser parser;
    private final LoyaltyServiceClient loyaltyClient;

    @Override
    public WebhookTopic topic() {
        return WebhookTopic.SHOP_REDACT;
    }

    @Override
    public ProcessingResult processWebhook(WebhookContext context) {
        ShopInfo shop = parser.parseShop(context.getPayload(), context.getShopDomain());
        if (shop.getShopDomain() == null) {
            return ProcessingResult.failure("No shop domain found in redaction request");
        }

        JsonNode redactionResult = loyaltyClient.redactShop(ComplianceRequest.builder()
                .shopDomain(shop.getShopDomain())
                .shopId(shop.getShopId())
                .redactionType("full")
                .requestedAt(Instant.now().toString())
                .referenceId(context.getWebhookId())
                .webhookSource(topic().getValue())
                .build());

        log.warn("All loyalty data redacted for shop {}", shop.getShopDomain());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("shopId", shop.getShopId());
        data.put("shopDomain", shop.getShopDomain());
        data.put("redactionResult", redactionResult);
        return ProcessingResult.success("Shop data redacted successfully for shop " + shop.getShopDomain(), data);
    }
}
