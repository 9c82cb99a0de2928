package com.example.loyaltyhook.webhook.processor;

import com.example.loyaltyhook.client.LoyaltyServiceClient;
import com.example.loyaltyhook.client.dto.AppUninstallRequest;
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
 * app/uninstalled：软删除店铺数据，保留以便重新安装时恢复。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AppUninstalledProcessor implements WebhookProcessor {

    private final WebhookPayloadParser parser;
    private final LoyaltyServiceClient loyaltyClient;

    @Override
    public WebhookTopic topic() {
        return WebhookTopic.APP_UNINSTALLED;
    }

    @Override
    public ProcessingResult processWebhook(WebhookContext context) {
        ShopInfo shop = parser.parseShop(context.getPayload(), context.getShopDomain());
        if (shop.getShopDomain() == null) {
            return ProcessingResult.failure("No shop domain found in uninstall request");
        }

        JsonNode cleanupResult = loyaltyClient.uninstallApp(AppUninstallRequest.builder()
                .shopDomain(shop.getShopDomain())
                .shopId(shop.getShopId())
                .uninstalledAt(Instant.now().toString())
                .cleanupType(AppUninstallRequest.SOFT_DELETE)
                .referenceId(context.getWebhookId())
                .webhookSource(topic().getValue())
                .build());

        log.info("App uninstall cleanup completed for shop {}", shop.getShopDomain());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("shopId", shop.getShopId());
        data.put("shopDomain", shop.getShopDomain());
        data.put("cleanupResult", cleanupResult);
        return ProcessingResult.success("App uninstall cleanup completed for shop " + shop.getShopDomain(), data);
    }
}
