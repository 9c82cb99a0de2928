package com.example.loyaltyhook.support;

import com.example.loyaltyhook.model.WebhookContext;
import com.example.loyaltyhook.model.WebhookTopic;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * 测试用的签名与载荷工具。
 */
public final class WebhookTestSupport {

    public static final String SECRET = "test-webhook-secret";
    public static final String SHOP = "test-shop.myshopify.com";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WebhookTestSupport() {
    }

    public static String sign(String body) {
        return sign(body.getBytes(StandardCharsets.UTF_8), SECRET);
    }

    public static String sign(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return Base64.getEncoder().encodeToString(mac.doFinal(body));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    public static JsonNode json(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    public static WebhookContext context(WebhookTopic topic, String json) {
        return WebhookContext.builder()
                .topic(topic)
                .shopDomain(SHOP)
                .webhookId("webhook-123")
                .apiVersion("2024-01")
                .payload(json(json))
                .build();
    }

    public static String paidOrder(String customerId, String totalPrice) {
        String customer = customerId == null ? "" : "\"customer\":{\"id\":" + customerId + "},";
        return "{\"id\":12345,\"order_number\":1001," + customer
                + "\"total_price\":\"" + totalPrice + "\",\"currency\":\"USD\",\"line_items\":[]}";
    }
}
