package com.example.loyaltyhook.model;

import lombok.Builder;
import lombok.Value;

/**
 * 单次入站投递的原始内容。只在一次请求内存在，不做持久化。
 */
@Value
@Builder
public class WebhookEvent {

    WebhookTopic topic;

    String shopDomain;

    byte[] rawBody;

    /**
     * X-Shopify-Hmac-Sha256 请求头，可能为空。
     */
    String signatureHeader;

    /**
     * 平台声明的主题（X-Shopify-Topic），用于与端点主题比对。
     */
    String topicHeader;

    String webhookId;

    String apiVersion;

    public byte[] getRawBody() {
        return rawBody == null ? new byte[0] : rawBody.clone();
    }
}
