package com.example.loyaltyhook.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * 验签与解析完成后交给主题处理器的上下文。
 */
@Value
@Builder
public class WebhookContext {

    WebhookTopic topic;

    String shopDomain;

    String webhookId;

    String apiVersion;

    JsonNode payload;
}
