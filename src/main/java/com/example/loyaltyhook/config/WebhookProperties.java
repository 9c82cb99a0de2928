package com.example.loyaltyhook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Webhook 摄入配置。
 */
@Data
@ConfigurationProperties(prefix = "loyalty.webhook")
public class WebhookProperties {

    /**
     * HMAC 共享密钥，为空时所有投递都会被拒绝。
     */
    private String secret;

    /**
     * /webhooks/** 请求体上限（字节）。
     */
    private long maxBodyBytes = 2 * 1024 * 1024;
}
