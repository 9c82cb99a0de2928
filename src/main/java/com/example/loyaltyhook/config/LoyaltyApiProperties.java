package com.example.loyaltyhook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 积分后端（Loyalty API）连接配置。
 */
@Data
@ConfigurationProperties(prefix = "loyalty.api")
public class LoyaltyApiProperties {

    /**
     * 单个 Webhook 最多串行调用后端的次数（refunds/create：查询订单、扣分、等级重算）。
     */
    public static final int MAX_CALLS_PER_WEBHOOK = 3;

    private String baseUrl = "http://localhost:8000";

    /**
     * 以 X-API-Key 请求头发送。
     */
    private String apiKey = "dev-key";

    private Duration connectTimeout = Duration.ofSeconds(1);

    private Duration requestTimeout = Duration.ofMillis(1500);

    /**
     * 平台等待 Webhook 响应的时间窗口，超时即视为投递失败并重投。
     */
    private Duration deliveryWindow = Duration.ofSeconds(5);

    private Retry retry = new Retry();

    /**
     * 按当前超时与重试配置，串行调用 calls 次后端的最长耗时。
     * 每次尝试以 requestTimeout 为上限，重试间隔按 2 倍递增。
     */
    public Duration worstCaseDuration(int calls) {
        Duration perCall = requestTimeout.multipliedBy(retry.getMaxAttempts());
        long backoff = retry.getDelayMs();
        for (int attempt = 1; attempt < retry.getMaxAttempts(); attempt++) {
            perCall = perCall.plusMillis(backoff);
            backoff *= 2;
        }
        return perCall.multipliedBy(calls);
    }

    @Data
    public static class Retry {
        /**
         * 默认不在进程内重试：平台对非 2xx 响应会自行重投。
         */
        private int maxAttempts = 1;
        private long delayMs = 100;
    }
}
