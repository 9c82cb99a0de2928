package com.example.loyaltyhook.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LoyaltyApiPropertiesTest {

    @Test
    void defaultsFitInsideDeliveryWindow() {
        LoyaltyApiProperties properties = new LoyaltyApiProperties();

        Duration worstCase = properties.worstCaseDuration(LoyaltyApiProperties.MAX_CALLS_PER_WEBHOOK);

        assertThat(worstCase).isEqualTo(Duration.ofMillis(4500));
        assertThat(worstCase).isLessThanOrEqualTo(properties.getDeliveryWindow());
    }

    @Test
    void worstCaseCountsEveryAttemptAndBackoff() {
        LoyaltyApiProperties properties = new LoyaltyApiProperties();
        properties.setRequestTimeout(Duration.ofSeconds(2));
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setDelayMs(100);

        // 3 x 2s + 100ms + 200ms per call
        assertThat(properties.worstCaseDuration(2)).isEqualTo(Duration.ofMillis(12600));
        assertThat(properties.worstCaseDuration(2)).isGreaterThan(properties.getDeliveryWindow());
    }
}
