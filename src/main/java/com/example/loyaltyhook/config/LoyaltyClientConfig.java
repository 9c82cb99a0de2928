package com.example.loyaltyhook.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
@Slf4j
public class LoyaltyClientConfig {

    @Bean
    public HttpClient loyaltyHttpClient(LoyaltyApiProperties properties) {
        Duration worstCase = properties.worstCaseDuration(LoyaltyApiProperties.MAX_CALLS_PER_WEBHOOK);
        if (worstCase.compareTo(properties.getDeliveryWindow()) > 0) {
            log.warn("Loyalty API worst case of {} for {} sequential calls exceeds the webhook delivery window of {};"
                    + " lower loyalty.api.request-timeout or loyalty.api.retry.max-attempts", worstCase,
                    LoyaltyApiProperties.MAX_CALLS_PER_WEBHOOK, properties.getDeliveryWindow());
        }
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }
}
