package com.example.loyaltyhook.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 支持的 Webhook 主题，每个主题对应一个处理器。
 */
public enum WebhookTopic {

    ORDERS_PAID("orders/paid", "Awards loyalty points for paid orders"),
    REFUNDS_CREATE("refunds/create", "Deducts loyalty points for refunded orders"),
    CUSTOMERS_CREATE("customers/create", "Creates initial loyalty profiles for new customers"),
    CUSTOMERS_REDACT("customers/redact", "Handles customer data deletion requests (GDPR compliance)"),
    CUSTOMERS_DATA_REQUEST("customers/data_request", "Handles customer data export requests (GDPR compliance)"),
    SHOP_REDACT("shop/redact", "Handles shop data deletion requests (GDPR compliance)"),
    APP_UNINSTALLED("app/uninstalled", "Handles app uninstallation cleanup");

    private final String value;
    private final String description;

    WebhookTopic(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 按平台主题名查找，例如 "orders/paid"。
     */
    public static Optional<WebhookTopic> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(topic -> topic.value.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}
