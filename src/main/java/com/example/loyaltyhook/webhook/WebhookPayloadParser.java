package com.example.loyaltyhook.webhook;

import com.example.loyaltyhook.model.CustomerInfo;
import com.example.loyaltyhook.model.LineItem;
import com.example.loyaltyhook.model.OrderInfo;
import com.example.loyaltyhook.model.RefundInfo;
import com.example.loyaltyhook.model.RefundLineItem;
import com.example.loyaltyhook.model.ShopInfo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * 将平台载荷转换为领域对象。数字字段兼容字符串与数值两种写法。
 */
@Component
@Slf4j
public class WebhookPayloadParser {

    private static final String DEFAULT_CURRENCY = "USD";
    private static final int MAX_INTEGER_DIGITS = 18;
    private static final int MAX_FRACTION_DIGITS = 18;

    public OrderInfo parseOrder(JsonNode payload) {
        OrderInfo.OrderInfoBuilder builder = OrderInfo.builder()
                .orderId(text(payload.get("id")))
                .orderNumber(firstNonNull(text(payload.get("order_number")), text(payload.get("name"))))
                .totalPrice(decimal(payload.get("total_price")))
                .currency(firstNonNull(text(payload.get("currency")), DEFAULT_CURRENCY))
                .customerId(text(payload.path("customer").get("id")));

        for (JsonNode item : payload.path("line_items")) {
            builder.lineItem(LineItem.builder()
                    .productType(firstNonNull(text(item.path("product").get("product_type")),
                            text(item.get("product_type"))))
                    .quantity(integer(item.get("quantity"), 1))
                    .price(firstNonNull(decimal(item.get("price")), BigDecimal.ZERO))
                    .build());
        }
        return builder.build();
    }

    public RefundInfo parseRefund(JsonNode payload) {
        BigDecimal totalRefunded = decimal(payload.get("total_refunded_amount"));
        if (totalRefunded == null) {
            totalRefunded = sumRefundTransactions(payload.path("transactions"));
        }

        RefundInfo.RefundInfoBuilder builder = RefundInfo.builder()
                .refundId(text(payload.get("id")))
                .orderId(text(payload.get("order_id")))
                .totalRefundAmount(totalRefunded)
                .currency(text(payload.get("currency")))
                .createdAt(timestamp(payload.get("created_at")));

        for (JsonNode item : payload.path("refund_line_items")) {
            builder.refundLineItem(RefundLineItem.builder()
                    .lineItemId(text(item.get("line_item_id")))
                    .quantity(integer(item.get("quantity"), 0))
                    .price(decimal(item.path("line_item").get("price")))
                    .subtotal(decimal(item.get("subtotal")))
                    .build());
        }
        return builder.build();
    }

    /**
     * 客户信息可能嵌套在 customer 节点下，也可能就是载荷本身（customers/create）。
     */
    public CustomerInfo parseCustomer(JsonNode payload) {
        JsonNode customer = payload.path("customer").isObject() ? payload.get("customer") : payload;
        return CustomerInfo.builder()
                .customerId(firstNonNull(text(customer.get("id")), text(payload.get("customer_id"))))
                .email(firstNonNull(text(customer.get("email")), text(payload.get("email"))))
                .firstName(text(customer.get("first_name")))
                .lastName(text(customer.get("last_name")))
                .build();
    }

    /**
     * 店铺域名优先取载荷，缺失时回退到请求头中的域名。
     */
    public ShopInfo parseShop(JsonNode payload, String headerShopDomain) {
        String domain = firstNonNull(text(payload.get("shop_domain")), text(payload.get("myshopify_domain")));
        domain = firstNonNull(domain, text(payload.get("domain")));
        return ShopInfo.builder()
                .shopDomain(firstNonNull(domain, blankToNull(headerShopDomain)))
                .shopId(firstNonNull(text(payload.get("shop_id")), text(payload.get("id"))))
                .build();
    }

    private BigDecimal sumRefundTransactions(JsonNode transactions) {
        BigDecimal sum = BigDecimal.ZERO;
        for (JsonNode transaction : transactions) {
            if (!"refund".equalsIgnoreCase(transaction.path("kind").asText())) {
                continue;
            }
            BigDecimal amount = decimal(transaction.get("amount"));
            if (amount != null) {
                sum = sum.add(amount);
            }
        }
        return sum;
    }

    static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        return blankToNull(node.asText());
    }

    static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String raw = node.asText();
        BigDecimal value;
        try {
            if (node.isNumber()) {
                value = node.decimalValue();
            } else {
                raw = blankToNull(raw);
                if (raw == null) {
                    return null;
                }
                value = new BigDecimal(raw.trim());
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric amount '{}'", raw);
            return null;
        }
        if (value.precision() - value.scale() > MAX_INTEGER_DIGITS || value.scale() > MAX_FRACTION_DIGITS) {
            log.warn("Ignoring out-of-range amount '{}'", raw);
            return null;
        }
        return value;
    }

    private static int integer(JsonNode node, int defaultValue) {
        BigDecimal value = decimal(node);
        if (value == null) {
            return defaultValue;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            log.warn("Ignoring non-integer quantity '{}'", value);
            return defaultValue;
        }
    }

    private static OffsetDateTime timestamp(JsonNode node) {
        String value = text(node);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}'", value);
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }
}
