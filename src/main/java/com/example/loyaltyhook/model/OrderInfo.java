package com.example.loyaltyhook.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 orders/paid 载荷中解析出的订单信息。orderId 与 totalPrice 为必填。
 */
@Value
@Builder
public class OrderInfo {

    String orderId;

    String orderNumber;

    BigDecimal totalPrice;

    String currency;

    @Singular
    List<LineItem> lineItems;

    /**
     * 游客结账时为空。
     */
    String customerId;

    /**
     * 缺失的必填字段名，全部存在时为空列表。
     */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (orderId == null || orderId.isBlank()) {
            missing.add("orderId");
        }
        if (totalPrice == null) {
            missing.add("totalPrice");
        }
        return missing;
    }

    /**
     * 用于响应消息展示，优先使用订单号。
     */
    public String displayName() {
        return orderNumber != null ? orderNumber : orderId;
    }
}
