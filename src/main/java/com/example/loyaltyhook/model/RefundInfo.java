package com.example.loyaltyhook.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 refunds/create 载荷中解析出的退款信息。refundId 与 orderId 为必填。
 */
@Value
@Builder
public class RefundInfo {

    String refundId;

    String orderId;

    @Builder.Default
    BigDecimal totalRefundAmount = BigDecimal.ZERO;

    String currency;

    @Singular
    List<RefundLineItem> refundLineItems;

    OffsetDateTime createdAt;

    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (refundId == null || refundId.isBlank()) {
            missing.add("refundId");
        }
        if (orderId == null || orderId.isBlank()) {
            missing.add("orderId");
        }
        return missing;
    }
}
