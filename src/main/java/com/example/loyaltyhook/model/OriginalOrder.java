package com.example.loyaltyhook.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 积分后端记录的原始订单（GET /api/orders/{id}）。
 */
@Value
@Builder
public class OriginalOrder {

    String orderId;

    String customerId;

    long pointsAwarded;

    BigDecimal orderTotal;
}
