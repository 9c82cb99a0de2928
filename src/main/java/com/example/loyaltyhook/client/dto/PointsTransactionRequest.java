package com.example.loyaltyhook.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 积分发放 / 扣减请求。referenceId 为平台事件 ID，后端据此去重。
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PointsTransactionRequest {

    public static final String EARNED = "earned";
    public static final String DEDUCTED = "deducted";

    String customerId;

    long points;

    String transactionType;

    String reason;

    String referenceId;

    Map<String, Object> metadata;
}
