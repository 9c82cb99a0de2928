package com.example.loyaltyhook.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TierEvaluationRequest {

    public static final String ORDER_COMPLETED = "order_completed";
    public static final String REFUND_PROCESSED = "refund_processed";

    String customerId;

    String trigger;

    Map<String, Object> metadata;
}
