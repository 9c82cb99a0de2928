package com.example.loyaltyhook.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * 客户脱敏、数据导出与店铺脱敏共用的请求体。
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplianceRequest {

    String customerId;

    /**
     * 客户级请求中的店铺域名。
     */
    String shop;

    String shopDomain;

    String shopId;

    String redactionType;

    String exportFormat;

    String requestedAt;

    String referenceId;

    String webhookSource;
}
