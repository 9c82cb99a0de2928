package com.example.loyaltyhook.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AppUninstallRequest {

    // Data is kept so a reinstall can restore it
    public static final String SOFT_DELETE = "soft_delete";

    String shopDomain;

    String shopId;

    String uninstalledAt;

    String cleanupType;

    String referenceId;

    String webhookSource;
}
