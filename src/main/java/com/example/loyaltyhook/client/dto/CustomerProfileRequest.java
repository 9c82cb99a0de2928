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
public class CustomerProfileRequest {

    String customerId;

    String email;

    String firstName;

    String lastName;

    String shop;

    long initialPoints;

    String createdVia;

    String referenceId;

    String webhookSource;
}
