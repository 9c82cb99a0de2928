package com.example.loyaltyhook.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CustomerInfo {

    String customerId;

    String email;

    String firstName;

    String lastName;
}
