package com.example.loyaltyhook.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class LineItem {

    String productType;

    @Builder.Default
    int quantity = 1;

    @Builder.Default
    BigDecimal price = BigDecimal.ZERO;
}
