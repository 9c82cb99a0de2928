package com.example.loyaltyhook.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RefundLineItem {

    String lineItemId;

    int quantity;

    BigDecimal price;

    BigDecimal subtotal;
}
