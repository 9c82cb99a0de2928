package com.example.loyaltyhook.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ShopInfo {

    String shopDomain;

    /**
     * 可选。
     */
    String shopId;
}
