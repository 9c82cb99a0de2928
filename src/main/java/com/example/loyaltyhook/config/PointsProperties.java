package com.example.loyaltyhook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 积分计算规则配置。
 */
@Data
@ConfigurationProperties(prefix = "loyalty.points")
public class PointsProperties {

    private BigDecimal minimumOrderAmount = BigDecimal.ONE;

    private BigDecimal largeOrderThreshold = new BigDecimal("100");

    private BigDecimal largeOrderBonusRate = new BigDecimal("0.1");

    /**
     * 商品类型 -> 积分倍率。只有超出 1 倍的部分计入类目奖励。
     */
    private Map<String, BigDecimal> categoryMultipliers = defaultCategoryMultipliers();

    /**
     * 为空表示不限制币种。
     */
    private List<String> supportedCurrencies = new ArrayList<>();

    private BigDecimal fullRefundRatio = new BigDecimal("0.99");

    private static Map<String, BigDecimal> defaultCategoryMultipliers() {
        Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
        multipliers.put("electronics", new BigDecimal("2"));
        multipliers.put("books", new BigDecimal("1.5"));
        multipliers.put("clothing", new BigDecimal("1.2"));
        return multipliers;
    }
}
