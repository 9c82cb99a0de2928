package com.example.loyaltyhook.points;

import com.example.loyaltyhook.config.PointsProperties;
import com.example.loyaltyhook.model.LineItem;
import com.example.loyaltyhook.model.OrderInfo;
import com.example.loyaltyhook.model.PointsCalculationResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 订单积分计算：1 元 1 分（向下取整），大额订单奖励与商品类目奖励叠加。
 * 纯函数，同一订单总是得到相同结果。
 */
@Component
public class OrderPointsCalculator {

    private final BigDecimal minimumOrderAmount;
    private final BigDecimal largeOrderThreshold;
    private final BigDecimal largeOrderBonusRate;
    private final Map<String, BigDecimal> categoryMultipliers;
    private final Set<String> supportedCurrencies;

    public OrderPointsCalculator(PointsProperties properties) {
        this.minimumOrderAmount = properties.getMinimumOrderAmount();
        this.largeOrderThreshold = properties.getLargeOrderThreshold();
        this.largeOrderBonusRate = properties.getLargeOrderBonusRate();

        Map<String, BigDecimal> multipliers = new HashMap<>();
        properties.getCategoryMultipliers().forEach((type, multiplier) -> multipliers.put(normalize(type), multiplier));
        this.categoryMultipliers = Map.copyOf(multipliers);

        this.supportedCurrencies = properties.getSupportedCurrencies().stream()
                .map(currency -> currency.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * 计算订单应得积分。
     *
     * @param order 订单
     * @return 积分及审计说明
     */
    public PointsCalculationResult calculate(OrderInfo order) {
        BigDecimal totalPrice = order.getTotalPrice() == null ? BigDecimal.ZERO : order.getTotalPrice();

        if (!isCurrencySupported(order.getCurrency())) {
            return PointsCalculationResult.none("Currency " + order.getCurrency() + " not supported for points");
        }

        if (totalPrice.compareTo(minimumOrderAmount) < 0) {
            return PointsCalculationResult.none("Order below minimum threshold");
        }

        long points = floor(totalPrice);
        StringBuilder reason = new StringBuilder("Order purchase: $")
                .append(totalPrice.setScale(2, RoundingMode.HALF_UP).toPlainString());

        if (totalPrice.compareTo(largeOrderThreshold) >= 0) {
            long bonus = floor(totalPrice.multiply(largeOrderBonusRate));
            points += bonus;
            reason.append(" (includes ").append(bonus).append(" bonus points for large order)");
        }

        long categoryBonus = calculateCategoryBonus(order.getLineItems());
        if (categoryBonus > 0) {
            points += categoryBonus;
            reason.append(" (includes ").append(categoryBonus).append(" category bonus points)");
        }

        return new PointsCalculationResult(points, reason.toString());
    }

    /**
     * 类目奖励：只计入倍率超出 1 倍的部分，即 floor(price * quantity * (multiplier - 1))，逐行累加。
     */
    public long calculateCategoryBonus(List<LineItem> lineItems) {
        if (lineItems == null) {
            return 0;
        }
        long bonus = 0;
        for (LineItem item : lineItems) {
            if (item.getProductType() == null || item.getPrice() == null) {
                continue;
            }
            BigDecimal multiplier = categoryMultipliers.get(normalize(item.getProductType()));
            if (multiplier == null || multiplier.compareTo(BigDecimal.ONE) <= 0) {
                continue;
            }
            BigDecimal lineTotal = item.getPrice().multiply(BigDecimal.valueOf(item.getQuantity()));
            if (lineTotal.signum() <= 0) {
                continue;
            }
            bonus += floor(lineTotal.multiply(multiplier.subtract(BigDecimal.ONE)));
        }
        return bonus;
    }

    private boolean isCurrencySupported(String currency) {
        if (supportedCurrencies.isEmpty() || currency == null) {
            return true;
        }
        return supportedCurrencies.contains(currency.trim().toUpperCase(Locale.ROOT));
    }

    private static long floor(BigDecimal value) {
        return value.setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    private static String normalize(String productType) {
        return productType.trim().toLowerCase(Locale.ROOT);
    }
}
