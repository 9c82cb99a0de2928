package com.example.loyaltyhook.points;

import com.example.loyaltyhook.config.PointsProperties;
import com.example.loyaltyhook.model.OriginalOrder;
import com.example.loyaltyhook.model.PointsCalculationResult;
import com.example.loyaltyhook.model.RefundInfo;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 退款扣分：按退款金额占订单总额的比例扣减原发放积分，比例封顶 1。
 */
@Component
public class RefundPointsCalculator {

    private static final int RATIO_SCALE = 4;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final BigDecimal fullRefundRatio;

    public RefundPointsCalculator(PointsProperties properties) {
        this.fullRefundRatio = properties.getFullRefundRatio();
    }

    public PointsCalculationResult calculate(RefundInfo refund, OriginalOrder order) {
        BigDecimal refundAmount = refund.getTotalRefundAmount() == null ? BigDecimal.ZERO : refund.getTotalRefundAmount();
        BigDecimal orderTotal = order.getOrderTotal() == null ? BigDecimal.ZERO : order.getOrderTotal();
        long originalPoints = Math.max(0, order.getPointsAwarded());

        if (refundAmount.signum() <= 0 || orderTotal.signum() <= 0) {
            return PointsCalculationResult.none("Invalid refund or order amount");
        }

        // floor(originalPoints * refund / total) computed without an intermediate rounded ratio
        BigDecimal cappedRefund = refundAmount.min(orderTotal);
        long pointsToDeduct = BigDecimal.valueOf(originalPoints)
                .multiply(cappedRefund)
                .divide(orderTotal, 0, RoundingMode.FLOOR)
                .longValueExact();

        String amount = refundAmount.setScale(2, RoundingMode.HALF_UP).toPlainString();

        String reason;
        if (reachesFullRefundRatio(cappedRefund, orderTotal)) {
            reason = "Full refund: $" + amount;
        } else {
            BigDecimal ratio = cappedRefund.divide(orderTotal, RATIO_SCALE, RoundingMode.HALF_UP);
            reason = "Refund: $" + amount + " ("
                    + ratio.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString() + "% of order)";
        }

        return new PointsCalculationResult(Math.min(pointsToDeduct, originalPoints), reason);
    }

    /**
     * 仅用于消息展示，不影响扣分公式。
     */
    public boolean isFullRefund(RefundInfo refund, OriginalOrder order) {
        BigDecimal orderTotal = order.getOrderTotal();
        if (orderTotal == null || orderTotal.signum() <= 0 || refund.getTotalRefundAmount() == null) {
            return false;
        }
        return reachesFullRefundRatio(refund.getTotalRefundAmount().min(orderTotal), orderTotal);
    }

    // refund / total >= ratio, compared exactly as refund >= total * ratio
    private boolean reachesFullRefundRatio(BigDecimal cappedRefund, BigDecimal orderTotal) {
        return cappedRefund.compareTo(orderTotal.multiply(fullRefundRatio)) >= 0;
    }
}
