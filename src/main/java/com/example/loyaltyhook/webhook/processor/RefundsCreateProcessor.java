package com.example.loyaltyhook.webhook.processor;

import com.example.loyaltyhook.client.LoyaltyServiceClient;
import com.example.loyaltyhook.client.dto.PointsTransactionRequest;
import com.example.loyaltyhook.client.dto.TierEvaluationRequest;
import com.example.loyaltyhook.exception.LoyaltyServiceException;
import com.example.loyaltyhook.model.OriginalOrder;
import com.example.loyaltyhook.model.PointsCalculationResult;
import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.RefundInfo;
import com.example.loyaltyhook.model.WebhookContext;
import com.example.loyaltyhook.model.WebhookTopic;
import com.example.loyaltyhook.points.RefundPointsCalculator;
import com.example.loyaltyhook.webhook.WebhookMetrics;
import com.example.loyaltyhook.webhook.WebhookPayloadParser;
import com.example.loyaltyhook.webhook.WebhookProcessor;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * refunds/create：按退款比例扣减原订单发放的积分，并触发会员等级重算。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefundsCreateProcessor implements WebhookProcessor {

    private final WebhookPayloadParser parser;
    private final RefundPointsCalculator calculator;
    private final LoyaltyServiceClient loyaltyClient;
    private final WebhookMetrics metrics;

    @Override
    public WebhookTopic topic() {
        return WebhookTopic.REFUNDS_CREATE;
    }

    @Override
    public ProcessingResult processWebhook(WebhookContext context) {
        RefundInfo refund = parser.parseRefund(context.getPayload());

        List<String> missing = refund.missingRequiredFields();
        if (!missing.isEmpty()) {
            return ProcessingResult.failure("Missing required refund fields: " + String.join(", ", missing));
        }

        Optional<OriginalOrder> original = lookupOriginalOrder(refund.getOrderId());
        if (original.isEmpty() || original.get().getCustomerId() == null) {
            log.info("Refund {} for order {} has no loyalty customer, skipping deduction", refund.getRefundId(),
                    refund.getOrderId());
            return ProcessingResult.success("Refund processed but no customer found for points deduction",
                    summary(refund, null, 0, null));
        }
        OriginalOrder order = original.get();

        PointsCalculationResult calculation = calculator.calculate(refund, order);
        if (calculation.getPoints() == 0) {
            log.info("Refund {} deducts no points: {}", refund.getRefundId(), calculation.getReason());
            return ProcessingResult.success("Refund processed but no points deducted (" + calculation.getReason() + ")",
                    summary(refund, order.getCustomerId(), 0, calculation.getReason()));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("original_order_id", refund.getOrderId());
        metadata.put("refund_amount", refund.getTotalRefundAmount());
        metadata.put("full_refund", calculator.isFullRefund(refund, order));
        metadata.put("shop", context.getShopDomain());
        metadata.put("refund_items_count", refund.getRefundLineItems().size());
        metadata.put("webhook_source", topic().getValue());

        JsonNode loyaltyResult = loyaltyClient.deductPoints(PointsTransactionRequest.builder()
                .customerId(order.getCustomerId())
                .points(calculation.getPoints())
                .transactionType(PointsTransactionRequest.DEDUCTED)
                .reason(calculation.getReason())
                .referenceId(refund.getRefundId())
                .metadata(metadata)
                .build());
        metrics.recordPointsDeducted(calculation.getPoints());

        Map<String, Object> tierMetadata = new LinkedHashMap<>();
        tierMetadata.put("refund_id", refund.getRefundId());
        tierMetadata.put("points_deducted", calculation.getPoints());
        loyaltyClient.evaluateTier(TierEvaluationRequest.builder()
                .customerId(order.getCustomerId())
                .trigger(TierEvaluationRequest.REFUND_PROCESSED)
                .metadata(tierMetadata)
                .build());

        log.info("Deducted {} points from customer {} for refund {} of order {}", calculation.getPoints(),
                order.getCustomerId(), refund.getRefundId(), refund.getOrderId());

        Map<String, Object> data = summary(refund, order.getCustomerId(), calculation.getPoints(),
                calculation.getReason());
        data.put("loyaltyResult", loyaltyResult);
        return ProcessingResult.success("Successfully deducted " + calculation.getPoints() + " points for refund "
                + refund.getRefundId(), data);
    }

    /**
     * 原订单不可用（未知或后端故障）时视为无需扣分。
     */
    private Optional<OriginalOrder> lookupOriginalOrder(String orderId) {
        try {
            return loyaltyClient.findOrder(orderId);
        } catch (LoyaltyServiceException e) {
            log.warn("Failed to get original order info for {}: {}", orderId, e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, Object> summary(RefundInfo refund, String customerId, long points, String reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("refundId", refund.getRefundId());
        data.put("orderId", refund.getOrderId());
        if (customerId != null) {
            data.put("customerId", customerId);
        }
        data.put("pointsDeducted", points);
        if (reason != null) {
            data.put("reason", reason);
        }
        return data;
    }
}
