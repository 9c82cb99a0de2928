package com.example.loyaltyhook.webhook.processor;

import com.example.loyaltyhook.client.LoyaltyServiceClient;
import com.example.loyaltyhook.client.dto.PointsTransactionRequest;
import com.example.loyaltyhook.client.dto.TierEvaluationRequest;
import com.example.loyaltyhook.model.OrderInfo;
import com.example.loyaltyhook.model.PointsCalculationResult;
import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.WebhookContext;
import com.example.loyaltyhook.model.WebhookTopic;
import com.example.loyaltyhook.points.OrderPointsCalculator;
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

/**
 * orders/paid：为已支付订单发放积分，并触发会员等级重算。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrdersPaidProcessor implements WebhookProcessor {

    private final WebhookPayloadParser parser;
    private final OrderPointsCalculator calculator;
    private final LoyaltyServiceClient loyaltyClient;
    private final WebhookMetrics metrics;

    @Override
    public WebhookTopic topic() {
        return WebhookTopic.ORDERS_PAID;
    }

    @Override
    public ProcessingResult processWebhook(WebhookContext context) {
        OrderInfo order = parser.parseOrder(context.getPayload());

        List<String> missing = order.missingRequiredFields();
        if (!missing.isEmpty()) {
            return ProcessingResult.failure("Missing required order fields: " + String.join(", ", missing));
        }

        if (order.getCustomerId() == null) {
            log.info("Order {} from shop {} has no customer (guest checkout), skipping points", order.getOrderId(),
                    context.getShopDomain());
            return ProcessingResult.success("Order processed but no customer ID found (guest checkout)",
                    summary(order, 0, null));
        }

        PointsCalculationResult calculation = calculator.calculate(order);
        if (calculation.getPoints() == 0) {
            log.info("Order {} earns no points: {}", order.getOrderId(), calculation.getReason());
            return ProcessingResult.success("Order processed but no points awarded (" + calculation.getReason() + ")",
                    summary(order, 0, calculation.getReason()));
        }

        JsonNode loyaltyResult = loyaltyClient.awardPoints(PointsTransactionRequest.builder()
                .customerId(order.getCustomerId())
                .points(calculation.getPoints())
                .transactionType(PointsTransactionRequest.EARNED)
                .reason(calculation.getReason())
                .referenceId(order.getOrderId())
                .metadata(awardMetadata(order, context))
                .build());
        metrics.recordPointsAwarded(calculation.getPoints());

        Map<String, Object> tierMetadata = new LinkedHashMap<>();
        tierMetadata.put("order_id", order.getOrderId());
        tierMetadata.put("points_awarded", calculation.getPoints());
        loyaltyClient.evaluateTier(TierEvaluationRequest.builder()
                .customerId(order.getCustomerId())
                .trigger(TierEvaluationRequest.ORDER_COMPLETED)
                .metadata(tierMetadata)
                .build());

        log.info("Awarded {} points to customer {} for order {} (shop {})", calculation.getPoints(),
                order.getCustomerId(), order.getOrderId(), context.getShopDomain());

        Map<String, Object> data = summary(order, calculation.getPoints(), calculation.getReason());
        data.put("loyaltyResult", loyaltyResult);
        return ProcessingResult.success("Successfully awarded " + calculation.getPoints() + " points for order "
                + order.displayName(), data);
    }

    private Map<String, Object> awardMetadata(OrderInfo order, WebhookContext context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("order_number", order.getOrderNumber());
        metadata.put("total_price", order.getTotalPrice());
        metadata.put("currency", order.getCurrency());
        metadata.put("shop", context.getShopDomain());
        metadata.put("line_items_count", order.getLineItems().size());
        metadata.put("webhook_source", topic().getValue());
        return metadata;
    }

    private Map<String, Object> summary(OrderInfo order, long points, String reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("orderId", order.getOrderId());
        if (order.getCustomerId() != null) {
            data.put("customerId", order.getCustomerId());
        }
        data.put("pointsAwarded", points);
        if (reason != null) {
            data.put("reason", reason);
        }
        return data;
    }
}
