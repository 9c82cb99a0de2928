package com.example.loyaltyhook.webhook.processor;

import com.example.loyaltyhook.client.LoyaltyServiceClient;
import com.example.loyaltyhook.client.dto.PointsTransactionRequest;
import com.example.loyaltyhook.client.dto.TierEvaluationRequest;
import com.example.loyaltyhook.config.PointsProperties;
import com.example.loyaltyhook.exception.LoyaltyServiceUnavailableException;
import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.WebhookTopic;
import com.example.loyaltyhook.points.OrderPointsCalculator;
import com.example.loyaltyhook.webhook.WebhookMetrics;
import com.example.loyaltyhook.webhook.WebhookPayloadParser;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static com.example.loyaltyhook.support.WebhookTestSupport.context;
import static com.example.loyaltyhook.support.WebhookTestSupport.paidOrder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OrdersPaidProcessorTest {

    private LoyaltyServiceClient loyaltyClient;
    private SimpleMeterRegistry meterRegistry;
    private OrdersPaidProcessor processor;

    @BeforeEach
    void setUp() {
        loyaltyClient = mock(LoyaltyServiceClient.class);
        meterRegistry = new SimpleMeterRegistry();
        processor = new OrdersPaidProcessor(new WebhookPayloadParser(),
                new OrderPointsCalculator(new PointsProperties()), loyaltyClient, new WebhookMetrics(meterRegistry));
    }

    @Test
    void awardsPointsAndEvaluatesTier() {
        when(loyaltyClient.awardPoints(any())).thenReturn(JsonNodeFactory.instance.objectNode().put("ok", true));

        ProcessingResult result = processor.processWebhook(context(WebhookTopic.ORDERS_PAID, paidOrder("42", "150.00")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Successfully awarded 165 points for order 1001");
        assertThat(result.getData()).containsEntry("pointsAwarded", 165L).containsEntry("customerId", "42");

        ArgumentCaptor<PointsTransactionRequest> award = ArgumentCaptor.forClass(PointsTransactionRequest.class);
        verify(loyaltyClient).awardPoints(award.capture());
        assertThat(award.getValue().getCustomerId()).isEqualTo("42");
        assertThat(award.getValue().getPoints()).isEqualTo(165);
        assertThat(award.getValue().getTransactionType()).isEqualTo("earned");
        assertThat(award.getValue().getReferenceId()).isEqualTo("12345");
        assertThat(award.getValue().getMetadata())
                .containsEntry("webhook_source", "orders/paid")
                .containsEntry("shop", "test-shop.myshopify.com")
                .containsEntry("currency", "USD");

        ArgumentCaptor<TierEvaluationRequest> tier = ArgumentCaptor.forClass(TierEvaluationRequest.class);
        verify(loyaltyClient).evaluateTier(tier.capture());
        assertThat(tier.getValue().getTrigger()).isEqualTo("order_completed");
        assertThat(tier.getValue().getMetadata()).containsEntry("order_id", "12345").containsEntry("points_awarded", 165L);

        assertThat(meterRegistry.get(WebhookMetrics.POINTS_COUNTER).tag("direction", "awarded").counter().count())
                .isEqualTo(165.0);
    }

    @Test
    void guestCheckoutMakesNoBackendCall() {
        ProcessingResult result = processor.processWebhook(context(WebhookTopic.ORDERS_PAID, paidOrder(null, "150.00")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Order processed but no customer ID found (guest checkout)");
        assertThat(result.getData()).containsEntry("pointsAwarded", 0L);
        verifyNoInteractions(loyaltyClient);
    }

    @Test
    void orderBelowMinimumMakesNoBackendCall() {
        ProcessingResult result = processor.processWebhook(context(WebhookTopic.ORDERS_PAID, paidOrder("42", "0.50")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Order processed but no points awarded (Order below minimum threshold)");
        verifyNoInteractions(loyaltyClient);
    }

    @Test
    void missingFieldsFail() {
        ProcessingResult result = processor.processWebhook(context(WebhookTopic.ORDERS_PAID,
                "{\"customer\":{\"id\":42}}"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Missing required order fields: orderId, totalPrice");
        verifyNoInteractions(loyaltyClient);
    }

    @Test
    void backendFailurePropagatesWithoutTierEvaluation() {
        when(loyaltyClient.awardPoints(any()))
                .thenThrow(new LoyaltyServiceUnavailableException("/api/points/award", 503, "Loyalty API error: HTTP 503"));

        assertThatThrownBy(() -> processor.processWebhook(context(WebhookTopic.ORDERS_PAID, paidOrder("42", "20"))))
                .isInstanceOf(LoyaltyServiceUnavailableException.class);
        verify(loyaltyClient, never()).evaluateTier(any());
    }
}
