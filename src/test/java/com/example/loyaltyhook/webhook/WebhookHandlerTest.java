package com.example.loyaltyhook.webhook;

import com.example.loyaltyhook.config.WebhookProperties;
import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.WebhookContext;
import com.example.loyaltyhook.model.WebhookEvent;
import com.example.loyaltyhook.model.WebhookTopic;
import com.example.loyaltyhook.security.HmacVerifier;
import com.example.loyaltyhook.support.WebhookTestSupport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebhookHandlerTest {

    private static final String BODY = WebhookTestSupport.paidOrder("42", "150.00");

    private WebhookProcessor processor;
    private SimpleMeterRegistry meterRegistry;
    private WebhookHandler handler;

    @BeforeEach
    void setUp() {
        processor = mock(WebhookProcessor.class);
        when(processor.topic()).thenReturn(WebhookTopic.ORDERS_PAID);

        WebhookProperties properties = new WebhookProperties();
        properties.setSecret(WebhookTestSupport.SECRET);

        meterRegistry = new SimpleMeterRegistry();
        handler = new WebhookHandler(new HmacVerifier(), new WebhookProcessorRegistry(List.of(processor)),
                new ObjectMapper(), properties, new WebhookMetrics(meterRegistry));
    }

    @Test
    void invalidSignatureIsRejectedWithoutProcessing() {
        ResponseEntity<ProcessingResult> response = handler.handle(event(BODY, "bogus", null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getMessage()).isEqualTo("Webhook verification failed");
        verify(processor, never()).processWebhook(any());
        assertThat(timerCount("rejected")).isEqualTo(1);
    }

    @Test
    void successfulProcessingReturnsOk() {
        when(processor.processWebhook(any())).thenReturn(ProcessingResult.success("done"));

        ResponseEntity<ProcessingResult> response = handler.handle(event(BODY, WebhookTestSupport.sign(BODY), null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getMessage()).isEqualTo("done");

        ArgumentCaptor<WebhookContext> captor = ArgumentCaptor.forClass(WebhookContext.class);
        verify(processor).processWebhook(captor.capture());
        WebhookContext context = captor.getValue();
        assertThat(context.getShopDomain()).isEqualTo(WebhookTestSupport.SHOP);
        assertThat(context.getWebhookId()).isEqualTo("webhook-123");
        assertThat(context.getPayload().path("id").asText()).isEqualTo("12345");
        assertThat(timerCount("success")).isEqualTo(1);
    }

    @Test
    void failedResultMapsToServerError() {
        when(processor.processWebhook(any())).thenReturn(ProcessingResult.failure("Missing required order fields: orderId"));

        ResponseEntity<ProcessingResult> response = handler.handle(event(BODY, WebhookTestSupport.sign(BODY), null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(timerCount("failure")).isEqualTo(1);
    }

    @Test
    void processorExceptionIsConvertedToFailure() {
        when(processor.processWebhook(any())).thenThrow(new IllegalStateException("backend down"));

        ResponseEntity<ProcessingResult> response = handler.handle(event(BODY, WebhookTestSupport.sign(BODY), null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).isEqualTo("Failed to process orders/paid webhook");
        assertThat(response.getBody().getError()).isEqualTo("backend down");
    }

    @Test
    void malformedJsonIsBadRequest() {
        String body = "{not json";

        ResponseEntity<ProcessingResult> response = handler.handle(event(body, WebhookTestSupport.sign(body), null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getMessage()).isEqualTo("Invalid JSON payload");
        verify(processor, never()).processWebhook(any());
    }

    @Test
    void nonObjectJsonIsBadRequest() {
        String body = "[1,2,3]";

        ResponseEntity<ProcessingResult> response = handler.handle(event(body, WebhookTestSupport.sign(body), null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(timerCount("bad_request")).isEqualTo(1);
    }

    @Test
    void topicHeaderMismatchIsBadRequest() {
        ResponseEntity<ProcessingResult> response = handler.handle(
                event(BODY, WebhookTestSupport.sign(BODY), "refunds/create"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getMessage()).isEqualTo("Topic mismatch. Expected orders/paid, got refunds/create");
        verify(processor, never()).processWebhook(any());
    }

    @Test
    void matchingTopicHeaderIsAccepted() {
        when(processor.processWebhook(any())).thenReturn(ProcessingResult.success("done"));

        ResponseEntity<ProcessingResult> response = handler.handle(
                event(BODY, WebhookTestSupport.sign(BODY), "orders/paid"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void missingProcessorIsFailure() {
        WebhookEvent event = WebhookEvent.builder()
                .topic(WebhookTopic.SHOP_REDACT)
                .rawBody("{}".getBytes(StandardCharsets.UTF_8))
                .signatureHeader(WebhookTestSupport.sign("{}"))
                .build();

        ResponseEntity<ProcessingResult> response = handler.handle(event);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private long timerCount(String outcome) {
        return meterRegistry.get(WebhookMetrics.PROCESSING_TIMER)
                .tag("topic", "orders/paid")
                .tag("outcome", outcome)
                .timer()
                .count();
    }

    private static WebhookEvent event(String body, String signature, String topicHeader) {
        return WebhookEvent.builder()
                .topic(WebhookTopic.ORDERS_PAID)
                .shopDomain(WebhookTestSupport.SHOP)
                .rawBody(body.getBytes(StandardCharsets.UTF_8))
                .signatureHeader(signature)
                .topicHeader(topicHeader)
                .webhookId("webhook-123")
                .build();
    }
}
