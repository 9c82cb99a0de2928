package com.example.loyaltyhook.webhook;

import com.example.loyaltyhook.config.WebhookProperties;
import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.WebhookContext;
import com.example.loyaltyhook.model.WebhookEvent;
import com.example.loyaltyhook.model.WebhookTopic;
import com.example.loyaltyhook.security.VerifierStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Webhook 统一处理流程：验签 -> 解析 -> 分发到主题处理器 -> 渲染响应。
 *
 * 状态码约定：
 * 200 处理成功（包括无需调用后端的业务空操作）
 * 401 验签失败，不做任何处理
 * 400 JSON 无法解析或主题请求头与端点不一致
 * 500 校验失败、后端失败或任何未预期异常（平台会据此重投）
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookHandler {

    private final VerifierStrategy verifier;
    private final WebhookProcessorRegistry registry;
    private final ObjectMapper objectMapper;
    private final WebhookProperties properties;
    private final WebhookMetrics metrics;

    public ResponseEntity<ProcessingResult> handle(WebhookEvent event) {
        WebhookTopic topic = event.getTopic();
        Timer.Sample sample = metrics.start();
        log.info("Webhook {} received: shop={}, webhookId={}", topic, event.getShopDomain(), event.getWebhookId());

        // 1. 验签
        if (!verifier.verify(event.getRawBody(), event.getSignatureHeader(), properties.getSecret())) {
            log.warn("Webhook {} rejected: invalid signature, shop={}, webhookId={}", topic, event.getShopDomain(),
                    event.getWebhookId());
            return respond(sample, topic, WebhookMetrics.OUTCOME_REJECTED, HttpStatus.UNAUTHORIZED,
                    ProcessingResult.failure("Webhook verification failed", "Invalid signature"));
        }

        // 2. 主题一致性
        String declaredTopic = event.getTopicHeader();
        if (declaredTopic != null && !declaredTopic.isBlank()
                && !topic.getValue().equalsIgnoreCase(declaredTopic.trim())) {
            log.warn("Webhook {} rejected: topic header '{}' does not match endpoint, shop={}", topic,
                    declaredTopic, event.getShopDomain());
            return respond(sample, topic, WebhookMetrics.OUTCOME_BAD_REQUEST, HttpStatus.BAD_REQUEST,
                    ProcessingResult.failure("Topic mismatch. Expected " + topic + ", got " + declaredTopic));
        }

        // 3. 解析 JSON
        JsonNode payload;
        try {
            payload = objectMapper.readTree(event.getRawBody());
        } catch (IOException e) {
            log.warn("Webhook {} rejected: invalid JSON payload, shop={}: {}", topic, event.getShopDomain(),
                    e.getMessage());
            return respond(sample, topic, WebhookMetrics.OUTCOME_BAD_REQUEST, HttpStatus.BAD_REQUEST,
                    ProcessingResult.failure("Invalid JSON payload", "Malformed JSON"));
        }
        if (payload == null || !payload.isObject()) {
            log.warn("Webhook {} rejected: payload is not a JSON object, shop={}", topic, event.getShopDomain());
            return respond(sample, topic, WebhookMetrics.OUTCOME_BAD_REQUEST, HttpStatus.BAD_REQUEST,
                    ProcessingResult.failure("Invalid JSON payload", "Expected a JSON object"));
        }

        WebhookContext context = WebhookContext.builder()
                .topic(topic)
                .shopDomain(event.getShopDomain())
                .webhookId(event.getWebhookId())
                .apiVersion(event.getApiVersion())
                .payload(payload)
                .build();

        // 4. 分发处理
        ProcessingResult result = process(context);

        if (result.isSuccess()) {
            log.info("Webhook {} processed: shop={}, message={}", topic, context.getShopDomain(), result.getMessage());
            return respond(sample, topic, WebhookMetrics.OUTCOME_SUCCESS, HttpStatus.OK, result);
        }

        log.error("Webhook {} failed: shop={}, webhookId={}, message={}, error={}", topic, context.getShopDomain(),
                context.getWebhookId(), result.getMessage(), result.getError());
        return respond(sample, topic, WebhookMetrics.OUTCOME_FAILURE, HttpStatus.INTERNAL_SERVER_ERROR, result);
    }

    /**
     * 调用主题处理器，任何异常都转换为失败结果，不向传输层抛出。
     */
    private ProcessingResult process(WebhookContext context) {
        WebhookTopic topic = context.getTopic();
        WebhookProcessor processor = registry.getProcessor(topic).orElse(null);
        if (processor == null) {
            return ProcessingResult.failure("No processor registered for topic " + topic);
        }

        try {
            ProcessingResult result = processor.processWebhook(context);
            if (result == null) {
                return ProcessingResult.failure("Processor returned no result for topic " + topic);
            }
            return result;
        } catch (Exception e) {
            log.error("Webhook {} processing error: shop={}, webhookId={}", topic, context.getShopDomain(),
                    context.getWebhookId(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ProcessingResult.failure("Failed to process " + topic + " webhook", error);
        }
    }

    private ResponseEntity<ProcessingResult> respond(Timer.Sample sample, WebhookTopic topic, String outcome,
            HttpStatus status, ProcessingResult body) {
        metrics.stop(sample, topic, outcome);
        return ResponseEntity.status(status).body(body);
    }
}
