package com.example.loyaltyhook.controller;

import com.example.loyaltyhook.exception.UnknownTopicException;
import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.WebhookEvent;
import com.example.loyaltyhook.model.WebhookTopic;
import com.example.loyaltyhook.webhook.WebhookHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Webhook 入口。每个主题对应一个 /webhooks/{resource}/{event} 端点，
 * POST 接收投递，GET 返回端点就绪状态。
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    public static final String HMAC_HEADER = "X-Shopify-Hmac-Sha256";
    public static final String SHOP_DOMAIN_HEADER = "X-Shopify-Shop-Domain";
    public static final String TOPIC_HEADER = "X-Shopify-Topic";
    public static final String WEBHOOK_ID_HEADER = "X-Shopify-Webhook-Id";
    public static final String API_VERSION_HEADER = "X-Shopify-Api-Version";

    private final WebhookHandler webhookHandler;

    @PostMapping("/{resource}/{event}")
    public ResponseEntity<ProcessingResult> receive(@PathVariable String resource,
            @PathVariable String event,
            @RequestHeader(value = HMAC_HEADER, required = false) String signature,
            @RequestHeader(value = SHOP_DOMAIN_HEADER, required = false) String shopDomain,
            @RequestHeader(value = TOPIC_HEADER, required = false) String topicHeader,
            @RequestHeader(value = WEBHOOK_ID_HEADER, required = false) String webhookId,
            @RequestHeader(value = API_VERSION_HEADER, required = false) String apiVersion,
            @RequestBody(required = false) byte[] body) {

        WebhookTopic topic = resolveTopic(resource, event);
        log.debug("Received {} webhook from shop {} (id={})", topic, shopDomain, webhookId);

        WebhookEvent webhookEvent = WebhookEvent.builder()
                .topic(topic)
                .shopDomain(shopDomain)
                .rawBody(body)
                .signatureHeader(signature)
                .topicHeader(topicHeader)
                .webhookId(webhookId)
                .apiVersion(apiVersion)
                .build();

        return webhookHandler.handle(webhookEvent);
    }

    @GetMapping("/{resource}/{event}")
    public ResponseEntity<Map<String, String>> status(@PathVariable String resource, @PathVariable String event) {
        WebhookTopic topic = resolveTopic(resource, event);

        Map<String, String> body = new LinkedHashMap<>();
        body.put("webhook", topic.getValue());
        body.put("status", "ready");
        body.put("description", topic.getDescription());
        return ResponseEntity.ok(body);
    }

    private WebhookTopic resolveTopic(String resource, String event) {
        String value = resource + "/" + event;
        return WebhookTopic.fromValue(value).orElseThrow(() -> new UnknownTopicException(value));
    }
}
