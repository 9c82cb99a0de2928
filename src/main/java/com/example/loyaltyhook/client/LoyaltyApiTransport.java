package com.example.loyaltyhook.client;

import com.example.loyaltyhook.config.LoyaltyApiProperties;
import com.example.loyaltyhook.exception.LoyaltyServiceException;
import com.example.loyaltyhook.exception.LoyaltyServiceTimeoutException;
import com.example.loyaltyhook.exception.LoyaltyServiceUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;

/**
 * 积分后端的 JSON over HTTP 传输层。
 * 5xx 与网络错误按配置做指数退避重试；超时与其余错误直接抛出。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoyaltyApiTransport {

    private static final String API_KEY_HEADER = "X-API-Key";

    private final HttpClient loyaltyHttpClient;
    private final ObjectMapper objectMapper;
    private final LoyaltyApiProperties properties;

    /**
     * 发送请求并解析 JSON 响应。
     *
     * @param method HTTP 方法
     * @param path   以 / 开头的接口路径
     * @param body   请求体，GET 时为 null
     * @return 响应 JSON，响应体为空时返回 NullNode
     */
    @Retryable(retryFor = LoyaltyServiceUnavailableException.class,
            maxAttemptsExpression = "${loyalty.api.retry.max-attempts:1}",
            backoff = @Backoff(delayExpression = "${loyalty.api.retry.delay-ms:100}", multiplier = 2.0))
    public JsonNode exchange(String method, String path, Object body) {
        HttpRequest request = buildRequest(method, path, body);

        HttpResponse<String> response;
        try {
            response = loyaltyHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("Loyalty API {} {} timed out after {}", method, path, properties.getRequestTimeout());
            throw new LoyaltyServiceTimeoutException(path, "Loyalty API timeout", e);
        } catch (IOException e) {
            log.warn("Loyalty API {} {} failed: {}", method, path, e.getMessage());
            throw new LoyaltyServiceUnavailableException(path, "Loyalty API unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoyaltyServiceUnavailableException(path, "Loyalty API call interrupted", e);
        }

        int status = response.statusCode();
        log.debug("Loyalty API {} {} -> HTTP {}", method, path, status);

        if (status >= 500) {
            throw new LoyaltyServiceUnavailableException(path, status, "Loyalty API error: HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            throw new LoyaltyServiceException(path, status, "Loyalty API error: HTTP " + status);
        }

        return readBody(path, status, response.body());
    }

    private HttpRequest buildRequest(String method, String path, Object body) {
        HttpRequest.BodyPublisher publisher;
        if (body == null) {
            publisher = HttpRequest.BodyPublishers.noBody();
        } else {
            try {
                publisher = HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
            } catch (JsonProcessingException e) {
                throw new LoyaltyServiceException(path, -1, "Failed to serialize request body", e);
            }
        }

        return HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(properties.getBaseUrl()) + path))
                .timeout(properties.getRequestTimeout())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header(API_KEY_HEADER, properties.getApiKey())
                .method(method, publisher)
                .build();
    }

    private JsonNode readBody(String path, int status, String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LoyaltyServiceException(path, status, "Loyalty API returned invalid JSON", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
