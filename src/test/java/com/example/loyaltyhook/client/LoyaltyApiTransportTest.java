package com.example.loyaltyhook.client;

import com.example.loyaltyhook.client.dto.PointsTransactionRequest;
import com.example.loyaltyhook.config.LoyaltyApiProperties;
import com.example.loyaltyhook.exception.LoyaltyServiceException;
import com.example.loyaltyhook.exception.LoyaltyServiceTimeoutException;
import com.example.loyaltyhook.exception.LoyaltyServiceUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LoyaltyApiTransportTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpClient httpClient;
    private LoyaltyApiTransport transport;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        LoyaltyApiProperties properties = new LoyaltyApiProperties();
        properties.setBaseUrl("http://loyalty.test/");
        properties.setApiKey("secret-key");
        transport = new LoyaltyApiTransport(httpClient, objectMapper, properties);
    }

    @Test
    void sendsJsonWithApiKey() throws Exception {
        respond(200, "{\"transaction_id\":\"t-1\"}");

        JsonNode result = transport.exchange("POST", "/api/points/award",
                PointsTransactionRequest.builder().customerId("42").points(10).build());

        assertThat(result.path("transaction_id").asText()).isEqualTo("t-1");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertThat(request.uri().toString()).isEqualTo("http://loyalty.test/api/points/award");
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.headers().firstValue("X-API-Key")).contains("secret-key");
        assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(request.timeout()).isPresent();
    }

    @Test
    void emptyBodyIsNullNode() throws Exception {
        respond(204, "");

        assertThat(transport.exchange("POST", "/api/tiers/evaluate", Map.of()).isNull()).isTrue();
    }

    @Test
    void serverErrorIsUnavailable() throws Exception {
        respond(503, "{\"detail\":\"down\"}");

        assertThatThrownBy(() -> transport.exchange("POST", "/api/points/award", Map.of()))
                .isInstanceOf(LoyaltyServiceUnavailableException.class)
                .hasMessageContaining("503");
    }

    @Test
    void clientErrorIsNotRetryable() throws Exception {
        respond(404, "{\"detail\":\"not found\"}");

        assertThatThrownBy(() -> transport.exchange("GET", "/api/orders/1", null))
                .isExactlyInstanceOf(LoyaltyServiceException.class)
                .satisfies(e -> assertThat(((LoyaltyServiceException) e).isNotFound()).isTrue());
    }

    @Test
    void timeoutIsNotTreatedAsUnavailable() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> transport.exchange("POST", "/api/points/deduct", Map.of()))
                .isExactlyInstanceOf(LoyaltyServiceTimeoutException.class)
                .isNotInstanceOf(LoyaltyServiceUnavailableException.class)
                .hasMessage("Loyalty API timeout");
    }

    @Test
    void networkErrorIsUnavailable() throws Exception {
        doThrow(new IOException("Connection refused")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> transport.exchange("POST", "/api/points/deduct", Map.of()))
                .isInstanceOf(LoyaltyServiceUnavailableException.class)
                .extracting(e -> ((LoyaltyServiceException) e).getStatusCode())
                .isEqualTo(-1);
    }

    @Test
    void invalidJsonResponseFails() throws Exception {
        respond(200, "<html>oops</html>");

        assertThatThrownBy(() -> transport.exchange("POST", "/api/points/award", Map.of()))
                .isExactlyInstanceOf(LoyaltyServiceException.class);
    }

    @Test
    void requestBodiesUseSnakeCase() throws Exception {
        String json = objectMapper.writeValueAsString(PointsTransactionRequest.builder()
                .customerId("42")
                .points(165)
                .transactionType(PointsTransactionRequest.EARNED)
                .referenceId("12345")
                .build());

        JsonNode node = objectMapper.readTree(json);
        assertThat(node.path("customer_id").asText()).isEqualTo("42");
        assertThat(node.path("transaction_type").asText()).isEqualTo("earned");
        assertThat(node.path("reference_id").asText()).isEqualTo("12345");
        assertThat(node.has("metadata")).isFalse();
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(), any());
    }
}
