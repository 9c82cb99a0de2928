package com.example.loyaltyhook.client;

import com.example.loyaltyhook.client.dto.AppUninstallRequest;
import com.example.loyaltyhook.client.dto.ComplianceRequest;
import com.example.loyaltyhook.client.dto.CustomerProfileRequest;
import com.example.loyaltyhook.client.dto.PointsTransactionRequest;
import com.example.loyaltyhook.client.dto.TierEvaluationRequest;
import com.example.loyaltyhook.exception.LoyaltyServiceException;
import com.example.loyaltyhook.model.OriginalOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * 基于 HTTP 的积分后端客户端。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HttpLoyaltyServiceClient implements LoyaltyServiceClient {

    static final String AWARD_PATH = "/api/points/award";
    static final String DEDUCT_PATH = "/api/points/deduct";
    static final String TIER_EVALUATE_PATH = "/api/tiers/evaluate";
    static final String ORDERS_PATH = "/api/orders/";
    static final String REDACT_CUSTOMER_PATH = "/api/compliance/redact-customer";
    static final String EXPORT_CUSTOMER_PATH = "/api/compliance/export-customer-data";
    static final String REDACT_SHOP_PATH = "/api/compliance/redact-shop";
    static final String UNINSTALL_PATH = "/api/app/uninstall";
    static final String CREATE_PROFILE_PATH = "/api/customers/create-profile";

    private final LoyaltyApiTransport transport;

    @Override
    public JsonNode awardPoints(PointsTransactionRequest request) {
        return transport.exchange("POST", AWARD_PATH, request);
    }

    @Override
    public JsonNode deductPoints(PointsTransactionRequest request) {
        return transport.exchange("POST", DEDUCT_PATH, request);
    }

    @Override
    public JsonNode evaluateTier(TierEvaluationRequest request) {
        return transport.exchange("POST", TIER_EVALUATE_PATH, request);
    }

    @Override
    public Optional<OriginalOrder> findOrder(String orderId) {
        String path = ORDERS_PATH + URLEncoder.encode(orderId, StandardCharsets.UTF_8);
        JsonNode node;
        try {
            node = transport.exchange("GET", path, null);
        } catch (LoyaltyServiceException e) {
            if (e.isNotFound()) {
                log.info("Loyalty API has no record of order {}", orderId);
                return Optional.empty();
            }
            throw e;
        }

        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        return Optional.of(OriginalOrder.builder()
                .orderId(orderId)
                .customerId(textOrNull(node.get("customer_id")))
                .pointsAwarded(Math.max(0, node.path("points_awarded").asLong(0)))
                .orderTotal(decimalOrZero(node.get("total_price")))
                .build());
    }

    @Override
    public JsonNode redactCustomer(ComplianceRequest request) {
        return transport.exchange("POST", REDACT_CUSTOMER_PATH, request);
    }

    @Override
    public JsonNode exportCustomerData(ComplianceRequest request) {
        return transport.exchange("POST", EXPORT_CUSTOMER_PATH, request);
    }

    @Override
    public JsonNode redactShop(ComplianceRequest request) {
        return transport.exchange("POST", REDACT_SHOP_PATH, request);
    }

    @Override
    public JsonNode uninstallApp(AppUninstallRequest request) {
        return transport.exchange("POST", UNINSTALL_PATH, request);
    }

    @Override
    public JsonNode createCustomerProfile(CustomerProfileRequest request) {
        return transport.exchange("POST", CREATE_PROFILE_PATH, request);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static BigDecimal decimalOrZero(JsonNode node) {
        if (node == null || node.isNull()) {
            return BigDecimal.ZERO;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }
}
