package com.example.loyaltyhook.client;

import com.example.loyaltyhook.client.dto.AppUninstallRequest;
import com.example.loyaltyhook.client.dto.ComplianceRequest;
import com.example.loyaltyhook.client.dto.CustomerProfileRequest;
import com.example.loyaltyhook.client.dto.PointsTransactionRequest;
import com.example.loyaltyhook.client.dto.TierEvaluationRequest;
import com.example.loyaltyhook.model.OriginalOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Calls into the authoritative loyalty backend.
 * Every failure surfaces as {@link com.example.loyaltyhook.exception.LoyaltyServiceException}.
 * Mutating calls carry a reference id the backend uses to absorb redeliveries.
 */
public interface LoyaltyServiceClient {

    JsonNode awardPoints(PointsTransactionRequest request);

    JsonNode deductPoints(PointsTransactionRequest request);

    JsonNode evaluateTier(TierEvaluationRequest request);

    /**
     * @return empty when the backend does not know the order
     */
    Optional<OriginalOrder> findOrder(String orderId);

    JsonNode redactCustomer(ComplianceRequest request);

    JsonNode exportCustomerData(ComplianceRequest request);

    JsonNode redactShop(ComplianceRequest request);

    JsonNode uninstallApp(AppUninstallRequest request);

    JsonNode createCustomerProfile(CustomerProfileRequest request);
}
