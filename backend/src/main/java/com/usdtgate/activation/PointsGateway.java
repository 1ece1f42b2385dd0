package com.usdtgate.activation;

import java.util.Map;

/**
 * Points ledger service. Calls carry the payment id as idempotency key.
 */
public interface PointsGateway {

    /**
     * @return id of the points transaction
     * @throws ActivationException when the service fails or times out
     */
    String addPoints(String userId, int amount, String reason, String description, Map<String, Object> metadata);
}
