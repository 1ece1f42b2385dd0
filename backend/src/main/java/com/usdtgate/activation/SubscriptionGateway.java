package com.usdtgate.activation;

/**
 * Subscription service. Calls carry the payment id as idempotency key, so a repeated call for the
 * same payment returns the same subscription.
 */
public interface SubscriptionGateway {

    /**
     * @return id of the created or upgraded subscription
     * @throws ActivationException when the service fails or times out
     */
    String createOrUpgrade(String userId, String plan, String duration, String paymentId);
}
