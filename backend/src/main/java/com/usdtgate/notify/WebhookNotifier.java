package com.usdtgate.notify;

/**
 * Delivers payment events to an external endpoint.
 */
public interface WebhookNotifier {

    /**
     * Delivers with bounded retries. Never throws.
     *
     * @return true when the endpoint accepted the payload; false when disabled or delivery failed
     */
    boolean send(WebhookPayload payload);
}
