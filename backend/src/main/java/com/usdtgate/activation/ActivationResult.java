package com.usdtgate.activation;

/**
 * Outcome of {@link ActivationDispatcher#activate}. {@code linkedId} is the subscription or points
 * transaction id recorded on the payment.
 */
public record ActivationResult(boolean success, String linkedId, boolean alreadyActivated, String error) {

    public static ActivationResult activated(String linkedId) {
        return new ActivationResult(true, linkedId, false, null);
    }

    public static ActivationResult alreadyActivated(String linkedId) {
        return new ActivationResult(true, linkedId, true, null);
    }

    public static ActivationResult failure(String error) {
        return new ActivationResult(false, null, false, error);
    }
}
