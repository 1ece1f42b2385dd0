package com.usdtgate.domain;

import java.time.Instant;

/**
 * Application event published after a payment status change has been persisted.
 */
public record PaymentStatusChangedEvent(
        String paymentId,
        String userId,
        PaymentType paymentType,
        PaymentStatus previousStatus,
        PaymentStatus status,
        String transactionHash,
        String errorMessage,
        Instant occurredAt
) {

    public static PaymentStatusChangedEvent of(Payment payment, PaymentStatus previousStatus, Instant occurredAt) {
        return new PaymentStatusChangedEvent(
                payment.getPaymentId(),
                payment.getUserId(),
                payment.getPaymentType(),
                previousStatus,
                payment.getStatus(),
                payment.getTransactionHash(),
                payment.getErrorMessage(),
                occurredAt);
    }
}
