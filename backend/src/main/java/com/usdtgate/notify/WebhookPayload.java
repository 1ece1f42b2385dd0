package com.usdtgate.notify;

import com.usdtgate.domain.PaymentStatusChangedEvent;

import java.time.Instant;

public record WebhookPayload(
        String event,
        String paymentId,
        String userId,
        String paymentType,
        String status,
        String previousStatus,
        String transactionHash,
        String errorMessage,
        Instant timestamp
) {

    public static final String STATUS_CHANGED = "payment.status_changed";

    public static WebhookPayload from(PaymentStatusChangedEvent event) {
        return new WebhookPayload(
                STATUS_CHANGED,
                event.paymentId(),
                event.userId(),
                event.paymentType() != null ? event.paymentType().name() : null,
                event.status() != null ? event.status().name() : null,
                event.previousStatus() != null ? event.previousStatus().name() : null,
                event.transactionHash(),
                event.errorMessage(),
                event.occurredAt());
    }
}
