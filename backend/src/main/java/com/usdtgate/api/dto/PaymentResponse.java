package com.usdtgate.api.dto;

import com.usdtgate.domain.Payment;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment as returned by the payment and admin endpoints. {@code message} is set on single-payment reads.
 */
public record PaymentResponse(
        String paymentId,
        String orderInvoiceNumber,
        String userId,
        String paymentType,
        String status,
        String message,
        String plan,
        String duration,
        Integer pointsAmount,
        BigDecimal amountUsdt,
        BigDecimal amountVnd,
        String toAddress,
        String fromAddress,
        String transactionHash,
        Long blockNumber,
        int confirmationCount,
        int requiredConfirmations,
        String errorMessage,
        boolean manuallyProcessed,
        Instant createdAt,
        Instant expiresAt,
        Instant confirmedAt,
        Instant completedAt
) {

    public static PaymentResponse from(Payment p, String message) {
        return new PaymentResponse(
                p.getPaymentId(),
                p.getOrderInvoiceNumber(),
                p.getUserId(),
                p.getPaymentType() != null ? p.getPaymentType().name() : null,
                p.getStatus() != null ? p.getStatus().name() : null,
                message,
                p.getPlan(),
                p.getDuration(),
                p.getPointsAmount(),
                p.getAmountUsdt(),
                p.getAmountVnd(),
                p.getToAddress(),
                p.getFromAddress(),
                p.getTransactionHash(),
                p.getBlockNumber(),
                p.getConfirmationCount(),
                p.getRequiredConfirmations(),
                p.getErrorMessage(),
                p.isManuallyProcessed(),
                p.getCreatedAt(),
                p.getExpiresAt(),
                p.getConfirmedAt(),
                p.getCompletedAt());
    }

    public static PaymentResponse from(Payment p) {
        return from(p, null);
    }
}
