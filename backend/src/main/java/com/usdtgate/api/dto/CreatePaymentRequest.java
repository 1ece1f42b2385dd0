package com.usdtgate.api.dto;

import com.usdtgate.api.validation.EvmAddress;
import com.usdtgate.domain.PaymentType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * POST /api/v1/payments request body. {@code plan} and {@code duration} are required for subscriptions,
 * {@code pointsAmount} for points purchases; the store enforces which applies.
 */
public record CreatePaymentRequest(
        @NotBlank(message = "INVALID_USER")
        String userId,
        String userEmail,
        String userName,

        @NotNull(message = "INVALID_PAYMENT_TYPE")
        PaymentType paymentType,

        @NotNull(message = "INVALID_AMOUNT")
        @DecimalMin(value = "0", inclusive = false, message = "INVALID_AMOUNT")
        BigDecimal amountUsdt,
        BigDecimal amountVnd,
        BigDecimal usdtRate,

        @EvmAddress
        String fromAddress,

        String plan,
        String duration,

        @Positive(message = "INVALID_POINTS_AMOUNT")
        Integer pointsAmount,

        String notes
) {
}
