package com.usdtgate.store;

import com.usdtgate.domain.PaymentType;

import java.math.BigDecimal;

/**
 * Input of {@link PaymentStore#createPayment}. {@code plan}/{@code duration} apply to subscriptions,
 * {@code pointsAmount} to points purchases.
 */
public record CreatePaymentCommand(
        String userId,
        String userEmail,
        String userName,
        PaymentType paymentType,
        BigDecimal amountUsdt,
        BigDecimal amountVnd,
        BigDecimal usdtRate,
        String toAddress,
        String fromAddress,
        String plan,
        String duration,
        Integer pointsAmount,
        String ipAddress,
        String userAgent,
        String notes
) {

    public CreatePaymentCommand withToAddress(String receivingAddress) {
        return new CreatePaymentCommand(userId, userEmail, userName, paymentType, amountUsdt, amountVnd, usdtRate,
                receivingAddress, fromAddress, plan, duration, pointsAmount, ipAddress, userAgent, notes);
    }
}
