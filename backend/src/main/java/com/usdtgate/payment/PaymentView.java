package com.usdtgate.payment;

import com.usdtgate.domain.Payment;

/**
 * A payment together with the user-facing message for its current status.
 */
public record PaymentView(Payment payment, String message) {
}
