package com.usdtgate.payment;

import lombok.Getter;

/**
 * Thrown by PaymentService when a request is invalid for the payment's current state.
 * The API layer maps the code to 400, 404, 409 or 422.
 */
@Getter
public class PaymentServiceException extends RuntimeException {

    public static final String PAYMENT_NOT_FOUND = "PAYMENT_NOT_FOUND";
    public static final String INVALID_TRANSACTION_HASH = "INVALID_TRANSACTION_HASH";
    public static final String TRANSACTION_ALREADY_SET = "TRANSACTION_ALREADY_SET";
    public static final String TRANSACTION_ALREADY_CLAIMED = "TRANSACTION_ALREADY_CLAIMED";
    public static final String INVALID_STATE = "INVALID_STATE";
    public static final String INSUFFICIENT_BALANCE = "INSUFFICIENT_BALANCE";

    private final String errorCode;

    public PaymentServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
