package com.usdtgate.store;

import lombok.Getter;

/**
 * Rejected store operation. The HTTP layer maps the error code to a status.
 */
@Getter
public class PaymentStoreException extends RuntimeException {

    public static final String PAYMENT_NOT_FOUND = "PAYMENT_NOT_FOUND";
    public static final String INVALID_PAYMENT = "INVALID_PAYMENT";
    public static final String LINKAGE_CONFLICT = "LINKAGE_CONFLICT";
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";

    /** One of the constants above. */
    private final String errorCode;

    public PaymentStoreException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
