package com.usdtgate.activation;

/**
 * A gateway call failed or returned no usable id.
 */
public class ActivationException extends RuntimeException {

    public ActivationException(String message) {
        super(message);
    }

    public ActivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
