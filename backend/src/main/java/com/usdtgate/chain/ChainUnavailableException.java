package com.usdtgate.chain;

/**
 * The chain could not be read after the reader's own retries. Transient by nature; never means "not found".
 */
public class ChainUnavailableException extends RuntimeException {

    public ChainUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
