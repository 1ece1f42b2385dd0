package com.usdtgate.domain;

/**
 * Queue state of a payment under verification: SCANNING while the transaction hash is unknown,
 * PENDING once the hash is known and confirmations are being counted.
 */
public enum PendingTransactionStatus {
    SCANNING,
    PENDING
}
