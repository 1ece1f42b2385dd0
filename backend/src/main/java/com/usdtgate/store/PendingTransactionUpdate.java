package com.usdtgate.store;

import com.usdtgate.domain.PendingTransactionStatus;

/**
 * Partial update of a queue entry; null fields are left untouched.
 */
public record PendingTransactionUpdate(
        Integer retryCount,
        Integer confirmationCount,
        String transactionHash,
        String fromAddress,
        PendingTransactionStatus status
) {

    public static PendingTransactionUpdate confirmations(int confirmationCount) {
        return new PendingTransactionUpdate(null, confirmationCount, null, null, null);
    }

    /** Hash discovered while scanning: the entry moves to PENDING. */
    public static PendingTransactionUpdate found(String transactionHash, String fromAddress, int confirmationCount) {
        return new PendingTransactionUpdate(null, confirmationCount, transactionHash, fromAddress,
                PendingTransactionStatus.PENDING);
    }
}
