package com.usdtgate.domain;

import org.springframework.data.mongodb.core.query.Update;

/**
 * Atomic partial updates on queue entries.
 */
public interface PendingTransactionRepositoryCustom {

    /** @return the updated entry, or null when it no longer exists */
    PendingTransaction updateByPaymentId(String paymentId, Update update);
}
