package com.usdtgate.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for the verification work queue.
 */
public interface PendingTransactionRepository extends MongoRepository<PendingTransaction, String>,
        PendingTransactionRepositoryCustom {

    /** Least recently checked first, so every entry gets a turn when the batch is capped. */
    List<PendingTransaction> findByStatusOrderByLastCheckedAtAsc(PendingTransactionStatus status, Pageable pageable);

    long deleteByTransactionHash(String transactionHash);

    long deleteByPaymentIdIn(List<String> paymentIds);
}
