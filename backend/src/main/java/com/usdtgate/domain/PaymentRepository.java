package com.usdtgate.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for payments. Status writes go through {@link PaymentRepositoryCustom} so they stay atomic.
 */
public interface PaymentRepository extends MongoRepository<Payment, String>, PaymentRepositoryCustom {

    Optional<Payment> findByOrderInvoiceNumber(String orderInvoiceNumber);

    Optional<Payment> findFirstByTransactionHash(String transactionHash);

    /** Expiry candidates, oldest first. */
    List<Payment> findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
            Collection<PaymentStatus> statuses, Instant createdBefore, Pageable pageable);

    List<Payment> findByStatusOrderByUpdatedAtAsc(PaymentStatus status, Pageable pageable);
}
