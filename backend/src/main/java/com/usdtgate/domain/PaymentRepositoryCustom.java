package com.usdtgate.domain;

import org.springframework.data.mongodb.core.query.Update;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Atomic single-document updates and aggregate queries on payments.
 */
public interface PaymentRepositoryCustom {

    /**
     * Applies {@code update} only if the payment's current status is in {@code expectedCurrent}
     * (and, when {@code requireActivation}, a subscription or points linkage is present).
     *
     * @return the document as it was before the update, or null when the guard did not match
     */
    Payment updateIfStatusIn(String paymentId, Collection<PaymentStatus> expectedCurrent, Update update,
                             boolean requireActivation);

    /**
     * Sets {@code field} to {@code value} only while it is still unset and the payment type matches.
     *
     * @return the updated document, or null when the field was already set or the type differs
     */
    Payment setLinkIfAbsent(String paymentId, PaymentType type, String field, String value, Instant now);

    List<Payment> search(String userId, PaymentType type, PaymentStatus status, int limit, int skip);

    List<String> findTransactionHashesCreatedSince(Instant since);

    Map<PaymentStatus, Long> countByStatus();

    BigDecimal sumAmountUsdtByStatus(PaymentStatus status);
}
