package com.usdtgate.store;

import com.usdtgate.domain.Payment;
import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PaymentType;
import com.usdtgate.domain.PendingTransaction;
import com.usdtgate.domain.PendingTransactionStatus;
import com.usdtgate.domain.WalletAddress;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sole writer of payments, the verification queue and wallet usage.
 * Every status write is a single atomic document update.
 */
public interface PaymentStore {

    /** Validates the command and stores a PENDING payment expiring after the configured TTL. */
    Payment createPayment(CreatePaymentCommand command);

    Optional<Payment> getPayment(String paymentId);

    Optional<Payment> getPaymentByInvoice(String orderInvoiceNumber);

    Optional<Payment> getPaymentByTxHash(String transactionHash);

    /**
     * Moves the payment to {@code newStatus}, writes the non-null {@code fields} and stamps the status timestamp.
     * A terminal payment, a backward move, or COMPLETED without a linkage leaves the document unchanged.
     *
     * @return the updated payment, or empty when the update was a no-op
     */
    Optional<Payment> updatePaymentStatus(String paymentId, PaymentStatus newStatus, PaymentStatusUpdate fields);

    /**
     * As {@link #updatePaymentStatus}, and additionally only while the current status is one of {@code expected}.
     */
    Optional<Payment> updatePaymentStatusFrom(String paymentId, Set<PaymentStatus> expected, PaymentStatus newStatus,
                                              PaymentStatusUpdate fields);

    /**
     * Records the subscription created for this payment. Idempotent for the same id.
     *
     * @throws PaymentStoreException LINKAGE_CONFLICT when a different id is already recorded
     */
    Payment linkSubscription(String paymentId, String subscriptionId);

    /**
     * Records the points transaction created for this payment. Idempotent for the same id.
     *
     * @throws PaymentStoreException LINKAGE_CONFLICT when a different id is already recorded
     */
    Payment linkPointsTransaction(String paymentId, String pointsTransactionId);

    /** Inserts the entry; an entry already queued for the same payment is returned instead. */
    PendingTransaction addPendingTransaction(PendingTransaction entry);

    Optional<PendingTransaction> getPendingTransaction(String paymentId);

    List<PendingTransaction> getPendingTransactions(PendingTransactionStatus status, int limit);

    Optional<PendingTransaction> updatePendingTransaction(String paymentId, PendingTransactionUpdate update);

    /**
     * Records a sweep that could not resolve the entry.
     *
     * @param chainError     the sweep failed on an RPC error rather than a genuine absence
     * @param consumesRetry  whether the sweep counts toward the retry budget
     */
    Optional<PendingTransaction> recordUnresolvedCheck(String paymentId, boolean chainError, boolean consumesRetry);

    /** Removes by payment id, or by transaction hash when given a 0x hash. */
    boolean removePendingTransaction(String paymentIdOrHash);

    WalletAddress registerWallet(String userId, String walletAddress, String label);

    WalletAddress updateWalletUsage(String userId, String walletAddress, BigDecimal amountUsdt);

    List<WalletAddress> getUserWallets(String userId);

    List<Payment> getAllPayments(PaymentFilter filter);

    List<Payment> getUserPayments(String userId, PaymentType type, PaymentStatus status, int limit, int skip);

    /** PENDING or SCANNING payments created before {@code createdBefore}. */
    List<Payment> findExpirable(Instant createdBefore, int limit);

    List<Payment> findByStatus(PaymentStatus status, int limit);

    /** Lowercase hashes already recorded on payments created since {@code since}. */
    Set<String> findClaimedTransactionHashes(Instant since);

    /**
     * Admin override: forces a non-completed payment to CONFIRMED and marks it manually processed.
     * An existing confirmedAt is kept. A COMPLETED payment is returned unchanged.
     */
    Payment manualConfirmPayment(String paymentId, String adminId, String notes);

    PaymentStats getPaymentStats();
}
