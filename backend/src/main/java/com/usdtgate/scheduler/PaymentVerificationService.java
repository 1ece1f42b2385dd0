package com.usdtgate.scheduler;

import com.usdtgate.activation.ActivationDispatcher;
import com.usdtgate.activation.ActivationResult;
import com.usdtgate.chain.ChainReader;
import com.usdtgate.chain.ChainResult;
import com.usdtgate.chain.ChainUnavailableException;
import com.usdtgate.chain.TransactionReceipt;
import com.usdtgate.chain.TransferMatch;
import com.usdtgate.chain.TransferQuery;
import com.usdtgate.config.AsyncConfig;
import com.usdtgate.domain.Payment;
import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PendingTransaction;
import com.usdtgate.domain.PendingTransactionStatus;
import com.usdtgate.store.PaymentProperties;
import com.usdtgate.store.PaymentStatusUpdate;
import com.usdtgate.store.PaymentStore;
import com.usdtgate.store.PendingTransactionUpdate;
import com.usdtgate.verification.TransferVerifier;
import com.usdtgate.verification.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives queued payments through the lifecycle. One sweep runs four phases in order: expire, scan for
 * transfers, check submitted or found transactions, and retry activation of confirmed payments.
 * Items within a phase run on the verification executor; a failing item is logged and skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentVerificationService {

    static final String MSG_EXPIRED = "Payment expired";
    static final String MSG_NO_MATCH = "No matching transaction found";
    static final String MSG_NOT_MINED_EXPIRED = "Payment expired - transaction not mined";
    static final String MSG_NOT_MINED_RETRIES = "Transaction not mined after maximum retries";
    static final String MSG_REVERTED = "Blockchain transaction failed: reverted";
    static final String MSG_INVALID_PREFIX = "Invalid transfer: ";

    /** Statuses in which no transfer has been tied to the payment yet. */
    static final Set<PaymentStatus> AWAITING_TRANSFER = Collections.unmodifiableSet(
            EnumSet.of(PaymentStatus.PENDING, PaymentStatus.SCANNING));
    /** Statuses the sweep may still fail; a CONFIRMED payment only ever moves on to COMPLETED. */
    static final Set<PaymentStatus> UNCONFIRMED = Collections.unmodifiableSet(
            EnumSet.of(PaymentStatus.PENDING, PaymentStatus.SCANNING, PaymentStatus.PROCESSING, PaymentStatus.VERIFYING));

    private final PaymentStore paymentStore;
    private final ChainReader chainReader;
    private final TransferVerifier transferVerifier;
    private final ActivationDispatcher activationDispatcher;
    private final VerificationProperties verificationProperties;
    private final PaymentProperties paymentProperties;
    private final Clock clock;
    @Qualifier(AsyncConfig.VERIFICATION_EXECUTOR)
    private final Executor verificationExecutor;

    /**
     * Puts a payment on the verification queue. Without a transaction hash the payment is scanned for;
     * with one it goes straight to confirmation checks.
     *
     * @return the queue entry, or empty when the payment is missing or already terminal
     */
    public Optional<PendingTransaction> beginVerification(Payment payment, String transactionHash) {
        return beginVerification(payment, transactionHash, null);
    }

    /**
     * As {@link #beginVerification(Payment, String)}, also recording a sender already read from the chain.
     */
    public Optional<PendingTransaction> beginVerification(Payment payment, String transactionHash, String senderAddress) {
        String paymentId = payment.getPaymentId();
        boolean hashKnown = transactionHash != null;
        PaymentStatus target = hashKnown ? PaymentStatus.PROCESSING : PaymentStatus.SCANNING;
        PaymentStatusUpdate fields = hashKnown
                ? PaymentStatusUpdate.transaction(transactionHash, null, null).withFromAddress(senderAddress)
                : PaymentStatusUpdate.none();
        Optional<Payment> updated = paymentStore.updatePaymentStatus(paymentId, target, fields);
        if (updated.isEmpty()) {
            log.debug("Payment {} not queued: status update to {} refused", paymentId, target);
            return Optional.empty();
        }
        Payment current = updated.get();

        PendingTransaction entry = new PendingTransaction();
        entry.setPaymentId(paymentId);
        entry.setUserId(current.getUserId());
        entry.setTransactionHash(transactionHash);
        entry.setFromAddress(current.getFromAddress());
        entry.setToAddress(current.getToAddress());
        entry.setAmountUsdt(current.getAmountUsdt());
        entry.setRequiredConfirmations(current.getRequiredConfirmations());
        entry.setStatus(hashKnown ? PendingTransactionStatus.PENDING : PendingTransactionStatus.SCANNING);
        PendingTransaction queued = paymentStore.addPendingTransaction(entry);

        if (hashKnown && (queued.getStatus() != PendingTransactionStatus.PENDING
                || !transactionHash.equalsIgnoreCase(queued.getTransactionHash()))) {
            queued = paymentStore.updatePendingTransaction(paymentId,
                            PendingTransactionUpdate.found(transactionHash, current.getFromAddress(), 0))
                    .orElse(queued);
        }
        log.info("Payment {} queued for verification as {}", paymentId, queued.getStatus());
        return Optional.of(queued);
    }

    public SweepReport sweep(BooleanSupplier stillOwner) {
        return sweep(clock.instant(), stillOwner);
    }

    public SweepReport sweep(Instant now) {
        return sweep(now, () -> true);
    }

    /**
     * @param stillOwner asked before every phase and every item; once it answers false the rest of the
     *                   sweep is skipped and the report is marked aborted
     */
    public SweepReport sweep(Instant now, BooleanSupplier stillOwner) {
        Tally tally = new Tally();
        int batch = Math.max(1, verificationProperties.getBatchSize());
        Instant expiryCutoff = now.minus(Duration.ofMinutes(paymentProperties.getTtlMinutes()));

        if (owns(stillOwner, tally)) {
            runPhase("expire", paymentStore.findExpirable(expiryCutoff, batch), Payment::getPaymentId,
                    p -> expire(p.getPaymentId(), tally), stillOwner, tally);
        }

        if (owns(stillOwner, tally)) {
            List<PendingTransaction> scanning =
                    paymentStore.getPendingTransactions(PendingTransactionStatus.SCANNING, batch);
            if (!scanning.isEmpty()) {
                Set<String> claimed = paymentStore.findClaimedTransactionHashes(
                        now.minus(Duration.ofMinutes(verificationProperties.getClaimLookbackMinutes())));
                Set<String> claimedThisSweep = ConcurrentHashMap.newKeySet();
                runPhase("scan", scanning, PendingTransaction::getPaymentId,
                        e -> scanOne(e, expiryCutoff, claimed, claimedThisSweep, tally), stillOwner, tally);
            }
        }

        if (owns(stillOwner, tally)) {
            runPhase("check", paymentStore.getPendingTransactions(PendingTransactionStatus.PENDING, batch),
                    PendingTransaction::getPaymentId, e -> checkOne(e, now, tally), stillOwner, tally);
        }

        if (owns(stillOwner, tally)) {
            List<Payment> unqueuedConfirmed = paymentStore.findByStatus(PaymentStatus.CONFIRMED, batch).stream()
                    .filter(p -> paymentStore.getPendingTransaction(p.getPaymentId()).isEmpty())
                    .toList();
            runPhase("activation-retry", unqueuedConfirmed, Payment::getPaymentId, p -> complete(p, tally),
                    stillOwner, tally);
        }

        SweepReport report = tally.toReport();
        if (report.aborted()) {
            log.warn("Verification sweep stopped early: {}", report);
        } else if (report.hasActivity()) {
            log.info("Verification sweep: {}", report);
        } else {
            log.debug("Verification sweep: {}", report);
        }
        return report;
    }

    /**
     * Activates a CONFIRMED payment and completes it. On failure the payment stays CONFIRMED.
     */
    public ActivationResult completeActivation(Payment payment) {
        return complete(payment, new Tally());
    }

    void scanOne(PendingTransaction entry, Instant expiryCutoff, Set<String> claimed, Set<String> claimedThisSweep,
                 Tally tally) {
        String paymentId = entry.getPaymentId();
        Payment payment = paymentStore.getPayment(paymentId).orElse(null);
        if (payment == null || payment.getStatus().isTerminal()) {
            paymentStore.removePendingTransaction(paymentId);
            return;
        }
        if (payment.getStatus() == PaymentStatus.CONFIRMED) {
            complete(payment, tally);
            return;
        }
        if (!AWAITING_TRANSFER.contains(payment.getStatus())) {
            log.debug("Payment {} is {}, scan entry left for the check phase", paymentId, payment.getStatus());
            return;
        }
        if (payment.getCreatedAt() != null && payment.getCreatedAt().isBefore(expiryCutoff)) {
            expire(paymentId, tally);
            return;
        }
        tally.scanned.incrementAndGet();
        TransferQuery query = new TransferQuery(
                entry.getFromAddress(),
                entry.getToAddress(),
                entry.getAmountUsdt(),
                verificationProperties.getScanToleranceFraction(),
                verificationProperties.getMaxBlocksToScan(),
                claimed);
        ChainResult<TransferMatch> result = read(() -> chainReader.findTransfer(query));

        switch (result.kind()) {
            case FOUND -> {
                TransferMatch match = result.value();
                if (!claimedThisSweep.add(match.transactionHash().toLowerCase(Locale.ROOT))) {
                    log.debug("Transfer {} already matched to another payment in this sweep", match.transactionHash());
                    return;
                }
                int confirmations = toInt(match.confirmations());
                Optional<Payment> verifying = paymentStore.updatePaymentStatusFrom(paymentId, AWAITING_TRANSFER,
                        PaymentStatus.VERIFYING,
                        PaymentStatusUpdate.transaction(match.transactionHash(), match.blockNumber(), confirmations)
                                .withFromAddress(match.fromAddress()));
                if (verifying.isEmpty()) {
                    log.debug("Payment {} moved on during the scan, match {} dropped", paymentId, match.transactionHash());
                    return;
                }
                paymentStore.updatePendingTransaction(paymentId,
                        PendingTransactionUpdate.found(match.transactionHash(), match.fromAddress(), confirmations));
                tally.matched.incrementAndGet();
                log.info("Payment {} matched transfer {} ({} confirmations)", paymentId, match.transactionHash(), confirmations);
            }
            case NOT_FOUND -> {
                Optional<PendingTransaction> updated = paymentStore.recordUnresolvedCheck(paymentId, false, true);
                if (budgetExhausted(updated)) {
                    fail(paymentId, MSG_NO_MATCH, AWAITING_TRANSFER, tally);
                }
            }
            case UNAVAILABLE -> {
                boolean consumes = verificationProperties.isChainErrorsConsumeRetries();
                log.warn("Scan for payment {} skipped: {}", paymentId, result.failureReason());
                Optional<PendingTransaction> updated = paymentStore.recordUnresolvedCheck(paymentId, true, consumes);
                if (consumes && budgetExhausted(updated)) {
                    fail(paymentId, MSG_NO_MATCH, AWAITING_TRANSFER, tally);
                }
            }
        }
    }

    void checkOne(PendingTransaction entry, Instant now, Tally tally) {
        String paymentId = entry.getPaymentId();
        Payment payment = paymentStore.getPayment(paymentId).orElse(null);
        if (payment == null || payment.getStatus().isTerminal()) {
            paymentStore.removePendingTransaction(paymentId);
            return;
        }
        if (payment.getStatus() == PaymentStatus.CONFIRMED) {
            complete(payment, tally);
            return;
        }
        tally.checked.incrementAndGet();
        String txHash = entry.getTransactionHash();
        ChainResult<Long> confirmations = read(() -> chainReader.getConfirmations(txHash));

        if (confirmations.isUnavailable()) {
            log.warn("Confirmation check for payment {} skipped: {}", paymentId, confirmations.failureReason());
            paymentStore.recordUnresolvedCheck(paymentId, true, false);
            return;
        }
        if (confirmations.isNotFound()) {
            if (payment.isExpiredAt(now)) {
                if (paymentStore.updatePaymentStatusFrom(paymentId, UNCONFIRMED, PaymentStatus.CANCELLED,
                        PaymentStatusUpdate.error(MSG_NOT_MINED_EXPIRED)).isPresent()) {
                    paymentStore.removePendingTransaction(paymentId);
                    tally.failed.incrementAndGet();
                }
                return;
            }
            if (budgetExhausted(paymentStore.recordUnresolvedCheck(paymentId, false, true))) {
                fail(paymentId, MSG_NOT_MINED_RETRIES, UNCONFIRMED, tally);
            }
            return;
        }

        int count = toInt(confirmations.value());
        paymentStore.updatePendingTransaction(paymentId, PendingTransactionUpdate.confirmations(count));
        paymentStore.updatePaymentStatus(paymentId, PaymentStatus.VERIFYING,
                PaymentStatusUpdate.transaction(null, null, count));

        ChainResult<TransactionReceipt> receipt = read(() -> chainReader.getReceipt(txHash));
        if (!receipt.isFound()) {
            log.debug("Receipt of {} for payment {} not available yet: {}", txHash, paymentId, receipt);
            return;
        }
        if (!receipt.value().isSuccessful()) {
            fail(paymentId, MSG_REVERTED, UNCONFIRMED, tally);
            return;
        }
        int required = Math.max(1, payment.getRequiredConfirmations());
        if (count < required) {
            log.debug("Payment {} at {}/{} confirmations", paymentId, count, required);
            return;
        }

        VerificationResult verdict = transferVerifier.verify(receipt.value(), payment.getToAddress(),
                payment.getAmountUsdt(), verificationProperties.getAmountToleranceUsdt());
        if (!verdict.valid()) {
            fail(paymentId, MSG_INVALID_PREFIX + verdict.reason(), UNCONFIRMED, tally);
            return;
        }
        VerificationResult.TransferDetails details = verdict.details();
        Optional<Payment> confirmed = paymentStore.updatePaymentStatus(paymentId, PaymentStatus.CONFIRMED,
                PaymentStatusUpdate.transaction(details.transactionHash(), details.blockNumber(), count)
                        .withFromAddress(details.fromAddress())
                        .withGasUsed(details.gasUsed()));
        if (confirmed.isEmpty()) {
            return;
        }
        tally.confirmed.incrementAndGet();
        log.info("Payment {} confirmed: {} USDT from {} in {}", paymentId, details.amountUsdt(),
                details.fromAddress(), details.transactionHash());
        complete(confirmed.get(), tally);
    }

    private ActivationResult complete(Payment payment, Tally tally) {
        String paymentId = payment.getPaymentId();
        ActivationResult activation = activationDispatcher.activate(payment);
        if (!activation.success()) {
            log.warn("Payment {} stays CONFIRMED, activation failed: {}", paymentId, activation.error());
            return activation;
        }
        Optional<Payment> completed = paymentStore.updatePaymentStatus(paymentId, PaymentStatus.COMPLETED,
                PaymentStatusUpdate.none());
        completed.filter(p -> p.getFromAddress() != null)
                .ifPresent(p -> paymentStore.updateWalletUsage(p.getUserId(), p.getFromAddress(), p.getAmountUsdt()));
        paymentStore.removePendingTransaction(paymentId);
        if (completed.isPresent()) {
            tally.completed.incrementAndGet();
        }
        return activation;
    }

    /**
     * Expires a payment still waiting for its transfer. A payment that picked up a transaction in the
     * meantime keeps its status and its queue entry.
     */
    private void expire(String paymentId, Tally tally) {
        if (paymentStore.updatePaymentStatusFrom(paymentId, AWAITING_TRANSFER, PaymentStatus.EXPIRED,
                PaymentStatusUpdate.error(MSG_EXPIRED)).isEmpty()) {
            log.debug("Payment {} not expired, it is no longer awaiting a transfer", paymentId);
            return;
        }
        tally.expired.incrementAndGet();
        paymentStore.removePendingTransaction(paymentId);
    }

    private void fail(String paymentId, String message, Set<PaymentStatus> expected, Tally tally) {
        if (paymentStore.updatePaymentStatusFrom(paymentId, expected, PaymentStatus.FAILED,
                PaymentStatusUpdate.error(message)).isEmpty()) {
            log.debug("Payment {} not failed ({}), status changed concurrently", paymentId, message);
            return;
        }
        paymentStore.removePendingTransaction(paymentId);
        tally.failed.incrementAndGet();
        log.info("Payment {} failed: {}", paymentId, message);
    }

    private boolean budgetExhausted(Optional<PendingTransaction> entry) {
        return entry.map(e -> e.getRetryCount() >= verificationProperties.getMaxRetries()).orElse(false);
    }

    private static <T> ChainResult<T> read(Supplier<ChainResult<T>> call) {
        try {
            return call.get();
        } catch (ChainUnavailableException e) {
            return ChainResult.unavailable(e.getMessage());
        }
    }

    private static boolean owns(BooleanSupplier stillOwner, Tally tally) {
        if (tally.aborted.get()) {
            return false;
        }
        if (stillOwner.getAsBoolean()) {
            return true;
        }
        tally.aborted.set(true);
        return false;
    }

    private <T> void runPhase(String phase, List<T> items, Function<T, String> idOf,
                              Consumer<T> action, BooleanSupplier stillOwner, Tally tally) {
        if (items.isEmpty()) {
            return;
        }
        CompletableFuture<?>[] futures = items.stream()
                .map(item -> CompletableFuture.runAsync(() -> {
                    if (!owns(stillOwner, tally)) {
                        return;
                    }
                    try {
                        action.accept(item);
                    } catch (RuntimeException e) {
                        tally.errors.incrementAndGet();
                        log.error("Verification {} failed for payment {}", phase, idOf.apply(item), e);
                    }
                }, verificationExecutor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
    }

    private static int toInt(long value) {
        return (int) Math.min(value, Integer.MAX_VALUE);
    }

    static final class Tally {
        final AtomicInteger expired = new AtomicInteger();
        final AtomicInteger scanned = new AtomicInteger();
        final AtomicInteger matched = new AtomicInteger();
        final AtomicInteger checked = new AtomicInteger();
        final AtomicInteger confirmed = new AtomicInteger();
        final AtomicInteger completed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();
        final AtomicBoolean aborted = new AtomicBoolean();

        SweepReport toReport() {
            return new SweepReport(expired.get(), scanned.get(), matched.get(), checked.get(),
                    confirmed.get(), completed.get(), failed.get(), errors.get(), aborted.get());
        }
    }
}
