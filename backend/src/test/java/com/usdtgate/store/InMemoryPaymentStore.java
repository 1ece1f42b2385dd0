package com.usdtgate.store;

import com.usdtgate.common.EvmHex;
import com.usdtgate.domain.Payment;
import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PaymentType;
import com.usdtgate.domain.PendingTransaction;
import com.usdtgate.domain.PendingTransactionStatus;
import com.usdtgate.domain.WalletAddress;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Map-backed {@link PaymentStore} for service tests. Applies the same transition guard as the Mongo store
 * and records every accepted status change per payment.
 */
public class InMemoryPaymentStore implements PaymentStore {

    private final Map<String, Payment> payments = new ConcurrentHashMap<>();
    private final Map<String, PendingTransaction> queue = new ConcurrentHashMap<>();
    private final Map<String, WalletAddress> wallets = new ConcurrentHashMap<>();
    private final Map<String, List<PaymentStatus>> history = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final Clock clock;
    private final int ttlMinutes;
    private final int requiredConfirmations;

    public InMemoryPaymentStore(Clock clock, int ttlMinutes, int requiredConfirmations) {
        this.clock = clock;
        this.ttlMinutes = ttlMinutes;
        this.requiredConfirmations = requiredConfirmations;
    }

    /** Accepted statuses of the payment in order, starting with PENDING. */
    public List<PaymentStatus> history(String paymentId) {
        return List.copyOf(history.getOrDefault(paymentId, List.of()));
    }

    /** Direct write for arranging fixtures; bypasses the transition guard. */
    public synchronized void put(Payment payment) {
        payments.put(payment.getPaymentId(), payment);
        history.computeIfAbsent(payment.getPaymentId(), id -> new ArrayList<>()).add(payment.getStatus());
    }

    @Override
    public synchronized Payment createPayment(CreatePaymentCommand command) {
        if (command.amountUsdt() == null || command.amountUsdt().signum() <= 0) {
            throw new PaymentStoreException(PaymentStoreException.INVALID_PAYMENT, "amountUsdt must be positive");
        }
        Instant now = clock.instant();
        Payment payment = new Payment();
        payment.setPaymentId("USDT-" + now.getEpochSecond() + "-" + String.format("%08x", sequence.incrementAndGet()));
        payment.setOrderInvoiceNumber("INV-" + payment.getPaymentId());
        payment.setPaymentType(command.paymentType());
        payment.setPlan(command.plan());
        payment.setDuration(command.duration());
        payment.setPointsAmount(command.pointsAmount());
        payment.setAmountUsdt(command.amountUsdt());
        payment.setAmountVnd(command.amountVnd());
        payment.setUserId(command.userId());
        payment.setFromAddress(EvmHex.normalizeAddress(command.fromAddress()));
        payment.setToAddress(EvmHex.normalizeAddress(command.toAddress()));
        payment.setRequiredConfirmations(requiredConfirmations);
        payment.setStatus(PaymentStatus.PENDING);
        payment.setCreatedAt(now);
        payment.setUpdatedAt(now);
        payment.setExpiresAt(now.plus(Duration.ofMinutes(ttlMinutes)));
        put(payment);
        return copy(payment);
    }

    @Override
    public Optional<Payment> getPayment(String paymentId) {
        return Optional.ofNullable(payments.get(paymentId)).map(InMemoryPaymentStore::copy);
    }

    @Override
    public Optional<Payment> getPaymentByInvoice(String orderInvoiceNumber) {
        return payments.values().stream()
                .filter(p -> orderInvoiceNumber.equals(p.getOrderInvoiceNumber()))
                .findFirst().map(InMemoryPaymentStore::copy);
    }

    @Override
    public Optional<Payment> getPaymentByTxHash(String transactionHash) {
        return payments.values().stream()
                .filter(p -> transactionHash != null && transactionHash.equalsIgnoreCase(p.getTransactionHash()))
                .findFirst().map(InMemoryPaymentStore::copy);
    }

    @Override
    public Optional<Payment> updatePaymentStatus(String paymentId, PaymentStatus newStatus,
                                                 PaymentStatusUpdate fields) {
        return updatePaymentStatusFrom(paymentId, EnumSet.allOf(PaymentStatus.class), newStatus, fields);
    }

    @Override
    public synchronized Optional<Payment> updatePaymentStatusFrom(String paymentId, Set<PaymentStatus> expected,
                                                                  PaymentStatus newStatus, PaymentStatusUpdate fields) {
        Payment p = payments.get(paymentId);
        if (p == null || !expected.contains(p.getStatus())
                || !PaymentStatus.predecessorsOf(newStatus).contains(p.getStatus())) {
            return Optional.empty();
        }
        if (newStatus == PaymentStatus.COMPLETED && !p.isActivated()) {
            return Optional.empty();
        }
        PaymentStatus previous = p.getStatus();
        Instant now = clock.instant();
        PaymentStatusUpdate f = fields != null ? fields : PaymentStatusUpdate.none();
        if (f.transactionHash() != null) {
            p.setTransactionHash(f.transactionHash().toLowerCase(Locale.ROOT));
        }
        if (f.blockNumber() != null) {
            p.setBlockNumber(f.blockNumber());
        }
        if (f.confirmationCount() != null) {
            p.setConfirmationCount(f.confirmationCount());
        }
        if (f.fromAddress() != null) {
            p.setFromAddress(EvmHex.normalizeAddress(f.fromAddress()));
        }
        if (f.errorMessage() != null) {
            p.setErrorMessage(f.errorMessage());
        }
        if (f.gasUsed() != null) {
            p.setGasUsed(f.gasUsed());
        }
        p.setStatus(newStatus);
        p.setUpdatedAt(now);
        switch (newStatus) {
            case PROCESSING, VERIFYING -> p.setPaymentReceivedAt(min(p.getPaymentReceivedAt(), now));
            case CONFIRMED -> p.setConfirmedAt(min(p.getConfirmedAt(), now));
            case COMPLETED -> {
                p.setCompletedAt(now);
                p.setConfirmedAt(min(p.getConfirmedAt(), now));
            }
            case CANCELLED -> p.setCancelledAt(now);
            case EXPIRED -> p.setExpiredAt(now);
            case FAILED -> p.setFailedAt(now);
            default -> {
            }
        }
        if (previous != newStatus) {
            history.computeIfAbsent(paymentId, id -> new ArrayList<>()).add(newStatus);
        }
        return Optional.of(copy(p));
    }

    @Override
    public Payment linkSubscription(String paymentId, String subscriptionId) {
        return link(paymentId, PaymentType.SUBSCRIPTION, subscriptionId);
    }

    @Override
    public Payment linkPointsTransaction(String paymentId, String pointsTransactionId) {
        return link(paymentId, PaymentType.POINTS, pointsTransactionId);
    }

    private synchronized Payment link(String paymentId, PaymentType type, String value) {
        Payment p = payments.get(paymentId);
        if (p == null) {
            throw new PaymentStoreException(PaymentStoreException.PAYMENT_NOT_FOUND, "Payment not found: " + paymentId);
        }
        if (p.getPaymentType() != type) {
            throw new PaymentStoreException(PaymentStoreException.TYPE_MISMATCH, "Wrong payment type");
        }
        if (p.linkedActivationId() != null && !p.linkedActivationId().equals(value)) {
            throw new PaymentStoreException(PaymentStoreException.LINKAGE_CONFLICT, "Already linked");
        }
        if (type == PaymentType.SUBSCRIPTION) {
            p.setSubscriptionId(value);
        } else {
            p.setPointsTransactionId(value);
        }
        return copy(p);
    }

    @Override
    public synchronized PendingTransaction addPendingTransaction(PendingTransaction entry) {
        PendingTransaction existing = queue.get(entry.getPaymentId());
        if (existing != null) {
            return copy(existing);
        }
        if (entry.getStatus() == PendingTransactionStatus.PENDING && entry.getTransactionHash() == null) {
            throw new PaymentStoreException(PaymentStoreException.INVALID_PAYMENT, "hash required");
        }
        PendingTransaction stored = copy(entry);
        stored.setFirstSeenAt(clock.instant());
        if (stored.getTransactionHash() != null) {
            stored.setTransactionHash(stored.getTransactionHash().toLowerCase(Locale.ROOT));
        }
        queue.put(stored.getPaymentId(), stored);
        return copy(stored);
    }

    @Override
    public Optional<PendingTransaction> getPendingTransaction(String paymentId) {
        return Optional.ofNullable(queue.get(paymentId)).map(InMemoryPaymentStore::copy);
    }

    @Override
    public List<PendingTransaction> getPendingTransactions(PendingTransactionStatus status, int limit) {
        return queue.values().stream()
                .filter(e -> e.getStatus() == status)
                .sorted(Comparator.comparing(PendingTransaction::getPaymentId))
                .limit(limit)
                .map(InMemoryPaymentStore::copy)
                .toList();
    }

    @Override
    public synchronized Optional<PendingTransaction> updatePendingTransaction(String paymentId,
                                                                           PendingTransactionUpdate update) {
        PendingTransaction e = queue.get(paymentId);
        if (e == null) {
            return Optional.empty();
        }
        e.setLastCheckedAt(clock.instant());
        if (update.retryCount() != null) {
            e.setRetryCount(update.retryCount());
        }
        if (update.confirmationCount() != null) {
            e.setConfirmationCount(update.confirmationCount());
        }
        if (update.transactionHash() != null) {
            e.setTransactionHash(update.transactionHash().toLowerCase(Locale.ROOT));
        }
        if (update.fromAddress() != null) {
            e.setFromAddress(EvmHex.normalizeAddress(update.fromAddress()));
        }
        if (update.status() != null) {
            e.setStatus(update.status());
        }
        return Optional.of(copy(e));
    }

    @Override
    public synchronized Optional<PendingTransaction> recordUnresolvedCheck(String paymentId, boolean chainError,
                                                                        boolean consumesRetry) {
        PendingTransaction e = queue.get(paymentId);
        if (e == null) {
            return Optional.empty();
        }
        e.setLastCheckedAt(clock.instant());
        if (consumesRetry) {
            e.setRetryCount(e.getRetryCount() + 1);
        }
        if (chainError) {
            e.setChainErrorCount(e.getChainErrorCount() + 1);
        }
        return Optional.of(copy(e));
    }

    @Override
    public synchronized boolean removePendingTransaction(String paymentIdOrHash) {
        if (EvmHex.isTransactionHash(paymentIdOrHash)) {
            return queue.values().removeIf(e -> paymentIdOrHash.equalsIgnoreCase(e.getTransactionHash()));
        }
        return queue.remove(paymentIdOrHash) != null;
    }

    @Override
    public synchronized WalletAddress registerWallet(String userId, String walletAddress, String label) {
        String address = EvmHex.normalizeAddress(walletAddress);
        return wallets.computeIfAbsent(WalletAddress.idOf(userId, address), id -> {
            WalletAddress w = new WalletAddress();
            w.setId(id);
            w.setUserId(userId);
            w.setWalletAddress(address);
            w.setLabel(label);
            w.setFirstUsedAt(clock.instant());
            w.setTotalAmountUsdt(BigDecimal.ZERO);
            return w;
        });
    }

    @Override
    public synchronized WalletAddress updateWalletUsage(String userId, String walletAddress, BigDecimal amountUsdt) {
        WalletAddress w = registerWallet(userId, walletAddress, null);
        w.setPaymentCount(w.getPaymentCount() + 1);
        w.setTotalAmountUsdt(w.getTotalAmountUsdt().add(amountUsdt != null ? amountUsdt : BigDecimal.ZERO));
        w.setLastUsedAt(clock.instant());
        return w;
    }

    @Override
    public List<WalletAddress> getUserWallets(String userId) {
        return wallets.values().stream().filter(w -> userId.equals(w.getUserId())).toList();
    }

    @Override
    public List<Payment> getAllPayments(PaymentFilter filter) {
        return payments.values().stream()
                .filter(p -> filter.userId() == null || filter.userId().equals(p.getUserId()))
                .filter(p -> filter.paymentType() == null || filter.paymentType() == p.getPaymentType())
                .filter(p -> filter.status() == null || filter.status() == p.getStatus())
                .sorted(Comparator.comparing(Payment::getCreatedAt).reversed())
                .skip(filter.skip())
                .limit(filter.limit())
                .map(InMemoryPaymentStore::copy)
                .toList();
    }

    @Override
    public List<Payment> getUserPayments(String userId, PaymentType type, PaymentStatus status, int limit, int skip) {
        return getAllPayments(new PaymentFilter(userId, type, status, limit, skip));
    }

    @Override
    public List<Payment> findExpirable(Instant createdBefore, int limit) {
        return payments.values().stream()
                .filter(p -> p.getStatus() == PaymentStatus.PENDING || p.getStatus() == PaymentStatus.SCANNING)
                .filter(p -> p.getCreatedAt().isBefore(createdBefore))
                .limit(limit)
                .map(InMemoryPaymentStore::copy)
                .toList();
    }

    @Override
    public List<Payment> findByStatus(PaymentStatus status, int limit) {
        return payments.values().stream()
                .filter(p -> p.getStatus() == status)
                .limit(limit)
                .map(InMemoryPaymentStore::copy)
                .toList();
    }

    @Override
    public Set<String> findClaimedTransactionHashes(Instant since) {
        return payments.values().stream()
                .filter(p -> p.getTransactionHash() != null && !p.getCreatedAt().isBefore(since))
                .map(p -> p.getTransactionHash().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    @Override
    public synchronized Payment manualConfirmPayment(String paymentId, String adminId, String notes) {
        Payment p = payments.get(paymentId);
        if (p == null) {
            throw new PaymentStoreException(PaymentStoreException.PAYMENT_NOT_FOUND, "Payment not found: " + paymentId);
        }
        if (p.getStatus() != PaymentStatus.COMPLETED) {
            if (p.getStatus() != PaymentStatus.CONFIRMED) {
                history.computeIfAbsent(paymentId, id -> new ArrayList<>()).add(PaymentStatus.CONFIRMED);
            }
            p.setStatus(PaymentStatus.CONFIRMED);
            p.setManuallyProcessed(true);
            p.setProcessedByAdmin(adminId);
            p.setAdminNotes(notes);
            p.setErrorMessage(null);
            p.setConfirmedAt(min(p.getConfirmedAt(), clock.instant()));
        }
        return copy(p);
    }

    @Override
    public PaymentStats getPaymentStats() {
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        payments.values().forEach(p -> counts.merge(p.getStatus(), 1L, Long::sum));
        BigDecimal completed = payments.values().stream()
                .filter(p -> p.getStatus() == PaymentStatus.COMPLETED)
                .map(Payment::getAmountUsdt)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new PaymentStats(counts, payments.size(), completed);
    }

    private static Instant min(Instant current, Instant now) {
        return current == null || now.isBefore(current) ? now : current;
    }

    private static Payment copy(Payment p) {
        Payment c = new Payment();
        c.setPaymentId(p.getPaymentId());
        c.setOrderInvoiceNumber(p.getOrderInvoiceNumber());
        c.setPaymentType(p.getPaymentType());
        c.setPlan(p.getPlan());
        c.setDuration(p.getDuration());
        c.setPointsAmount(p.getPointsAmount());
        c.setAmountUsdt(p.getAmountUsdt());
        c.setAmountVnd(p.getAmountVnd());
        c.setUsdtRate(p.getUsdtRate());
        c.setUserId(p.getUserId());
        c.setFromAddress(p.getFromAddress());
        c.setToAddress(p.getToAddress());
        c.setTransactionHash(p.getTransactionHash());
        c.setBlockNumber(p.getBlockNumber());
        c.setConfirmationCount(p.getConfirmationCount());
        c.setRequiredConfirmations(p.getRequiredConfirmations());
        c.setGasUsed(p.getGasUsed());
        c.setStatus(p.getStatus());
        c.setErrorMessage(p.getErrorMessage());
        c.setSubscriptionId(p.getSubscriptionId());
        c.setPointsTransactionId(p.getPointsTransactionId());
        c.setManuallyProcessed(p.isManuallyProcessed());
        c.setProcessedByAdmin(p.getProcessedByAdmin());
        c.setAdminNotes(p.getAdminNotes());
        c.setCreatedAt(p.getCreatedAt());
        c.setUpdatedAt(p.getUpdatedAt());
        c.setExpiresAt(p.getExpiresAt());
        c.setPaymentReceivedAt(p.getPaymentReceivedAt());
        c.setConfirmedAt(p.getConfirmedAt());
        c.setCompletedAt(p.getCompletedAt());
        c.setCancelledAt(p.getCancelledAt());
        c.setExpiredAt(p.getExpiredAt());
        c.setFailedAt(p.getFailedAt());
        return c;
    }

    private static PendingTransaction copy(PendingTransaction e) {
        PendingTransaction c = new PendingTransaction();
        c.setPaymentId(e.getPaymentId());
        c.setUserId(e.getUserId());
        c.setTransactionHash(e.getTransactionHash());
        c.setFromAddress(e.getFromAddress());
        c.setToAddress(e.getToAddress());
        c.setAmountUsdt(e.getAmountUsdt());
        c.setFirstSeenAt(e.getFirstSeenAt());
        c.setLastCheckedAt(e.getLastCheckedAt());
        c.setConfirmationCount(e.getConfirmationCount());
        c.setRequiredConfirmations(e.getRequiredConfirmations());
        c.setRetryCount(e.getRetryCount());
        c.setChainErrorCount(e.getChainErrorCount());
        c.setStatus(e.getStatus());
        return c;
    }
}
