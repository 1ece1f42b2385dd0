package com.usdtgate.store;

import com.usdtgate.common.EvmHex;
import com.usdtgate.domain.Payment;
import com.usdtgate.domain.PaymentRepository;
import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PaymentStatusChangedEvent;
import com.usdtgate.domain.PaymentType;
import com.usdtgate.domain.PendingTransaction;
import com.usdtgate.domain.PendingTransactionRepository;
import com.usdtgate.domain.PendingTransactionStatus;
import com.usdtgate.domain.WalletAddress;
import com.usdtgate.domain.WalletAddressRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * MongoDB payment store. Status transitions are guarded findAndModify calls keyed on the allowed
 * predecessor statuses, so racing sweeps and terminal payments resolve to no-ops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoPaymentStore implements PaymentStore {

    private static final Set<PaymentStatus> EXPIRABLE = EnumSet.of(PaymentStatus.PENDING, PaymentStatus.SCANNING);

    private final PaymentRepository paymentRepository;
    private final PendingTransactionRepository pendingTransactionRepository;
    private final WalletAddressRepository walletAddressRepository;
    private final PaymentProperties paymentProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public Payment createPayment(CreatePaymentCommand command) {
        validate(command);
        Instant now = clock.instant();
        Payment payment = new Payment();
        payment.setPaymentId(newPaymentId(now));
        payment.setOrderInvoiceNumber(newInvoiceNumber(now, command.userId()));
        payment.setPaymentType(command.paymentType());
        if (command.paymentType() == PaymentType.SUBSCRIPTION) {
            payment.setPlan(command.plan().toLowerCase(Locale.ROOT));
            payment.setDuration(command.duration().toLowerCase(Locale.ROOT));
        } else {
            payment.setPointsAmount(command.pointsAmount());
        }
        payment.setAmountUsdt(command.amountUsdt());
        payment.setAmountVnd(command.amountVnd());
        payment.setUsdtRate(command.usdtRate());
        payment.setUserId(command.userId());
        payment.setUserEmail(command.userEmail());
        payment.setUserName(command.userName());
        payment.setFromAddress(EvmHex.normalizeAddress(command.fromAddress()));
        payment.setToAddress(EvmHex.normalizeAddress(command.toAddress()));
        payment.setRequiredConfirmations(Math.max(1, paymentProperties.getRequiredConfirmations()));
        payment.setStatus(PaymentStatus.PENDING);
        payment.setIpAddress(command.ipAddress());
        payment.setUserAgent(command.userAgent());
        payment.setNotes(command.notes());
        payment.setCreatedAt(now);
        payment.setUpdatedAt(now);
        payment.setExpiresAt(now.plus(Duration.ofMinutes(paymentProperties.getTtlMinutes())));
        Payment saved = paymentRepository.insert(payment);
        log.info("Created {} payment {} ({} USDT) for user {}",
                saved.getPaymentType(), saved.getPaymentId(), saved.getAmountUsdt(), saved.getUserId());
        return saved;
    }

    @Override
    public Optional<Payment> getPayment(String paymentId) {
        return paymentRepository.findById(paymentId);
    }

    @Override
    public Optional<Payment> getPaymentByInvoice(String orderInvoiceNumber) {
        return paymentRepository.findByOrderInvoiceNumber(orderInvoiceNumber);
    }

    @Override
    public Optional<Payment> getPaymentByTxHash(String transactionHash) {
        if (transactionHash == null) {
            return Optional.empty();
        }
        return paymentRepository.findFirstByTransactionHash(transactionHash.toLowerCase(Locale.ROOT));
    }

    @Override
    public Optional<Payment> updatePaymentStatus(String paymentId, PaymentStatus newStatus, PaymentStatusUpdate fields) {
        return updatePaymentStatusFrom(paymentId, EnumSet.allOf(PaymentStatus.class), newStatus, fields);
    }

    @Override
    public Optional<Payment> updatePaymentStatusFrom(String paymentId, Set<PaymentStatus> expected,
                                                     PaymentStatus newStatus, PaymentStatusUpdate fields) {
        if (newStatus == null) {
            throw new PaymentStoreException(PaymentStoreException.INVALID_PAYMENT, "Status is required");
        }
        Set<PaymentStatus> from = PaymentStatus.predecessorsOf(newStatus);
        from.retainAll(expected);
        if (from.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Update update = new Update().set("status", newStatus).set("updatedAt", now);
        applyFields(update, fields != null ? fields : PaymentStatusUpdate.none());
        stampStatusTimestamp(update, newStatus, now);
        Payment before = paymentRepository.updateIfStatusIn(paymentId, from, update,
                newStatus == PaymentStatus.COMPLETED);
        if (before == null) {
            log.debug("Status update of {} to {} skipped (status not in {} or missing linkage)", paymentId, newStatus, from);
            return Optional.empty();
        }
        Optional<Payment> after = paymentRepository.findById(paymentId);
        after.filter(p -> before.getStatus() != newStatus)
                .ifPresent(p -> publishChange(p, before.getStatus(), now));
        return after;
    }

    @Override
    public Payment linkSubscription(String paymentId, String subscriptionId) {
        return link(paymentId, PaymentType.SUBSCRIPTION, "subscriptionId", subscriptionId);
    }

    @Override
    public Payment linkPointsTransaction(String paymentId, String pointsTransactionId) {
        return link(paymentId, PaymentType.POINTS, "pointsTransactionId", pointsTransactionId);
    }

    private Payment link(String paymentId, PaymentType type, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new PaymentStoreException(PaymentStoreException.INVALID_PAYMENT, field + " is required");
        }
        Payment updated = paymentRepository.setLinkIfAbsent(paymentId, type, field, value, clock.instant());
        if (updated != null) {
            log.info("Payment {} linked {}={}", paymentId, field, value);
            return updated;
        }
        Payment existing = paymentRepository.findById(paymentId).orElseThrow(() -> notFound(paymentId));
        if (existing.getPaymentType() != type) {
            throw new PaymentStoreException(PaymentStoreException.TYPE_MISMATCH,
                    "Payment " + paymentId + " is " + existing.getPaymentType() + ", cannot set " + field);
        }
        if (value.equals(existing.linkedActivationId())) {
            return existing;
        }
        throw new PaymentStoreException(PaymentStoreException.LINKAGE_CONFLICT,
                "Payment " + paymentId + " already linked to " + existing.linkedActivationId() + ", refusing " + value);
    }

    @Override
    public PendingTransaction addPendingTransaction(PendingTransaction entry) {
        if (entry.getPaymentId() == null || entry.getStatus() == null) {
            throw new PaymentStoreException(PaymentStoreException.INVALID_PAYMENT, "paymentId and status are required");
        }
        if (entry.getStatus() == PendingTransactionStatus.PENDING && entry.getTransactionHash() == null) {
            throw new PaymentStoreException(PaymentStoreException.INVALID_PAYMENT,
                    "A PENDING queue entry needs a transaction hash");
        }
        Instant now = clock.instant();
        if (entry.getFirstSeenAt() == null) {
            entry.setFirstSeenAt(now);
        }
        entry.setTransactionHash(entry.getTransactionHash() != null
                ? entry.getTransactionHash().toLowerCase(Locale.ROOT) : null);
        entry.setToAddress(EvmHex.normalizeAddress(entry.getToAddress()));
        entry.setFromAddress(EvmHex.normalizeAddress(entry.getFromAddress()));
        try {
            return pendingTransactionRepository.insert(entry);
        } catch (DuplicateKeyException e) {
            log.debug("Payment {} already queued", entry.getPaymentId());
            return pendingTransactionRepository.findById(entry.getPaymentId()).orElseThrow(() -> e);
        }
    }

    @Override
    public Optional<PendingTransaction> getPendingTransaction(String paymentId) {
        return pendingTransactionRepository.findById(paymentId);
    }

    @Override
    public List<PendingTransaction> getPendingTransactions(PendingTransactionStatus status, int limit) {
        return pendingTransactionRepository.findByStatusOrderByLastCheckedAtAsc(status, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public Optional<PendingTransaction> updatePendingTransaction(String paymentId, PendingTransactionUpdate update) {
        Update u = new Update().set("lastCheckedAt", clock.instant());
        if (update.retryCount() != null) {
            u.set("retryCount", update.retryCount());
        }
        if (update.confirmationCount() != null) {
            u.set("confirmationCount", update.confirmationCount());
        }
        if (update.transactionHash() != null) {
            u.set("transactionHash", update.transactionHash().toLowerCase(Locale.ROOT));
        }
        if (update.fromAddress() != null) {
            u.set("fromAddress", EvmHex.normalizeAddress(update.fromAddress()));
        }
        if (update.status() != null) {
            u.set("status", update.status());
        }
        return Optional.ofNullable(pendingTransactionRepository.updateByPaymentId(paymentId, u));
    }

    @Override
    public Optional<PendingTransaction> recordUnresolvedCheck(String paymentId, boolean chainError, boolean consumesRetry) {
        Update u = new Update().set("lastCheckedAt", clock.instant());
        if (consumesRetry) {
            u.inc("retryCount", 1);
        }
        if (chainError) {
            u.inc("chainErrorCount", 1);
        }
        return Optional.ofNullable(pendingTransactionRepository.updateByPaymentId(paymentId, u));
    }

    @Override
    public boolean removePendingTransaction(String paymentIdOrHash) {
        if (EvmHex.isTransactionHash(paymentIdOrHash)) {
            return pendingTransactionRepository.deleteByTransactionHash(paymentIdOrHash.toLowerCase(Locale.ROOT)) > 0;
        }
        if (!pendingTransactionRepository.existsById(paymentIdOrHash)) {
            return false;
        }
        pendingTransactionRepository.deleteById(paymentIdOrHash);
        return true;
    }

    @Override
    public WalletAddress registerWallet(String userId, String walletAddress, String label) {
        requireWallet(userId, walletAddress);
        return walletAddressRepository.registerIfAbsent(userId, EvmHex.normalizeAddress(walletAddress), label, clock.instant());
    }

    @Override
    public WalletAddress updateWalletUsage(String userId, String walletAddress, BigDecimal amountUsdt) {
        requireWallet(userId, walletAddress);
        return walletAddressRepository.recordPayment(userId, EvmHex.normalizeAddress(walletAddress),
                amountUsdt != null ? amountUsdt : BigDecimal.ZERO, clock.instant());
    }

    @Override
    public List<WalletAddress> getUserWallets(String userId) {
        return walletAddressRepository.findByUserIdOrderByLastUsedAtDesc(userId);
    }

    @Override
    public List<Payment> getAllPayments(PaymentFilter filter) {
        return paymentRepository.search(filter.userId(), filter.paymentType(), filter.status(), filter.limit(), filter.skip());
    }

    @Override
    public List<Payment> getUserPayments(String userId, PaymentType type, PaymentStatus status, int limit, int skip) {
        PaymentFilter filter = new PaymentFilter(userId, type, status, limit, skip);
        return paymentRepository.search(userId, type, status, filter.limit(), filter.skip());
    }

    @Override
    public List<Payment> findExpirable(Instant createdBefore, int limit) {
        return paymentRepository.findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                EXPIRABLE, createdBefore, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public List<Payment> findByStatus(PaymentStatus status, int limit) {
        return paymentRepository.findByStatusOrderByUpdatedAtAsc(status, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public Set<String> findClaimedTransactionHashes(Instant since) {
        Set<String> hashes = new HashSet<>();
        for (String hash : paymentRepository.findTransactionHashesCreatedSince(since)) {
            hashes.add(hash.toLowerCase(Locale.ROOT));
        }
        return hashes;
    }

    @Override
    public Payment manualConfirmPayment(String paymentId, String adminId, String notes) {
        Payment existing = paymentRepository.findById(paymentId).orElseThrow(() -> notFound(paymentId));
        if (existing.getStatus() == PaymentStatus.COMPLETED) {
            return existing;
        }
        Instant now = clock.instant();
        Update update = new Update()
                .set("status", PaymentStatus.CONFIRMED)
                .set("updatedAt", now)
                .set("manuallyProcessed", true)
                .set("processedByAdmin", adminId)
                .set("adminNotes", notes)
                .unset("errorMessage")
                .min("confirmedAt", now);
        Set<PaymentStatus> overridable = EnumSet.complementOf(EnumSet.of(PaymentStatus.COMPLETED));
        Payment before = paymentRepository.updateIfStatusIn(paymentId, overridable, update, false);
        Payment after = paymentRepository.findById(paymentId).orElseThrow(() -> notFound(paymentId));
        if (before != null) {
            log.info("Payment {} manually confirmed by {} (was {})", paymentId, adminId, before.getStatus());
            if (before.getStatus() != PaymentStatus.CONFIRMED) {
                publishChange(after, before.getStatus(), now);
            }
        }
        return after;
    }

    @Override
    public PaymentStats getPaymentStats() {
        Map<PaymentStatus, Long> counts = paymentRepository.countByStatus();
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return new PaymentStats(counts, total, paymentRepository.sumAmountUsdtByStatus(PaymentStatus.COMPLETED));
    }

    private void publishChange(Payment payment, PaymentStatus previous, Instant now) {
        log.info("Payment {} {} -> {}", payment.getPaymentId(), previous, payment.getStatus());
        eventPublisher.publishEvent(PaymentStatusChangedEvent.of(payment, previous, now));
    }

    private static void applyFields(Update update, PaymentStatusUpdate fields) {
        if (fields.transactionHash() != null) {
            update.set("transactionHash", fields.transactionHash().toLowerCase(Locale.ROOT));
        }
        if (fields.blockNumber() != null) {
            update.set("blockNumber", fields.blockNumber());
        }
        if (fields.confirmationCount() != null) {
            update.set("confirmationCount", fields.confirmationCount());
        }
        if (fields.fromAddress() != null) {
            update.set("fromAddress", EvmHex.normalizeAddress(fields.fromAddress()));
        }
        if (fields.errorMessage() != null) {
            update.set("errorMessage", fields.errorMessage());
        }
        if (fields.gasUsed() != null) {
            update.set("gasUsed", fields.gasUsed());
        }
    }

    /** $min keeps the first stamp when a timestamp is only written once. */
    private static void stampStatusTimestamp(Update update, PaymentStatus status, Instant now) {
        switch (status) {
            case PROCESSING, VERIFYING -> update.min("paymentReceivedAt", now);
            case CONFIRMED -> update.min("confirmedAt", now);
            case COMPLETED -> update.set("completedAt", now).min("confirmedAt", now);
            case CANCELLED -> update.set("cancelledAt", now);
            case EXPIRED -> update.set("expiredAt", now);
            case FAILED -> update.set("failedAt", now);
            default -> {
            }
        }
    }

    private static void validate(CreatePaymentCommand c) {
        if (c == null) {
            throw invalid("Payment command is required");
        }
        if (c.userId() == null || c.userId().isBlank()) {
            throw invalid("userId is required");
        }
        if (c.paymentType() == null) {
            throw invalid("paymentType is required");
        }
        if (c.amountUsdt() == null || c.amountUsdt().signum() <= 0) {
            throw invalid("amountUsdt must be positive");
        }
        if (!EvmHex.isAddress(c.toAddress())) {
            throw invalid("toAddress is not a valid BSC address");
        }
        if (c.fromAddress() != null && !EvmHex.isAddress(c.fromAddress())) {
            throw invalid("fromAddress is not a valid BSC address");
        }
        if (c.paymentType() == PaymentType.SUBSCRIPTION) {
            if (c.plan() == null || !Payment.PLANS.contains(c.plan().toLowerCase(Locale.ROOT))) {
                throw invalid("plan must be one of " + Payment.PLANS);
            }
            if (c.duration() == null || !Payment.DURATIONS.contains(c.duration().toLowerCase(Locale.ROOT))) {
                throw invalid("duration must be one of " + Payment.DURATIONS);
            }
        } else if (c.pointsAmount() == null || c.pointsAmount() <= 0) {
            throw invalid("pointsAmount must be positive");
        }
    }

    private static void requireWallet(String userId, String walletAddress) {
        if (userId == null || userId.isBlank()) {
            throw invalid("userId is required");
        }
        if (!EvmHex.isAddress(walletAddress)) {
            throw invalid("walletAddress is not a valid BSC address");
        }
    }

    private static String newPaymentId(Instant now) {
        return "USDT-" + now.getEpochSecond() + "-" + randomHex(8);
    }

    private static String newInvoiceNumber(Instant now, String userId) {
        String userPart = userId.length() > 8 ? userId.substring(0, 8) : userId;
        return "INV-USDT-" + now.getEpochSecond() + "-" + userPart + "-" + randomHex(4).toUpperCase(Locale.ROOT);
    }

    private static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }

    private static PaymentStoreException invalid(String message) {
        return new PaymentStoreException(PaymentStoreException.INVALID_PAYMENT, message);
    }

    private static PaymentStoreException notFound(String paymentId) {
        return new PaymentStoreException(PaymentStoreException.PAYMENT_NOT_FOUND, "Payment not found: " + paymentId);
    }
}
