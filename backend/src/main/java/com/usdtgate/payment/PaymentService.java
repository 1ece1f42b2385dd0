package com.usdtgate.payment;

import com.usdtgate.activation.ActivationResult;
import com.usdtgate.chain.ChainReader;
import com.usdtgate.chain.ChainResult;
import com.usdtgate.chain.ChainTransaction;
import com.usdtgate.chain.ChainUnavailableException;
import com.usdtgate.chain.config.ChainProperties;
import com.usdtgate.common.EvmHex;
import com.usdtgate.domain.Payment;
import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PaymentType;
import com.usdtgate.domain.WalletAddress;
import com.usdtgate.scheduler.PaymentVerificationService;
import com.usdtgate.store.CreatePaymentCommand;
import com.usdtgate.store.PaymentFilter;
import com.usdtgate.store.PaymentProperties;
import com.usdtgate.store.PaymentStats;
import com.usdtgate.store.PaymentStatusUpdate;
import com.usdtgate.store.PaymentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * User and admin operations on payments. All writes go through {@link PaymentStore}; queueing goes
 * through {@link PaymentVerificationService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    static final String MSG_CANCELLED_BY_USER = "Cancelled by user";

    private final PaymentStore paymentStore;
    private final PaymentVerificationService verificationService;
    private final ChainReader chainReader;
    private final PaymentProperties paymentProperties;
    private final ChainProperties chainProperties;

    /** Creates the payment; without an explicit recipient the platform receiving address is used. */
    public Payment createPayment(CreatePaymentCommand request) {
        CreatePaymentCommand command = request.toAddress() == null
                ? request.withToAddress(chainProperties.getReceivingAddress())
                : request;
        if (paymentProperties.isBalanceCheckEnabled() && command.fromAddress() != null && command.amountUsdt() != null) {
            checkBalance(command.fromAddress(), command.amountUsdt());
        }
        Payment payment = paymentStore.createPayment(command);
        if (payment.getFromAddress() != null) {
            paymentStore.registerWallet(payment.getUserId(), payment.getFromAddress(), null);
        }
        if (paymentProperties.isScanOnCreate()) {
            verificationService.beginVerification(payment, null);
            return paymentStore.getPayment(payment.getPaymentId()).orElse(payment);
        }
        return payment;
    }

    public PaymentView getPayment(String paymentId) {
        Payment payment = require(paymentId);
        return new PaymentView(payment, statusMessage(payment));
    }

    /**
     * Attaches the user's transaction hash and queues it for confirmation checks. Submitting the hash the
     * payment already carries is a no-op.
     */
    public Payment submitTransactionHash(String paymentId, String transactionHash) {
        if (!EvmHex.isTransactionHash(transactionHash)) {
            throw new PaymentServiceException(PaymentServiceException.INVALID_TRANSACTION_HASH,
                    "Transaction hash must be 0x followed by 64 hex characters");
        }
        String hash = transactionHash.trim().toLowerCase(Locale.ROOT);
        Payment payment = require(paymentId);
        if (hash.equalsIgnoreCase(payment.getTransactionHash())) {
            return payment;
        }
        if (payment.getTransactionHash() != null) {
            throw new PaymentServiceException(PaymentServiceException.TRANSACTION_ALREADY_SET,
                    "Payment " + paymentId + " already has transaction " + payment.getTransactionHash());
        }
        if (payment.getStatus().isTerminal()) {
            throw invalidState(payment);
        }
        Optional<Payment> claimant = paymentStore.getPaymentByTxHash(hash);
        if (claimant.isPresent() && !claimant.get().getPaymentId().equals(paymentId)) {
            throw new PaymentServiceException(PaymentServiceException.TRANSACTION_ALREADY_CLAIMED,
                    "Transaction " + hash + " is already used by another payment");
        }
        String sender = payment.getFromAddress() == null ? lookupSender(hash) : null;
        if (verificationService.beginVerification(payment, hash, sender).isEmpty()) {
            throw invalidState(require(paymentId));
        }
        log.info("Transaction {} submitted for payment {}", hash, paymentId);
        return require(paymentId);
    }

    /** The user reports the transfer as sent: starts scanning unless the payment is already queued. */
    public Payment confirmSent(String paymentId) {
        Payment payment = require(paymentId);
        if (payment.getStatus().isTerminal()) {
            throw invalidState(payment);
        }
        if (paymentStore.getPendingTransaction(paymentId).isPresent()) {
            return payment;
        }
        verificationService.beginVerification(payment, payment.getTransactionHash());
        return require(paymentId);
    }

    public Payment cancel(String paymentId) {
        Payment payment = require(paymentId);
        if (payment.getStatus() == PaymentStatus.CANCELLED) {
            return payment;
        }
        if (payment.getStatus() != PaymentStatus.PENDING && payment.getStatus() != PaymentStatus.SCANNING) {
            throw invalidState(payment);
        }
        paymentStore.updatePaymentStatus(paymentId, PaymentStatus.CANCELLED, PaymentStatusUpdate.error(MSG_CANCELLED_BY_USER));
        paymentStore.removePendingTransaction(paymentId);
        return require(paymentId);
    }

    public List<Payment> getUserPayments(String userId, PaymentType type, PaymentStatus status, int limit, int skip) {
        return paymentStore.getUserPayments(userId, type, status, limit, skip);
    }

    public List<WalletAddress> getUserWallets(String userId) {
        return paymentStore.getUserWallets(userId);
    }

    public List<Payment> listPayments(PaymentFilter filter) {
        return paymentStore.getAllPayments(filter);
    }

    public PaymentStats getStats() {
        return paymentStore.getPaymentStats();
    }

    /**
     * Admin override: confirms the payment whatever the chain says, then activates and completes it.
     * Any queue entry is dropped, so when activation fails the activation-retry phase of the sweep
     * owns the payment from here on.
     */
    public Payment manualConfirm(String paymentId, String adminId, String notes) {
        Payment confirmed = paymentStore.manualConfirmPayment(paymentId, adminId, notes);
        if (confirmed.getStatus() == PaymentStatus.COMPLETED) {
            return confirmed;
        }
        paymentStore.removePendingTransaction(paymentId);
        ActivationResult activation = verificationService.completeActivation(confirmed);
        if (!activation.success()) {
            log.warn("Manual confirm of {} by {}: activation pending ({})", paymentId, adminId, activation.error());
        }
        return require(paymentId);
    }

    static String statusMessage(Payment payment) {
        boolean subscription = payment.getPaymentType() == PaymentType.SUBSCRIPTION;
        return switch (payment.getStatus()) {
            case PENDING -> "Awaiting payment. Please send USDT to the provided address.";
            case SCANNING -> "Waiting for payment. Scanning the blockchain for your transfer...";
            case PROCESSING -> "Transaction submitted. Waiting for it to be mined...";
            case VERIFYING -> "Transaction detected, verifying... Confirmations: "
                    + payment.getConfirmationCount() + "/" + payment.getRequiredConfirmations();
            case CONFIRMED -> subscription
                    ? "Payment confirmed! Activating subscription..."
                    : "Payment confirmed! Crediting points...";
            case COMPLETED -> subscription
                    ? "Payment completed and subscription activated!"
                    : "Payment completed and points credited!";
            case FAILED -> "Payment failed: "
                    + (payment.getErrorMessage() != null ? payment.getErrorMessage() : "Unknown error");
            case CANCELLED -> "Payment cancelled or expired";
            case EXPIRED -> "Payment expired";
        };
    }

    private void checkBalance(String fromAddress, BigDecimal amountUsdt) {
        if (!EvmHex.isAddress(fromAddress)) {
            return;
        }
        BigDecimal balance;
        try {
            balance = chainReader.getBalance(fromAddress);
        } catch (ChainUnavailableException e) {
            log.warn("Balance check for {} skipped: {}", fromAddress, e.getMessage());
            return;
        }
        if (balance.compareTo(amountUsdt) < 0) {
            throw new PaymentServiceException(PaymentServiceException.INSUFFICIENT_BALANCE,
                    "Insufficient USDT balance: required " + amountUsdt.toPlainString()
                            + ", available " + balance.stripTrailingZeros().toPlainString());
        }
    }

    private String lookupSender(String hash) {
        try {
            ChainResult<ChainTransaction> tx = chainReader.getTransaction(hash);
            return tx.isFound() ? tx.value().from() : null;
        } catch (ChainUnavailableException e) {
            log.debug("Sender of {} unknown for now: {}", hash, e.getMessage());
            return null;
        }
    }

    private Payment require(String paymentId) {
        return paymentStore.getPayment(paymentId)
                .orElseThrow(() -> new PaymentServiceException(PaymentServiceException.PAYMENT_NOT_FOUND,
                        "Payment not found: " + paymentId));
    }

    private static PaymentServiceException invalidState(Payment payment) {
        return new PaymentServiceException(PaymentServiceException.INVALID_STATE,
                "Payment " + payment.getPaymentId() + " is " + payment.getStatus());
    }
}
