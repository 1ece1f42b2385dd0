package com.usdtgate.activation;

import com.usdtgate.domain.Payment;
import com.usdtgate.domain.PaymentType;
import com.usdtgate.store.PaymentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Grants what a confirmed payment bought, at most once per payment. The payment is re-read before
 * calling out; an existing subscription or points linkage short-circuits to success. Failures are
 * returned, never thrown, so the payment stays CONFIRMED and the next sweep retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivationDispatcher {

    public static final String PAYMENT_METHOD = "USDT_BEP20";
    static final String POINTS_REASON = "purchase";

    private final PaymentStore paymentStore;
    private final SubscriptionGateway subscriptionGateway;
    private final PointsGateway pointsGateway;

    public ActivationResult activate(Payment payment) {
        String paymentId = payment.getPaymentId();
        try {
            Payment current = paymentStore.getPayment(paymentId).orElse(null);
            if (current == null) {
                return ActivationResult.failure("Payment not found: " + paymentId);
            }
            if (current.isActivated()) {
                log.debug("Payment {} already activated ({})", paymentId, current.linkedActivationId());
                return ActivationResult.alreadyActivated(current.linkedActivationId());
            }
            String linkedId = current.getPaymentType() == PaymentType.SUBSCRIPTION
                    ? activateSubscription(current)
                    : creditPoints(current);
            return ActivationResult.activated(linkedId);
        } catch (RuntimeException e) {
            log.error("Activation of payment {} failed: {}", paymentId, e.getMessage(), e);
            return ActivationResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private String activateSubscription(Payment payment) {
        String subscriptionId = subscriptionGateway.createOrUpgrade(
                payment.getUserId(), payment.getPlan(), payment.getDuration(), payment.getPaymentId());
        paymentStore.linkSubscription(payment.getPaymentId(), subscriptionId);
        log.info("Subscription {} ({} {}) activated for payment {}",
                subscriptionId, payment.getPlan(), payment.getDuration(), payment.getPaymentId());
        return subscriptionId;
    }

    private String creditPoints(Payment payment) {
        if (payment.getPointsAmount() == null || payment.getPointsAmount() <= 0) {
            throw new ActivationException("Payment " + payment.getPaymentId() + " has no points amount");
        }
        String transactionId = pointsGateway.addPoints(
                payment.getUserId(),
                payment.getPointsAmount(),
                POINTS_REASON,
                "Points purchase via USDT: " + payment.getPaymentId(),
                pointsMetadata(payment));
        paymentStore.linkPointsTransaction(payment.getPaymentId(), transactionId);
        log.info("{} points credited (txn {}) for payment {}",
                payment.getPointsAmount(), transactionId, payment.getPaymentId());
        return transactionId;
    }

    static Map<String, Object> pointsMetadata(Payment payment) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("paymentId", payment.getPaymentId());
        metadata.put("payment_method", PAYMENT_METHOD);
        metadata.put("amountUsdt", payment.getAmountUsdt());
        metadata.put("amountVnd", payment.getAmountVnd());
        metadata.put("transactionHash", payment.getTransactionHash());
        return metadata;
    }
}
