package com.usdtgate.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * A user's intent to pay a fixed USDT amount for a subscription or a points package.
 * Created by the payment service, then mutated only through {@code PaymentStore}.
 */
@Document(collection = "payments")
@CompoundIndexes({
        @CompoundIndex(name = "user_status", def = "{'userId': 1, 'status': 1}"),
        @CompoundIndex(name = "status_created", def = "{'status': 1, 'createdAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Payment {

    public static final Set<String> PLANS = Set.of("premium", "pro", "vip");
    public static final Set<String> DURATIONS = Set.of("3_months", "12_months");

    @Id
    @EqualsAndHashCode.Include
    private String paymentId;
    @Indexed(unique = true)
    private String orderInvoiceNumber;

    private PaymentType paymentType;
    private String plan;
    private String duration;
    private Integer pointsAmount;

    private BigDecimal amountUsdt;
    private BigDecimal amountVnd;
    private BigDecimal usdtRate;

    private String userId;
    private String userEmail;
    private String userName;
    /** Sender wallet; unknown until discovered on-chain unless the user supplied it. */
    private String fromAddress;
    private String toAddress;

    @Indexed(sparse = true)
    private String transactionHash;
    private Long blockNumber;
    private int confirmationCount;
    private int requiredConfirmations;
    private Long gasUsed;

    private PaymentStatus status;
    private String errorMessage;
    private String notes;

    private String subscriptionId;
    private String pointsTransactionId;

    private boolean manuallyProcessed;
    private String processedByAdmin;
    private String adminNotes;

    private String ipAddress;
    private String userAgent;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    private Instant paymentReceivedAt;
    private Instant confirmedAt;
    private Instant completedAt;
    private Instant cancelledAt;
    private Instant expiredAt;
    private Instant failedAt;

    /** The side-effect id matching the payment type, or null when not yet activated. */
    public String linkedActivationId() {
        return paymentType == PaymentType.SUBSCRIPTION ? subscriptionId : pointsTransactionId;
    }

    public boolean isActivated() {
        return linkedActivationId() != null;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
