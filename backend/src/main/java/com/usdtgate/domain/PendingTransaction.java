package com.usdtgate.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Work-queue membership of a payment under verification. Removed as soon as the payment is terminal.
 */
@Document(collection = "pending_transactions")
@CompoundIndex(name = "status_last_checked", def = "{'status': 1, 'lastCheckedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PendingTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String paymentId;
    private String userId;
    private String transactionHash;
    private String fromAddress;
    private String toAddress;
    private BigDecimal amountUsdt;

    private Instant firstSeenAt;
    private Instant lastCheckedAt;
    private int confirmationCount;
    private int requiredConfirmations;
    /** Unresolved sweeps (not found / not mined); bounded by max-retries. */
    private int retryCount;
    /** Sweeps that hit an RPC failure. */
    private int chainErrorCount;
    private PendingTransactionStatus status;
}
