package com.usdtgate.scheduler;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Verification sweep knobs. The sweep interval ({@code check-interval-ms}) and first delay
 * ({@code initial-delay-ms}) live under the same prefix but are read by {@link PaymentVerificationJob}'s
 * {@code @Scheduled} placeholders.
 */
@ConfigurationProperties(prefix = "usdtgate.verification")
@NoArgsConstructor
@Getter
@Setter
public class VerificationProperties {

    private boolean enabled = true;

    /** Unresolved sweeps allowed per payment before it is failed. */
    private int maxRetries = 20;

    /** Absolute tolerance when verifying a receipt against the expected amount. */
    private BigDecimal amountToleranceUsdt = new BigDecimal("0.01");

    /** Relative tolerance when scanning logs for a matching transfer. */
    private BigDecimal scanToleranceFraction = new BigDecimal("0.01");

    private int maxBlocksToScan = 1_000;

    /** Queue entries handled per phase per sweep. */
    private int batchSize = 100;

    private int workerThreads = 4;

    /** Whether an RPC failure during scanning counts toward {@link #maxRetries}. */
    private boolean chainErrorsConsumeRetries = true;

    /** Window of recent payments whose transaction hashes are excluded from scanning. */
    private long claimLookbackMinutes = 1_440;

    private boolean leaseEnabled = true;

    private long leaseTtlMs = 120_000;
}
