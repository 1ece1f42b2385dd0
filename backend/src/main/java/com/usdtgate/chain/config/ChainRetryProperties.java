package com.usdtgate.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry inside the chain reader (exponential backoff ± jitter). Independent from the payment retry budget.
 */
@ConfigurationProperties(prefix = "usdtgate.chain.retry")
@NoArgsConstructor
@Getter
@Setter
public class ChainRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Total attempts per read, including the first. */
    private int maxAttempts = 3;

    /** Upper bound for a single backoff delay. */
    private long maxDelayMs = 4_000L;
}
