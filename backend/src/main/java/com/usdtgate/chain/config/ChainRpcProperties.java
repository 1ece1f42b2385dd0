package com.usdtgate.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * RPC throttling and endpoint cool-down.
 */
@ConfigurationProperties(prefix = "usdtgate.chain.rpc")
@NoArgsConstructor
@Getter
@Setter
public class ChainRpcProperties {

    /** RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 20;

    /** Time to skip an endpoint after rate-limit errors (HTTP 429, -32005). */
    private long endpointCooldownMs = 30_000;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;
}
