package com.usdtgate.chain;

import com.usdtgate.common.RetryPolicy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin RPC endpoint selection that skips endpoints cooling down after rate-limit errors,
 * plus the backoff used between attempts.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;
    private final RetryPolicy retryPolicy;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    /**
     * Next endpoint in round-robin order that is not cooling down. When every endpoint is cooling down
     * the plain round-robin choice is returned.
     */
    public String nextEndpoint(long nowMs) {
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = roundRobin();
            Long until = cooldownUntilMs.get(endpoint);
            if (until == null || until <= nowMs) {
                return endpoint;
            }
        }
        return roundRobin();
    }

    /**
     * Skips {@code endpoint} for {@code cooldownMs}.
     *
     * @return true if the endpoint was not already cooling down
     */
    public boolean coolDown(String endpoint, long cooldownMs, long nowMs) {
        Long previous = cooldownUntilMs.put(endpoint, nowMs + Math.max(0L, cooldownMs));
        return previous == null || previous <= nowMs;
    }

    public boolean isCoolingDown(String endpoint, long nowMs) {
        Long until = cooldownUntilMs.get(endpoint);
        return until != null && until > nowMs;
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    private String roundRobin() {
        int i = Math.floorMod(index.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }
}
