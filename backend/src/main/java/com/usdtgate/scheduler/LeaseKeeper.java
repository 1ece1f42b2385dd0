package com.usdtgate.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Keeps the verification lease alive while a sweep runs. Asked before every phase and item; renews once a
 * third of the TTL has passed since the last renewal. Once a renewal fails the lease counts as lost for
 * the rest of the sweep.
 */
@Slf4j
final class LeaseKeeper implements BooleanSupplier {

    private final SchedulerLeaseManager leaseManager;
    private final String name;
    private final Duration ttl;
    private final Duration renewEvery;
    private final Clock clock;

    private Instant renewedAt;
    private boolean lost;

    /**
     * @param acquiredAt when the lease was last acquired or renewed
     */
    LeaseKeeper(SchedulerLeaseManager leaseManager, String name, Duration ttl, Clock clock, Instant acquiredAt) {
        this.leaseManager = leaseManager;
        this.name = name;
        this.ttl = ttl;
        this.renewEvery = ttl.dividedBy(3);
        this.clock = clock;
        this.renewedAt = acquiredAt;
    }

    @Override
    public synchronized boolean getAsBoolean() {
        if (lost) {
            return false;
        }
        Instant now = clock.instant();
        if (Duration.between(renewedAt, now).compareTo(renewEvery) < 0) {
            return true;
        }
        boolean renewed;
        try {
            renewed = leaseManager.renew(name, ttl);
        } catch (RuntimeException e) {
            log.warn("Renewing lease {} failed: {}", name, e.getMessage());
            renewed = false;
        }
        if (renewed) {
            renewedAt = now;
            return true;
        }
        lost = true;
        log.warn("Lease {} lost during the sweep, remaining work is left to the next holder", name);
        return false;
    }
}
