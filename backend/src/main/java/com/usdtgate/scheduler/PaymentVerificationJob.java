package com.usdtgate.scheduler;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Periodic verification sweep. Fixed delay keeps ticks from overlapping; the running flag also guards
 * manual {@link #runOnce()} calls.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentVerificationJob {

    static final String LEASE_NAME = "payment-verification";
    private static final long SHUTDOWN_WAIT_MS = 60_000;

    private final PaymentVerificationService verificationService;
    private final SchedulerLeaseManager leaseManager;
    private final VerificationProperties verificationProperties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object idle = new Object();
    private volatile boolean stopped;

    @Scheduled(
            fixedDelayString = "${usdtgate.verification.check-interval-ms:30000}",
            initialDelayString = "${usdtgate.verification.initial-delay-ms:10000}")
    public void runScheduled() {
        runOnce();
    }

    /**
     * Runs one sweep unless disabled, stopping, already running, or another node holds the lease.
     * The lease is renewed as the sweep goes; losing it stops the sweep early.
     */
    public Optional<SweepReport> runOnce() {
        if (!verificationProperties.isEnabled() || stopped) {
            return Optional.empty();
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("Verification sweep already in progress");
            return Optional.empty();
        }
        try {
            BooleanSupplier stillOwner = () -> true;
            if (verificationProperties.isLeaseEnabled()) {
                Duration ttl = Duration.ofMillis(verificationProperties.getLeaseTtlMs());
                Instant acquiredAt = clock.instant();
                if (!leaseManager.tryAcquire(LEASE_NAME, ttl)) {
                    log.debug("Verification lease held elsewhere, skipping tick");
                    return Optional.empty();
                }
                stillOwner = new LeaseKeeper(leaseManager, LEASE_NAME, ttl, clock, acquiredAt);
            }
            return Optional.of(verificationService.sweep(stillOwner));
        } catch (RuntimeException e) {
            log.error("Verification sweep aborted", e);
            return Optional.empty();
        } finally {
            running.set(false);
            synchronized (idle) {
                idle.notifyAll();
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        stopped = true;
        long deadline = System.currentTimeMillis() + SHUTDOWN_WAIT_MS;
        synchronized (idle) {
            while (running.get()) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    log.warn("Verification sweep still running at shutdown");
                    break;
                }
                try {
                    idle.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        if (verificationProperties.isLeaseEnabled()) {
            try {
                leaseManager.release(LEASE_NAME);
            } catch (RuntimeException e) {
                log.warn("Could not release verification lease: {}", e.getMessage());
            }
        }
    }

    boolean isRunning() {
        return running.get();
    }
}
