package com.usdtgate.domain;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Payment lifecycle. Non-terminal statuses only move forward by rank; terminal statuses never change
 * except through the admin override in the payment store.
 */
public enum PaymentStatus {
    PENDING(0),
    SCANNING(1),
    PROCESSING(2),
    VERIFYING(3),
    CONFIRMED(4),
    COMPLETED(5),
    FAILED(6),
    CANCELLED(6),
    EXPIRED(6);

    private static final Set<PaymentStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED, EXPIRED);

    private final int rank;

    PaymentStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * COMPLETED is reachable only from CONFIRMED; failure exits from any non-terminal status;
     * otherwise same or higher rank. Same-status moves are allowed so a sweep can refresh fields.
     */
    public boolean canTransitionTo(PaymentStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == COMPLETED) {
            return this == CONFIRMED;
        }
        if (next.isTerminal()) {
            return true;
        }
        return next.rank >= rank;
    }

    /** Statuses from which {@code next} may be entered. */
    public static Set<PaymentStatus> predecessorsOf(PaymentStatus next) {
        Set<PaymentStatus> result = EnumSet.noneOf(PaymentStatus.class);
        Arrays.stream(values()).filter(s -> s.canTransitionTo(next)).forEach(result::add);
        return result;
    }

    public static Set<PaymentStatus> terminal() {
        return EnumSet.copyOf(TERMINAL);
    }
}
