package com.usdtgate.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentStatusTest {

    @ParameterizedTest
    @EnumSource(value = PaymentStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED", "EXPIRED"})
    @DisplayName("Terminal statuses accept no transition")
    void terminal_isFinal(PaymentStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (PaymentStatus next : PaymentStatus.values()) {
            assertThat(terminal.canTransitionTo(next)).as("%s -> %s", terminal, next).isFalse();
        }
    }

    @Test
    void forwardMoves_allowed() {
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.SCANNING)).isTrue();
        assertThat(PaymentStatus.SCANNING.canTransitionTo(PaymentStatus.VERIFYING)).isTrue();
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.CONFIRMED)).isTrue();
        assertThat(PaymentStatus.VERIFYING.canTransitionTo(PaymentStatus.VERIFYING)).isTrue();
    }

    @Test
    void backwardMoves_refused() {
        assertThat(PaymentStatus.VERIFYING.canTransitionTo(PaymentStatus.PROCESSING)).isFalse();
        assertThat(PaymentStatus.CONFIRMED.canTransitionTo(PaymentStatus.SCANNING)).isFalse();
    }

    @Test
    @DisplayName("COMPLETED only follows CONFIRMED")
    void completed_onlyFromConfirmed() {
        assertThat(PaymentStatus.predecessorsOf(PaymentStatus.COMPLETED)).containsExactly(PaymentStatus.CONFIRMED);
    }

    @Test
    void failureExits_fromEveryOpenStatus() {
        assertThat(PaymentStatus.predecessorsOf(PaymentStatus.FAILED)).containsExactlyInAnyOrder(
                PaymentStatus.PENDING, PaymentStatus.SCANNING, PaymentStatus.PROCESSING,
                PaymentStatus.VERIFYING, PaymentStatus.CONFIRMED);
        assertThat(PaymentStatus.predecessorsOf(PaymentStatus.EXPIRED))
                .isEqualTo(PaymentStatus.predecessorsOf(PaymentStatus.FAILED));
    }
}
