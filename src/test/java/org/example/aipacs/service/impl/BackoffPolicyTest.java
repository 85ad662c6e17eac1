package org.example.aipacs.service.impl;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    private static BackoffPolicy policy(double r) {
        return new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(60), 5, () -> r);
    }

    @Test
    void delaysDoubleFromBase() {
        BackoffPolicy p = policy(0.0);
        assertThat(p.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(p.delayFor(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(p.delayFor(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(p.delayFor(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(p.delayFor(5)).isEqualTo(Duration.ofSeconds(32));
    }

    @Test
    void jitterIsUpwardAndBelowHalfStep() {
        BackoffPolicy p = policy(1.0);
        assertThat(p.delayFor(1)).isGreaterThan(Duration.ofSeconds(2)).isLessThan(Duration.ofSeconds(3));
        assertThat(p.delayFor(3)).isGreaterThan(Duration.ofSeconds(8)).isLessThan(Duration.ofSeconds(12));
    }

    @Test
    void uncappedDelaysStrictlyIncreaseWhateverTheJitter() {
        BackoffPolicy high = policy(1.0);
        BackoffPolicy low = policy(0.0);
        for (int n = 1; n < 5; n++) {
            assertThat(low.delayFor(n + 1)).isGreaterThan(high.delayFor(n));
        }
    }

    @Test
    void delayIsCapped() {
        BackoffPolicy p = policy(0.5);
        assertThat(p.delayFor(6)).isEqualTo(Duration.ofSeconds(60));
        assertThat(p.delayFor(40)).isEqualTo(Duration.ofSeconds(60));
        assertThat(p.delayFor(5)).isLessThanOrEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void fifthFailureExhausts() {
        BackoffPolicy p = policy(0.0);
        assertThat(p.exhausted(4)).isFalse();
        assertThat(p.exhausted(5)).isTrue();
        assertThat(p.getMaxAttempts()).isEqualTo(5);
    }
}
