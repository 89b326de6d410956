package com.umitunal.qrun.worker;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    @DisplayName("Should double the delay per attempt up to one hour")
    void testExponential() {
        BackoffPolicy policy = BackoffPolicy.exponential();

        assertThat(policy.delayFor(1)).isEqualTo(2);
        assertThat(policy.delayFor(2)).isEqualTo(4);
        assertThat(policy.delayFor(3)).isEqualTo(8);
        assertThat(policy.delayFor(11)).isEqualTo(2048);
        assertThat(policy.delayFor(12)).isEqualTo(BackoffPolicy.MAX_DELAY_SECONDS);
        assertThat(policy.delayFor(40)).isEqualTo(BackoffPolicy.MAX_DELAY_SECONDS);
    }

    @Test
    @DisplayName("Should retry immediately without backoff")
    void testNone() {
        assertThat(BackoffPolicy.none().delayFor(5)).isZero();
    }
}
