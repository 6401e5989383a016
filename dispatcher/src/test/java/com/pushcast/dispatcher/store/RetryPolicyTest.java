package com.pushcast.dispatcher.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(30), Duration.ofMinutes(5));

    @Test
    void backoff_doublesPerAttempt() {
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.backoff(4)).isEqualTo(Duration.ofSeconds(240));
    }

    @Test
    void backoff_isCappedAtMax() {
        assertThat(policy.backoff(5)).isEqualTo(Duration.ofMinutes(5));
        assertThat(policy.backoff(60)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void canRetry_belowCeilingOnly() {
        assertThat(policy.canRetry(4)).isTrue();
        assertThat(policy.canRetry(5)).isFalse();
    }

    @Test
    void zeroAttempts_isRejected() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
