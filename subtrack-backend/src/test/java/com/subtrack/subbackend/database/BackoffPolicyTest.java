package com.subtrack.subbackend.database;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    @Test
    void linearWaitsAttemptNumberInSeconds() {
        BackoffPolicy policy = BackoffPolicy.linear();

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayAfter(10)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void linearIsStrictlyIncreasing() {
        BackoffPolicy policy = BackoffPolicy.linear();
        for (int attempt = 1; attempt < 10; attempt++) {
            assertThat(policy.delayAfter(attempt + 1)).isGreaterThan(policy.delayAfter(attempt));
        }
    }
}
