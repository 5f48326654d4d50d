package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.domain.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(60));

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = {"STORE_UNAVAILABLE", "UPSTREAM_UNAVAILABLE"})
    void retriesTransientErrorsWithinBudget(ErrorKind kind) {
        assertThat(policy.shouldRetry(kind, 1, 3)).isTrue();
        assertThat(policy.shouldRetry(kind, 2, 3)).isTrue();
        assertThat(policy.shouldRetry(kind, 3, 3)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = {"STORE_UNAVAILABLE", "UPSTREAM_UNAVAILABLE"},
            mode = EnumSource.Mode.EXCLUDE)
    void neverRetriesOtherErrors(ErrorKind kind) {
        assertThat(policy.shouldRetry(kind, 1, 3)).isFalse();
    }

    @Test
    void nextAttemptIsOneDelayLater() {
        Instant now = Instant.parse("2026-03-01T08:00:00Z");

        assertThat(policy.nextAttemptAt(now)).isEqualTo(now.plusSeconds(60));
    }
}
