package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void onlyDependencyFailuresAreRetryable() {
        assertThat(new StoreUnavailableException("GET k", new IllegalStateException()).isRetryable()).isTrue();
        assertThat(new UpstreamUnavailableException("model host down").isRetryable()).isTrue();
        assertThat(new ProcessingInterruptedException("j1").isRetryable()).isTrue();

        assertThat(new ValidationException("bad").isRetryable()).isFalse();
        assertThat(new ProcessingException("boom").isRetryable()).isFalse();
        assertThat(new JobTimeoutException(Duration.ofMinutes(1), false).isRetryable()).isFalse();
        assertThat(new JobCancelledException("j1").isRetryable()).isFalse();
    }

    @Test
    void eachExceptionCarriesItsKind() {
        assertThat(new ValidationException("bad").getKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(new ProcessingException("boom").getKind()).isEqualTo(ErrorKind.PROCESSING);
        assertThat(new ForbiddenException("no", "u2").getKind()).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(new NotFoundException("Job", "j1").getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(new JobCancelledException("j1").getKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(new ProcessingInterruptedException("j1").getKind()).isEqualTo(ErrorKind.UPSTREAM_UNAVAILABLE);
        assertThat(new RateLimitExceededException("k", 10, Duration.ofSeconds(60)).getKind())
                .isEqualTo(ErrorKind.RATE_LIMITED);
    }

    @Test
    void notFoundNamesResource() {
        NotFoundException ex = new NotFoundException("Job", "x");

        assertThat(ex).hasMessage("Job not found: x");
        assertThat(ex.getResourceType()).isEqualTo("Job");
        assertThat(ex.getResourceId()).isEqualTo("x");
    }

    @Test
    void storeUnavailableKeepsOperationAndCause() {
        IllegalStateException cause = new IllegalStateException("refused");
        StoreUnavailableException ex = new StoreUnavailableException("HGETALL job:1", cause);

        assertThat(ex.getOperation()).isEqualTo("HGETALL job:1");
        assertThat(ex).hasCause(cause).hasMessageContaining("HGETALL job:1");
    }

    @Test
    void timeoutDistinguishesSoftAndHard() {
        JobTimeoutException soft = new JobTimeoutException(Duration.ofMinutes(5), false);
        JobTimeoutException hard = new JobTimeoutException(Duration.ofMinutes(10), true);

        assertThat(soft.isHard()).isFalse();
        assertThat(soft).hasMessageStartingWith("Soft time limit");
        assertThat(hard.isHard()).isTrue();
        assertThat(hard.getLimit()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void rateLimitExposesLimitAndWindow() {
        RateLimitExceededException ex = new RateLimitExceededException("submit:u1:voice", 10, Duration.ofSeconds(60));

        assertThat(ex.getLimit()).isEqualTo(10);
        assertThat(ex.getWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(ex).hasMessageContaining("submit:u1:voice");
    }
}
