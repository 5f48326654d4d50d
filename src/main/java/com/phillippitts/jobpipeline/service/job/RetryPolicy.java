package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.domain.ErrorKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-delay retry with a bounded attempt budget. Only retryable error kinds are retried.
 */
@Component
public class RetryPolicy {

    private final Duration delay;

    @Autowired
    public RetryPolicy(JobProperties properties) {
        this(properties.getRetryDelay());
    }

    RetryPolicy(Duration delay) {
        this.delay = delay;
    }

    /**
     * @param kind        error kind of the failed attempt
     * @param attempts    attempts made so far, the failed one included
     * @param maxAttempts attempt budget of the job
     */
    public boolean shouldRetry(ErrorKind kind, int attempts, int maxAttempts) {
        return kind.isRetryable() && attempts < maxAttempts;
    }

    public Instant nextAttemptAt(Instant now) {
        return now.plus(delay);
    }

    public Duration getDelay() {
        return delay;
    }
}
