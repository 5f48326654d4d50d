package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

import java.time.Duration;

/**
 * Thrown at the request boundary when a caller exhausted its window.
 */
public class RateLimitExceededException extends JobPipelineException {

    private final int limit;
    private final Duration window;

    public RateLimitExceededException(String key, int limit, Duration window) {
        super(ErrorKind.RATE_LIMITED, "Rate limit of " + limit + " per " + window + " exceeded for " + key);
        this.limit = limit;
        this.window = window;
    }

    public int getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }
}
