package com.phillippitts.jobpipeline.service.ratelimit;

/**
 * Outcome of one rate limiter check.
 *
 * @param allowed   whether the request may proceed
 * @param remaining requests still admitted in the current window, never negative
 */
public record RateLimitDecision(boolean allowed, int remaining) {

    public RateLimitDecision {
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must be >= 0, got: " + remaining);
        }
    }

    public static RateLimitDecision allow(int remaining) {
        return new RateLimitDecision(true, remaining);
    }

    public static RateLimitDecision deny() {
        return new RateLimitDecision(false, 0);
    }
}
