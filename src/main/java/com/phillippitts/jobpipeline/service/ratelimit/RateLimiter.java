package com.phillippitts.jobpipeline.service.ratelimit;

import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.service.metrics.PipelineMetrics;
import com.phillippitts.jobpipeline.store.CoordinationStore;
import com.phillippitts.jobpipeline.store.StoreKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Fixed-window rate limiter backed by a counter in the coordination store.
 *
 * <p>Each check increments {@code rate_limit:{key}} first and compares afterwards. The
 * increment and the window expiry are a single atomic step, so the first request of a
 * window creates the counter with TTL = window and the window closes when the key
 * expires.
 *
 * <p>Concurrency: racers are never admitted above the limit, but the counter itself may
 * exceed it by the number of concurrent rejected callers. Every call past the limit is
 * rejected until the window expires, so the overshoot is harmless. Because windows are
 * fixed rather than sliding, a burst straddling a window boundary can admit up to
 * {@code 2 x limit} requests.
 *
 * <p>Store failures fail open: the request is allowed with the full limit remaining,
 * a WARN is logged and {@code jobpipeline.store.failopen{component=rate-limiter}} is
 * incremented, so store degradation never causes an outage and never goes unnoticed.
 */
@Service
public class RateLimiter {

    private static final Logger LOG = LogManager.getLogger(RateLimiter.class);
    private static final String COMPONENT = "rate-limiter";

    private final CoordinationStore store;
    private final PipelineMetrics metrics;

    public RateLimiter(CoordinationStore store, PipelineMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Checks and consumes one request from the window of {@code key}.
     *
     * @param key    caller and operation composite, e.g. {@code "submit:u1:voice"}
     * @param limit  requests admitted per window, must be positive
     * @param window window length, must be positive
     * @return decision with the remaining budget
     */
    public RateLimitDecision isAllowed(String key, int limit, Duration window) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        long count;
        try {
            count = store.incrementAndExpire(StoreKeys.rateLimit(key), 1, window);
        } catch (StoreUnavailableException e) {
            LOG.warn("Rate limiter store unavailable for key={}, allowing request: {}", key, e.getMessage());
            metrics.recordFailOpen(COMPONENT, "isAllowed");
            return RateLimitDecision.allow(limit);
        }

        RateLimitDecision decision = count <= limit
                ? RateLimitDecision.allow((int) (limit - count))
                : RateLimitDecision.deny();
        if (!decision.allowed()) {
            LOG.debug("Rate limit exceeded: key={}, count={}, limit={}", key, count, limit);
        }
        metrics.recordRateLimitDecision(decision.allowed());
        return decision;
    }
}
