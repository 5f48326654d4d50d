package com.phillippitts.jobpipeline.service.ratelimit;

import com.phillippitts.jobpipeline.service.metrics.PipelineMetrics;
import com.phillippitts.jobpipeline.testutil.InMemoryCoordinationStore;
import com.phillippitts.jobpipeline.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryCoordinationStore store;
    private SimpleMeterRegistry registry;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
        store = new InMemoryCoordinationStore(clock);
        registry = new SimpleMeterRegistry();
        limiter = new RateLimiter(store, new PipelineMetrics(registry));
    }

    @Test
    void admitsUpToLimitThenRejects() {
        List<RateLimitDecision> decisions = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            decisions.add(limiter.isAllowed("submit:u1:voice", 3, WINDOW));
        }

        assertThat(decisions).extracting(RateLimitDecision::allowed).containsExactly(true, true, true, false);
        assertThat(decisions).extracting(RateLimitDecision::remaining).containsExactly(2, 1, 0, 0);
    }

    @Test
    void windowResetsAfterExpiry() {
        for (int i = 0; i < 3; i++) {
            limiter.isAllowed("k", 3, WINDOW);
        }
        assertThat(limiter.isAllowed("k", 3, WINDOW).allowed()).isFalse();

        clock.advance(WINDOW.plusSeconds(1));

        RateLimitDecision decision = limiter.isAllowed("k", 3, WINDOW);
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(2);
    }

    @Test
    void windowStartsAtFirstRequest() {
        limiter.isAllowed("k", 1, WINDOW);
        clock.advance(Duration.ofSeconds(30));
        limiter.isAllowed("k", 1, WINDOW);

        assertThat(store.ttl("rate_limit:k")).contains(Duration.ofSeconds(30));
    }

    @Test
    void keysAreIndependent() {
        limiter.isAllowed("a", 1, WINDOW);

        assertThat(limiter.isAllowed("a", 1, WINDOW).allowed()).isFalse();
        assertThat(limiter.isAllowed("b", 1, WINDOW).allowed()).isTrue();
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> limiter.isAllowed("k", 0, WINDOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failsOpenWithFullBudgetWhenStoreUnavailable() {
        store.setAvailable(false);

        RateLimitDecision decision = limiter.isAllowed("k", 5, WINDOW);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(5);
        assertThat(registry.get("jobpipeline.store.failopen")
                .tag("component", "rate-limiter")
                .counter()
                .count()).isEqualTo(1.0);
    }

    @Test
    void recordsDecisions() {
        limiter.isAllowed("k", 1, WINDOW);
        limiter.isAllowed("k", 1, WINDOW);

        assertThat(registry.get("jobpipeline.ratelimit.decisions").tag("allowed", "true").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("jobpipeline.ratelimit.decisions").tag("allowed", "false").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void neverAdmitsMoreThanLimitUnderConcurrency() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads * 4; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return limiter.isAllowed("burst", 10, WINDOW).allowed();
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(10);
        } finally {
            executor.shutdownNow();
        }
    }
}
