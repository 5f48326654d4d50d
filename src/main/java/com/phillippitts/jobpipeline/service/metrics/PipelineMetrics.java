package com.phillippitts.jobpipeline.service.metrics;

import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.JobLifecycleEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the job pipeline and its coordination layer.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Fail-open events per component (cache, session store, rate limiter)</li>
 *   <li>Job state transitions per kind</li>
 *   <li>Processing latency per kind and outcome</li>
 *   <li>Rate limiter decisions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "jobpipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a store failure that a component absorbed by failing open.
     *
     * @param component component name (cache, session-store, rate-limiter)
     * @param operation operation that failed
     */
    public void recordFailOpen(String component, String operation) {
        Counter.builder(METRIC_PREFIX + ".store.failopen")
                .description("Coordination store failures absorbed by failing open")
                .tag("component", component)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * Counts every job state transition.
     */
    @EventListener
    public void onTransition(JobLifecycleEvent event) {
        Counter.builder(METRIC_PREFIX + ".job.transitions")
                .description("Job state transitions")
                .tag("kind", tagValue(event.kind()))
                .tag("from", event.from() == null ? "none" : event.from().name())
                .tag("to", event.to().name())
                .register(registry)
                .increment();
    }

    /**
     * Records the time one attempt spent inside its processing function.
     *
     * @param kind          job kind
     * @param outcome       succeeded, failed, timeout or cancelled
     * @param durationNanos duration in nanoseconds
     */
    public void recordProcessingLatency(JobKind kind, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".job.processing")
                .description("Time spent in processing functions per attempt")
                .tag("kind", tagValue(kind))
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRateLimitDecision(boolean allowed) {
        Counter.builder(METRIC_PREFIX + ".ratelimit.decisions")
                .description("Rate limiter admissions and rejections")
                .tag("allowed", Boolean.toString(allowed))
                .register(registry)
                .increment();
    }

    private static String tagValue(JobKind kind) {
        return kind == null ? "unknown" : kind.getValue().toLowerCase(Locale.ROOT);
    }
}
