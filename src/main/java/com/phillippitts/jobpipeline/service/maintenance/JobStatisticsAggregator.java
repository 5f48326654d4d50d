package com.phillippitts.jobpipeline.service.maintenance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.service.cache.CacheService;
import com.phillippitts.jobpipeline.service.job.JobRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Computes success rate and latency per job kind over the jobs still on record, and
 * publishes the snapshot through the cache for {@code jobs.statistics-ttl}.
 */
@Component
public class JobStatisticsAggregator {

    private static final Logger LOG = LogManager.getLogger(JobStatisticsAggregator.class);

    static final String CACHE_KEY = "stats:jobs";

    private final JobRepository repository;
    private final CacheService cache;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;

    public JobStatisticsAggregator(JobRepository repository,
                                   CacheService cache,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   JobProperties properties) {
        this.repository = repository;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = properties.getStatisticsTtl();
    }

    public JobStatisticsReport aggregate() {
        Map<JobKind, Tally> tallies = new EnumMap<>(JobKind.class);
        for (JobKind kind : JobKind.values()) {
            tallies.put(kind, new Tally());
        }
        for (String jobId : repository.allIds()) {
            repository.find(jobId).ifPresent(job -> tallies.get(job.kind()).add(job));
        }

        Map<JobKind, JobKindStatistics> kinds = new EnumMap<>(JobKind.class);
        tallies.forEach((kind, tally) -> kinds.put(kind, tally.toStatistics()));
        JobStatisticsReport report = new JobStatisticsReport(clock.instant(), kinds);
        publish(report);
        LOG.info("Job statistics aggregated: {}", kinds);
        return report;
    }

    /**
     * @return the last published snapshot, or empty if none is cached
     */
    public Optional<JobStatisticsReport> latest() {
        return cache.get(CACHE_KEY).flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, JobStatisticsReport.class));
            } catch (JsonProcessingException e) {
                LOG.warn("Discarding unreadable statistics snapshot: {}", e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    /**
     * @return the cached snapshot, or a freshly aggregated one if none is cached
     */
    public JobStatisticsReport current() {
        return latest().orElseGet(this::aggregate);
    }

    private void publish(JobStatisticsReport report) {
        try {
            cache.set(CACHE_KEY, objectMapper.writeValueAsString(report), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize statistics report", e);
        }
    }

    private static final class Tally {
        private long total;
        private long succeeded;
        private long failed;
        private long cancelled;
        private long latencySumMs;
        private long maxLatencyMs;

        void add(Job job) {
            total++;
            if (!job.isTerminal()) {
                return;
            }
            if (job.state() == JobState.SUCCEEDED) {
                succeeded++;
                long latency = Duration.between(job.createdAt(), job.updatedAt()).toMillis();
                latencySumMs += latency;
                maxLatencyMs = Math.max(maxLatencyMs, latency);
            } else if (job.state() == JobState.FAILED) {
                failed++;
            } else {
                cancelled++;
            }
        }

        JobKindStatistics toStatistics() {
            long finished = succeeded + failed;
            double successRate = finished == 0 ? 0.0 : (double) succeeded / finished;
            long average = succeeded == 0 ? 0 : latencySumMs / succeeded;
            return new JobKindStatistics(total, succeeded, failed, cancelled,
                    total - succeeded - failed - cancelled, successRate, average, maxLatencyMs);
        }
    }
}
