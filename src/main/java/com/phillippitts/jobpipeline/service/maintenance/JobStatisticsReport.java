package com.phillippitts.jobpipeline.service.maintenance;

import com.phillippitts.jobpipeline.domain.JobKind;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of per-kind statistics, as published by {@link JobStatisticsAggregator}.
 */
public record JobStatisticsReport(Instant generatedAt, Map<JobKind, JobKindStatistics> kinds) {

    public JobStatisticsReport {
        kinds = kinds == null ? Map.of() : Map.copyOf(kinds);
    }
}
