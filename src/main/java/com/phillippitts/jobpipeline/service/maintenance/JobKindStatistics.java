package com.phillippitts.jobpipeline.service.maintenance;

/**
 * Aggregated figures for one job kind.
 *
 * @param total            jobs on record
 * @param succeeded        jobs in SUCCEEDED
 * @param failed           jobs terminally FAILED
 * @param cancelled        jobs in CANCELLED
 * @param inFlight         jobs not yet terminal
 * @param successRate      succeeded / (succeeded + failed), 0 when neither occurred
 * @param averageLatencyMs mean submit-to-completion time of succeeded jobs
 * @param maxLatencyMs     longest submit-to-completion time of succeeded jobs
 */
public record JobKindStatistics(
        long total,
        long succeeded,
        long failed,
        long cancelled,
        long inFlight,
        double successRate,
        long averageLatencyMs,
        long maxLatencyMs
) {
}
