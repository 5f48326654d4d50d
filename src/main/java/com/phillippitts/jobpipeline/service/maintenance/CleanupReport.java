package com.phillippitts.jobpipeline.service.maintenance;

/**
 * Outcome of one cleanup sweep.
 *
 * @param removed  job records deleted (expired terminal jobs and unreadable records)
 * @param reaped   RUNNING jobs failed with TIMEOUT because their worker is gone
 * @param requeued waiting jobs put back on the run queue
 */
public record CleanupReport(int removed, int reaped, int requeued) {
}
