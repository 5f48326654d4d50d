package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.exception.JobCancelledException;
import com.phillippitts.jobpipeline.exception.JobTimeoutException;

/**
 * Checkpoint callback handed to processing functions.
 *
 * <p>Each checkpoint is where an attempt cooperates with the worker: it is the point at
 * which cancellation and the soft deadline are observed.
 */
public interface ProgressReporter {

    /**
     * Records progress and a localized status message.
     *
     * @param progress   percent complete; lower values than already reported are ignored
     * @param messageKey message key under {@code job.status.*}
     * @throws JobCancelledException if the job is no longer running
     * @throws JobTimeoutException   if the soft deadline has passed
     */
    void checkpoint(int progress, String messageKey);

    /** Identifier of the job being reported on. */
    String jobId();
}
