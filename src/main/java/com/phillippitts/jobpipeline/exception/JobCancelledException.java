package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

/**
 * Raised inside a running attempt once the job has been cancelled, so the processing
 * function stops at its next checkpoint.
 */
public class JobCancelledException extends JobPipelineException {

    public JobCancelledException(String jobId) {
        super(ErrorKind.CANCELLED, "Job cancelled: " + jobId);
    }
}
