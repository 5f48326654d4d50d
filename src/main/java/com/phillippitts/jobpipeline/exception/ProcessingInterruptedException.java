package com.phillippitts.jobpipeline.exception;

/**
 * Raised when the thread running a processing function is interrupted while the job is
 * still running, typically because the processing pool is shutting down.
 * Retryable like any other lost dependency.
 */
public class ProcessingInterruptedException extends UpstreamUnavailableException {

    public ProcessingInterruptedException(String jobId) {
        super("Processing of job " + jobId + " was interrupted");
    }
}
