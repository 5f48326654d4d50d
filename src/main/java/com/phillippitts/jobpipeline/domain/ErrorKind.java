package com.phillippitts.jobpipeline.domain;

/**
 * Error taxonomy shared by the worker pool, the processing adapter and the REST boundary.
 *
 * <p>Only retryable kinds are requeued by the worker pool; everything else surfaces
 * immediately as the terminal state of the job.
 */
public enum ErrorKind {
    /** Bad payload or parameters. */
    VALIDATION(false),
    /** The processing function failed deterministically. */
    PROCESSING(false),
    /** Coordination store unreachable or timed out. */
    STORE_UNAVAILABLE(true),
    /** A network dependency of the processing function was unreachable. */
    UPSTREAM_UNAVAILABLE(true),
    /** Soft or hard deadline exceeded; the job is abandoned. */
    TIMEOUT(false),
    FORBIDDEN(false),
    NOT_FOUND(false),
    RATE_LIMITED(false),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
