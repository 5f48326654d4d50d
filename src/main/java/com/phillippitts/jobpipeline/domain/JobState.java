package com.phillippitts.jobpipeline.domain;

/**
 * Lifecycle states of a job.
 *
 * <pre>
 * SUBMITTED → RUNNING → SUCCEEDED | FAILED | CANCELLED
 * FAILED → SUBMITTED (requeue while attempts remain and the error is retryable)
 * SUBMITTED | RUNNING | FAILED(retry pending) → CANCELLED
 * </pre>
 *
 * <p>{@code FAILED} is only final when no retry is pending; see {@link Job#isTerminal()}.
 */
public enum JobState {
    SUBMITTED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    /**
     * Returns true for states that end an attempt. A {@code FAILED} job may still be requeued.
     */
    public boolean endsAttempt() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
