package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.domain.JobError;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.domain.result.JobResult;

import java.time.Instant;

/**
 * Partial change to a job record, written atomically together with a state check.
 * Unset fields are left untouched.
 */
public final class JobUpdate {

    private JobState state;
    private Integer progress;
    private String statusMessage;
    private JobResult result;
    private JobError error;
    private boolean clearError;
    private Integer attempts;
    private Boolean retryPending;
    private Instant startedAt;
    private Instant nextAttemptAt;

    private JobUpdate() {
    }

    public static JobUpdate create() {
        return new JobUpdate();
    }

    public JobUpdate state(JobState state) {
        this.state = state;
        return this;
    }

    public JobUpdate progress(int progress) {
        this.progress = progress;
        return this;
    }

    public JobUpdate statusMessage(String statusMessage) {
        this.statusMessage = statusMessage;
        return this;
    }

    public JobUpdate result(JobResult result) {
        this.result = result;
        return this;
    }

    public JobUpdate error(JobError error) {
        this.error = error;
        this.clearError = false;
        return this;
    }

    public JobUpdate clearError() {
        this.error = null;
        this.clearError = true;
        return this;
    }

    public JobUpdate attempts(int attempts) {
        this.attempts = attempts;
        return this;
    }

    public JobUpdate retryPending(boolean retryPending) {
        this.retryPending = retryPending;
        return this;
    }

    public JobUpdate startedAt(Instant startedAt) {
        this.startedAt = startedAt;
        return this;
    }

    public JobUpdate nextAttemptAt(Instant nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
        return this;
    }

    JobState getState() {
        return state;
    }

    Integer getProgress() {
        return progress;
    }

    String getStatusMessage() {
        return statusMessage;
    }

    JobResult getResult() {
        return result;
    }

    JobError getError() {
        return error;
    }

    boolean isClearError() {
        return clearError;
    }

    Integer getAttempts() {
        return attempts;
    }

    Boolean getRetryPending() {
        return retryPending;
    }

    Instant getStartedAt() {
        return startedAt;
    }

    Instant getNextAttemptAt() {
        return nextAttemptAt;
    }
}
