package com.phillippitts.jobpipeline.domain;

import com.phillippitts.jobpipeline.domain.payload.JobPayload;
import com.phillippitts.jobpipeline.domain.result.JobResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Snapshot of a job record as stored in the coordination store.
 *
 * <p>A job is owned by the queue once submitted and only ever mutated through the
 * compare-and-set transitions of {@code JobStateMachine}. Instances are immutable
 * views; re-read the record to observe later transitions.
 *
 * @param id             opaque unique identifier
 * @param kind           job kind
 * @param ownerId        submitting user
 * @param payload        typed payload for {@code kind}
 * @param locale         language used for status messages
 * @param state          current state
 * @param progress       0-100, non-decreasing
 * @param statusMessage  localized, human-readable status
 * @param result         success payload, null unless {@link JobState#SUCCEEDED}
 * @param error          last failure, null if none
 * @param attempts       attempts started so far
 * @param maxAttempts    attempt budget
 * @param retryPending   true while a FAILED job waits to be requeued
 * @param createdAt      submission time
 * @param updatedAt      time of the last transition
 * @param startedAt      start of the current or last attempt, null before the first claim
 * @param nextAttemptAt  earliest time the job may be claimed
 * @param softTimeout    cooperative per-attempt budget
 * @param hardTimeout    forced per-attempt budget
 */
public record Job(
        String id,
        JobKind kind,
        String ownerId,
        JobPayload payload,
        Locale locale,
        JobState state,
        int progress,
        String statusMessage,
        JobResult result,
        JobError error,
        int attempts,
        int maxAttempts,
        boolean retryPending,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant nextAttemptAt,
        Duration softTimeout,
        Duration hardTimeout
) {

    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(softTimeout, "softTimeout");
        Objects.requireNonNull(hardTimeout, "hardTimeout");
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress must be between 0 and 100, got: " + progress);
        }
        locale = locale == null ? Locale.ROOT : locale;
        statusMessage = statusMessage == null ? "" : statusMessage;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
        nextAttemptAt = nextAttemptAt == null ? createdAt : nextAttemptAt;
    }

    /**
     * Creates the record written at submission time.
     */
    public static Job submitted(String id,
                                JobKind kind,
                                String ownerId,
                                JobPayload payload,
                                Locale locale,
                                String statusMessage,
                                int maxAttempts,
                                Duration softTimeout,
                                Duration hardTimeout,
                                Instant now) {
        return new Job(id, kind, ownerId, payload, locale, JobState.SUBMITTED, 0, statusMessage,
                null, null, 0, maxAttempts, false, now, now, null, now, softTimeout, hardTimeout);
    }

    /**
     * Returns true once no further transition can happen except deletion.
     */
    public boolean isTerminal() {
        return state == JobState.SUCCEEDED
                || state == JobState.CANCELLED
                || (state == JobState.FAILED && !retryPending);
    }

    /** Soft deadline of the current attempt, or null before the first claim. */
    public Instant softDeadline() {
        return startedAt == null ? null : startedAt.plus(softTimeout);
    }

    /** Hard deadline of the current attempt, or null before the first claim. */
    public Instant hardDeadline() {
        return startedAt == null ? null : startedAt.plus(hardTimeout);
    }
}
