package com.phillippitts.jobpipeline.domain;

import java.time.Instant;

/**
 * Published after a job state transition has been written to the store.
 *
 * @param jobId job identifier
 * @param kind  job kind
 * @param from  previous state
 * @param to    new state
 * @param error failure that caused the transition, null otherwise
 * @param at    time the transition was written
 */
public record JobLifecycleEvent(
        String jobId,
        JobKind kind,
        JobState from,
        JobState to,
        JobError error,
        Instant at
) {
    public JobLifecycleEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
