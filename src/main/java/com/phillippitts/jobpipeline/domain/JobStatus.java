package com.phillippitts.jobpipeline.domain;

import com.phillippitts.jobpipeline.domain.result.JobResult;

import java.time.Instant;

/**
 * Poller-facing view of a job. Always well formed: {@code result} is set only for
 * succeeded jobs and {@code error} only for failed ones, with internal detail kept in
 * {@link JobError#detail()} rather than the status message.
 */
public record JobStatus(
        String jobId,
        JobKind kind,
        JobState state,
        int progress,
        String statusMessage,
        JobResult result,
        JobError error,
        int attempts,
        int maxAttempts,
        boolean terminal,
        Instant createdAt,
        Instant updatedAt
) {

    public static JobStatus from(Job job) {
        JobResult result = job.state() == JobState.SUCCEEDED ? job.result() : null;
        JobError error = job.state() == JobState.FAILED ? job.error() : null;
        return new JobStatus(
                job.id(),
                job.kind(),
                job.state(),
                job.progress(),
                job.statusMessage(),
                result,
                error,
                job.attempts(),
                job.maxAttempts(),
                job.isTerminal(),
                job.createdAt(),
                job.updatedAt()
        );
    }
}
