package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.domain.JobError;
import com.phillippitts.jobpipeline.domain.JobLifecycleEvent;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.domain.result.JobResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * State transitions of a job, each applied as a compare-and-set on the stored state.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * SUBMITTED → RUNNING (claim)
 * RUNNING → RUNNING (progress)
 * RUNNING → SUCCEEDED | FAILED
 * FAILED → SUBMITTED (requeue, only while a retry is pending)
 * SUBMITTED | RUNNING | FAILED(retry pending) → CANCELLED
 * </pre>
 *
 * <p><b>Exclusivity:</b> no in-process lock is held. A transition is written only if the
 * record is still in the state its writer observed, so when a cancellation and a worker
 * race, exactly one of them wins and every later write by the loser is a no-op. A job
 * therefore records exactly one terminal transition.
 *
 * <p>A {@link JobLifecycleEvent} is published after every transition that was written.
 */
@Component
public class JobStateMachine {

    private static final Logger LOG = LogManager.getLogger(JobStateMachine.class);

    private final JobRepository repository;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public JobStateMachine(JobRepository repository, ApplicationEventPublisher publisher, Clock clock) {
        this.repository = repository;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Persists a freshly submitted job.
     */
    public void submit(Job job) {
        if (job.state() != JobState.SUBMITTED) {
            throw new IllegalArgumentException("New jobs must be SUBMITTED, got " + job.state());
        }
        repository.create(job);
        publish(job, null, JobState.SUBMITTED, null);
    }

    /**
     * Claims a submitted job for one attempt.
     *
     * @return the running job as stored, or empty if another writer moved it first
     */
    public Optional<Job> claim(Job job, String statusMessage) {
        Instant now = clock.instant();
        JobUpdate update = JobUpdate.create()
                .state(JobState.RUNNING)
                .attempts(job.attempts() + 1)
                .startedAt(now)
                .statusMessage(statusMessage)
                .retryPending(false)
                .clearError();
        if (!repository.transition(job.id(), JobState.SUBMITTED, update)) {
            LOG.debug("Claim lost for job {}", job.id());
            return Optional.empty();
        }
        publish(job, JobState.SUBMITTED, JobState.RUNNING, null);
        return repository.find(job.id()).filter(claimed -> claimed.state() == JobState.RUNNING);
    }

    /**
     * Writes progress of a running attempt.
     *
     * @return false if the job is no longer running
     */
    public boolean progress(Job job, int progress, String statusMessage) {
        JobUpdate update = JobUpdate.create().progress(progress).statusMessage(statusMessage);
        return repository.transition(job.id(), JobState.RUNNING, update);
    }

    /**
     * @return false if the job is no longer running, in which case the result is discarded
     */
    public boolean succeed(Job job, JobResult result, String statusMessage) {
        JobUpdate update = JobUpdate.create()
                .state(JobState.SUCCEEDED)
                .progress(100)
                .result(result)
                .statusMessage(statusMessage);
        return apply(job, JobState.RUNNING, JobState.SUCCEEDED, update, null);
    }

    /**
     * Ends the running attempt with an error.
     *
     * @param retryPending true if the job will be requeued, which keeps it non-terminal
     * @return false if the job is no longer running
     */
    public boolean fail(Job job, JobError error, String statusMessage, boolean retryPending) {
        JobUpdate update = JobUpdate.create()
                .state(JobState.FAILED)
                .error(error)
                .statusMessage(statusMessage)
                .retryPending(retryPending);
        return apply(job, JobState.RUNNING, JobState.FAILED, update, error);
    }

    /**
     * Moves a failed job with a pending retry back to the run queue state.
     *
     * @return false if the job was cancelled in the meantime
     */
    public boolean requeue(Job job, Instant nextAttemptAt, String statusMessage) {
        JobUpdate update = JobUpdate.create()
                .state(JobState.SUBMITTED)
                .retryPending(false)
                .nextAttemptAt(nextAttemptAt)
                .statusMessage(statusMessage);
        return apply(job, JobState.FAILED, JobState.SUBMITTED, update, null);
    }

    /**
     * Cancels {@code job} if it is still in the state it was read in.
     *
     * @return false if the job moved on or is already terminal
     */
    public boolean cancel(Job job, String statusMessage) {
        if (job.isTerminal()) {
            return false;
        }
        JobUpdate update = JobUpdate.create()
                .state(JobState.CANCELLED)
                .retryPending(false)
                .statusMessage(statusMessage);
        return apply(job, job.state(), JobState.CANCELLED, update, null);
    }

    private boolean apply(Job job, JobState from, JobState to, JobUpdate update, JobError error) {
        if (!repository.transition(job.id(), from, update)) {
            LOG.debug("Transition {} -> {} skipped for job {}: state changed concurrently", from, to, job.id());
            return false;
        }
        LOG.info("Job {} ({}) {} -> {}", job.id(), job.kind(), from, to);
        publish(job, from, to, error);
        return true;
    }

    private void publish(Job job, JobState from, JobState to, JobError error) {
        publisher.publishEvent(new JobLifecycleEvent(job.id(), job.kind(), from, to, error, clock.instant()));
    }
}
