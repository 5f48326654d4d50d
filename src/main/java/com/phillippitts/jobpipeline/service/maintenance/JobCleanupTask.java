package com.phillippitts.jobpipeline.service.maintenance;

import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.domain.ErrorKind;
import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.domain.JobError;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.service.job.JobQueue;
import com.phillippitts.jobpipeline.service.job.JobRepository;
import com.phillippitts.jobpipeline.service.job.JobStateMachine;
import com.phillippitts.jobpipeline.service.job.StatusMessages;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Daily sweep over the job index, plus the more frequent stranded-job reconciliation.
 *
 * <ul>
 *   <li>Deletes terminal jobs last updated more than {@code jobs.retention} ago</li>
 *   <li>Fails RUNNING jobs whose hard deadline passed more than {@code jobs.stale-grace}
 *       ago; their worker died without recording an outcome</li>
 *   <li>Re-enqueues waiting jobs that fell out of the run queue after a store failure</li>
 * </ul>
 *
 * <p>Every step is guarded by the job's current state, so running the sweep twice, or
 * concurrently with workers, has no additional effect.
 */
@Component
public class JobCleanupTask {

    private static final Logger LOG = LogManager.getLogger(JobCleanupTask.class);

    private final JobRepository repository;
    private final JobQueue queue;
    private final JobStateMachine stateMachine;
    private final StatusMessages messages;
    private final Clock clock;
    private final Duration retention;
    private final Duration staleGrace;

    public JobCleanupTask(JobRepository repository,
                          JobQueue queue,
                          JobStateMachine stateMachine,
                          StatusMessages messages,
                          Clock clock,
                          JobProperties properties) {
        this.repository = repository;
        this.queue = queue;
        this.stateMachine = stateMachine;
        this.messages = messages;
        this.clock = clock;
        this.retention = properties.getRetention();
        this.staleGrace = properties.getStaleGrace();
    }

    /**
     * @throws StoreUnavailableException if the store fails; the next sweep picks up where this one stopped
     */
    public CleanupReport sweep() {
        Instant now = clock.instant();
        int removed = 0;
        int reaped = 0;
        int requeued = 0;

        for (String jobId : repository.allIds()) {
            Optional<Job> found = repository.find(jobId);
            if (found.isEmpty()) {
                repository.delete(jobId);
                queue.remove(jobId);
                removed++;
                continue;
            }
            Job job = found.get();
            if (job.isTerminal()) {
                if (job.updatedAt().isBefore(now.minus(retention))) {
                    repository.delete(job);
                    removed++;
                }
            } else if (job.state() == JobState.RUNNING) {
                if (reapIfAbandoned(job, now)) {
                    reaped++;
                }
            } else if (requeueIfStranded(job, now)) {
                requeued++;
            }
        }

        CleanupReport report = new CleanupReport(removed, reaped, requeued);
        LOG.info("Job cleanup finished: removed={}, reaped={}, requeued={}", removed, reaped, requeued);
        return report;
    }

    /**
     * Schedules waiting jobs that are missing from the run queue, i.e. SUBMITTED jobs left
     * unscheduled and FAILED jobs whose retry was never requeued, once they have been idle
     * for {@code jobs.stale-grace}.
     *
     * @return number of jobs scheduled again
     * @throws StoreUnavailableException if the store fails
     */
    public int reconcileStranded() {
        Instant now = clock.instant();
        int requeued = 0;
        for (String jobId : repository.allIds()) {
            Optional<Job> found = repository.find(jobId);
            if (found.isEmpty()) {
                continue;
            }
            Job job = found.get();
            if (!job.isTerminal() && job.state() != JobState.RUNNING && requeueIfStranded(job, now)) {
                requeued++;
            }
        }
        if (requeued > 0) {
            LOG.info("Stranded job reconciliation scheduled {} job(s)", requeued);
        }
        return requeued;
    }

    private boolean reapIfAbandoned(Job job, Instant now) {
        Instant hardDeadline = job.hardDeadline();
        if (hardDeadline == null || !hardDeadline.plus(staleGrace).isBefore(now)) {
            return false;
        }
        JobError error = new JobError(ErrorKind.TIMEOUT, "Worker stopped reporting; hard time limit passed at " + hardDeadline);
        boolean failed = stateMachine.fail(job, error,
                messages.failure(job.kind(), ErrorKind.TIMEOUT, job.locale()), false);
        if (failed) {
            LOG.warn("Reaped abandoned job {} (started {})", job.id(), job.startedAt());
        }
        return failed;
    }

    private boolean requeueIfStranded(Job job, Instant now) {
        if (!job.updatedAt().plus(staleGrace).isBefore(now)) {
            return false;
        }
        if (job.state() == JobState.SUBMITTED) {
            if (queue.contains(job.id())) {
                return false;
            }
            queue.enqueue(job.id(), job.nextAttemptAt().isAfter(now) ? job.nextAttemptAt() : now);
            LOG.warn("Re-enqueued stranded job {}", job.id());
            return true;
        }
        if (job.state() == JobState.FAILED && job.retryPending()) {
            queue.enqueue(job.id(), now);
            if (stateMachine.requeue(job, now, messages.get(StatusMessages.QUEUED, job.locale()))) {
                LOG.warn("Requeued job {} left waiting for retry", job.id());
                return true;
            }
            queue.remove(job.id());
        }
        return false;
    }
}
