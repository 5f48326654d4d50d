package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.JobStatus;
import com.phillippitts.jobpipeline.domain.payload.JobPayload;
import com.phillippitts.jobpipeline.exception.ForbiddenException;
import com.phillippitts.jobpipeline.exception.NotFoundException;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.exception.ValidationException;
import com.phillippitts.jobpipeline.service.auth.AuthorizationPolicy;
import com.phillippitts.jobpipeline.service.processing.ProcessingAdapter;
import com.phillippitts.jobpipeline.service.processing.SubmissionRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for request handlers: submit jobs, read their status and cancel them.
 *
 * <p>Submission only writes the job record and enqueues it; it never waits for
 * processing.
 */
@Service
public class JobService {

    private static final Logger LOG = LogManager.getLogger(JobService.class);

    private final JobRepository repository;
    private final JobQueue queue;
    private final JobStateMachine stateMachine;
    private final ProcessingAdapter adapter;
    private final StatusMessages messages;
    private final AuthorizationPolicy authorizationPolicy;
    private final JobProperties properties;
    private final Clock clock;

    public JobService(JobRepository repository,
                      JobQueue queue,
                      JobStateMachine stateMachine,
                      ProcessingAdapter adapter,
                      StatusMessages messages,
                      AuthorizationPolicy authorizationPolicy,
                      JobProperties properties,
                      Clock clock) {
        this.repository = repository;
        this.queue = queue;
        this.stateMachine = stateMachine;
        this.adapter = adapter;
        this.messages = messages;
        this.authorizationPolicy = authorizationPolicy;
        this.properties = properties;
        this.clock = clock;
    }

    public String submit(String ownerId, JobKind kind, SubmissionRequest request) {
        return submit(ownerId, kind, request, null);
    }

    /**
     * Validates and enqueues a job.
     *
     * @param locale language of status messages, {@code jobs.default-locale} if null
     * @return the new job id
     * @throws ValidationException       if the payload is invalid or too large
     * @throws StoreUnavailableException if the job could not be recorded
     */
    public String submit(String ownerId, JobKind kind, SubmissionRequest request, Locale locale) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("ownerId is required");
        }
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(request, "request");
        if (!adapter.supports(kind)) {
            throw new ValidationException("No processing function available for " + kind.getValue());
        }

        JobPayload payload = adapter.decode(kind, request);
        Locale effectiveLocale = locale == null ? properties.getDefaultLocale() : locale;
        Instant now = clock.instant();
        Job job = Job.submitted(
                UUID.randomUUID().toString(),
                kind,
                ownerId,
                payload,
                effectiveLocale,
                messages.get(StatusMessages.QUEUED, effectiveLocale),
                properties.getMaxAttempts(),
                properties.getSoftTimeout(),
                properties.getHardTimeout(),
                now);

        stateMachine.submit(job);
        enqueueOrWithdraw(job, now);
        LOG.info("Submitted {} job {} for owner {}", kind.getValue(), job.id(), ownerId);
        return job.id();
    }

    /**
     * @throws NotFoundException if the job does not exist
     */
    public JobStatus getStatus(String jobId) {
        return JobStatus.from(find(jobId));
    }

    /**
     * Jobs submitted by {@code ownerId}, newest first.
     *
     * @param limit maximum number of entries, capped at {@code jobs.history-limit}
     * @throws ValidationException if the owner is missing or the limit is not positive
     */
    public List<JobStatus> history(String ownerId, int limit) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("ownerId is required");
        }
        if (limit <= 0) {
            throw new ValidationException("limit must be positive, got: " + limit);
        }
        return repository.findByOwner(ownerId).stream()
                .sorted(Comparator.comparing(Job::createdAt).reversed().thenComparing(Job::id))
                .limit(Math.min(limit, properties.getHistoryLimit()))
                .map(JobStatus::from)
                .toList();
    }

    /**
     * Cancels a job on behalf of {@code requesterId}.
     *
     * <p>A queued job is removed from the run queue; a running job stops at its next
     * checkpoint or when its worker next checks. Cancelling a terminal job changes nothing.
     *
     * @return the job status after the request
     * @throws NotFoundException  if the job does not exist
     * @throws ForbiddenException unless the requester owns the job or is an admin
     */
    public JobStatus cancel(String jobId, String requesterId) {
        // Each retry follows a concurrent transition, and a job only has a bounded number of them.
        while (true) {
            Job job = find(jobId);
            if (!job.ownerId().equals(requesterId) && !authorizationPolicy.isAdmin(requesterId)) {
                LOG.warn("User {} may not cancel job {} owned by {}", requesterId, jobId, job.ownerId());
                throw new ForbiddenException("Only the owner or an administrator may cancel job " + jobId, requesterId);
            }
            if (job.isTerminal()) {
                return JobStatus.from(job);
            }
            if (stateMachine.cancel(job, messages.get(StatusMessages.CANCELLED, job.locale()))) {
                queue.remove(jobId);
                LOG.info("Job {} cancelled by {}", jobId, requesterId);
                return getStatus(jobId);
            }
        }
    }

    /**
     * Schedules a freshly recorded job. When scheduling fails the record is withdrawn, so
     * the caller's error response matches the outcome; if the withdrawal fails as well the
     * stranded-job reconciliation schedules the job later.
     */
    private void enqueueOrWithdraw(Job job, Instant readyAt) {
        try {
            queue.enqueue(job.id(), readyAt);
        } catch (StoreUnavailableException e) {
            try {
                repository.delete(job);
                LOG.warn("Withdrew job {}: could not schedule it: {}", job.id(), e.getMessage());
            } catch (StoreUnavailableException deleteFailure) {
                e.addSuppressed(deleteFailure);
                LOG.error("Job {} is recorded but unscheduled; reconciliation will schedule it", job.id());
            }
            throw e;
        }
    }

    private Job find(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new NotFoundException("Job", String.valueOf(jobId));
        }
        return repository.find(jobId).orElseThrow(() -> new NotFoundException("Job", jobId));
    }
}
