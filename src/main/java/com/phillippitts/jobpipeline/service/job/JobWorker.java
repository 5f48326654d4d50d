package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.domain.ErrorKind;
import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.domain.JobError;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.domain.result.JobResult;
import com.phillippitts.jobpipeline.exception.JobCancelledException;
import com.phillippitts.jobpipeline.exception.JobPipelineException;
import com.phillippitts.jobpipeline.exception.JobTimeoutException;
import com.phillippitts.jobpipeline.exception.ProcessingException;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.exception.UpstreamUnavailableException;
import com.phillippitts.jobpipeline.service.metrics.PipelineMetrics;
import com.phillippitts.jobpipeline.service.processing.ProcessingAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Claims and executes one job at a time.
 *
 * <p>Protocol per job:
 * <ol>
 *   <li>Pop a due id from the run queue (atomic, so no other worker receives it)</li>
 *   <li>Claim it with a SUBMITTED → RUNNING compare-and-set; a lost claim is dropped</li>
 *   <li>Run the processing call on the processing pool and wait for it in slices,
 *       watching for cancellation and the hard deadline</li>
 *   <li>Write the outcome: SUCCEEDED, terminal FAILED, or FAILED with a retry pending
 *       followed by a requeue after the retry delay. An interrupted processing thread
 *       counts as a retryable failure, so jobs in flight at shutdown are requeued</li>
 * </ol>
 *
 * <p>The worker holds {@code jobId}, {@code jobKind} and {@code ownerId} in the Log4j2
 * ThreadContext while a job runs; the processing pool inherits them.
 */
@Component
public class JobWorker {

    private static final Logger LOG = LogManager.getLogger(JobWorker.class);

    private final JobQueue queue;
    private final JobRepository repository;
    private final JobStateMachine stateMachine;
    private final ProcessingAdapter adapter;
    private final RetryPolicy retryPolicy;
    private final StatusMessages messages;
    private final AsyncTaskExecutor processingExecutor;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Duration cancellationCheckInterval;

    public JobWorker(JobQueue queue,
                     JobRepository repository,
                     JobStateMachine stateMachine,
                     ProcessingAdapter adapter,
                     RetryPolicy retryPolicy,
                     StatusMessages messages,
                     @Qualifier("processingExecutor") AsyncTaskExecutor processingExecutor,
                     PipelineMetrics metrics,
                     Clock clock,
                     JobProperties properties) {
        this.queue = queue;
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.adapter = adapter;
        this.retryPolicy = retryPolicy;
        this.messages = messages;
        this.processingExecutor = processingExecutor;
        this.metrics = metrics;
        this.clock = clock;
        this.cancellationCheckInterval = properties.getCancellationCheckInterval();
    }

    /**
     * Processes at most one due job.
     *
     * @return true if a job id was taken from the queue, false if none was due
     * @throws StoreUnavailableException if the store fails while polling or claiming
     */
    public boolean runOnce() {
        Optional<String> next = queue.poll(clock.instant());
        if (next.isEmpty()) {
            return false;
        }
        String jobId = next.get();

        Optional<Job> found = repository.find(jobId);
        if (found.isEmpty()) {
            LOG.warn("Dropping queued job {}: no record", jobId);
            return true;
        }
        Job job = found.get();
        if (job.state() != JobState.SUBMITTED) {
            LOG.debug("Dropping queued job {}: state is {}", jobId, job.state());
            return true;
        }

        Optional<Job> claimed = stateMachine.claim(job, messages.get(StatusMessages.INITIALIZING, job.locale()));
        if (claimed.isEmpty()) {
            return true;
        }
        execute(claimed.get());
        return true;
    }

    private void execute(Job job) {
        ThreadContext.put("jobId", job.id());
        ThreadContext.put("jobKind", job.kind().getValue());
        ThreadContext.put("ownerId", job.ownerId());
        JobExecution execution = new JobExecution(job, stateMachine, messages, clock);
        long start = System.nanoTime();
        String outcome = "failed";
        try {
            LOG.info("Starting attempt {}/{} of job {}", job.attempts(), job.maxAttempts(), job.id());
            JobResult result = await(job, submit(job, execution));
            execution.checkSoftDeadline();
            if (stateMachine.succeed(job, result, messages.get(StatusMessages.SUCCEEDED, job.locale()))) {
                outcome = "succeeded";
            } else {
                outcome = "cancelled";
                LOG.info("Job {} was cancelled before its result could be stored; result discarded", job.id());
            }
        } catch (JobCancelledException e) {
            if (isCancelled(job.id())) {
                outcome = "cancelled";
                LOG.info("Job {} stopped: no longer running", job.id());
            } else {
                LOG.warn("Job {} reported cancellation but is still running", job.id());
                handleFailure(job, new UpstreamUnavailableException(e.getMessage(), e));
            }
        } catch (JobPipelineException e) {
            outcome = e.getKind() == ErrorKind.TIMEOUT ? "timeout" : "failed";
            handleFailure(job, e);
            if (e.getCause() instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
        } finally {
            metrics.recordProcessingLatency(job.kind(), outcome, System.nanoTime() - start);
            ThreadContext.remove("jobId");
            ThreadContext.remove("jobKind");
            ThreadContext.remove("ownerId");
        }
    }

    private Future<JobResult> submit(Job job, JobExecution execution) {
        try {
            return processingExecutor.submit(() -> adapter.execute(job.kind(), job.payload(), execution));
        } catch (TaskRejectedException e) {
            throw new UpstreamUnavailableException("Processing pool saturated", e);
        }
    }

    /**
     * Waits for the processing call, checking for cancellation every
     * {@code jobs.cancellation-check-interval} and interrupting the call at the hard deadline.
     */
    private JobResult await(Job job, Future<JobResult> future) {
        Instant hardDeadline = job.hardDeadline();
        while (true) {
            Duration remaining = Duration.between(clock.instant(), hardDeadline);
            if (remaining.isNegative() || remaining.isZero()) {
                future.cancel(true);
                LOG.warn("Job {} exceeded its hard time limit of {}", job.id(), job.hardTimeout());
                throw new JobTimeoutException(job.hardTimeout(), true);
            }
            long sliceMillis = Math.max(1, Math.min(remaining.toMillis(), cancellationCheckInterval.toMillis()));
            try {
                return future.get(sliceMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (isCancelled(job.id())) {
                    future.cancel(true);
                    throw new JobCancelledException(job.id());
                }
            } catch (ExecutionException e) {
                throw translate(e.getCause());
            } catch (InterruptedException e) {
                future.cancel(true);
                throw new UpstreamUnavailableException("Worker interrupted while waiting for job " + job.id(), e);
            }
        }
    }

    private boolean isCancelled(String jobId) {
        try {
            return repository.find(jobId)
                    .map(current -> current.state() != JobState.RUNNING)
                    .orElse(true);
        } catch (StoreUnavailableException e) {
            LOG.debug("Cancellation check for job {} skipped: {}", jobId, e.getMessage());
            return false;
        }
    }

    private static JobPipelineException translate(Throwable cause) {
        if (cause instanceof JobPipelineException pipelineException) {
            return pipelineException;
        }
        return new ProcessingException("Unexpected processing failure: " + cause, cause);
    }

    private void handleFailure(Job job, JobPipelineException e) {
        JobError error = new JobError(e.getKind(), e.getMessage());
        if (retryPolicy.shouldRetry(e.getKind(), job.attempts(), job.maxAttempts())) {
            String retrying = messages.get(StatusMessages.RETRYING, job.locale(), job.attempts(), job.maxAttempts());
            LOG.warn("Attempt {}/{} of job {} failed ({}), retrying in {}: {}", job.attempts(), job.maxAttempts(),
                    job.id(), e.getKind(), retryPolicy.getDelay(), e.getMessage());
            if (stateMachine.fail(job, error, retrying, true)) {
                requeue(job, retryPolicy.nextAttemptAt(clock.instant()));
            }
            return;
        }

        if (e.getKind() == ErrorKind.PROCESSING || e.getKind() == ErrorKind.STORE_UNAVAILABLE
                || e.getKind() == ErrorKind.UPSTREAM_UNAVAILABLE) {
            LOG.error("Job {} failed after {} attempt(s) ({})", job.id(), job.attempts(), e.getKind(), e);
        } else {
            LOG.warn("Job {} failed after {} attempt(s) ({}): {}", job.id(), job.attempts(), e.getKind(),
                    e.getMessage());
        }
        stateMachine.fail(job, error, messages.failure(job.kind(), e.getKind(), job.locale()), false);
    }

    /**
     * Schedules the retry before moving the job back to SUBMITTED. If scheduling fails the
     * job stays FAILED with a retry pending, which the stranded-job reconciliation picks up.
     * A schedule entry whose transition then loses to a cancellation is removed again, and
     * would be dropped by the polling worker otherwise.
     */
    private void requeue(Job job, Instant nextAttemptAt) {
        queue.enqueue(job.id(), nextAttemptAt);
        if (!stateMachine.requeue(job, nextAttemptAt, messages.get(StatusMessages.QUEUED, job.locale()))) {
            queue.remove(job.id());
        }
    }
}
