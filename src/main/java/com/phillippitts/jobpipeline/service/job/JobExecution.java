package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.exception.JobCancelledException;
import com.phillippitts.jobpipeline.exception.JobTimeoutException;
import com.phillippitts.jobpipeline.exception.ProcessingInterruptedException;

import java.time.Clock;
import java.time.Instant;

/**
 * Progress reporter for one claimed attempt of a job.
 *
 * <p>Progress written here never decreases and stays below 100 until the job succeeds.
 */
class JobExecution implements ProgressReporter {

    private static final int MAX_IN_FLIGHT_PROGRESS = 99;

    private final Job job;
    private final JobStateMachine stateMachine;
    private final StatusMessages messages;
    private final Clock clock;
    private volatile int progress;

    JobExecution(Job job, JobStateMachine stateMachine, StatusMessages messages, Clock clock) {
        this.job = job;
        this.stateMachine = stateMachine;
        this.messages = messages;
        this.clock = clock;
        this.progress = job.progress();
    }

    /**
     * @throws ProcessingInterruptedException if the processing thread was interrupted
     * @throws JobCancelledException          if the job left RUNNING, e.g. it was cancelled
     * @throws JobTimeoutException            if the soft deadline passed
     */
    @Override
    public synchronized void checkpoint(int requested, String messageKey) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProcessingInterruptedException(job.id());
        }
        checkSoftDeadline();

        int next = Math.max(progress, Math.min(MAX_IN_FLIGHT_PROGRESS, requested));
        if (!stateMachine.progress(job, next, messages.get(messageKey, job.locale()))) {
            throw new JobCancelledException(job.id());
        }
        progress = next;
    }

    @Override
    public String jobId() {
        return job.id();
    }

    /**
     * @throws JobTimeoutException if the soft deadline of this attempt has passed
     */
    void checkSoftDeadline() {
        Instant deadline = job.softDeadline();
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw new JobTimeoutException(job.softTimeout(), false);
        }
    }

    int currentProgress() {
        return progress;
    }
}
