package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.store.CoordinationStore;
import com.phillippitts.jobpipeline.store.StoreKeys;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Run queue of job ids ordered by the time they become runnable.
 *
 * <p>{@link #poll(Instant)} removes the id atomically, so each enqueued id is handed to
 * at most one worker.
 */
@Component
public class JobQueue {

    private final CoordinationStore store;

    public JobQueue(CoordinationStore store) {
        this.store = store;
    }

    public void enqueue(String jobId, Instant readyAt) {
        store.schedule(StoreKeys.JOB_QUEUE, jobId, readyAt);
    }

    /**
     * @return the earliest runnable job id, or empty if none is due
     */
    public Optional<String> poll(Instant now) {
        return store.popDue(StoreKeys.JOB_QUEUE, now);
    }

    public boolean remove(String jobId) {
        return store.unschedule(StoreKeys.JOB_QUEUE, jobId);
    }

    public boolean contains(String jobId) {
        return store.isScheduled(StoreKeys.JOB_QUEUE, jobId);
    }
}
