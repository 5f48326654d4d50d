package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs {@code jobs.worker-count} worker loops for the lifetime of the application context.
 *
 * <p>Each loop takes one job at a time and sleeps for {@code jobs.poll-interval} when the
 * queue is empty or the store is unavailable. On shutdown the loops stop polling and finish
 * the job they hold.
 */
@Component
public class JobWorkerPool implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(JobWorkerPool.class);

    private final JobWorker worker;
    private final TaskExecutor workerExecutor;
    private final JobProperties properties;
    private volatile boolean running;

    public JobWorkerPool(JobWorker worker,
                         @Qualifier("workerExecutor") TaskExecutor workerExecutor,
                         JobProperties properties) {
        this.worker = worker;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
    }

    @Override
    public void start() {
        if (!properties.isWorkerEnabled()) {
            LOG.info("Job workers disabled (jobs.worker-enabled=false)");
            return;
        }
        running = true;
        for (int i = 0; i < properties.getWorkerCount(); i++) {
            workerExecutor.execute(this::loop);
        }
        LOG.info("Started {} job worker(s), poll interval {}", properties.getWorkerCount(), properties.getPollInterval());
    }

    @Override
    public void stop() {
        running = false;
        LOG.info("Stopping job workers");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void loop() {
        Duration idle = properties.getPollInterval();
        while (running) {
            try {
                if (!worker.runOnce() && !pause(idle)) {
                    return;
                }
            } catch (StoreUnavailableException e) {
                LOG.warn("Worker paused, coordination store unavailable: {}", e.getMessage());
                if (!pause(idle)) {
                    return;
                }
            } catch (RuntimeException e) {
                LOG.error("Unexpected worker failure", e);
                if (!pause(idle)) {
                    return;
                }
            }
        }
    }

    private static boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
