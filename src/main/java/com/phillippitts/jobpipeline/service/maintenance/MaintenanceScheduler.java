package com.phillippitts.jobpipeline.service.maintenance;

import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the maintenance tasks on their cron schedules ({@code jobs.cleanup-cron},
 * {@code jobs.statistics-cron}) in {@code jobs.maintenance-zone}, and the stranded-job
 * reconciliation every {@code jobs.reconcile-interval}.
 */
@Component
public class MaintenanceScheduler {

    private static final Logger LOG = LogManager.getLogger(MaintenanceScheduler.class);

    private final JobCleanupTask cleanupTask;
    private final JobStatisticsAggregator statisticsAggregator;

    public MaintenanceScheduler(JobCleanupTask cleanupTask, JobStatisticsAggregator statisticsAggregator) {
        this.cleanupTask = cleanupTask;
        this.statisticsAggregator = statisticsAggregator;
    }

    @Scheduled(cron = "${jobs.cleanup-cron:0 0 2 * * *}", zone = "${jobs.maintenance-zone:Asia/Ho_Chi_Minh}")
    public void cleanup() {
        try {
            cleanupTask.sweep();
        } catch (StoreUnavailableException e) {
            LOG.warn("Job cleanup skipped, coordination store unavailable: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${jobs.reconcile-interval:PT1M}",
            initialDelayString = "${jobs.reconcile-interval:PT1M}")
    public void reconcileStranded() {
        try {
            cleanupTask.reconcileStranded();
        } catch (StoreUnavailableException e) {
            LOG.warn("Stranded job reconciliation skipped, coordination store unavailable: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${jobs.statistics-cron:0 0 1 * * MON}", zone = "${jobs.maintenance-zone:Asia/Ho_Chi_Minh}")
    public void aggregateStatistics() {
        try {
            statisticsAggregator.aggregate();
        } catch (StoreUnavailableException e) {
            LOG.warn("Job statistics skipped, coordination store unavailable: {}", e.getMessage());
        }
    }
}
