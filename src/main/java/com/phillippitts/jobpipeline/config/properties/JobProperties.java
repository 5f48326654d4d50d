package com.phillippitts.jobpipeline.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;

/**
 * Configuration properties for job execution, retries and maintenance.
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public class JobProperties {

    /** Run worker loops in this process; API-only nodes turn this off. */
    private boolean workerEnabled = true;

    /** Concurrent worker loops per process. */
    @Positive(message = "Worker count must be positive")
    private int workerCount = 2;

    /** Delay between queue polls while the queue is empty. */
    @NotNull
    private Duration pollInterval = Duration.ofMillis(500);

    /** How often a worker waiting on a processing call checks for cancellation. */
    @NotNull
    private Duration cancellationCheckInterval = Duration.ofMillis(250);

    /** Total attempts per job, first attempt included. */
    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 3;

    /** Fixed delay before a retryable failure is requeued. */
    @NotNull
    private Duration retryDelay = Duration.ofSeconds(60);

    /** Cooperative per-attempt budget, checked at progress checkpoints. */
    @NotNull
    private Duration softTimeout = Duration.ofMinutes(25);

    /** Forced per-attempt budget; the processing call is interrupted past it. */
    @NotNull
    private Duration hardTimeout = Duration.ofMinutes(30);

    /** Largest decoded binary payload accepted at submission. */
    @Positive(message = "Max payload bytes must be positive")
    private int maxPayloadBytes = 10 * 1024 * 1024;

    /** Language of status messages when the submitter does not specify one. */
    @NotNull
    private Locale defaultLocale = Locale.forLanguageTag("vi-VN");

    /** Age after which terminal job records are removed by the cleanup sweep. */
    @NotNull
    private Duration retention = Duration.ofHours(24);

    /**
     * Extra time past the hard deadline before the cleanup sweep treats a RUNNING job as
     * abandoned by a dead worker.
     */
    @NotNull
    private Duration staleGrace = Duration.ofMinutes(5);

    /**
     * Delay between runs of the stranded-job reconciliation, which schedules waiting jobs
     * missing from the run queue. ISO-8601 form (e.g. PT1M) because the scheduler reads it.
     */
    @NotNull
    private Duration reconcileInterval = Duration.ofMinutes(1);

    /** Largest number of jobs returned by one history listing. */
    @Positive(message = "History limit must be positive")
    private int historyLimit = 100;

    /** How long a statistics snapshot stays readable. */
    @NotNull
    private Duration statisticsTtl = Duration.ofDays(7);

    @NotBlank
    private String cleanupCron = "0 0 2 * * *";

    @NotBlank
    private String statisticsCron = "0 0 1 * * MON";

    @NotBlank
    private String maintenanceZone = "Asia/Ho_Chi_Minh";

    public boolean isWorkerEnabled() {
        return workerEnabled;
    }

    public void setWorkerEnabled(boolean workerEnabled) {
        this.workerEnabled = workerEnabled;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getCancellationCheckInterval() {
        return cancellationCheckInterval;
    }

    public void setCancellationCheckInterval(Duration cancellationCheckInterval) {
        this.cancellationCheckInterval = cancellationCheckInterval;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public Duration getSoftTimeout() {
        return softTimeout;
    }

    public void setSoftTimeout(Duration softTimeout) {
        this.softTimeout = softTimeout;
    }

    public Duration getHardTimeout() {
        return hardTimeout;
    }

    public void setHardTimeout(Duration hardTimeout) {
        this.hardTimeout = hardTimeout;
    }

    public int getMaxPayloadBytes() {
        return maxPayloadBytes;
    }

    public void setMaxPayloadBytes(int maxPayloadBytes) {
        this.maxPayloadBytes = maxPayloadBytes;
    }

    public Locale getDefaultLocale() {
        return defaultLocale;
    }

    public void setDefaultLocale(Locale defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public Duration getStaleGrace() {
        return staleGrace;
    }

    public void setStaleGrace(Duration staleGrace) {
        this.staleGrace = staleGrace;
    }

    public Duration getReconcileInterval() {
        return reconcileInterval;
    }

    public void setReconcileInterval(Duration reconcileInterval) {
        this.reconcileInterval = reconcileInterval;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public Duration getStatisticsTtl() {
        return statisticsTtl;
    }

    public void setStatisticsTtl(Duration statisticsTtl) {
        this.statisticsTtl = statisticsTtl;
    }

    public String getCleanupCron() {
        return cleanupCron;
    }

    public void setCleanupCron(String cleanupCron) {
        this.cleanupCron = cleanupCron;
    }

    public String getStatisticsCron() {
        return statisticsCron;
    }

    public void setStatisticsCron(String statisticsCron) {
        this.statisticsCron = statisticsCron;
    }

    public String getMaintenanceZone() {
        return maintenanceZone;
    }

    public void setMaintenanceZone(String maintenanceZone) {
        this.maintenanceZone = maintenanceZone;
    }
}
