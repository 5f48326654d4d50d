package com.phillippitts.jobpipeline.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The worker pool size itself comes from {@code jobs.worker-count}; this class only
 * tunes thread naming and the bounded pool that runs processing functions.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private WorkerPoolProperties worker = new WorkerPoolProperties();
    private ProcessingPoolProperties processing = new ProcessingPoolProperties();

    public WorkerPoolProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerPoolProperties worker) {
        this.worker = worker;
    }

    public ProcessingPoolProperties getProcessing() {
        return processing;
    }

    public void setProcessing(ProcessingPoolProperties processing) {
        this.processing = processing;
    }

    /**
     * Worker loop executor configuration.
     */
    public static class WorkerPoolProperties {
        private String threadNamePrefix = "job-worker-";
        private int awaitTerminationSeconds = 30;

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }

    /**
     * Processing function executor configuration.
     */
    public static class ProcessingPoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 16;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "job-processing-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
