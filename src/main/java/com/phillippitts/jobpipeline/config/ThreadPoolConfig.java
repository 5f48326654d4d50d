package com.phillippitts.jobpipeline.config;

import com.phillippitts.jobpipeline.config.logging.MdcTaskDecorator;
import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the job pipeline.
 *
 * <p>Two pools are kept apart so a worker can abandon a processing call at the hard
 * deadline without losing its own thread:
 * <ul>
 *   <li>{@code workerExecutor}: one thread per worker loop, sized by {@code jobs.worker-count}</li>
 *   <li>{@code processingExecutor}: runs processing functions, bounded by {@code threadpool.processing.*}</li>
 * </ul>
 *
 * <p>Both reject with {@link ThreadPoolExecutor.AbortPolicy}. A saturated processing pool
 * surfaces to the worker as a retryable failure instead of running the call on the
 * worker thread, where it could no longer be interrupted at the hard deadline.
 *
 * <p>MDC propagation: both copy the Log4j2 ThreadContext of the submitting thread.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final JobProperties jobProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties, JobProperties jobProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.jobProperties = jobProperties;
    }

    @Bean(name = "workerExecutor")
    public ThreadPoolTaskExecutor workerExecutor() {
        ThreadPoolProperties.WorkerPoolProperties workerProps = threadPoolProperties.getWorker();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(jobProperties.getWorkerCount());
        executor.setMaxPoolSize(jobProperties.getWorkerCount());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(workerProps.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(workerProps.getAwaitTerminationSeconds());
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    @Bean(name = "processingExecutor")
    public ThreadPoolTaskExecutor processingExecutor() {
        ThreadPoolProperties.ProcessingPoolProperties processingProps = threadPoolProperties.getProcessing();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(processingProps.getCorePoolSize());
        executor.setMaxPoolSize(processingProps.getMaxPoolSize());
        executor.setQueueCapacity(processingProps.getQueueCapacity());
        executor.setThreadNamePrefix(processingProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(processingProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }
}
