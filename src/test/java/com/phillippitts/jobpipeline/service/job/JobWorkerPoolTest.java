package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.domain.JobStatus;
import com.phillippitts.jobpipeline.domain.result.CalculationResult;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.service.processing.placeholder.PlaceholderCalculateFunction;
import com.phillippitts.jobpipeline.testutil.JobPipelineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobWorkerPoolTest {

    private JobWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop();
        }
    }

    private static JobProperties fastPolling() {
        JobProperties properties = JobPipelineFixture.properties();
        properties.setPollInterval(Duration.ofMillis(20));
        return properties;
    }

    @Test
    void processesCalculateJobEndToEnd() {
        JobPipelineFixture fixture = new JobPipelineFixture(Clock.systemUTC(), fastPolling(),
                new PlaceholderCalculateFunction());
        pool = new JobWorkerPool(fixture.worker, new SimpleAsyncTaskExecutor("test-worker-"), fixture.properties);
        pool.start();

        String id = fixture.submitCalculate("u1");

        await().atMost(Duration.ofSeconds(5))
                .until(() -> fixture.service.getStatus(id).state() == JobState.SUCCEEDED);
        JobStatus status = fixture.service.getStatus(id);
        assertThat(status.progress()).isEqualTo(100);
        assertThat(status.kind()).isEqualTo(JobKind.CALCULATE);
        assertThat(status.result()).isInstanceOfSatisfying(CalculationResult.class, result ->
                assertThat(result.calculations()).containsEntry("tax_payable", new BigDecimal("2350000")));
    }

    @Test
    void doesNotStartWhenWorkersDisabled() {
        JobProperties properties = fastPolling();
        properties.setWorkerEnabled(false);
        TaskExecutor executor = mock(TaskExecutor.class);
        pool = new JobWorkerPool(mock(JobWorker.class), executor, properties);

        pool.start();

        assertThat(pool.isRunning()).isFalse();
        verify(executor, never()).execute(any());
    }

    @Test
    void startsOneLoopPerWorker() {
        JobProperties properties = fastPolling();
        properties.setWorkerCount(3);
        TaskExecutor executor = mock(TaskExecutor.class);
        pool = new JobWorkerPool(mock(JobWorker.class), executor, properties);

        pool.start();

        assertThat(pool.isRunning()).isTrue();
        verify(executor, times(3)).execute(any());
    }

    @Test
    void loopSurvivesStoreOutage() {
        JobWorker worker = mock(JobWorker.class);
        when(worker.runOnce())
                .thenThrow(new StoreUnavailableException("popDue", new IllegalStateException("down")))
                .thenReturn(false);
        pool = new JobWorkerPool(worker, new SimpleAsyncTaskExecutor("test-worker-"), fastPolling());

        pool.start();

        verify(worker, timeout(2000).atLeast(3)).runOnce();
    }

    @Test
    void stopEndsLoops() {
        JobWorker worker = mock(JobWorker.class);
        when(worker.runOnce()).thenReturn(false);
        pool = new JobWorkerPool(worker, new SimpleAsyncTaskExecutor("test-worker-"), fastPolling());
        pool.start();
        verify(worker, timeout(2000).atLeast(1)).runOnce();

        pool.stop();

        assertThat(pool.isRunning()).isFalse();
    }
}
