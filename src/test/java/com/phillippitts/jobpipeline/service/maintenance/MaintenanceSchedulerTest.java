package com.phillippitts.jobpipeline.service.maintenance;

import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MaintenanceSchedulerTest {

    private final JobCleanupTask cleanupTask = mock(JobCleanupTask.class);
    private final JobStatisticsAggregator aggregator = mock(JobStatisticsAggregator.class);
    private final MaintenanceScheduler scheduler = new MaintenanceScheduler(cleanupTask, aggregator);

    @Test
    void runsTasks() {
        scheduler.cleanup();
        scheduler.aggregateStatistics();
        scheduler.reconcileStranded();

        verify(cleanupTask).sweep();
        verify(aggregator).aggregate();
        verify(cleanupTask).reconcileStranded();
    }

    @Test
    void skipsRunWhenStoreUnavailable() {
        StoreUnavailableException outage = new StoreUnavailableException("SMEMBERS jobs:index",
                new IllegalStateException("down"));
        when(cleanupTask.sweep()).thenThrow(outage);
        when(aggregator.aggregate()).thenThrow(outage);
        when(cleanupTask.reconcileStranded()).thenThrow(outage);

        assertThatCode(scheduler::cleanup).doesNotThrowAnyException();
        assertThatCode(scheduler::aggregateStatistics).doesNotThrowAnyException();
        assertThatCode(scheduler::reconcileStranded).doesNotThrowAnyException();
    }
}
