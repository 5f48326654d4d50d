package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.domain.JobStatus;
import com.phillippitts.jobpipeline.exception.ForbiddenException;
import com.phillippitts.jobpipeline.exception.NotFoundException;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.exception.ValidationException;
import com.phillippitts.jobpipeline.service.maintenance.JobCleanupTask;
import com.phillippitts.jobpipeline.service.processing.SubmissionRequest;
import com.phillippitts.jobpipeline.store.StoreKeys;
import com.phillippitts.jobpipeline.testutil.CalculateStub;
import com.phillippitts.jobpipeline.testutil.JobPipelineFixture;
import com.phillippitts.jobpipeline.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class JobServiceTest {

    private MutableClock clock;
    private JobPipelineFixture fixture;
    private JobService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
        fixture = new JobPipelineFixture(clock, JobPipelineFixture.properties(), CalculateStub.succeeding());
        service = fixture.service;
    }

    @Test
    void submitReturnsImmediatelyWithQueuedJob() {
        String id = fixture.submitCalculate("u1");

        JobStatus status = service.getStatus(id);
        assertThat(status.state()).isEqualTo(JobState.SUBMITTED);
        assertThat(status.progress()).isLessThan(100);
        assertThat(status.statusMessage()).isEqualTo("Đang chờ xử lý...");
        assertThat(status.terminal()).isFalse();
        assertThat(status.result()).isNull();
        assertThat(fixture.queue.contains(id)).isTrue();
        assertThat(fixture.repository.allIds()).containsExactly(id);
    }

    @Test
    void submitAssignsUniqueIds() {
        assertThat(fixture.submitCalculate("u1")).isNotEqualTo(fixture.submitCalculate("u1"));
    }

    @Test
    void submitAppliesConfiguredRetryBudgetAndTimeouts() {
        String id = fixture.submitCalculate("u1");

        assertThat(fixture.job(id).maxAttempts()).isEqualTo(3);
        assertThat(fixture.job(id).softTimeout()).isEqualTo(fixture.properties.getSoftTimeout());
        assertThat(fixture.job(id).hardTimeout()).isEqualTo(fixture.properties.getHardTimeout());
    }

    @Test
    void submitRejectsBlankOwner() {
        assertThatThrownBy(() -> service.submit(" ", JobKind.CALCULATE, JobPipelineFixture.calculateRequest()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void submitRejectsKindWithoutProcessingFunction() {
        SubmissionRequest request = new SubmissionRequest("AAAA", Map.of("targetField", "f", "formType", "t"));

        assertThatThrownBy(() -> service.submit("u1", JobKind.VOICE, request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("voice");
        assertThat(fixture.repository.allIds()).isEmpty();
    }

    @Test
    void submitRejectsInvalidPayloadWithoutRecordingJob() {
        SubmissionRequest request = new SubmissionRequest(null, Map.of("formType", "02/QTT-TNCN"));

        assertThatThrownBy(() -> service.submit("u1", JobKind.CALCULATE, request))
                .isInstanceOf(ValidationException.class);
        assertThat(fixture.repository.allIds()).isEmpty();
    }

    @Test
    void submitPropagatesStoreFailure() {
        fixture.store.setAvailable(false);

        assertThatThrownBy(() -> fixture.submitCalculate("u1"))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void getStatusOfUnknownJobThrowsNotFound() {
        assertThatThrownBy(() -> service.getStatus("nope"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Job not found: nope");
    }

    @Test
    void ownerCancelsQueuedJob() {
        String id = fixture.submitCalculate("u1");

        JobStatus status = service.cancel(id, "u1");

        assertThat(status.state()).isEqualTo(JobState.CANCELLED);
        assertThat(status.terminal()).isTrue();
        assertThat(fixture.queue.contains(id)).isFalse();
    }

    @Test
    void adminMayCancelAnyJob() {
        String id = fixture.submitCalculate("u1");

        assertThat(service.cancel(id, JobPipelineFixture.ADMIN).state()).isEqualTo(JobState.CANCELLED);
    }

    @Test
    void otherUsersMayNotCancel() {
        String id = fixture.submitCalculate("u1");

        assertThatThrownBy(() -> service.cancel(id, "u2"))
                .isInstanceOf(ForbiddenException.class);
        assertThat(fixture.job(id).state()).isEqualTo(JobState.SUBMITTED);
    }

    @Test
    void cancelOfUnknownJobThrowsNotFound() {
        assertThatThrownBy(() -> service.cancel("nope", "u1"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void cancelOfTerminalJobChangesNothing() {
        String id = fixture.submitCalculate("u1");
        fixture.worker.runOnce();
        int events = fixture.events.size();

        JobStatus status = service.cancel(id, "u1");

        assertThat(status.state()).isEqualTo(JobState.SUCCEEDED);
        assertThat(status.result()).isNotNull();
        assertThat(fixture.events).hasSize(events);
    }

    @Test
    void cancelIsIdempotent() {
        String id = fixture.submitCalculate("u1");
        service.cancel(id, "u1");

        assertThat(service.cancel(id, "u1").state()).isEqualTo(JobState.CANCELLED);
        assertThat(fixture.events).filteredOn(e -> e.to() == JobState.CANCELLED).hasSize(1);
    }

    @Test
    void submitWithdrawsJobThatCouldNotBeScheduled() {
        fixture.store.failOn("schedule");

        assertThatThrownBy(() -> fixture.submitCalculate("u1"))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(fixture.repository.allIds()).isEmpty();
        assertThat(fixture.store.members(StoreKeys.ownerIndex("u1"))).isEmpty();
    }

    @Test
    void jobLeftBehindByFailedWithdrawalIsScheduledByReconciliation() {
        fixture.store.failOn("schedule");
        fixture.store.failOn("delete");

        Throwable thrown = catchThrowable(() -> fixture.submitCalculate("u1"));

        assertThat(thrown).isInstanceOf(StoreUnavailableException.class);
        assertThat(thrown.getSuppressed()).hasSize(1);
        assertThat(fixture.repository.allIds()).hasSize(1);
        String id = fixture.repository.allIds().iterator().next();

        fixture.store.clearFailures();
        clock.advance(Duration.ofMinutes(6));
        JobCleanupTask cleanup = new JobCleanupTask(fixture.repository, fixture.queue, fixture.stateMachine,
                fixture.messages, clock, fixture.properties);

        assertThat(cleanup.reconcileStranded()).isEqualTo(1);
        assertThat(fixture.queue.contains(id)).isTrue();
        assertThat(fixture.job(id).state()).isEqualTo(JobState.SUBMITTED);
    }

    @Test
    void historyListsOwnJobsNewestFirst() {
        String first = fixture.submitCalculate("u1");
        clock.advance(Duration.ofSeconds(1));
        fixture.submitCalculate("u2");
        clock.advance(Duration.ofSeconds(1));
        String second = fixture.submitCalculate("u1");

        assertThat(service.history("u1", 20)).extracting(JobStatus::jobId).containsExactly(second, first);
        assertThat(service.history("u1", 1)).extracting(JobStatus::jobId).containsExactly(second);
        assertThat(service.history("nobody", 20)).isEmpty();
    }

    @Test
    void historyIsCappedAtConfiguredLimit() {
        JobProperties properties = JobPipelineFixture.properties();
        properties.setHistoryLimit(2);
        JobPipelineFixture capped = new JobPipelineFixture(clock, properties, CalculateStub.succeeding());
        for (int i = 0; i < 3; i++) {
            capped.submitCalculate("u1");
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(capped.service.history("u1", 50)).hasSize(2);
    }

    @Test
    void historyRejectsInvalidArguments() {
        assertThatThrownBy(() -> service.history("u1", 0))
                .isInstanceOf(ValidationException.class)
                .hasMessage("limit must be positive, got: 0");
        assertThatThrownBy(() -> service.history(" ", 10))
                .isInstanceOf(ValidationException.class)
                .hasMessage("ownerId is required");
    }

    @Test
    void historySkipsAndPrunesVanishedRecords() {
        String kept = fixture.submitCalculate("u1");
        String vanished = fixture.submitCalculate("u1");
        fixture.store.delete(StoreKeys.job(vanished));

        assertThat(service.history("u1", 20)).extracting(JobStatus::jobId).containsExactly(kept);
        assertThat(fixture.store.members(StoreKeys.ownerIndex("u1"))).containsExactly(kept);
    }
}
