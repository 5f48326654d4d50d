package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.domain.ErrorKind;
import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.domain.JobError;
import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.JobLifecycleEvent;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.domain.payload.CalculatePayload;
import com.phillippitts.jobpipeline.testutil.CalculateStub;
import com.phillippitts.jobpipeline.testutil.InMemoryCoordinationStore;
import com.phillippitts.jobpipeline.testutil.JobPipelineFixture;
import com.phillippitts.jobpipeline.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStateMachineTest {

    private final List<JobLifecycleEvent> events = new ArrayList<>();
    private MutableClock clock;
    private JobRepository repository;
    private JobStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
        repository = new JobRepository(new InMemoryCoordinationStore(clock),
                new JobRecordMapper(JobPipelineFixture.objectMapper()), clock);
        ApplicationEventPublisher publisher = event -> events.add((JobLifecycleEvent) event);
        stateMachine = new JobStateMachine(repository, publisher, clock);
    }

    private Job newJob(String id) {
        Job job = Job.submitted(id, JobKind.CALCULATE, "u1",
                new CalculatePayload(Map.of("income", 1), "02/QTT-TNCN", 2025), Locale.ENGLISH, "Queued",
                3, Duration.ofMinutes(25), Duration.ofMinutes(30), clock.instant());
        stateMachine.submit(job);
        return job;
    }

    @Test
    void submitPublishesInitialEvent() {
        newJob("j1");

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.from()).isNull();
            assertThat(event.to()).isEqualTo(JobState.SUBMITTED);
            assertThat(event.jobId()).isEqualTo("j1");
        });
    }

    @Test
    void submitRejectsJobInOtherState() {
        Job running = new Job("j1", JobKind.CALCULATE, "u1", null, Locale.ENGLISH, JobState.RUNNING, 0, "",
                null, null, 1, 3, false, clock.instant(), null, clock.instant(), null,
                Duration.ofMinutes(25), Duration.ofMinutes(30));

        assertThatThrownBy(() -> stateMachine.submit(running)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void claimStartsAttempt() {
        Job job = newJob("j1");
        clock.advance(Duration.ofSeconds(5));

        Job claimed = stateMachine.claim(job, "Initializing...").orElseThrow();

        assertThat(claimed.state()).isEqualTo(JobState.RUNNING);
        assertThat(claimed.attempts()).isEqualTo(1);
        assertThat(claimed.startedAt()).isEqualTo(clock.instant());
        assertThat(claimed.hardDeadline()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
    }

    @Test
    void onlyOneClaimWins() {
        Job job = newJob("j1");

        assertThat(stateMachine.claim(job, "a")).isPresent();
        assertThat(stateMachine.claim(job, "b")).isEmpty();
    }

    @Test
    void claimClearsErrorOfPreviousAttempt() {
        Job job = newJob("j1");
        Job running = stateMachine.claim(job, "a").orElseThrow();
        stateMachine.fail(running, new JobError(ErrorKind.UPSTREAM_UNAVAILABLE, "down"), "retrying", true);
        Job failed = repository.find("j1").orElseThrow();
        stateMachine.requeue(failed, clock.instant(), "Queued");

        Job second = stateMachine.claim(repository.find("j1").orElseThrow(), "b").orElseThrow();

        assertThat(second.attempts()).isEqualTo(2);
        assertThat(second.error()).isNull();
        assertThat(second.retryPending()).isFalse();
    }

    @Test
    void progressRequiresRunningJob() {
        Job job = newJob("j1");

        assertThat(stateMachine.progress(job, 10, "x")).isFalse();

        Job running = stateMachine.claim(job, "a").orElseThrow();
        assertThat(stateMachine.progress(running, 10, "x")).isTrue();
        assertThat(repository.find("j1").orElseThrow().progress()).isEqualTo(10);
    }

    @Test
    void succeedStoresResultAndCompletesProgress() {
        Job running = stateMachine.claim(newJob("j1"), "a").orElseThrow();

        assertThat(stateMachine.succeed(running, CalculateStub.result(), "Completed")).isTrue();

        Job done = repository.find("j1").orElseThrow();
        assertThat(done.state()).isEqualTo(JobState.SUCCEEDED);
        assertThat(done.progress()).isEqualTo(100);
        assertThat(done.result()).isEqualTo(CalculateStub.result());
        assertThat(done.isTerminal()).isTrue();
    }

    @Test
    void failWithRetryPendingIsNotTerminal() {
        Job running = stateMachine.claim(newJob("j1"), "a").orElseThrow();

        stateMachine.fail(running, new JobError(ErrorKind.UPSTREAM_UNAVAILABLE, "down"), "retrying", true);

        Job failed = repository.find("j1").orElseThrow();
        assertThat(failed.state()).isEqualTo(JobState.FAILED);
        assertThat(failed.isTerminal()).isFalse();
        assertThat(failed.error()).isEqualTo(new JobError(ErrorKind.UPSTREAM_UNAVAILABLE, "down"));
    }

    @Test
    void cancelOfTerminalJobIsRejected() {
        Job running = stateMachine.claim(newJob("j1"), "a").orElseThrow();
        stateMachine.succeed(running, CalculateStub.result(), "Completed");

        assertThat(stateMachine.cancel(repository.find("j1").orElseThrow(), "Cancelled")).isFalse();
        assertThat(repository.find("j1").orElseThrow().state()).isEqualTo(JobState.SUCCEEDED);
    }

    @Test
    void cancelWinsOverLaterSuccess() {
        Job running = stateMachine.claim(newJob("j1"), "a").orElseThrow();

        assertThat(stateMachine.cancel(running, "Cancelled")).isTrue();
        assertThat(stateMachine.succeed(running, CalculateStub.result(), "Completed")).isFalse();
        assertThat(stateMachine.progress(running, 80, "x")).isFalse();

        Job job = repository.find("j1").orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.CANCELLED);
        assertThat(job.result()).isNull();
    }

    @Test
    void cancelOfRetryPendingJobIsAllowed() {
        Job running = stateMachine.claim(newJob("j1"), "a").orElseThrow();
        stateMachine.fail(running, new JobError(ErrorKind.UPSTREAM_UNAVAILABLE, "down"), "retrying", true);

        assertThat(stateMachine.cancel(repository.find("j1").orElseThrow(), "Cancelled")).isTrue();
        assertThat(stateMachine.requeue(running, clock.instant(), "Queued")).isFalse();
    }

    @Test
    void concurrentCompletionRecordsExactlyOneTerminalTransition() throws Exception {
        Job running = stateMachine.claim(newJob("j1"), "a").orElseThrow();
        events.clear();
        ExecutorService executor = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<Boolean>> writers = List.of(
                    () -> { start.await(); return stateMachine.succeed(running, CalculateStub.result(), "ok"); },
                    () -> { start.await(); return stateMachine.cancel(running, "cancelled"); },
                    () -> { start.await(); return stateMachine.fail(running,
                            new JobError(ErrorKind.PROCESSING, "x"), "failed", false); });
            List<Future<Boolean>> results = new ArrayList<>();
            for (Callable<Boolean> writer : writers) {
                results.add(executor.submit(writer));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(events).hasSize(1);
    }
}
