package io.kitchensync.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import io.kitchensync.core.TestHarness;
import io.kitchensync.core.job.Cadence;
import io.kitchensync.core.job.JobDefinition;
import io.kitchensync.core.job.JobRun;
import io.kitchensync.core.job.JobStatus;
import io.kitchensync.core.job.RunStatus;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CadenceSchedulerTest {
    private static final Instant NOW = TestHarness.T0;

    @TempDir
    Path tempDir;

    private TestHarness harness;
    private CadenceScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        harness = new TestHarness(tempDir, tempDir.resolve("bin/calendarsync"), Duration.ZERO);
        harness.saveAccount("acct-1", "refresh-1");
        harness.saveEndpoint("cal-src", "acct-1", "source@example.com");
        harness.saveEndpoint("cal-dst", "acct-1", "dest@example.com");
        scheduler = harness.scheduler(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void shouldEnqueueDueJobAndAdvanceNextRun() throws Exception {
        harness.saveJob("job-1", "cal-src", "cal-dst", Cadence.HOURLY, NOW.minus(Duration.ofMinutes(5)));

        EnqueueSummary summary = scheduler.enqueueDue();

        assertThat(summary.enqueued()).isEqualTo(1);
        List<JobRun> runs = harness.runQueue.listByJob("job-1");
        assertThat(runs).hasSize(1);
        assertThat(runs.get(0).status()).isEqualTo(RunStatus.PENDING);
        assertThat(runs.get(0).createdAt()).isEqualTo(NOW);
        assertThat(harness.jobStore.find("job-1").orElseThrow().nextRunAt())
            .isEqualTo(Instant.parse("2026-03-01T10:55:00Z"));
    }

    @Test
    void shouldTreatJobWithoutNextRunAsDue() throws Exception {
        harness.saveJob("job-1", "cal-src", "cal-dst", Cadence.DAILY, null);

        EnqueueSummary summary = scheduler.enqueueDue();

        assertThat(summary.enqueued()).isEqualTo(1);
        assertThat(harness.jobStore.find("job-1").orElseThrow().nextRunAt()).isEqualTo(NOW.plus(Duration.ofDays(1)));
    }

    @Test
    void shouldScheduleHourlyJobWithoutNextRunOneHourAhead() throws Exception {
        harness.saveJob("job-1", "cal-src", "cal-dst", Cadence.HOURLY, null);

        EnqueueSummary summary = scheduler.enqueueDue();

        assertThat(summary).isEqualTo(new EnqueueSummary(1, 0, 0));
        assertThat(harness.runQueue.listByJob("job-1")).singleElement()
            .extracting(JobRun::status).isEqualTo(RunStatus.PENDING);
        assertThat(harness.jobStore.find("job-1").orElseThrow().nextRunAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void shouldEnqueueOnceAndSkipToNextSlotWhenDailyJobIsDaysOverdue() throws Exception {
        harness.saveJob("job-1", "cal-src", "cal-dst", Cadence.DAILY, Instant.parse("2026-02-26T08:00:00Z"));

        EnqueueSummary summary = scheduler.enqueueDue();

        assertThat(summary.enqueued()).isEqualTo(1);
        assertThat(harness.runQueue.listByJob("job-1")).singleElement()
            .extracting(JobRun::status).isEqualTo(RunStatus.PENDING);
        assertThat(harness.jobStore.find("job-1").orElseThrow().nextRunAt())
            .isEqualTo(Instant.parse("2026-03-02T08:00:00Z"));
    }

    @Test
    void shouldIgnoreJobsThatAreNotDueOrPaused() throws Exception {
        harness.saveJob("later", "cal-src", "cal-dst", Cadence.HOURLY, NOW.plus(Duration.ofMinutes(1)));
        JobDefinition paused = harness.saveJob("paused", "cal-src", "cal-dst", Cadence.HOURLY, NOW);
        harness.jobStore.update(new JobDefinition(
            paused.id(), paused.ownerId(), paused.name(), paused.sourceEndpointId(), paused.destinationEndpointId(),
            paused.cadence(), JobStatus.PAUSED, paused.options(), null, paused.nextRunAt(), paused.createdAt()
        ));

        EnqueueSummary summary = scheduler.enqueueDue();

        assertThat(summary.enqueued()).isZero();
        assertThat(harness.runQueue.listByJob("later")).isEmpty();
        assertThat(harness.runQueue.listByJob("paused")).isEmpty();
    }

    @Test
    void shouldOnlyAdvanceScheduleWhileRunIsOutstanding() throws Exception {
        harness.saveJob("job-1", "cal-src", "cal-dst", Cadence.FIFTEEN_MINUTES, NOW);
        scheduler.enqueueDue();
        Instant later = NOW.plus(Duration.ofMinutes(20));

        EnqueueSummary summary = harness.scheduler(Clock.fixed(later, ZoneOffset.UTC)).enqueueDue();

        assertThat(summary.enqueued()).isZero();
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(harness.runQueue.listByJob("job-1")).hasSize(1);
        assertThat(harness.jobStore.find("job-1").orElseThrow().nextRunAt())
            .isEqualTo(NOW.plus(Duration.ofMinutes(30)));
    }

    @Test
    void shouldEnqueueAgainOnceOutstandingRunFinished() throws Exception {
        harness.saveJob("job-1", "cal-src", "cal-dst", Cadence.FIFTEEN_MINUTES, NOW);
        scheduler.enqueueDue();
        JobRun first = harness.runQueue.listByJob("job-1").get(0);
        harness.runQueue.tryClaim(first.id(), NOW);
        harness.runQueue.complete(first.id(), RunStatus.SUCCESS, NOW.plusSeconds(5), "ok", null);

        EnqueueSummary summary = harness.scheduler(Clock.fixed(NOW.plus(Duration.ofMinutes(16)), ZoneOffset.UTC))
            .enqueueDue();

        assertThat(summary.enqueued()).isEqualTo(1);
        assertThat(harness.runQueue.listByJob("job-1")).hasSize(2);
    }

    @Test
    void shouldCreateSingleRunWhenTicksRaceEachOther() throws Exception {
        harness.saveJob("job-1", "cal-src", "cal-dst", Cadence.HOURLY, NOW);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<EnqueueSummary>> ticks = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                ticks.add(() -> scheduler.enqueueDue());
            }
            int enqueued = 0;
            for (Future<EnqueueSummary> result : pool.invokeAll(ticks)) {
                enqueued += result.get().enqueued();
            }

            assertThat(enqueued).isEqualTo(1);
            assertThat(harness.runQueue.listByJob("job-1")).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
