package io.kitchensync.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kitchensync.core.TestHarness;
import io.kitchensync.core.job.Cadence;
import io.kitchensync.core.job.JobDefinition;
import io.kitchensync.core.job.JobStatus;
import io.kitchensync.core.job.LinkedAccount;
import io.kitchensync.core.job.SyncEndpoint;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteJobStoreTest {
    private static final Instant NOW = TestHarness.T0;

    @TempDir
    Path tempDir;

    private TestHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new TestHarness(tempDir, tempDir.resolve("bin/calendarsync"), Duration.ZERO);
        harness.saveAccount("acct-1", "refresh-1");
        harness.saveEndpoint("cal-a", "acct-1", "a@example.com");
        harness.saveEndpoint("cal-b", "acct-1", "b@example.com");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void shouldAssignIdAndPersistOptions() throws Exception {
        JobDefinition created = harness.jobStore.create(new JobDefinition(
            null, "user-1", "Work to family", "cal-a", "cal-b", Cadence.DAILY, null,
            TestHarness.options("{\"titleTemplate\":{\"enabled\":true,\"values\":{\"prefix\":\"[W] \"}}}"),
            null, NOW, null
        ));

        JobDefinition loaded = harness.jobStore.find(created.id()).orElseThrow();
        assertThat(created.id()).isNotBlank();
        assertThat(loaded.status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(loaded.options().path("titleTemplate").path("values").path("prefix").asText()).isEqualTo("[W] ");
        assertThat(loaded.nextRunAt()).isEqualTo(NOW);
        assertThat(harness.jobStore.list()).extracting(JobDefinition::id).containsExactly(created.id());
    }

    @Test
    void shouldReportMissingAndPausedJobsWhenEnqueueing() throws Exception {
        JobDefinition job = harness.saveJob("job-1", "cal-a", "cal-b", Cadence.HOURLY, NOW);
        harness.jobStore.update(withStatus(job, JobStatus.PAUSED));

        assertThat(harness.jobStore.enqueueIfDue("job-1", NOW, j -> NOW)).isEqualTo(EnqueueOutcome.NOT_ACTIVE);
        assertThat(harness.jobStore.enqueueIfDue("missing", NOW, j -> NOW)).isEqualTo(EnqueueOutcome.MISSING);
        assertThat(harness.jobStore.findDueJobIds(NOW)).isEmpty();
    }

    @Test
    void shouldDeleteRunsWithTheirJob() throws Exception {
        harness.saveJob("job-1", "cal-a", "cal-b", Cadence.HOURLY, NOW);
        harness.jobStore.enqueueIfDue("job-1", NOW, j -> NOW.plus(Duration.ofHours(1)));

        assertThat(harness.jobStore.delete("job-1")).isTrue();

        assertThat(harness.runQueue.listByJob("job-1")).isEmpty();
        assertThat(harness.jobStore.delete("job-1")).isFalse();
    }

    @Test
    void shouldRejectJobPointingAtUnknownEndpoint() {
        assertThatThrownBy(() -> harness.saveJob("job-1", "cal-a", "cal-unknown", Cadence.HOURLY, NOW))
            .isInstanceOf(IOException.class);
    }

    @Test
    void shouldUpsertAccountsAndKeepBundleSeparately() throws Exception {
        LinkedAccount original = harness.accountStore.findAccount("acct-1").orElseThrow();
        harness.accountStore.saveAuthBundle("acct-1", "armored");
        harness.accountStore.saveAccount(new LinkedAccount(
            original.id(), original.userId(), original.providerAccountId(), "renamed@example.com",
            original.accessToken(), original.refreshToken(), original.expiresAt(), original.tokenType(), "armored"
        ));

        LinkedAccount loaded = harness.accountStore.findAccount("acct-1").orElseThrow();
        assertThat(loaded.email()).isEqualTo("renamed@example.com");
        assertThat(loaded.hasAuthBundle()).isTrue();
        assertThat(harness.accountStore.listEndpoints("acct-1"))
            .extracting(SyncEndpoint::externalId)
            .containsExactlyInAnyOrder("a@example.com", "b@example.com");
        assertThat(harness.accountStore.saveAuthBundle("missing", "x")).isFalse();
    }

    private static JobDefinition withStatus(JobDefinition job, JobStatus status) {
        return new JobDefinition(
            job.id(), job.ownerId(), job.name(), job.sourceEndpointId(), job.destinationEndpointId(),
            job.cadence(), status, job.options(), job.lastRunAt(), job.nextRunAt(), job.createdAt()
        );
    }
}
