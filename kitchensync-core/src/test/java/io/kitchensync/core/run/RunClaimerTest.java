package io.kitchensync.core.run;

import static org.assertj.core.api.Assertions.assertThat;

import io.kitchensync.core.job.JobRun;
import io.kitchensync.core.job.RunStatus;
import io.kitchensync.core.store.RunQueue;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RunClaimerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void shouldReturnClaimedRunAsRunning() throws Exception {
        InMemoryQueue queue = new InMemoryQueue();
        queue.add("run-1");

        Optional<JobRun> claimed = new RunClaimer(queue, clock).claimNext();

        assertThat(claimed).isPresent();
        assertThat(claimed.get().status()).isEqualTo(RunStatus.RUNNING);
        assertThat(claimed.get().startedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldMoveOnWhenAnotherWorkerWinsTheClaim() throws Exception {
        InMemoryQueue queue = new InMemoryQueue();
        queue.add("run-1");
        queue.add("run-2");
        queue.stolen.add("run-1");

        Optional<JobRun> claimed = new RunClaimer(queue, clock).claimNext();

        assertThat(claimed).map(JobRun::id).contains("run-2");
        assertThat(queue.claimAttempts).containsExactly("run-1", "run-2");
    }

    @Test
    void shouldSkipRunWhoseClaimFailsForRestOfPass() throws Exception {
        InMemoryQueue queue = new InMemoryQueue();
        queue.add("run-1");
        queue.add("run-2");
        queue.broken.add("run-1");
        Set<String> skipped = new HashSet<>();

        Optional<JobRun> claimed = new RunClaimer(queue, clock).claimNext(skipped);

        assertThat(claimed).map(JobRun::id).contains("run-2");
        assertThat(skipped).containsExactly("run-1");
        assertThat(new RunClaimer(queue, clock).claimNext(skipped)).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenNothingIsPending() throws Exception {
        assertThat(new RunClaimer(new InMemoryQueue(), clock).claimNext()).isEmpty();
    }

    private static final class InMemoryQueue implements RunQueue {
        private final Map<String, RunStatus> runs = new LinkedHashMap<>();
        private final Set<String> stolen = new HashSet<>();
        private final Set<String> broken = new HashSet<>();
        private final List<String> claimAttempts = new ArrayList<>();

        void add(String runId) {
            runs.put(runId, RunStatus.PENDING);
        }

        @Override
        public Optional<JobRun> findOldestPending(Set<String> excludedRunIds) {
            return runs.entrySet().stream()
                .filter(entry -> entry.getValue() == RunStatus.PENDING)
                .filter(entry -> !excludedRunIds.contains(entry.getKey()))
                .findFirst()
                .map(entry -> new JobRun(entry.getKey(), "job-1", RunStatus.PENDING, NOW, null, null, null, null));
        }

        @Override
        public boolean tryClaim(String runId, Instant startedAt) throws IOException {
            claimAttempts.add(runId);
            if (broken.contains(runId)) {
                throw new IOException("database is locked");
            }
            if (stolen.contains(runId)) {
                runs.put(runId, RunStatus.RUNNING);
                return false;
            }
            runs.put(runId, RunStatus.RUNNING);
            return true;
        }

        @Override
        public boolean complete(String runId, RunStatus status, Instant finishedAt, String message, String logLocation) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean cancelPending(String runId, Instant finishedAt, String message) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Optional<JobRun> find(String runId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<JobRun> listByJob(String jobId) {
            throw new UnsupportedOperationException();
        }
    }
}
