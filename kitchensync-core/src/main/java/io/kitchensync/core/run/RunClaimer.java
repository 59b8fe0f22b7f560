package io.kitchensync.core.run;

import io.kitchensync.core.job.JobRun;
import io.kitchensync.core.job.RunStatus;
import io.kitchensync.core.store.RunQueue;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Claims the oldest pending run with a conditional PENDING to RUNNING update. Losing the race to
 * another worker just means looking again.
 */
public final class RunClaimer {
    private static final Logger LOG = LoggerFactory.getLogger(RunClaimer.class);

    private final RunQueue runQueue;
    private final Clock clock;

    public RunClaimer(RunQueue runQueue, Clock clock) {
        this.runQueue = Objects.requireNonNull(runQueue, "runQueue must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Optional<JobRun> claimNext() throws IOException {
        return claimNext(new HashSet<>());
    }

    /**
     * Claims the next run, skipping ids in {@code skipped}. A candidate whose claim fails with an
     * error is added to {@code skipped} so the rest of the pass does not retry it.
     */
    public Optional<JobRun> claimNext(Set<String> skipped) throws IOException {
        while (true) {
            Optional<JobRun> candidate = runQueue.findOldestPending(skipped);
            if (candidate.isEmpty()) {
                return Optional.empty();
            }

            JobRun run = candidate.get();
            Instant startedAt = clock.instant();
            try {
                if (runQueue.tryClaim(run.id(), startedAt)) {
                    LOG.debug("Claimed run {} of job {}", run.id(), run.jobId());
                    return Optional.of(new JobRun(
                        run.id(),
                        run.jobId(),
                        RunStatus.RUNNING,
                        run.createdAt(),
                        startedAt,
                        null,
                        run.message(),
                        run.logLocation()
                    ));
                }
                LOG.debug("Run {} was taken by another worker, looking again", run.id());
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to claim run {}, skipping it for this pass", run.id(), e);
                skipped.add(run.id());
            }
        }
    }
}
