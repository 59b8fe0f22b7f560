package io.kitchensync.core.schedule;

import io.kitchensync.core.store.EnqueueOutcome;
import io.kitchensync.core.store.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CadenceScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(CadenceScheduler.class);

    private final JobStore jobStore;
    private final NextRunCalculator calculator;
    private final Clock clock;

    public CadenceScheduler(JobStore jobStore, NextRunCalculator calculator, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public EnqueueSummary enqueueDue() throws IOException {
        return enqueueDue(clock.instant());
    }

    public EnqueueSummary enqueueDue(Instant now) throws IOException {
        List<String> dueJobIds = jobStore.findDueJobIds(now);
        int enqueued = 0;
        int skipped = 0;
        int failed = 0;

        for (String jobId : dueJobIds) {
            try {
                EnqueueOutcome outcome = jobStore.enqueueIfDue(
                    jobId,
                    now,
                    job -> calculator.next(job.cadence(), job.nextRunAt(), now)
                );
                if (outcome == EnqueueOutcome.ENQUEUED) {
                    enqueued++;
                } else {
                    skipped++;
                    if (outcome == EnqueueOutcome.OUTSTANDING) {
                        LOG.debug("Sync job {} still has an outstanding run, advanced its schedule only", jobId);
                    }
                }
            } catch (IOException | RuntimeException e) {
                failed++;
                LOG.error("Failed to enqueue sync job {}", jobId, e);
            }
        }

        if (enqueued > 0) {
            LOG.info("Enqueued {} sync job{} for execution", enqueued, enqueued == 1 ? "" : "s");
        } else {
            LOG.debug("No due sync jobs found");
        }
        return new EnqueueSummary(enqueued, skipped, failed);
    }
}
