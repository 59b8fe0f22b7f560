package io.kitchensync.core.schedule;

import io.kitchensync.core.job.Cadence;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Computes the next due time of a job. Missed intervals are skipped: the result is the first
 * whole cadence step after {@code now}, counted from the previous due time.
 */
public final class NextRunCalculator {
    private final ZoneId zone;

    public NextRunCalculator() {
        this(ZoneOffset.UTC);
    }

    public NextRunCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public Instant next(Cadence cadence, Instant previousNextRunAt, Instant now) {
        Objects.requireNonNull(cadence, "cadence must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Instant base = previousNextRunAt == null ? now : previousNextRunAt;
        ZonedDateTime candidate = cadence.addTo(base.atZone(zone));
        while (!candidate.toInstant().isAfter(now)) {
            candidate = cadence.addTo(candidate);
        }
        return candidate.toInstant();
    }

    public ZoneId zone() {
        return zone;
    }
}
