package io.kitchensync.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import io.kitchensync.core.job.Cadence;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Random;
import org.junit.jupiter.api.Test;

class NextRunCalculatorTest {
    private final NextRunCalculator calculator = new NextRunCalculator();

    @Test
    void shouldStepOnceWhenJobIsExactlyDue() {
        Instant previous = Instant.parse("2026-03-01T10:00:00Z");

        Instant next = calculator.next(Cadence.HOURLY, previous, previous);

        assertThat(next).isEqualTo(Instant.parse("2026-03-01T11:00:00Z"));
    }

    @Test
    void shouldSkipMissedIntervalsInsteadOfBackfilling() {
        Instant previous = Instant.parse("2026-03-01T10:00:00Z");
        Instant now = Instant.parse("2026-03-04T10:30:00Z");

        Instant next = calculator.next(Cadence.DAILY, previous, now);

        assertThat(next).isEqualTo(Instant.parse("2026-03-05T10:00:00Z"));
    }

    @Test
    void shouldCountFromNowWhenJobWasNeverScheduled() {
        Instant now = Instant.parse("2026-03-01T10:07:00Z");

        Instant next = calculator.next(Cadence.FIFTEEN_MINUTES, null, now);

        assertThat(next).isEqualTo(Instant.parse("2026-03-01T10:22:00Z"));
    }

    @Test
    void shouldKeepWallClockTimeAcrossDaylightSavingInConfiguredZone() {
        NextRunCalculator berlin = new NextRunCalculator(ZoneId.of("Europe/Berlin"));
        Instant previous = Instant.parse("2026-03-28T07:00:00Z");

        Instant next = berlin.next(Cadence.DAILY, previous, previous);

        assertThat(next).isEqualTo(Instant.parse("2026-03-29T06:00:00Z"));
    }

    @Test
    void shouldAlwaysLandStrictlyAfterNowWithinOneCadenceStep() {
        Random random = new Random(42);
        Instant origin = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 500; i++) {
            Cadence cadence = Cadence.values()[random.nextInt(Cadence.values().length)];
            Instant previous = origin.plusSeconds(random.nextInt(30 * 24 * 3600));
            Instant now = previous.plusSeconds(random.nextInt(10 * 24 * 3600));

            Instant next = calculator.next(cadence, previous, now);

            assertThat(next).isAfter(now);
            assertThat(Duration.between(now, next)).isLessThanOrEqualTo(step(cadence));
            assertThat(Duration.between(previous, next).toSeconds() % step(cadence).toSeconds()).isZero();
        }
    }

    private static Duration step(Cadence cadence) {
        return switch (cadence) {
            case FIFTEEN_MINUTES -> Duration.ofMinutes(15);
            case HOURLY -> Duration.ofHours(1);
            case DAILY -> Duration.ofDays(1);
        };
    }
}
