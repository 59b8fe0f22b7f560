package io.kitchensync.core.job;

import java.time.ZonedDateTime;

public enum Cadence {
    FIFTEEN_MINUTES,
    HOURLY,
    DAILY;

    public ZonedDateTime addTo(ZonedDateTime base) {
        return switch (this) {
            case FIFTEEN_MINUTES -> base.plusMinutes(15);
            case HOURLY -> base.plusHours(1);
            case DAILY -> base.plusDays(1);
        };
    }
}
