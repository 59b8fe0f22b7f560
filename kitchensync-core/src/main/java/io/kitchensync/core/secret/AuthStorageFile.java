package io.kitchensync.core.secret;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

record AuthStorageFile(@JsonProperty("Calendars") List<CalendarAuth> calendars) {
}
