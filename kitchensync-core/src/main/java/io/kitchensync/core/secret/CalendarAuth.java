package io.kitchensync.core.secret;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One calendar's credentials in the sync tool's auth storage file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"CalendarID", "access_token", "refresh_token", "token_type", "expiry"})
public record CalendarAuth(
    @JsonProperty("CalendarID") String calendarId,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expiry") String expiry
) {
}
