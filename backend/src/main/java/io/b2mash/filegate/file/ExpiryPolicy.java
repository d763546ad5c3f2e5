package io.b2mash.filegate.file;

import io.b2mash.filegate.exception.InvalidRequestException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/** Expiry conventions shared by file records and API keys. */
public final class ExpiryPolicy {

  /** Stored in place of "never expires". */
  public static final Instant NEVER = Instant.parse("9999-12-31T23:59:59Z");

  private ExpiryPolicy() {}

  /** Expiry {@code hours} from now, or null when hours is absent or not positive. */
  public static Instant fromHours(Integer hours) {
    if (hours == null || hours <= 0) {
      return null;
    }
    return Instant.now().plus(Duration.ofHours(hours));
  }

  /**
   * Parses an explicitly supplied expiry. Null, blank and {@code never} map to {@link #NEVER}.
   *
   * @throws InvalidRequestException if the value is not an ISO-8601 instant or offset date-time
   */
  public static Instant parseExplicit(String value) {
    if (value == null || value.isBlank() || "never".equalsIgnoreCase(value.trim())) {
      return NEVER;
    }
    String trimmed = value.trim();
    try {
      return Instant.parse(trimmed);
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(trimmed).toInstant();
      } catch (DateTimeParseException nested) {
        throw new InvalidRequestException(
            "Invalid expiry", "expires_at must be an ISO-8601 date-time or 'never'");
      }
    }
  }
}
