package io.b2mash.filegate.file;

import io.b2mash.filegate.exception.InvalidRequestException;
import java.time.Instant;
import java.util.Map;

/**
 * Sparse change set for a file record. A null {@link Change} means the field was not supplied; a
 * {@link Change} holding null means the field was explicitly cleared.
 */
public record FileRecordUpdate(
    Change<String> remark,
    Change<String> slug,
    Change<String> filename,
    Change<String> password,
    Change<Instant> expiresAt,
    Change<Integer> maxViews,
    Change<Boolean> useProxy) {

  public record Change<T>(T value) {}

  /** Reads snake_case request fields, leaving absent keys unset. */
  public static FileRecordUpdate fromFields(Map<String, Object> fields) {
    return new FileRecordUpdate(
        stringChange(fields, "remark"),
        stringChange(fields, "slug"),
        stringChange(fields, "filename"),
        stringChange(fields, "password"),
        fields.containsKey("expires_at")
            ? new Change<>(ExpiryPolicy.parseExplicit(asString(fields.get("expires_at"))))
            : null,
        fields.containsKey("max_views")
            ? new Change<>(FileValues.maxViews(asInteger(fields.get("max_views"), "max_views")))
            : null,
        fields.containsKey("use_proxy")
            ? new Change<>(FileValues.flag(fields.get("use_proxy"), true))
            : null);
  }

  public boolean isEmpty() {
    return remark == null
        && slug == null
        && filename == null
        && password == null
        && expiresAt == null
        && maxViews == null
        && useProxy == null;
  }

  private static Change<String> stringChange(Map<String, Object> fields, String key) {
    return fields.containsKey(key) ? new Change<>(asString(fields.get(key))) : null;
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static Integer asInteger(Object value, String field) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.valueOf(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new InvalidRequestException("Invalid field", field + " must be a whole number");
    }
  }
}
