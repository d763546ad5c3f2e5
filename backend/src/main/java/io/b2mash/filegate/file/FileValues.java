package io.b2mash.filegate.file;

/** Coercions for loosely typed file fields arriving from query strings and JSON bodies. */
public final class FileValues {

  private FileValues() {}

  /** Zero, negative and absent all mean unlimited, stored as null. */
  public static Integer maxViews(Integer requested) {
    return requested == null || requested <= 0 ? null : requested;
  }

  public static long nonNegative(Long value) {
    return value == null ? 0 : Math.max(0, value);
  }

  /** Interprets {@code true/false}, {@code 1/0} and their string forms. */
  public static boolean flag(Object value, boolean defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof Number number) {
      return number.intValue() != 0;
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return defaultValue;
    }
    return !("0".equals(text) || "false".equalsIgnoreCase(text));
  }
}
