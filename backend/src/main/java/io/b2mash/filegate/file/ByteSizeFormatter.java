package io.b2mash.filegate.file;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Binary-unit sizes for user-facing messages, e.g. {@code 1.5 MB}. */
public final class ByteSizeFormatter {

  private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB", "PB"};

  private ByteSizeFormatter() {}

  public static String format(long bytes) {
    if (bytes <= 0) {
      return "0 B";
    }
    int unit = 0;
    double value = bytes;
    while (value >= 1024 && unit < UNITS.length - 1) {
      value /= 1024;
      unit++;
    }
    String number =
        BigDecimal.valueOf(value)
            .setScale(2, RoundingMode.HALF_UP)
            .stripTrailingZeros()
            .toPlainString();
    return number + " " + UNITS[unit];
  }
}
