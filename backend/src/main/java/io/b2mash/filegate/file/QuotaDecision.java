package io.b2mash.filegate.file;

/**
 * Outcome of a capacity check. {@code totalBytes} is null for configs without a ceiling, in which
 * case the decision is always an admit.
 */
public record QuotaDecision(
    boolean admitted, long usedBytes, long requestedBytes, Long totalBytes) {

  public static QuotaDecision unlimited(long requestedBytes) {
    return new QuotaDecision(true, 0, requestedBytes, null);
  }

  public long remainingBytes() {
    if (totalBytes == null) {
      return Long.MAX_VALUE;
    }
    return Math.max(0, totalBytes - usedBytes);
  }
}
