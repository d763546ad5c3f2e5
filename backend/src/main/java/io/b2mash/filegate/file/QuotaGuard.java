package io.b2mash.filegate.file;

import io.b2mash.filegate.exception.StorageCapacityExceededException;
import io.b2mash.filegate.storageconfig.StorageConfig;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admits or rejects writes against a config's capacity ceiling. Usage is summed live from the file
 * records on every call, so concurrent uploads can jointly overshoot the ceiling.
 */
@Component
public class QuotaGuard {

  private static final Logger log = LoggerFactory.getLogger(QuotaGuard.class);

  private final FileRecordRepository fileRecordRepository;

  public QuotaGuard(FileRecordRepository fileRecordRepository) {
    this.fileRecordRepository = fileRecordRepository;
  }

  public QuotaDecision check(StorageConfig config, long incomingSize) {
    return check(config, incomingSize, null);
  }

  @Transactional(readOnly = true)
  public QuotaDecision check(StorageConfig config, long incomingSize, UUID excludedFileId) {
    long requested = Math.max(0, incomingSize);
    if (!config.hasCapacityLimit()) {
      return QuotaDecision.unlimited(requested);
    }
    long used =
        excludedFileId == null
            ? fileRecordRepository.sumSizeByStorageConfigId(config.getId())
            : fileRecordRepository.sumSizeByStorageConfigIdExcluding(
                config.getId(), excludedFileId);
    long total = config.getTotalStorageBytes();
    // used + requested can overflow for client-reported sizes
    boolean admitted = used <= total && requested <= total - used;
    return new QuotaDecision(admitted, used, requested, total);
  }

  /**
   * @throws StorageCapacityExceededException when the write would push usage past the ceiling
   */
  public QuotaDecision admit(StorageConfig config, long incomingSize, UUID excludedFileId) {
    var decision = check(config, incomingSize, excludedFileId);
    if (!decision.admitted()) {
      log.info(
          "Quota rejected: config={}, used={}, requested={}, total={}",
          config.getId(),
          decision.usedBytes(),
          decision.requestedBytes(),
          decision.totalBytes());
      throw rejection(decision, null);
    }
    return decision;
  }

  public QuotaDecision admit(StorageConfig config, long incomingSize) {
    return admit(config, incomingSize, null);
  }

  /** Builds the capacity error; {@code suffix} is appended to the detail when not null. */
  public static StorageCapacityExceededException rejection(QuotaDecision decision, String suffix) {
    String detail =
        "Insufficient storage space. Remaining: "
            + ByteSizeFormatter.format(decision.remainingBytes())
            + ", requested: "
            + ByteSizeFormatter.format(decision.requestedBytes())
            + ", total: "
            + ByteSizeFormatter.format(decision.totalBytes());
    if (suffix != null) {
      detail = detail + ". " + suffix;
    }
    return new StorageCapacityExceededException(
        decision.remainingBytes(), decision.requestedBytes(), decision.totalBytes(), detail);
  }
}
