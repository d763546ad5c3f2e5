package io.b2mash.filegate.settings;

import io.b2mash.filegate.config.UploadProperties;
import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.file.ByteSizeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Per-upload size ceiling, read from the {@code max_upload_size} setting (MiB). */
@Service
@EnableConfigurationProperties(UploadProperties.class)
public class UploadLimits {

  private static final Logger log = LoggerFactory.getLogger(UploadLimits.class);

  static final String MAX_UPLOAD_SIZE_KEY = "max_upload_size";
  private static final long MIB = 1024L * 1024L;

  private final SystemSettingRepository systemSettingRepository;
  private final UploadProperties uploadProperties;

  public UploadLimits(
      SystemSettingRepository systemSettingRepository, UploadProperties uploadProperties) {
    this.systemSettingRepository = systemSettingRepository;
    this.uploadProperties = uploadProperties;
  }

  @Transactional(readOnly = true)
  public long maxUploadBytes() {
    long megabytes =
        systemSettingRepository
            .findById(MAX_UPLOAD_SIZE_KEY)
            .map(SystemSetting::getValue)
            .map(this::parseMegabytes)
            .orElse((long) uploadProperties.defaultMaxUploadSizeMb());
    try {
      return Math.multiplyExact(megabytes, MIB);
    } catch (ArithmeticException e) {
      log.warn("Ignoring oversized {} setting: {} MiB", MAX_UPLOAD_SIZE_KEY, megabytes);
      return uploadProperties.defaultMaxUploadSizeMb() * MIB;
    }
  }

  /**
   * @throws InvalidRequestException if {@code size} exceeds the configured ceiling
   */
  public void checkSize(long size) {
    long limit = maxUploadBytes();
    if (size > limit) {
      throw new InvalidRequestException(
          "File too large",
          "File size "
              + ByteSizeFormatter.format(size)
              + " exceeds the upload limit of "
              + ByteSizeFormatter.format(limit));
    }
  }

  private long parseMegabytes(String raw) {
    try {
      long parsed = Long.parseLong(raw.trim());
      if (parsed > 0) {
        return parsed;
      }
    } catch (NumberFormatException e) {
      log.warn("Ignoring unparsable {} setting: {}", MAX_UPLOAD_SIZE_KEY, raw);
    }
    return uploadProperties.defaultMaxUploadSizeMb();
  }
}
