package io.b2mash.filegate.upload;

import io.b2mash.filegate.file.ShortIdGenerator;
import io.b2mash.filegate.storageconfig.StorageConfig;
import org.springframework.stereotype.Component;

/**
 * Composes bucket keys as {@code <mount prefix><default folder>/<custom dir>/<name>}. The name is
 * {@code <shortId>-<safe base><ext>} unless the caller asked to keep the original filename.
 */
@Component
public class StorageKeyBuilder {

  static final int SHORT_ID_LENGTH = 6;
  static final int SAFE_NAME_MAX_LENGTH = 50;

  private final ShortIdGenerator shortIdGenerator;

  public StorageKeyBuilder(ShortIdGenerator shortIdGenerator) {
    this.shortIdGenerator = shortIdGenerator;
  }

  public String build(
      String mountPrefix,
      StorageConfig config,
      String customPath,
      String filename,
      boolean keepOriginalName) {
    String shortId = keepOriginalName ? null : shortIdGenerator.generate(SHORT_ID_LENGTH);
    return compose(mountPrefix, config.getDefaultFolder(), customPath, filename, shortId);
  }

  /** A null {@code shortId} leaves the name unprefixed. */
  static String compose(
      String mountPrefix,
      String defaultFolder,
      String customPath,
      String filename,
      String shortId) {
    String name = safeName(baseName(filename)) + extension(filename);
    String fileComponent = shortId == null ? name : shortId + "-" + name;
    String key =
        nullToEmpty(mountPrefix)
            + asDirectory(defaultFolder)
            + asDirectory(customPath)
            + fileComponent;
    while (key.startsWith("/")) {
      key = key.substring(1);
    }
    return key;
  }

  static String safeName(String baseName) {
    String safe = baseName.replaceAll("[^a-zA-Z0-9._-]", "_");
    return safe.length() > SAFE_NAME_MAX_LENGTH ? safe.substring(0, SAFE_NAME_MAX_LENGTH) : safe;
  }

  static String baseName(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  static String extension(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(dot) : "";
  }

  private static String asDirectory(String path) {
    if (path == null || path.isBlank()) {
      return "";
    }
    String trimmed = path.trim();
    return trimmed.endsWith("/") ? trimmed : trimmed + "/";
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
