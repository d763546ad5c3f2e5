package io.b2mash.filegate.mount;

import java.util.UUID;

/**
 * An active mount joined with the public flag of its storage config. {@code configPublic} is null
 * when the mount has no config or the config row is gone.
 */
public record MountCandidate(
    UUID mountId,
    String name,
    String storageType,
    UUID storageConfigId,
    String mountPath,
    Boolean configPublic) {

  public boolean isS3() {
    return StorageMount.STORAGE_TYPE_S3.equals(storageType);
  }

  public boolean isBackedByPublicConfig() {
    return Boolean.TRUE.equals(configPublic);
  }
}
