package io.b2mash.filegate.file;

import java.time.Instant;
import java.util.UUID;

/** Values for a record about to be inserted. {@code password} is plaintext and may be null. */
public record NewFileRecord(
    String slug,
    String filename,
    String storagePath,
    String s3Url,
    UUID storageConfigId,
    String mimetype,
    String createdBy,
    String remark,
    long size,
    String etag,
    String password,
    Instant expiresAt,
    Integer maxViews,
    boolean useProxy) {

  /** Presign-time placeholder: no size, no ETag, default sharing settings. */
  public static NewFileRecord placeholder(
      String slug,
      String filename,
      String storagePath,
      String s3Url,
      UUID storageConfigId,
      String mimetype,
      String createdBy) {
    return new NewFileRecord(
        slug,
        filename,
        storagePath,
        s3Url,
        storageConfigId,
        mimetype,
        createdBy,
        null,
        0,
        null,
        null,
        null,
        null,
        true);
  }
}
