package io.b2mash.filegate.storage;

import io.b2mash.filegate.storageconfig.StorageConfig;

/**
 * Port for S3-compatible object stores. Each call targets the bucket of the given config; all SDK
 * types stay behind this interface.
 */
public interface ObjectStorage {

  /** Presigned PUT bound to {@code contentType}, valid for the config's signature expiry. */
  PresignedUrl presignPut(StorageConfig config, String key, String contentType);

  /**
   * Presigned GET. {@code filenameOverride} and {@code asAttachment} shape the response
   * Content-Disposition; {@code enableCache=false} asks intermediaries not to cache.
   */
  PresignedUrl presignGet(
      StorageConfig config,
      String key,
      String filenameOverride,
      boolean asAttachment,
      String contentType,
      boolean enableCache);

  /**
   * Uploads bytes and returns the ETag without quotes, or null when the store sent none.
   *
   * @throws io.b2mash.filegate.exception.UpstreamTransferException if the store rejects the write
   */
  String put(StorageConfig config, String key, byte[] content, String contentType);

  /** Best-effort delete. Returns false and logs when the store refused. */
  boolean deleteObject(StorageConfig config, String key);

  /** Absolute, unsigned URL of the object, preferring the config's custom host. */
  String buildPublicUrl(StorageConfig config, String key);
}
