package io.b2mash.filegate.storage;

import io.b2mash.filegate.exception.UpstreamTransferException;
import io.b2mash.filegate.storageconfig.StorageConfig;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/** AWS SDK v2 implementation of {@link ObjectStorage}. */
@Component
public class S3ObjectStorage implements ObjectStorage {

  private static final Logger log = LoggerFactory.getLogger(S3ObjectStorage.class);

  static final String NO_CACHE = "no-cache, no-store, must-revalidate";

  private final S3ClientFactory clientFactory;

  public S3ObjectStorage(S3ClientFactory clientFactory) {
    this.clientFactory = clientFactory;
  }

  @Override
  public PresignedUrl presignPut(StorageConfig config, String key, String contentType) {
    var expiry = signatureExpiry(config);
    var putRequest =
        PutObjectRequest.builder()
            .bucket(config.getBucketName())
            .key(key)
            .contentType(contentType)
            .build();

    var presignRequest =
        PutObjectPresignRequest.builder()
            .signatureDuration(expiry)
            .putObjectRequest(putRequest)
            .build();

    var presigned = clientFactory.presigner(config).presignPutObject(presignRequest);
    return new PresignedUrl(presigned.url().toExternalForm(), Instant.now().plus(expiry));
  }

  @Override
  public PresignedUrl presignGet(
      StorageConfig config,
      String key,
      String filenameOverride,
      boolean asAttachment,
      String contentType,
      boolean enableCache) {
    var expiry = signatureExpiry(config);
    var getRequest = GetObjectRequest.builder().bucket(config.getBucketName()).key(key);

    if (filenameOverride != null && !filenameOverride.isBlank()) {
      var disposition =
          asAttachment ? ContentDisposition.attachment() : ContentDisposition.inline();
      getRequest.responseContentDisposition(
          disposition.filename(filenameOverride, StandardCharsets.UTF_8).build().toString());
    } else if (asAttachment) {
      getRequest.responseContentDisposition("attachment");
    }
    if (contentType != null && !contentType.isBlank()) {
      getRequest.responseContentType(contentType);
    }
    if (!enableCache) {
      getRequest.responseCacheControl(NO_CACHE);
    }

    var presignRequest =
        GetObjectPresignRequest.builder()
            .signatureDuration(expiry)
            .getObjectRequest(getRequest.build())
            .build();

    var presigned = clientFactory.presigner(config).presignGetObject(presignRequest);
    return new PresignedUrl(presigned.url().toExternalForm(), Instant.now().plus(expiry));
  }

  @Override
  public String put(StorageConfig config, String key, byte[] content, String contentType) {
    var putRequest =
        PutObjectRequest.builder()
            .bucket(config.getBucketName())
            .key(key)
            .contentType(contentType)
            .contentLength((long) content.length)
            .build();
    try {
      var response =
          clientFactory.client(config).putObject(putRequest, RequestBody.fromBytes(content));
      return EtagValues.strip(response.eTag());
    } catch (SdkException e) {
      throw new UpstreamTransferException(
          "Upload to bucket " + config.getBucketName() + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean deleteObject(StorageConfig config, String key) {
    try {
      var deleteRequest =
          DeleteObjectRequest.builder().bucket(config.getBucketName()).key(key).build();
      clientFactory.client(config).deleteObject(deleteRequest);
      return true;
    } catch (Exception e) {
      log.warn(
          "Best-effort S3 deletion failed for config={}, key={}: {}",
          config.getId(),
          key,
          e.getMessage());
      return false;
    }
  }

  @Override
  public String buildPublicUrl(StorageConfig config, String key) {
    String encodedKey = UriUtils.encodePath(key, StandardCharsets.UTF_8);

    if (config.getCustomHost() != null && !config.getCustomHost().isBlank()) {
      return withScheme(trimTrailingSlash(config.getCustomHost().trim())) + "/" + encodedKey;
    }

    if (S3ClientFactory.hasEndpoint(config)) {
      var endpoint = URI.create(trimTrailingSlash(config.getEndpointUrl().trim()));
      if (config.isPathStyle()) {
        return endpoint + "/" + config.getBucketName() + "/" + encodedKey;
      }
      return endpoint.getScheme()
          + "://"
          + config.getBucketName()
          + "."
          + endpoint.getAuthority()
          + "/"
          + encodedKey;
    }

    return "https://"
        + config.getBucketName()
        + ".s3."
        + S3ClientFactory.regionOf(config)
        + ".amazonaws.com/"
        + encodedKey;
  }

  private static Duration signatureExpiry(StorageConfig config) {
    int seconds = config.getSignatureExpiresInSeconds();
    return Duration.ofSeconds(seconds > 0 ? seconds : 3600);
  }

  private static String withScheme(String host) {
    return host.startsWith("http://") || host.startsWith("https://") ? host : "https://" + host;
  }

  private static String trimTrailingSlash(String value) {
    String result = value;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
