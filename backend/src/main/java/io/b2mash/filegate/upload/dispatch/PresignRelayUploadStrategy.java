package io.b2mash.filegate.upload.dispatch;

import io.b2mash.filegate.exception.UpstreamTransferException;
import io.b2mash.filegate.storage.EtagValues;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.ProviderKind;
import io.b2mash.filegate.storageconfig.StorageConfig;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Uploads by presigning a PUT and sending the bytes over plain HTTP. Backblaze B2's S3 layer
 * rejects the SDK's signed PutObject headers, so only {@code Content-Type} travels with the body.
 */
@Component
public class PresignRelayUploadStrategy implements UploadStrategy {

  private static final Logger log = LoggerFactory.getLogger(PresignRelayUploadStrategy.class);

  private final ObjectStorage objectStorage;
  private final RestClient restClient;

  @Autowired
  public PresignRelayUploadStrategy(ObjectStorage objectStorage) {
    this(objectStorage, RestClient.builder());
  }

  PresignRelayUploadStrategy(ObjectStorage objectStorage, RestClient.Builder restClientBuilder) {
    this.objectStorage = objectStorage;
    this.restClient = restClientBuilder.build();
  }

  @Override
  public Set<ProviderKind> supportedKinds() {
    return EnumSet.of(ProviderKind.BACKBLAZE_B2);
  }

  @Override
  public String put(StorageConfig config, String key, byte[] content, String contentType) {
    var presigned = objectStorage.presignPut(config, key, contentType);
    log.debug("Relaying {} bytes to {} via presigned PUT", content.length, key);
    try {
      return restClient
          .put()
          .uri(URI.create(presigned.url()))
          .contentType(MediaType.parseMediaType(contentType))
          .body(content)
          .exchange(
              (request, response) -> {
                if (!response.getStatusCode().is2xxSuccessful()) {
                  String body =
                      new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                  throw new UpstreamTransferException(
                      "Presigned upload to bucket "
                          + config.getBucketName()
                          + " failed with HTTP "
                          + response.getStatusCode().value()
                          + ": "
                          + body);
                }
                return EtagValues.strip(response.getHeaders().getETag());
              });
    } catch (RestClientException e) {
      throw new UpstreamTransferException(
          "Presigned upload to bucket " + config.getBucketName() + " failed: " + e.getMessage(),
          e);
    }
  }
}
