package io.b2mash.filegate.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.b2mash.filegate.config.CacheProperties;
import io.b2mash.filegate.storageconfig.StorageConfig;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.checksums.RequestChecksumCalculation;
import software.amazon.awssdk.core.checksums.ResponseChecksumValidation;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Builds and caches one S3 client and presigner per storage config. Entries are keyed on the
 * config's id and update timestamp so an edited config gets a fresh client.
 */
@Component
@EnableConfigurationProperties(CacheProperties.class)
public class S3ClientFactory {

  private static final Logger log = LoggerFactory.getLogger(S3ClientFactory.class);

  static final String DEFAULT_REGION = "us-east-1";

  private final CredentialCipher credentialCipher;
  private final Cache<ClientKey, S3Clients> clients;

  public S3ClientFactory(CredentialCipher credentialCipher, CacheProperties cacheProperties) {
    this.credentialCipher = credentialCipher;
    this.clients =
        Caffeine.newBuilder()
            .expireAfterAccess(cacheProperties.clientTtl())
            .maximumSize(cacheProperties.clientMaxSize())
            .removalListener(
                (ClientKey key, S3Clients value, RemovalCause cause) -> {
                  if (value != null) {
                    value.close();
                  }
                })
            .build();
  }

  public S3Client client(StorageConfig config) {
    return clientsFor(config).client();
  }

  public S3Presigner presigner(StorageConfig config) {
    return clientsFor(config).presigner();
  }

  @PreDestroy
  void closeAll() {
    clients.invalidateAll();
    clients.cleanUp();
  }

  private S3Clients clientsFor(StorageConfig config) {
    var key = new ClientKey(config.getId(), config.getUpdatedAt());
    return clients.get(key, k -> build(config));
  }

  private S3Clients build(StorageConfig config) {
    var credentials =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(
                config.getAccessKeyId(),
                credentialCipher.decrypt(config.getEncryptedSecretAccessKey())));
    var region = Region.of(regionOf(config));
    var serviceConfiguration =
        S3Configuration.builder().pathStyleAccessEnabled(config.isPathStyle()).build();

    var clientBuilder =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentials)
            .serviceConfiguration(serviceConfiguration)
            // Non-AWS stores reject the SDK's default flexible checksums
            .requestChecksumCalculation(RequestChecksumCalculation.WHEN_REQUIRED)
            .responseChecksumValidation(ResponseChecksumValidation.WHEN_REQUIRED);
    var presignerBuilder =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentials)
            .serviceConfiguration(serviceConfiguration);

    if (hasEndpoint(config)) {
      var endpoint = URI.create(config.getEndpointUrl().trim());
      clientBuilder.endpointOverride(endpoint);
      presignerBuilder.endpointOverride(endpoint);
    }

    log.info(
        "Built S3 client for storage config {} (provider={}, bucket={})",
        config.getId(),
        config.getProviderKind(),
        config.getBucketName());
    return new S3Clients(clientBuilder.build(), presignerBuilder.build());
  }

  static boolean hasEndpoint(StorageConfig config) {
    return config.getEndpointUrl() != null && !config.getEndpointUrl().isBlank();
  }

  static String regionOf(StorageConfig config) {
    return config.getRegion() == null || config.getRegion().isBlank()
        ? DEFAULT_REGION
        : config.getRegion().trim();
  }

  private record ClientKey(UUID configId, Instant updatedAt) {}

  private record S3Clients(S3Client client, S3Presigner presigner) {
    void close() {
      client.close();
      presigner.close();
    }
  }
}
