package io.b2mash.filegate.storage;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.filegate.config.CacheProperties;
import io.b2mash.filegate.storageconfig.ProviderKind;
import io.b2mash.filegate.storageconfig.StorageConfig;
import io.b2mash.filegate.testutil.TestEntities;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Presigning is computed locally by the SDK, so these run without an object store. */
class S3ObjectStorageTest {

  private CredentialCipher cipher;
  private S3ClientFactory clientFactory;
  private S3ObjectStorage storage;

  @BeforeEach
  void setUp() {
    cipher =
        new CredentialCipher(
            Base64.getEncoder().encodeToString("0123456789abcdef0123456789abcdef".getBytes()));
    clientFactory =
        new S3ClientFactory(cipher, new CacheProperties(Duration.ofMinutes(1), 10, null, 0));
    storage = new S3ObjectStorage(clientFactory);
  }

  @AfterEach
  void tearDown() {
    clientFactory.closeAll();
  }

  private StorageConfig config(String endpoint, String region) {
    var config =
        new StorageConfig(
            "test",
            ProviderKind.OTHER,
            endpoint,
            region,
            "media",
            "AKIATEST",
            cipher.encrypt("secret"));
    return TestEntities.withId(config, UUID.randomUUID());
  }

  @Test
  void buildPublicUrl_defaultsToAwsVirtualHost() {
    var config = config(null, "eu-west-1");

    assertThat(storage.buildPublicUrl(config, "docs/a b.txt"))
        .isEqualTo("https://media.s3.eu-west-1.amazonaws.com/docs/a%20b.txt");
  }

  @Test
  void buildPublicUrl_fallsBackToUsEast1WithoutRegion() {
    var config = config(null, null);

    assertThat(storage.buildPublicUrl(config, "a.txt"))
        .isEqualTo("https://media.s3.us-east-1.amazonaws.com/a.txt");
  }

  @Test
  void buildPublicUrl_pathStyleEndpointPutsBucketInPath() {
    var config = config("http://localhost:4566/", "us-east-1");

    assertThat(storage.buildPublicUrl(config, "a.txt"))
        .isEqualTo("http://localhost:4566/media/a.txt");
  }

  @Test
  void buildPublicUrl_virtualHostEndpointPutsBucketInHost() {
    var config = config("https://s3.example.com", "auto");
    config.configureLayout(null, null, false);

    assertThat(storage.buildPublicUrl(config, "a.txt"))
        .isEqualTo("https://media.s3.example.com/a.txt");
  }

  @Test
  void buildPublicUrl_customHostWins() {
    var config = config("https://s3.example.com", "auto");
    config.configureLayout(null, "cdn.example.com/", true);

    assertThat(storage.buildPublicUrl(config, "x/y.png"))
        .isEqualTo("https://cdn.example.com/x/y.png");
  }

  @Test
  void presignPut_signsAgainstConfiguredEndpoint() {
    var config = config("http://localhost:4566", "us-east-1");

    var presigned = storage.presignPut(config, "uploads/a.txt", "text/plain");

    assertThat(presigned.url())
        .startsWith("http://localhost:4566/media/uploads/a.txt")
        .contains("X-Amz-Signature=");
    assertThat(presigned.expiresAt()).isAfter(Instant.now().plusSeconds(3500));
  }

  @Test
  void presignGet_uncachedAttachmentCarriesResponseOverrides() {
    var config = config("http://localhost:4566", "us-east-1");

    var presigned =
        storage.presignGet(config, "uploads/a.txt", "a.txt", true, "text/plain", false);

    assertThat(presigned.url())
        .contains("response-content-disposition=attachment")
        .contains("response-cache-control=")
        .contains("response-content-type=text%2Fplain");
  }

  @Test
  void presignGet_cachedInlineOmitsCacheOverride() {
    var config = config("http://localhost:4566", "us-east-1");

    var presigned = storage.presignGet(config, "uploads/a.txt", "a.txt", false, null, true);

    assertThat(presigned.url())
        .contains("response-content-disposition=inline")
        .doesNotContain("response-cache-control");
  }
}
