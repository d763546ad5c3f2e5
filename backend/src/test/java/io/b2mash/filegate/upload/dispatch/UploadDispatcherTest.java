package io.b2mash.filegate.upload.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.ProviderKind;
import io.b2mash.filegate.storageconfig.StorageConfig;
import io.b2mash.filegate.testutil.TestEntities;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UploadDispatcherTest {

  @Mock private ObjectStorage objectStorage;

  private SdkPutUploadStrategy sdkPut;
  private PresignRelayUploadStrategy presignRelay;

  @BeforeEach
  void setUp() {
    sdkPut = new SdkPutUploadStrategy(objectStorage);
    presignRelay = new PresignRelayUploadStrategy(objectStorage);
  }

  @Test
  void strategyFor_routesBackblazeToPresignRelay() {
    var dispatcher = new UploadDispatcher(List.of(sdkPut, presignRelay), sdkPut);

    assertThat(dispatcher.strategyFor(ProviderKind.BACKBLAZE_B2)).isSameAs(presignRelay);
    assertThat(dispatcher.strategyFor(ProviderKind.CLOUDFLARE_R2)).isSameAs(sdkPut);
    assertThat(dispatcher.strategyFor(ProviderKind.ALIYUN_OSS)).isSameAs(sdkPut);
  }

  @Test
  void strategyFor_unclaimedOrMissingKindUsesFallback() {
    var dispatcher = new UploadDispatcher(List.of(presignRelay), sdkPut);

    assertThat(dispatcher.strategyFor(ProviderKind.AWS_S3)).isSameAs(sdkPut);
    assertThat(dispatcher.strategyFor(null)).isSameAs(sdkPut);
  }

  @Test
  void constructor_rejectsTwoStrategiesForOneKind() {
    UploadStrategy rogue =
        new UploadStrategy() {
          @Override
          public Set<ProviderKind> supportedKinds() {
            return EnumSet.of(ProviderKind.BACKBLAZE_B2);
          }

          @Override
          public String put(StorageConfig config, String key, byte[] content, String type) {
            return null;
          }
        };

    assertThatThrownBy(() -> new UploadDispatcher(List.of(presignRelay, rogue), sdkPut))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("BACKBLAZE_B2");
  }

  @Test
  void put_sdkStrategyDelegatesToObjectStorage() {
    var dispatcher = new UploadDispatcher(List.of(sdkPut, presignRelay), sdkPut);
    StorageConfig config = TestEntities.storageConfig(ProviderKind.CLOUDFLARE_R2);
    byte[] content = "hello".getBytes();
    when(objectStorage.put(config, "a.txt", content, "text/plain")).thenReturn("etag-r2");

    assertThat(dispatcher.put(config, "a.txt", content, "text/plain")).isEqualTo("etag-r2");
    verify(objectStorage).put(config, "a.txt", content, "text/plain");
  }
}
