package io.b2mash.filegate.upload.dispatch;

import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.ProviderKind;
import io.b2mash.filegate.storageconfig.StorageConfig;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Plain PutObject through the S3 client. Also the fallback for kinds no strategy claims. */
@Component
public class SdkPutUploadStrategy implements UploadStrategy {

  private final ObjectStorage objectStorage;

  public SdkPutUploadStrategy(ObjectStorage objectStorage) {
    this.objectStorage = objectStorage;
  }

  @Override
  public Set<ProviderKind> supportedKinds() {
    return EnumSet.of(
        ProviderKind.AWS_S3,
        ProviderKind.CLOUDFLARE_R2,
        ProviderKind.ALIYUN_OSS,
        ProviderKind.OTHER);
  }

  @Override
  public String put(StorageConfig config, String key, byte[] content, String contentType) {
    return objectStorage.put(config, key, content, contentType);
  }
}
