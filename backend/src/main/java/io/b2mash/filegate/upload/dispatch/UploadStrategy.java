package io.b2mash.filegate.upload.dispatch;

import io.b2mash.filegate.storageconfig.ProviderKind;
import io.b2mash.filegate.storageconfig.StorageConfig;
import java.util.Set;

/** One way of moving request bytes into a store. */
public interface UploadStrategy {

  /** Provider kinds this strategy handles. A kind may be claimed by only one strategy. */
  Set<ProviderKind> supportedKinds();

  /**
   * Writes {@code content} under {@code key} and returns the store's ETag without quotes, or null
   * when the store returned none.
   *
   * @throws io.b2mash.filegate.exception.UpstreamTransferException if the store refuses the write
   */
  String put(StorageConfig config, String key, byte[] content, String contentType);
}
