package io.b2mash.filegate.upload.dispatch;

import io.b2mash.filegate.storageconfig.ProviderKind;
import io.b2mash.filegate.storageconfig.StorageConfig;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes a synchronous upload to the strategy registered for the config's provider kind. Built once
 * at startup; two strategies claiming one kind is a startup failure.
 */
@Component
public class UploadDispatcher {

  private static final Logger log = LoggerFactory.getLogger(UploadDispatcher.class);

  private final Map<ProviderKind, UploadStrategy> strategies = new EnumMap<>(ProviderKind.class);
  private final UploadStrategy fallback;

  public UploadDispatcher(List<UploadStrategy> registered, SdkPutUploadStrategy fallback) {
    this.fallback = fallback;
    for (var strategy : registered) {
      for (var kind : strategy.supportedKinds()) {
        var existing = strategies.putIfAbsent(kind, strategy);
        if (existing != null) {
          throw new IllegalStateException(
              "Duplicate UploadStrategy: providerKind="
                  + kind
                  + " registered by both "
                  + existing.getClass().getName()
                  + " and "
                  + strategy.getClass().getName());
        }
      }
    }
  }

  /** Transfers the bytes and returns the unquoted ETag (null when the store sent none). */
  public String put(StorageConfig config, String key, byte[] content, String contentType) {
    var strategy = strategyFor(config.getProviderKind());
    long started = System.currentTimeMillis();
    String etag = strategy.put(config, key, content, contentType);
    log.info(
        "Uploaded key={} size={} provider={} via {} in {}ms",
        key,
        content.length,
        config.getProviderKind(),
        strategy.getClass().getSimpleName(),
        System.currentTimeMillis() - started);
    return etag;
  }

  UploadStrategy strategyFor(ProviderKind kind) {
    if (kind == null) {
      return fallback;
    }
    return strategies.getOrDefault(kind, fallback);
  }
}
