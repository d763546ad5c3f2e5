package io.b2mash.filegate.upload;

import io.b2mash.filegate.directory.DirectoryCacheInvalidator;
import io.b2mash.filegate.directory.DirectoryTimestampService;
import io.b2mash.filegate.storageconfig.StorageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Post-write bookkeeping shared by both upload flows. Never fails the upload. */
@Component
public class DirectoryRefresher {

  private static final Logger log = LoggerFactory.getLogger(DirectoryRefresher.class);

  private final DirectoryTimestampService directoryTimestampService;
  private final DirectoryCacheInvalidator directoryCacheInvalidator;

  public DirectoryRefresher(
      DirectoryTimestampService directoryTimestampService,
      DirectoryCacheInvalidator directoryCacheInvalidator) {
    this.directoryTimestampService = directoryTimestampService;
    this.directoryCacheInvalidator = directoryCacheInvalidator;
  }

  public void afterWrite(StorageConfig config, String key) {
    try {
      directoryTimestampService.touchAncestors(config, key);
    } catch (RuntimeException e) {
      log.warn("Directory timestamp refresh failed for key={}: {}", key, e.getMessage());
    }
    directoryCacheInvalidator.invalidate(config.getId());
  }
}
