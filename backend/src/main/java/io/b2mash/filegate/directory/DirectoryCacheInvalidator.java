package io.b2mash.filegate.directory;

import io.b2mash.filegate.mount.StorageMountRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Drops cached listings of every mount backed by a storage config. Never throws. */
@Component
public class DirectoryCacheInvalidator {

  private static final Logger log = LoggerFactory.getLogger(DirectoryCacheInvalidator.class);

  private final StorageMountRepository storageMountRepository;
  private final DirectoryListingCache directoryListingCache;

  public DirectoryCacheInvalidator(
      StorageMountRepository storageMountRepository, DirectoryListingCache directoryListingCache) {
    this.storageMountRepository = storageMountRepository;
    this.directoryListingCache = directoryListingCache;
  }

  @Transactional(readOnly = true)
  public int invalidate(UUID storageConfigId) {
    try {
      int evicted = 0;
      for (var mount : storageMountRepository.findByStorageConfigId(storageConfigId)) {
        evicted += directoryListingCache.evictMount(mount.getId());
      }
      log.debug("Evicted {} cached listing(s) for storage config {}", evicted, storageConfigId);
      return evicted;
    } catch (RuntimeException e) {
      log.warn(
          "Listing cache invalidation failed for storage config {}: {}",
          storageConfigId,
          e.getMessage());
      return 0;
    }
  }
}
