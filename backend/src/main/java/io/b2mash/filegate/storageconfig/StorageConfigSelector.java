package io.b2mash.filegate.storageconfig;

import io.b2mash.filegate.exception.ForbiddenException;
import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.exception.ResourceNotFoundException;
import io.b2mash.filegate.security.Uploader;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Picks the storage config an upload lands on and checks the uploader may use it. Administrators
 * may only use configs they own; API keys may only use public configs.
 */
@Service
public class StorageConfigSelector {

  private static final Logger log = LoggerFactory.getLogger(StorageConfigSelector.class);

  private final StorageConfigRepository storageConfigRepository;

  public StorageConfigSelector(StorageConfigRepository storageConfigRepository) {
    this.storageConfigRepository = storageConfigRepository;
  }

  /**
   * Returns the requested config after an access check, or the uploader's default when none was
   * requested.
   */
  @Transactional(readOnly = true)
  public StorageConfig select(Uploader uploader, UUID requestedConfigId) {
    if (requestedConfigId == null) {
      return selectDefault(uploader);
    }
    var config = require(requestedConfigId);
    checkAccess(uploader, config);
    return config;
  }

  @Transactional(readOnly = true)
  public StorageConfig require(UUID configId) {
    return storageConfigRepository
        .findById(configId)
        .orElseThrow(() -> new ResourceNotFoundException("StorageConfig", configId));
  }

  public void checkAccess(Uploader uploader, StorageConfig config) {
    if (uploader.isAdmin()) {
      if (!config.isOwnedBy(uploader.id())) {
        throw new ForbiddenException(
            "Storage config not accessible", "You do not own storage config " + config.getId());
      }
      return;
    }
    if (!config.isPublicAccess()) {
      throw new ForbiddenException(
          "Storage config not accessible",
          "API keys may only upload to public storage configs");
    }
  }

  private StorageConfig selectDefault(Uploader uploader) {
    var selected =
        uploader.isAdmin()
            ? storageConfigRepository
                .findFirstByAdminIdAndDefaultConfigTrue(uploader.id())
                .or(() -> storageConfigRepository.findFirstByAdminId(uploader.id()))
            : storageConfigRepository
                .findFirstByPublicAccessTrueAndDefaultConfigTrue()
                .or(storageConfigRepository::findFirstByPublicAccessTrue);
    var config =
        selected.orElseThrow(
            () ->
                new InvalidRequestException(
                    "No storage config available",
                    "No storage config is available for this uploader. Configure one first."));
    log.debug("Selected default storage config {} for {}", config.getId(), uploader.creatorTag());
    return config;
  }
}
