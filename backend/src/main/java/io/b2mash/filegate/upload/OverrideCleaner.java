package io.b2mash.filegate.upload;

import io.b2mash.filegate.directory.DirectoryCacheInvalidator;
import io.b2mash.filegate.exception.ForbiddenException;
import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.file.FileRecordService;
import io.b2mash.filegate.security.Uploader;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.StorageConfigRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes the record an override upload supersedes. Ownership is checked up front by {@link
 * #claim}; {@link #remove} then deletes object, record and password shadow without failing the
 * upload.
 */
@Component
public class OverrideCleaner {

  private static final Logger log = LoggerFactory.getLogger(OverrideCleaner.class);

  private final FileRecordService fileRecordService;
  private final StorageConfigRepository storageConfigRepository;
  private final ObjectStorage objectStorage;
  private final DirectoryCacheInvalidator directoryCacheInvalidator;

  public OverrideCleaner(
      FileRecordService fileRecordService,
      StorageConfigRepository storageConfigRepository,
      ObjectStorage objectStorage,
      DirectoryCacheInvalidator directoryCacheInvalidator) {
    this.fileRecordService = fileRecordService;
    this.storageConfigRepository = storageConfigRepository;
    this.objectStorage = objectStorage;
    this.directoryCacheInvalidator = directoryCacheInvalidator;
  }

  /**
   * Returns the record holding {@code slug} when the uploader may replace it.
   *
   * @throws ForbiddenException if the slug belongs to someone else
   */
  public Optional<FileRecord> claim(String slug, Uploader uploader) {
    var existing = fileRecordService.findBySlug(slug);
    existing.ifPresent(
        record -> {
          if (!record.isCreatedBy(uploader.creatorTag())) {
            throw new ForbiddenException(
                "Override not allowed", "Only the creator of '" + slug + "' may override it");
          }
        });
    return existing;
  }

  public void remove(FileRecord superseded) {
    try {
      storageConfigRepository
          .findById(superseded.getStorageConfigId())
          .ifPresentOrElse(
              config -> objectStorage.deleteObject(config, superseded.getStoragePath()),
              () ->
                  log.warn(
                      "Superseded file {} references missing storage config {}",
                      superseded.getId(),
                      superseded.getStorageConfigId()));
      fileRecordService.delete(superseded.getId());
      directoryCacheInvalidator.invalidate(superseded.getStorageConfigId());
      log.info(
          "Override removed file {} (slug={}, key={})",
          superseded.getId(),
          superseded.getSlug(),
          superseded.getStoragePath());
    } catch (RuntimeException e) {
      log.warn(
          "Cleanup of superseded file {} failed: {}", superseded.getId(), e.getMessage(), e);
    }
  }
}
