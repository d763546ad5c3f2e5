package io.b2mash.filegate.upload;

import io.b2mash.filegate.directory.DirectoryCacheInvalidator;
import io.b2mash.filegate.exception.ForbiddenException;
import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.file.FileRecordService;
import io.b2mash.filegate.file.FileRecordUpdate;
import io.b2mash.filegate.security.Uploader;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.StorageConfigRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Owner-only edits and deletion of committed files. */
@Service
public class FileMaintenanceService {

  private static final Logger log = LoggerFactory.getLogger(FileMaintenanceService.class);

  private final FileRecordService fileRecordService;
  private final StorageConfigRepository storageConfigRepository;
  private final ObjectStorage objectStorage;
  private final DirectoryCacheInvalidator directoryCacheInvalidator;

  public FileMaintenanceService(
      FileRecordService fileRecordService,
      StorageConfigRepository storageConfigRepository,
      ObjectStorage objectStorage,
      DirectoryCacheInvalidator directoryCacheInvalidator) {
    this.fileRecordService = fileRecordService;
    this.storageConfigRepository = storageConfigRepository;
    this.objectStorage = objectStorage;
    this.directoryCacheInvalidator = directoryCacheInvalidator;
  }

  public FileRecord update(Uploader uploader, UUID fileId, FileRecordUpdate update) {
    var record = fileRecordService.require(fileId);
    requireOwner(uploader, record);
    var updated = fileRecordService.update(fileId, update);
    directoryCacheInvalidator.invalidate(updated.getStorageConfigId());
    return updated;
  }

  public void delete(Uploader uploader, UUID fileId) {
    var record = fileRecordService.require(fileId);
    requireOwner(uploader, record);

    storageConfigRepository
        .findById(record.getStorageConfigId())
        .ifPresent(config -> objectStorage.deleteObject(config, record.getStoragePath()));
    fileRecordService.delete(fileId);
    directoryCacheInvalidator.invalidate(record.getStorageConfigId());
    log.info("Deleted file {} (slug={}) by {}", fileId, record.getSlug(), uploader.creatorTag());
  }

  private static void requireOwner(Uploader uploader, FileRecord record) {
    if (!record.isCreatedBy(uploader.creatorTag())) {
      throw new ForbiddenException(
          "Not the file owner", "Only the creator of file " + record.getId() + " may change it");
    }
  }
}
