package io.b2mash.filegate.upload;

import io.b2mash.filegate.exception.ForbiddenException;
import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.file.CommitDetails;
import io.b2mash.filegate.file.ExpiryPolicy;
import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.file.FileRecordService;
import io.b2mash.filegate.file.FileValues;
import io.b2mash.filegate.file.QuotaGuard;
import io.b2mash.filegate.security.Uploader;
import io.b2mash.filegate.settings.UploadLimits;
import io.b2mash.filegate.storage.EtagValues;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.StorageConfig;
import io.b2mash.filegate.storageconfig.StorageConfigSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Second half of the presign/commit protocol. Confirms an upload the client sent straight to the
 * store, re-checking quota with the real size and rolling the upload back when it no longer fits.
 */
@Service
public class CommitCoordinator {

  private static final Logger log = LoggerFactory.getLogger(CommitCoordinator.class);

  private final FileRecordService fileRecordService;
  private final StorageConfigSelector storageConfigSelector;
  private final QuotaGuard quotaGuard;
  private final ObjectStorage objectStorage;
  private final DirectoryRefresher directoryRefresher;
  private final ShareLinkBuilder shareLinkBuilder;
  private final UploadLimits uploadLimits;

  public CommitCoordinator(
      FileRecordService fileRecordService,
      StorageConfigSelector storageConfigSelector,
      QuotaGuard quotaGuard,
      ObjectStorage objectStorage,
      DirectoryRefresher directoryRefresher,
      ShareLinkBuilder shareLinkBuilder,
      UploadLimits uploadLimits) {
    this.fileRecordService = fileRecordService;
    this.storageConfigSelector = storageConfigSelector;
    this.quotaGuard = quotaGuard;
    this.objectStorage = objectStorage;
    this.directoryRefresher = directoryRefresher;
    this.shareLinkBuilder = shareLinkBuilder;
    this.uploadLimits = uploadLimits;
  }

  public UploadReceipt commit(Uploader uploader, CommitCommand command, String baseUrl) {
    if (command.fileId() == null) {
      throw new InvalidRequestException("Missing file id", "file_id is required");
    }
    String etag = EtagValues.strip(command.etag());
    if (etag == null) {
      // Browsers often cannot read the ETag header of a cross-origin PUT
      log.warn("Commit of file {} without ETag", command.fileId());
    }

    var record = fileRecordService.require(command.fileId());
    if (record.getCreatedBy() != null && !record.isCreatedBy(uploader.creatorTag())) {
      throw new ForbiddenException(
          "Commit not allowed", "File " + record.getId() + " belongs to another uploader");
    }

    var config = storageConfigSelector.require(record.getStorageConfigId());
    storageConfigSelector.checkAccess(uploader, config);

    Long reportedSize = command.size() == null ? null : FileValues.nonNegative(command.size());
    long sizeForQuota = reportedSize == null ? 0 : reportedSize;
    try {
      uploadLimits.checkSize(sizeForQuota);
    } catch (InvalidRequestException e) {
      rollBack(config, record);
      throw e;
    }
    var decision = quotaGuard.check(config, sizeForQuota, record.getId());
    if (!decision.admitted()) {
      rollBack(config, record);
      throw QuotaGuard.rejection(decision, "The uploaded file has been removed.");
    }

    var committed =
        fileRecordService.applyCommit(
            record.getId(),
            new CommitDetails(
                etag,
                reportedSize,
                uploader.creatorTag(),
                command.remark(),
                command.password(),
                ExpiryPolicy.fromHours(command.expiresInHours()),
                command.maxViews()));

    directoryRefresher.afterWrite(config, committed.getStoragePath());
    log.info(
        "Committed file {} (slug={}, size={}, by={})",
        committed.getId(),
        committed.getSlug(),
        committed.getSize(),
        uploader.creatorTag());

    var links = shareLinkBuilder.build(config, committed, baseUrl, command.password());
    return new UploadReceipt(committed, config, links, false);
  }

  private void rollBack(StorageConfig config, FileRecord record) {
    try {
      if (!objectStorage.deleteObject(config, record.getStoragePath())) {
        log.error("Object {} left behind after quota rejection", record.getStoragePath());
      }
    } catch (RuntimeException e) {
      log.error(
          "Failed to delete object {} after quota rejection: {}",
          record.getStoragePath(),
          e.getMessage(),
          e);
    }
    fileRecordService.delete(record.getId());
  }
}
