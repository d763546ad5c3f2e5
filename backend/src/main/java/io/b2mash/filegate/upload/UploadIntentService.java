package io.b2mash.filegate.upload;

import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.file.FileRecordService;
import io.b2mash.filegate.file.FileValues;
import io.b2mash.filegate.file.NewFileRecord;
import io.b2mash.filegate.file.QuotaGuard;
import io.b2mash.filegate.file.SlugAllocator;
import io.b2mash.filegate.mount.MountPathResolver;
import io.b2mash.filegate.security.Uploader;
import io.b2mash.filegate.settings.UploadLimits;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.StorageConfigSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * First half of the presign/commit protocol: validates the intent, reserves a placeholder record
 * and hands back a presigned PUT for the client to upload to directly.
 */
@Service
public class UploadIntentService {

  private static final Logger log = LoggerFactory.getLogger(UploadIntentService.class);

  private final StorageConfigSelector storageConfigSelector;
  private final MountPathResolver mountPathResolver;
  private final UploadLimits uploadLimits;
  private final QuotaGuard quotaGuard;
  private final SlugAllocator slugAllocator;
  private final OverrideCleaner overrideCleaner;
  private final StorageKeyBuilder storageKeyBuilder;
  private final ObjectStorage objectStorage;
  private final FileRecordService fileRecordService;

  public UploadIntentService(
      StorageConfigSelector storageConfigSelector,
      MountPathResolver mountPathResolver,
      UploadLimits uploadLimits,
      QuotaGuard quotaGuard,
      SlugAllocator slugAllocator,
      OverrideCleaner overrideCleaner,
      StorageKeyBuilder storageKeyBuilder,
      ObjectStorage objectStorage,
      FileRecordService fileRecordService) {
    this.storageConfigSelector = storageConfigSelector;
    this.mountPathResolver = mountPathResolver;
    this.uploadLimits = uploadLimits;
    this.quotaGuard = quotaGuard;
    this.slugAllocator = slugAllocator;
    this.overrideCleaner = overrideCleaner;
    this.storageKeyBuilder = storageKeyBuilder;
    this.objectStorage = objectStorage;
    this.fileRecordService = fileRecordService;
  }

  public PresignResult presign(Uploader uploader, PresignCommand command) {
    if (command.storageConfigId() == null) {
      throw new InvalidRequestException("Missing storage config", "s3_config_id is required");
    }
    if (command.filename() == null || command.filename().isBlank()) {
      throw new InvalidRequestException("Missing filename", "filename is required");
    }
    String filename = command.filename().trim();

    var config = storageConfigSelector.select(uploader, command.storageConfigId());
    String prefix = mountPathResolver.resolvePrefix(uploader.effectiveScope(), config);

    long declaredSize = FileValues.nonNegative(command.size());
    uploadLimits.checkSize(declaredSize);
    quotaGuard.admit(config, declaredSize);

    String slug = slugAllocator.allocate(command.slug(), command.override());
    if (command.override()) {
      overrideCleaner.claim(slug, uploader).ifPresent(overrideCleaner::remove);
    }

    String mimetype = MimeTypes.fromFilename(filename);
    String key = storageKeyBuilder.build(prefix, config, command.path(), filename, false);
    var uploadUrl = objectStorage.presignPut(config, key, mimetype);
    String s3Url = objectStorage.buildPublicUrl(config, key);

    var placeholder =
        fileRecordService.insertPlaceholder(
            NewFileRecord.placeholder(
                slug, filename, key, s3Url, config.getId(), mimetype, uploader.creatorTag()));

    log.info(
        "Presigned upload: file={}, slug={}, key={}, config={}, by={}",
        placeholder.getId(),
        slug,
        key,
        config.getId(),
        uploader.creatorTag());
    return new PresignResult(
        placeholder.getId(),
        uploadUrl.url(),
        key,
        s3Url,
        slug,
        config.getProviderKind(),
        mimetype);
  }
}
