package io.b2mash.filegate.upload;

import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.file.ExpiryPolicy;
import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.file.FileRecordService;
import io.b2mash.filegate.file.NewFileRecord;
import io.b2mash.filegate.file.QuotaGuard;
import io.b2mash.filegate.file.SlugAllocator;
import io.b2mash.filegate.mount.MountPathResolver;
import io.b2mash.filegate.security.Uploader;
import io.b2mash.filegate.settings.UploadLimits;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.StorageConfigSelector;
import io.b2mash.filegate.upload.dispatch.UploadDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Single-request upload: the bytes arrive in the request body and are transferred to the store
 * before the record is written.
 */
@Service
public class DirectUploadService {

  private static final Logger log = LoggerFactory.getLogger(DirectUploadService.class);

  private final StorageConfigSelector storageConfigSelector;
  private final MountPathResolver mountPathResolver;
  private final UploadLimits uploadLimits;
  private final QuotaGuard quotaGuard;
  private final SlugAllocator slugAllocator;
  private final OverrideCleaner overrideCleaner;
  private final StorageKeyBuilder storageKeyBuilder;
  private final UploadDispatcher uploadDispatcher;
  private final ObjectStorage objectStorage;
  private final FileRecordService fileRecordService;
  private final DirectoryRefresher directoryRefresher;
  private final ShareLinkBuilder shareLinkBuilder;

  public DirectUploadService(
      StorageConfigSelector storageConfigSelector,
      MountPathResolver mountPathResolver,
      UploadLimits uploadLimits,
      QuotaGuard quotaGuard,
      SlugAllocator slugAllocator,
      OverrideCleaner overrideCleaner,
      StorageKeyBuilder storageKeyBuilder,
      UploadDispatcher uploadDispatcher,
      ObjectStorage objectStorage,
      FileRecordService fileRecordService,
      DirectoryRefresher directoryRefresher,
      ShareLinkBuilder shareLinkBuilder) {
    this.storageConfigSelector = storageConfigSelector;
    this.mountPathResolver = mountPathResolver;
    this.uploadLimits = uploadLimits;
    this.quotaGuard = quotaGuard;
    this.slugAllocator = slugAllocator;
    this.overrideCleaner = overrideCleaner;
    this.storageKeyBuilder = storageKeyBuilder;
    this.uploadDispatcher = uploadDispatcher;
    this.objectStorage = objectStorage;
    this.fileRecordService = fileRecordService;
    this.directoryRefresher = directoryRefresher;
    this.shareLinkBuilder = shareLinkBuilder;
  }

  public UploadReceipt upload(Uploader uploader, DirectUploadCommand command, String baseUrl) {
    if (command.filename() == null || command.filename().isBlank()) {
      throw new InvalidRequestException("Missing filename", "A filename is required");
    }
    String filename = command.filename().trim();
    byte[] content = command.content() == null ? new byte[0] : command.content();

    var config = storageConfigSelector.select(uploader, command.storageConfigId());
    String prefix = mountPathResolver.resolvePrefix(uploader.effectiveScope(), config);

    uploadLimits.checkSize(content.length);
    quotaGuard.admit(config, content.length);

    String slug = slugAllocator.allocate(command.slug(), command.override());
    if (command.override()) {
      overrideCleaner.claim(slug, uploader).ifPresent(overrideCleaner::remove);
    }

    String mimetype = MimeTypes.fromFilename(filename);
    String declared = MimeTypes.stripParameters(command.declaredContentType());
    if (declared != null && !declared.isEmpty() && !declared.equals(mimetype)) {
      log.debug("Ignoring declared content type {} for {}, using {}", declared, filename, mimetype);
    }

    String key =
        storageKeyBuilder.build(
            prefix, config, command.path(), filename, command.keepOriginalFilename());
    String etag = uploadDispatcher.put(config, key, content, mimetype);
    String s3Url = objectStorage.buildPublicUrl(config, key);

    var values =
        new NewFileRecord(
            slug,
            filename,
            key,
            s3Url,
            config.getId(),
            mimetype,
            uploader.creatorTag(),
            command.remark(),
            content.length,
            etag,
            command.password(),
            ExpiryPolicy.fromHours(command.expiresInHours()),
            command.maxViews(),
            command.useProxy());
    FileRecord record;
    try {
      record = fileRecordService.insertComplete(values);
    } catch (DataIntegrityViolationException e) {
      // Lost the slug race after the bytes were written
      objectStorage.deleteObject(config, key);
      throw e;
    }

    directoryRefresher.afterWrite(config, key);
    log.info(
        "Direct upload stored file {} (slug={}, key={}, size={}, by={})",
        record.getId(),
        slug,
        key,
        content.length,
        uploader.creatorTag());

    var links = shareLinkBuilder.build(config, record, baseUrl, command.password());
    return new UploadReceipt(record, config, links, command.keepOriginalFilename());
  }
}
