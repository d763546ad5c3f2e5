package io.b2mash.filegate.file;

import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.exception.ResourceConflictException;
import io.b2mash.filegate.exception.ResourceNotFoundException;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the lifecycle of {@link FileRecord} and its {@link FilePassword} shadow. Each method runs in
 * its own transaction; callers compose them without an enclosing one.
 */
@Service
public class FileRecordService {

  private static final Logger log = LoggerFactory.getLogger(FileRecordService.class);

  private final FileRecordRepository fileRecordRepository;
  private final FilePasswordRepository filePasswordRepository;
  private final PasswordHasher passwordHasher;

  public FileRecordService(
      FileRecordRepository fileRecordRepository,
      FilePasswordRepository filePasswordRepository,
      PasswordHasher passwordHasher) {
    this.fileRecordRepository = fileRecordRepository;
    this.filePasswordRepository = filePasswordRepository;
    this.passwordHasher = passwordHasher;
  }

  @Transactional(readOnly = true)
  public FileRecord require(UUID fileId) {
    return fileRecordRepository
        .findById(fileId)
        .orElseThrow(() -> new ResourceNotFoundException("File", fileId));
  }

  @Transactional(readOnly = true)
  public Optional<FileRecord> findBySlug(String slug) {
    return fileRecordRepository.findBySlug(slug);
  }

  @Transactional
  public FileRecord insertPlaceholder(NewFileRecord values) {
    var record = fileRecordRepository.saveAndFlush(newRecord(values));
    log.debug("Inserted placeholder {} with slug {}", record.getId(), record.getSlug());
    return record;
  }

  @Transactional
  public FileRecord insertComplete(NewFileRecord values) {
    var record = newRecord(values);
    record.completeUpload(values.etag(), Math.max(0, values.size()));
    record.updateRemark(values.remark());
    record.expireAt(values.expiresAt());
    record.limitViews(FileValues.maxViews(values.maxViews()));
    record.routeThroughProxy(values.useProxy());
    if (hasText(values.password())) {
      record.protectWith(passwordHasher.hash(values.password()));
    }
    record = fileRecordRepository.saveAndFlush(record);
    if (hasText(values.password())) {
      upsertPassword(record.getId(), values.password());
    }
    return record;
  }

  /** Turns a placeholder into a complete record in place. */
  @Transactional
  public FileRecord applyCommit(UUID fileId, CommitDetails details) {
    var record = require(fileId);
    if (details.size() != null) {
      record.completeUpload(details.etag(), Math.max(0, details.size()));
    } else {
      record.completeUpload(details.etag());
    }
    record.assignCreator(details.creatorTag());
    record.updateRemark(details.remark());
    if (hasText(details.password())) {
      record.protectWith(passwordHasher.hash(details.password()));
    }
    record.expireAt(details.expiresAt());
    record.limitViews(FileValues.maxViews(details.maxViews()));
    record = fileRecordRepository.save(record);
    if (hasText(details.password())) {
      upsertPassword(record.getId(), details.password());
    }
    return record;
  }

  /**
   * Writes only the supplied fields.
   *
   * @throws InvalidRequestException if nothing was supplied or a supplied value is malformed
   * @throws ResourceConflictException if the new slug belongs to another record
   */
  @Transactional
  public FileRecord update(UUID fileId, FileRecordUpdate update) {
    if (update.isEmpty()) {
      throw new InvalidRequestException("Nothing to update", "Supply at least one field to change");
    }
    var record = require(fileId);

    if (update.remark() != null) {
      record.updateRemark(update.remark().value());
    }
    if (update.filename() != null) {
      record.rename(requireText(update.filename().value(), "filename"));
    }
    if (update.slug() != null) {
      String slug = requireText(update.slug().value(), "slug");
      SlugAllocator.validate(slug);
      if (!slug.equals(record.getSlug()) && fileRecordRepository.existsBySlug(slug)) {
        throw new ResourceConflictException(
            "Slug already in use", "Slug '" + slug + "' is already in use");
      }
      record.changeSlug(slug);
    }
    if (update.expiresAt() != null) {
      record.expireAt(update.expiresAt().value());
    }
    if (update.maxViews() != null) {
      record.limitViews(FileValues.maxViews(update.maxViews().value()));
    }
    if (update.useProxy() != null) {
      record.routeThroughProxy(update.useProxy().value());
    }
    if (update.password() != null) {
      String password = update.password().value();
      if (hasText(password)) {
        record.protectWith(passwordHasher.hash(password));
        upsertPassword(record.getId(), password);
      } else {
        record.protectWith(null);
        filePasswordRepository.deleteByFileId(record.getId());
      }
    }
    return fileRecordRepository.save(record);
  }

  /** Removes the record and its password shadow. Returns false when there was nothing to delete. */
  @Transactional
  public boolean delete(UUID fileId) {
    if (!fileRecordRepository.existsById(fileId)) {
      return false;
    }
    filePasswordRepository.deleteByFileId(fileId);
    fileRecordRepository.deleteById(fileId);
    return true;
  }

  @Transactional
  public void upsertPassword(UUID fileId, String password) {
    var shadow =
        filePasswordRepository
            .findByFileId(fileId)
            .map(
                existing -> {
                  existing.changePassword(password);
                  return existing;
                })
            .orElseGet(() -> new FilePassword(fileId, password));
    filePasswordRepository.save(shadow);
  }

  private FileRecord newRecord(NewFileRecord values) {
    return new FileRecord(
        requireText(values.slug(), "slug"),
        requireText(values.filename(), "filename"),
        values.storagePath(),
        values.s3Url(),
        values.storageConfigId(),
        values.mimetype(),
        values.createdBy());
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidRequestException("Invalid " + field, field + " must not be empty");
    }
    return value.trim();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isEmpty();
  }
}
