package io.b2mash.filegate.file;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Metadata for one shared object. Created as a placeholder at presign time (size 0, no ETag) or
 * complete by a direct upload.
 */
@Entity
@Table(name = "files")
public class FileRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "slug", nullable = false, unique = true, length = 100)
  private String slug;

  @Column(name = "filename", nullable = false, length = 500)
  private String filename;

  @Column(name = "storage_path", nullable = false, length = 1000)
  private String storagePath;

  @Column(name = "s3_url", length = 2000)
  private String s3Url;

  @Column(name = "s3_config_id", nullable = false)
  private UUID storageConfigId;

  @Column(name = "mimetype", length = 200)
  private String mimetype;

  @Column(name = "size", nullable = false)
  private long size;

  @Column(name = "etag", length = 200)
  private String etag;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private Status status;

  @Column(name = "created_by", length = 100)
  private String createdBy;

  @Column(name = "remark", length = 1000)
  private String remark;

  @Column(name = "password_hash", length = 200)
  private String passwordHash;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "max_views")
  private Integer maxViews;

  @Column(name = "views", nullable = false)
  private int views;

  @Column(name = "use_proxy", nullable = false)
  private boolean useProxy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected FileRecord() {}

  public FileRecord(
      String slug,
      String filename,
      String storagePath,
      String s3Url,
      UUID storageConfigId,
      String mimetype,
      String createdBy) {
    this.slug = slug;
    this.filename = filename;
    this.storagePath = storagePath;
    this.s3Url = s3Url;
    this.storageConfigId = storageConfigId;
    this.mimetype = mimetype;
    this.createdBy = createdBy;
    this.status = Status.PENDING;
    this.useProxy = true;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void completeUpload(String etag, long size) {
    this.etag = etag;
    this.size = size;
    this.status = Status.COMMITTED;
  }

  /** Commit without a reported size keeps whatever the placeholder carried. */
  public void completeUpload(String etag) {
    this.etag = etag;
    this.status = Status.COMMITTED;
  }

  public void assignCreator(String createdBy) {
    this.createdBy = createdBy;
  }

  public void updateRemark(String remark) {
    this.remark = remark;
  }

  public void rename(String filename) {
    this.filename = filename;
  }

  public void changeSlug(String slug) {
    this.slug = slug;
  }

  public void protectWith(String passwordHash) {
    this.passwordHash = passwordHash;
  }

  public void expireAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  public void limitViews(Integer maxViews) {
    this.maxViews = maxViews;
  }

  public void routeThroughProxy(boolean useProxy) {
    this.useProxy = useProxy;
  }

  public boolean isCreatedBy(String creatorTag) {
    return createdBy != null && createdBy.equals(creatorTag);
  }

  public boolean requiresPassword() {
    return passwordHash != null;
  }

  public UUID getId() {
    return id;
  }

  public String getSlug() {
    return slug;
  }

  public String getFilename() {
    return filename;
  }

  public String getStoragePath() {
    return storagePath;
  }

  public String getS3Url() {
    return s3Url;
  }

  public UUID getStorageConfigId() {
    return storageConfigId;
  }

  public String getMimetype() {
    return mimetype;
  }

  public long getSize() {
    return size;
  }

  public String getEtag() {
    return etag;
  }

  public Status getStatus() {
    return status;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public String getRemark() {
    return remark;
  }

  public String getPasswordHash() {
    return passwordHash;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Integer getMaxViews() {
    return maxViews;
  }

  public int getViews() {
    return views;
  }

  public boolean isUseProxy() {
    return useProxy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public enum Status {
    PENDING,
    COMMITTED
  }
}
