package io.b2mash.filegate.mount;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** An administrator-defined virtual directory backed by a storage config. */
@Entity
@Table(name = "storage_mounts")
public class StorageMount {

  public static final String STORAGE_TYPE_S3 = "S3";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "storage_type", nullable = false, length = 20)
  private String storageType;

  @Column(name = "storage_config_id")
  private UUID storageConfigId;

  @Column(name = "mount_path", nullable = false, length = 500)
  private String mountPath;

  @Column(name = "remark", length = 500)
  private String remark;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_by", length = 100)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected StorageMount() {}

  public StorageMount(String name, UUID storageConfigId, String mountPath, String createdBy) {
    this.name = name;
    this.storageType = STORAGE_TYPE_S3;
    this.storageConfigId = storageConfigId;
    this.mountPath = mountPath;
    this.createdBy = createdBy;
    this.active = true;
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

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getStorageType() {
    return storageType;
  }

  public UUID getStorageConfigId() {
    return storageConfigId;
  }

  public String getMountPath() {
    return mountPath;
  }

  public String getRemark() {
    return remark;
  }

  public boolean isActive() {
    return active;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
