package io.b2mash.filegate.storageconfig;

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
 * A named S3-compatible backing store. Administrative edits happen elsewhere; the upload core only
 * reads these rows.
 */
@Entity
@Table(name = "storage_configs")
public class StorageConfig {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider_type", nullable = false, length = 50)
  private ProviderKind providerKind;

  @Column(name = "endpoint_url", length = 500)
  private String endpointUrl;

  @Column(name = "region", length = 100)
  private String region;

  @Column(name = "bucket_name", nullable = false, length = 255)
  private String bucketName;

  @Column(name = "access_key_id", nullable = false, length = 255)
  private String accessKeyId;

  /** AES-GCM encrypted, see {@code CredentialCipher}. */
  @Column(name = "secret_access_key", nullable = false, columnDefinition = "TEXT")
  private String encryptedSecretAccessKey;

  @Column(name = "path_style", nullable = false)
  private boolean pathStyle;

  @Column(name = "default_folder", length = 500)
  private String defaultFolder;

  @Column(name = "custom_host", length = 500)
  private String customHost;

  @Column(name = "signature_expires_in", nullable = false)
  private int signatureExpiresInSeconds;

  @Column(name = "is_public", nullable = false)
  private boolean publicAccess;

  @Column(name = "is_default", nullable = false)
  private boolean defaultConfig;

  @Column(name = "admin_id")
  private UUID adminId;

  @Column(name = "total_storage_bytes")
  private Long totalStorageBytes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected StorageConfig() {}

  public StorageConfig(
      String name,
      ProviderKind providerKind,
      String endpointUrl,
      String region,
      String bucketName,
      String accessKeyId,
      String encryptedSecretAccessKey) {
    this.name = name;
    this.providerKind = providerKind;
    this.endpointUrl = endpointUrl;
    this.region = region;
    this.bucketName = bucketName;
    this.accessKeyId = accessKeyId;
    this.encryptedSecretAccessKey = encryptedSecretAccessKey;
    this.pathStyle = endpointUrl != null && !endpointUrl.isBlank();
    this.signatureExpiresInSeconds = 3600;
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

  public void assignOwner(UUID adminId) {
    this.adminId = adminId;
  }

  public void configureAccess(boolean publicAccess, boolean defaultConfig) {
    this.publicAccess = publicAccess;
    this.defaultConfig = defaultConfig;
  }

  public void configureLayout(String defaultFolder, String customHost, boolean pathStyle) {
    this.defaultFolder = defaultFolder;
    this.customHost = customHost;
    this.pathStyle = pathStyle;
  }

  public void limitCapacity(Long totalStorageBytes) {
    this.totalStorageBytes = totalStorageBytes;
  }

  public boolean isOwnedBy(UUID candidateAdminId) {
    return adminId != null && adminId.equals(candidateAdminId);
  }

  public boolean hasCapacityLimit() {
    return totalStorageBytes != null;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public ProviderKind getProviderKind() {
    return providerKind;
  }

  public String getEndpointUrl() {
    return endpointUrl;
  }

  public String getRegion() {
    return region;
  }

  public String getBucketName() {
    return bucketName;
  }

  public String getAccessKeyId() {
    return accessKeyId;
  }

  public String getEncryptedSecretAccessKey() {
    return encryptedSecretAccessKey;
  }

  public boolean isPathStyle() {
    return pathStyle;
  }

  public String getDefaultFolder() {
    return defaultFolder;
  }

  public String getCustomHost() {
    return customHost;
  }

  public int getSignatureExpiresInSeconds() {
    return signatureExpiresInSeconds;
  }

  public boolean isPublicAccess() {
    return publicAccess;
  }

  public boolean isDefaultConfig() {
    return defaultConfig;
  }

  public UUID getAdminId() {
    return adminId;
  }

  public Long getTotalStorageBytes() {
    return totalStorageBytes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
