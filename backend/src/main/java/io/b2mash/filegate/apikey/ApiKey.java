package io.b2mash.filegate.apikey;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "api_keys")
public class ApiKey {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, unique = true, length = 200)
  private String name;

  @Column(name = "key_value", nullable = false, unique = true, length = 200)
  private String keyValue;

  @Column(name = "text_permission", nullable = false)
  private boolean textPermission;

  @Column(name = "file_permission", nullable = false)
  private boolean filePermission;

  @Column(name = "mount_permission", nullable = false)
  private boolean mountPermission;

  @Column(name = "basic_path", nullable = false, length = 500)
  private String basicPath;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "last_used")
  private Instant lastUsed;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ApiKey() {}

  public ApiKey(String name, String keyValue, String basicPath, Instant expiresAt) {
    this.name = name;
    this.keyValue = keyValue;
    this.basicPath = basicPath;
    this.expiresAt = expiresAt;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  public void grant(boolean textPermission, boolean filePermission, boolean mountPermission) {
    this.textPermission = textPermission;
    this.filePermission = filePermission;
    this.mountPermission = mountPermission;
  }

  public void rename(String name) {
    this.name = name;
  }

  public void changeTextPermission(boolean textPermission) {
    this.textPermission = textPermission;
  }

  public void changeFilePermission(boolean filePermission) {
    this.filePermission = filePermission;
  }

  public void changeMountPermission(boolean mountPermission) {
    this.mountPermission = mountPermission;
  }

  public void changeBasicPath(String basicPath) {
    this.basicPath = basicPath;
  }

  public void changeExpiry(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  public void markUsed() {
    this.lastUsed = Instant.now();
  }

  public boolean isExpired() {
    return expiresAt != null && expiresAt.isBefore(Instant.now());
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getKeyValue() {
    return keyValue;
  }

  public boolean isTextPermission() {
    return textPermission;
  }

  public boolean isFilePermission() {
    return filePermission;
  }

  public boolean isMountPermission() {
    return mountPermission;
  }

  public String getBasicPath() {
    return basicPath;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getLastUsed() {
    return lastUsed;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
