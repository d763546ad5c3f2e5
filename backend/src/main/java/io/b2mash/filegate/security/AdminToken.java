package io.b2mash.filegate.security;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Bearer session token issued to an administrator by the login flow. */
@Entity
@Table(name = "admin_tokens")
public class AdminToken {

  @Id
  @Column(name = "token", nullable = false, length = 200)
  private String token;

  @Column(name = "admin_id", nullable = false)
  private UUID adminId;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected AdminToken() {}

  public AdminToken(String token, UUID adminId, Instant expiresAt) {
    this.token = token;
    this.adminId = adminId;
    this.expiresAt = expiresAt;
    this.createdAt = Instant.now();
  }

  public boolean isExpired() {
    return expiresAt.isBefore(Instant.now());
  }

  public String getToken() {
    return token;
  }

  public UUID getAdminId() {
    return adminId;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
