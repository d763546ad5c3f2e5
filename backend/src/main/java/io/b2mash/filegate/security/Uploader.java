package io.b2mash.filegate.security;

import io.b2mash.filegate.apikey.ApiKeyScope;
import java.util.UUID;

/**
 * The authenticated identity behind an upload. Administrators are unscoped; API keys carry the
 * {@link ApiKeyScope} they were issued with.
 */
public record Uploader(Kind kind, UUID id, ApiKeyScope scope) {

  public enum Kind {
    ADMIN("admin"),
    API_KEY("apikey");

    private final String tagPrefix;

    Kind(String tagPrefix) {
      this.tagPrefix = tagPrefix;
    }

    public String tagPrefix() {
      return tagPrefix;
    }
  }

  public static Uploader admin(UUID adminId) {
    return new Uploader(Kind.ADMIN, adminId, null);
  }

  public static Uploader apiKey(UUID apiKeyId, ApiKeyScope scope) {
    return new Uploader(Kind.API_KEY, apiKeyId, scope);
  }

  public boolean isAdmin() {
    return kind == Kind.ADMIN;
  }

  /** Creator tag persisted on file records, e.g. {@code apikey:3f2a...}. */
  public String creatorTag() {
    return kind.tagPrefix() + ":" + id;
  }

  /** Administrators resolve against the root path. */
  public ApiKeyScope effectiveScope() {
    return scope != null ? scope : new ApiKeyScope(ApiKeyScope.ROOT_PATH, true, true, true);
  }
}
