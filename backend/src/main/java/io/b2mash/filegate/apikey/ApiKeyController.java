package io.b2mash.filegate.apikey;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ApiKeyController {

  private final ApiKeyService apiKeyService;

  public ApiKeyController(ApiKeyService apiKeyService) {
    this.apiKeyService = apiKeyService;
  }

  @GetMapping("/api/admin/api-keys")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<List<ApiKeyResponse>> listKeys() {
    return ResponseEntity.ok(apiKeyService.listKeys().stream().map(ApiKeyResponse::from).toList());
  }

  @PostMapping("/api/admin/api-keys")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ApiKeyResponse> createKey(@RequestBody Map<String, Object> body) {
    return ResponseEntity.status(201).body(ApiKeyResponse.from(apiKeyService.create(body)));
  }

  @PutMapping("/api/admin/api-keys/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ApiKeyResponse> updateKey(
      @PathVariable UUID id, @RequestBody Map<String, Object> body) {
    return ResponseEntity.ok(ApiKeyResponse.from(apiKeyService.update(id, body)));
  }

  @DeleteMapping("/api/admin/api-keys/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteKey(@PathVariable UUID id) {
    apiKeyService.delete(id);
    return ResponseEntity.noContent().build();
  }

  public record ApiKeyResponse(
      UUID id,
      String name,
      String key,
      @JsonProperty("key_masked") String keyMasked,
      @JsonProperty("text_permission") boolean textPermission,
      @JsonProperty("file_permission") boolean filePermission,
      @JsonProperty("mount_permission") boolean mountPermission,
      @JsonProperty("basic_path") String basicPath,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("expires_at") Instant expiresAt,
      @JsonProperty("last_used") Instant lastUsed) {

    public static ApiKeyResponse from(ApiKey apiKey) {
      String key = apiKey.getKeyValue();
      return new ApiKeyResponse(
          apiKey.getId(),
          apiKey.getName(),
          key,
          key.substring(0, Math.min(6, key.length())) + "...",
          apiKey.isTextPermission(),
          apiKey.isFilePermission(),
          apiKey.isMountPermission(),
          apiKey.getBasicPath(),
          apiKey.getCreatedAt(),
          apiKey.getExpiresAt(),
          apiKey.getLastUsed());
    }
  }
}
