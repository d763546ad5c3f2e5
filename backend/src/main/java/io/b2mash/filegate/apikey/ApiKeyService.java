package io.b2mash.filegate.apikey;

import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.exception.ResourceConflictException;
import io.b2mash.filegate.exception.ResourceNotFoundException;
import io.b2mash.filegate.file.ExpiryPolicy;
import io.b2mash.filegate.file.FileValues;
import io.b2mash.filegate.file.ShortIdGenerator;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and maintains API keys. Keys carry a basic path and capability flags; expired keys are
 * purged whenever they are listed or presented.
 */
@Service
public class ApiKeyService {

  private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);

  static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
  static final int GENERATED_KEY_LENGTH = 12;
  static final Duration DEFAULT_LIFETIME = Duration.ofDays(1);

  private final ApiKeyRepository apiKeyRepository;
  private final ShortIdGenerator shortIdGenerator;

  public ApiKeyService(ApiKeyRepository apiKeyRepository, ShortIdGenerator shortIdGenerator) {
    this.apiKeyRepository = apiKeyRepository;
    this.shortIdGenerator = shortIdGenerator;
  }

  @Transactional
  public List<ApiKey> listKeys() {
    int purged = apiKeyRepository.deleteExpired(Instant.now());
    if (purged > 0) {
      log.info("Purged {} expired API key(s)", purged);
    }
    return apiKeyRepository.findAllByOrderByCreatedAtDesc();
  }

  /**
   * Creates a key from snake_case request fields. An absent {@code expires_at} means one day from
   * now; null or {@code never} means it never expires.
   */
  @Transactional
  public ApiKey create(Map<String, Object> fields) {
    String name = asString(fields.get("name"));
    if (name == null || name.isBlank()) {
      throw new InvalidRequestException("Invalid name", "Key name must not be empty");
    }
    name = name.trim();
    if (apiKeyRepository.existsByName(name)) {
      throw new ResourceConflictException(
          "Name already in use", "A key named '" + name + "' exists");
    }

    String keyValue = asString(fields.get("custom_key"));
    if (keyValue != null && !keyValue.isEmpty()) {
      validateKeyFormat(keyValue);
      if (apiKeyRepository.existsByKeyValue(keyValue)) {
        throw new ResourceConflictException("Key already in use", "Choose a different custom key");
      }
    } else {
      keyValue = shortIdGenerator.generate(GENERATED_KEY_LENGTH);
    }

    Instant expiresAt =
        fields.containsKey("expires_at")
            ? ExpiryPolicy.parseExplicit(asString(fields.get("expires_at")))
            : Instant.now().plus(DEFAULT_LIFETIME);

    String basicPath = asString(fields.get("basic_path"));
    var apiKey =
        new ApiKey(
            name,
            keyValue,
            basicPath == null || basicPath.isBlank() ? ApiKeyScope.ROOT_PATH : basicPath.trim(),
            expiresAt);
    apiKey.grant(
        FileValues.flag(fields.get("text_permission"), false),
        FileValues.flag(fields.get("file_permission"), false),
        FileValues.flag(fields.get("mount_permission"), false));
    apiKey = apiKeyRepository.save(apiKey);
    log.info("Created API key {} ({})", apiKey.getId(), apiKey.getName());
    return apiKey;
  }

  /** Applies only the supplied fields. */
  @Transactional
  public ApiKey update(UUID id, Map<String, Object> fields) {
    var apiKey =
        apiKeyRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("ApiKey", id));
    boolean changed = false;

    if (fields.containsKey("name")) {
      String name = asString(fields.get("name"));
      if (name == null || name.isBlank()) {
        throw new InvalidRequestException("Invalid name", "Key name must not be empty");
      }
      name = name.trim();
      if (apiKeyRepository.existsByNameAndIdNot(name, id)) {
        throw new ResourceConflictException(
            "Name already in use", "A key named '" + name + "' exists");
      }
      apiKey.rename(name);
      changed = true;
    }
    if (fields.containsKey("text_permission")) {
      apiKey.changeTextPermission(FileValues.flag(fields.get("text_permission"), false));
      changed = true;
    }
    if (fields.containsKey("file_permission")) {
      apiKey.changeFilePermission(FileValues.flag(fields.get("file_permission"), false));
      changed = true;
    }
    if (fields.containsKey("mount_permission")) {
      apiKey.changeMountPermission(FileValues.flag(fields.get("mount_permission"), false));
      changed = true;
    }
    if (fields.containsKey("basic_path")) {
      String basicPath = asString(fields.get("basic_path"));
      apiKey.changeBasicPath(
          basicPath == null || basicPath.isBlank() ? ApiKeyScope.ROOT_PATH : basicPath.trim());
      changed = true;
    }
    if (fields.containsKey("expires_at")) {
      apiKey.changeExpiry(ExpiryPolicy.parseExplicit(asString(fields.get("expires_at"))));
      changed = true;
    }

    if (!changed) {
      throw new InvalidRequestException("Nothing to update", "Supply at least one field to change");
    }
    return apiKeyRepository.save(apiKey);
  }

  @Transactional
  public void delete(UUID id) {
    if (!apiKeyRepository.existsById(id)) {
      throw new ResourceNotFoundException("ApiKey", id);
    }
    apiKeyRepository.deleteById(id);
    log.info("Deleted API key {}", id);
  }

  /**
   * Looks up a presented key. Expired keys are deleted and treated as unknown; live keys get their
   * last-used time stamped.
   */
  @Transactional
  public Optional<ApiKey> authenticate(String keyValue) {
    if (keyValue == null || keyValue.isBlank()) {
      return Optional.empty();
    }
    var found = apiKeyRepository.findByKeyValue(keyValue.trim());
    if (found.isEmpty()) {
      return Optional.empty();
    }
    var apiKey = found.get();
    if (apiKey.isExpired()) {
      log.info("Rejected expired API key {} and removed it", apiKey.getId());
      apiKeyRepository.delete(apiKey);
      return Optional.empty();
    }
    apiKey.markUsed();
    return Optional.of(apiKeyRepository.save(apiKey));
  }

  static void validateKeyFormat(String keyValue) {
    if (!KEY_PATTERN.matcher(keyValue).matches()) {
      throw new InvalidRequestException(
          "Invalid key", "Keys may only contain letters, digits, underscores and hyphens");
    }
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }
}
