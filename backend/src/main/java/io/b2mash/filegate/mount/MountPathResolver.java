package io.b2mash.filegate.mount;

import io.b2mash.filegate.apikey.ApiKeyScope;
import io.b2mash.filegate.exception.ForbiddenException;
import io.b2mash.filegate.storageconfig.StorageConfig;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps an API key's basic path onto the administrator's mount points.
 *
 * <p>A mount is reachable from a basic path when the basic path is the root, when the mount sits at
 * or below the basic path, or when the mount is an ancestor of the basic path. Uploads into a
 * config resolve through the longest mount that contains the basic path; the remainder becomes the
 * key prefix inside the bucket.
 */
@Service
public class MountPathResolver {

  private static final Logger log = LoggerFactory.getLogger(MountPathResolver.class);

  private final StorageMountRepository storageMountRepository;

  public MountPathResolver(StorageMountRepository storageMountRepository) {
    this.storageMountRepository = storageMountRepository;
  }

  /** Active mounts the basic path can see, in sort order then name. */
  @Transactional(readOnly = true)
  public List<MountCandidate> accessibleMounts(String basicPath) {
    var candidates = storageMountRepository.findActiveCandidates();

    var hidden =
        candidates.stream().filter(m -> m.isS3() && !m.isBackedByPublicConfig()).toList();
    if (!hidden.isEmpty()) {
      log.info(
          "Hiding {} S3 mount(s) backed by non-public configs: {}",
          hidden.size(),
          hidden.stream().map(MountCandidate::name).collect(Collectors.joining(", ")));
    }

    String basic = normalize(basicPath);
    return candidates.stream()
        .filter(m -> !m.isS3() || m.isBackedByPublicConfig())
        .filter(m -> isAccessible(basic, normalize(m.mountPath())))
        .toList();
  }

  /**
   * Resolves the bucket-relative prefix for uploads by {@code scope} into {@code config}. The
   * result is empty or ends with a slash.
   *
   * @throws ForbiddenException if no accessible mount is bound to the config
   */
  @Transactional(readOnly = true)
  public String resolvePrefix(ApiKeyScope scope, StorageConfig config) {
    String basic = normalize(scope.basicPath());
    if (ApiKeyScope.ROOT_PATH.equals(basic)) {
      return "";
    }

    var configMounts =
        accessibleMounts(basic).stream()
            .filter(m -> config.getId().equals(m.storageConfigId()))
            .toList();
    if (configMounts.isEmpty()) {
      log.warn("Basic path {} has no accessible mount on storage config {}", basic, config.getId());
      throw new ForbiddenException(
          "Storage config not accessible",
          "Storage config " + config.getId() + " is outside the key's basic path");
    }

    return configMounts.stream()
        .map(m -> normalize(m.mountPath()))
        .sorted(Comparator.comparingInt(String::length).reversed())
        .filter(mountPath -> mountPath.equals(basic) || isAncestor(mountPath, basic))
        .findFirst()
        .map(mountPath -> S3SubPathNormalizer.normalize(subPath(mountPath, basic)))
        .orElse("");
  }

  static String normalize(String path) {
    if (path == null || path.isBlank()) {
      return ApiKeyScope.ROOT_PATH;
    }
    String trimmed = path.trim();
    if (!trimmed.startsWith("/")) {
      trimmed = "/" + trimmed;
    }
    while (trimmed.length() > 1 && trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  static boolean isAccessible(String basicPath, String mountPath) {
    if (ApiKeyScope.ROOT_PATH.equals(basicPath)) {
      return true;
    }
    return mountPath.equals(basicPath)
        || isAncestor(basicPath, mountPath)
        || isAncestor(mountPath, basicPath);
  }

  private static boolean isAncestor(String ancestor, String path) {
    if (ApiKeyScope.ROOT_PATH.equals(ancestor)) {
      return !ApiKeyScope.ROOT_PATH.equals(path);
    }
    return path.startsWith(ancestor + "/");
  }

  private static String subPath(String mountPath, String basicPath) {
    if (ApiKeyScope.ROOT_PATH.equals(mountPath)) {
      return basicPath;
    }
    return basicPath.substring(mountPath.length());
  }
}
