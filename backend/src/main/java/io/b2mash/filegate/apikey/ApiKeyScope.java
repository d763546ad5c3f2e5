package io.b2mash.filegate.apikey;

/**
 * Per-request view of an API key's reach: the virtual path it is confined to plus its capability
 * flags. Never persisted on its own.
 */
public record ApiKeyScope(
    String basicPath, boolean textPermission, boolean filePermission, boolean mountPermission) {

  public static final String ROOT_PATH = "/";

  public ApiKeyScope {
    if (basicPath == null || basicPath.isBlank()) {
      basicPath = ROOT_PATH;
    }
  }

  public static ApiKeyScope of(ApiKey apiKey) {
    return new ApiKeyScope(
        apiKey.getBasicPath(),
        apiKey.isTextPermission(),
        apiKey.isFilePermission(),
        apiKey.isMountPermission());
  }

  public boolean isRoot() {
    return ROOT_PATH.equals(basicPath);
  }
}
