package io.b2mash.filegate.mount;

/** Turns a mount-relative sub-path into an S3 key prefix: no leading slash, one trailing slash. */
public final class S3SubPathNormalizer {

  private S3SubPathNormalizer() {}

  public static String normalize(String subPath) {
    if (subPath == null) {
      return "";
    }
    String normalized = subPath.trim().replaceAll("/{2,}", "/").replaceAll("^/+", "");
    if (normalized.isEmpty()) {
      return "";
    }
    return normalized.endsWith("/") ? normalized : normalized + "/";
  }
}
