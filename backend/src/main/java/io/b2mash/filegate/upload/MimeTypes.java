package io.b2mash.filegate.upload;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/** Content types are inferred from filenames server-side; client-declared ones are advisory. */
public final class MimeTypes {

  public static final String FALLBACK = MediaType.APPLICATION_OCTET_STREAM_VALUE;

  private MimeTypes() {}

  public static String fromFilename(String filename) {
    if (filename == null || filename.isBlank()) {
      return FALLBACK;
    }
    return MediaTypeFactory.getMediaType(filename.trim())
        .map(type -> type.getType() + "/" + type.getSubtype())
        .orElse(FALLBACK);
  }

  /** {@code text/plain; charset=utf-8} becomes {@code text/plain}. */
  public static String stripParameters(String contentType) {
    if (contentType == null) {
      return null;
    }
    int separator = contentType.indexOf(';');
    String bare = separator >= 0 ? contentType.substring(0, separator) : contentType;
    return bare.trim().toLowerCase();
  }
}
