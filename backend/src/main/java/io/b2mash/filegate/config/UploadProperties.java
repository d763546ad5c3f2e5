package io.b2mash.filegate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upload defaults.
 *
 * @param defaultMaxUploadSizeMb limit applied when the {@code max_upload_size} setting is absent
 * @param publicBaseUrl base for share links; when blank the request's own host is used
 */
@ConfigurationProperties(prefix = "filegate.upload")
public record UploadProperties(int defaultMaxUploadSizeMb, String publicBaseUrl) {

  public UploadProperties {
    if (defaultMaxUploadSizeMb <= 0) {
      defaultMaxUploadSizeMb = 100;
    }
  }
}
