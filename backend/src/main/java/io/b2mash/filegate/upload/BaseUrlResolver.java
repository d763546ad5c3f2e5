package io.b2mash.filegate.upload;

import io.b2mash.filegate.config.UploadProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/** Origin used in share links: the configured public URL, else the current request's. */
@Component
@EnableConfigurationProperties(UploadProperties.class)
public class BaseUrlResolver {

  private final UploadProperties uploadProperties;

  public BaseUrlResolver(UploadProperties uploadProperties) {
    this.uploadProperties = uploadProperties;
  }

  public String currentBaseUrl() {
    String configured = uploadProperties.publicBaseUrl();
    if (configured != null && !configured.isBlank()) {
      return configured.endsWith("/")
          ? configured.substring(0, configured.length() - 1)
          : configured;
    }
    return ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
  }
}
