package io.b2mash.filegate.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * In-process cache sizing.
 *
 * @param clientTtl how long an S3 client built for a storage config is reused
 * @param clientMaxSize maximum number of cached S3 clients
 * @param listingTtl lifetime of a cached directory listing
 * @param listingMaxSize maximum number of cached directory listings
 */
@ConfigurationProperties(prefix = "filegate.cache")
public record CacheProperties(
    Duration clientTtl, long clientMaxSize, Duration listingTtl, long listingMaxSize) {

  public CacheProperties {
    if (clientTtl == null) {
      clientTtl = Duration.ofMinutes(30);
    }
    if (clientMaxSize <= 0) {
      clientMaxSize = 100;
    }
    if (listingTtl == null) {
      listingTtl = Duration.ofMinutes(5);
    }
    if (listingMaxSize <= 0) {
      listingMaxSize = 10_000;
    }
  }
}
