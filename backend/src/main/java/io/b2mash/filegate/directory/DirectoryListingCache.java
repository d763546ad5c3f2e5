package io.b2mash.filegate.directory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.filegate.config.CacheProperties;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Listings of mount directories, keyed by mount and virtual path. Entries expire after {@code
 * filegate.cache.listing-ttl}; uploads evict a whole mount through {@link #evictMount}.
 */
@Component
@EnableConfigurationProperties(CacheProperties.class)
public class DirectoryListingCache {

  private final Cache<ListingKey, List<DirectoryEntry>> listings;

  public DirectoryListingCache(CacheProperties cacheProperties) {
    this.listings =
        Caffeine.newBuilder()
            .maximumSize(cacheProperties.listingMaxSize())
            .expireAfterWrite(cacheProperties.listingTtl())
            .build();
  }

  public Optional<List<DirectoryEntry>> get(UUID mountId, String path) {
    return Optional.ofNullable(listings.getIfPresent(new ListingKey(mountId, path)));
  }

  public void put(UUID mountId, String path, List<DirectoryEntry> entries) {
    listings.put(new ListingKey(mountId, path), List.copyOf(entries));
  }

  /** Drops every cached path of a mount. Returns how many listings were removed. */
  public int evictMount(UUID mountId) {
    var keys =
        listings.asMap().keySet().stream().filter(k -> k.mountId().equals(mountId)).toList();
    listings.invalidateAll(keys);
    return keys.size();
  }

  private record ListingKey(UUID mountId, String path) {}
}
