package io.b2mash.filegate.file;

import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.exception.ResourceConflictException;
import io.b2mash.filegate.exception.SlugExhaustedException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Validates a caller-chosen slug or generates a free one. Nothing is reserved: two requests can be
 * handed the same slug and the unique index on {@code files.slug} settles the race.
 */
@Component
public class SlugAllocator {

  private static final Logger log = LoggerFactory.getLogger(SlugAllocator.class);

  public static final Pattern SLUG_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
  static final int GENERATED_LENGTH = 6;
  static final int MAX_ATTEMPTS = 10;

  private final FileRecordRepository fileRecordRepository;
  private final ShortIdGenerator shortIdGenerator;

  public SlugAllocator(
      FileRecordRepository fileRecordRepository, ShortIdGenerator shortIdGenerator) {
    this.fileRecordRepository = fileRecordRepository;
    this.shortIdGenerator = shortIdGenerator;
  }

  /**
   * @param customSlug caller-supplied slug, or null/blank to generate one
   * @param override whether an existing record with {@code customSlug} may be replaced
   * @throws InvalidRequestException if the custom slug has characters outside {@code [A-Za-z0-9_-]}
   * @throws ResourceConflictException if the custom slug is taken and override is off
   * @throws SlugExhaustedException if no free slug turned up within the attempt budget
   */
  @Transactional(readOnly = true)
  public String allocate(String customSlug, boolean override) {
    if (customSlug != null && !customSlug.isBlank()) {
      String slug = customSlug.trim();
      validate(slug);
      if (!override && fileRecordRepository.existsBySlug(slug)) {
        throw new ResourceConflictException(
            "Slug already in use",
            "Slug '" + slug + "' is already in use. Choose another or enable override.");
      }
      return slug;
    }

    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      String candidate = shortIdGenerator.generate(GENERATED_LENGTH);
      if (!fileRecordRepository.existsBySlug(candidate)) {
        return candidate;
      }
      log.debug("Generated slug {} collided on attempt {}", candidate, attempt);
    }
    log.warn("Slug generation exhausted after {} attempts", MAX_ATTEMPTS);
    throw new SlugExhaustedException(MAX_ATTEMPTS);
  }

  public static void validate(String slug) {
    if (!SLUG_PATTERN.matcher(slug).matches()) {
      throw new InvalidRequestException(
          "Invalid slug",
          "Slug may only contain letters, digits, underscores and hyphens");
    }
  }
}
