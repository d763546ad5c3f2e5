package io.b2mash.filegate.directory;

import io.b2mash.filegate.storageconfig.StorageConfig;
import io.b2mash.filegate.upload.dispatch.UploadDispatcher;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Refreshes the modification time of every directory above a newly written key by rewriting its
 * zero-byte folder marker through the provider's upload strategy. Failures are logged and skipped.
 */
@Service
public class DirectoryTimestampService {

  private static final Logger log = LoggerFactory.getLogger(DirectoryTimestampService.class);

  static final String DIRECTORY_CONTENT_TYPE = "application/x-directory";
  private static final byte[] EMPTY = new byte[0];

  private final UploadDispatcher uploadDispatcher;

  public DirectoryTimestampService(UploadDispatcher uploadDispatcher) {
    this.uploadDispatcher = uploadDispatcher;
  }

  /** Returns how many markers were written. */
  public int touchAncestors(StorageConfig config, String key) {
    int touched = 0;
    for (String directory : ancestorsOf(key)) {
      try {
        uploadDispatcher.put(config, directory, EMPTY, DIRECTORY_CONTENT_TYPE);
        touched++;
      } catch (RuntimeException e) {
        log.warn(
            "Could not refresh directory marker {} on config {}: {}",
            directory,
            config.getId(),
            e.getMessage());
      }
    }
    return touched;
  }

  /** {@code a/b/c.txt} yields {@code a/}, {@code a/b/}. */
  static List<String> ancestorsOf(String key) {
    var ancestors = new ArrayList<String>();
    if (key == null) {
      return ancestors;
    }
    String trimmed = key.startsWith("/") ? key.substring(1) : key;
    int index = trimmed.indexOf('/');
    while (index > 0) {
      ancestors.add(trimmed.substring(0, index + 1));
      index = trimmed.indexOf('/', index + 1);
    }
    return ancestors;
  }
}
