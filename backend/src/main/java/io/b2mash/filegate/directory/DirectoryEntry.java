package io.b2mash.filegate.directory;

import java.time.Instant;

/** One row of a cached mount listing. */
public record DirectoryEntry(
    String name, String path, boolean directory, long size, Instant modified) {}
