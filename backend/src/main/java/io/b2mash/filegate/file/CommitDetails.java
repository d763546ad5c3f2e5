package io.b2mash.filegate.file;

import java.time.Instant;

/**
 * Values reported when a presigned upload is confirmed. A null {@code size} keeps the placeholder's
 * size; a null {@code password} leaves the record unprotected.
 */
public record CommitDetails(
    String etag,
    Long size,
    String creatorTag,
    String remark,
    String password,
    Instant expiresAt,
    Integer maxViews) {}
