package io.b2mash.filegate.upload;

import java.util.UUID;

/** One {@code PUT /api/upload-direct/{filename}} request. */
public record DirectUploadCommand(
    String filename,
    byte[] content,
    String declaredContentType,
    UUID storageConfigId,
    String slug,
    String path,
    String remark,
    String password,
    Integer expiresInHours,
    Integer maxViews,
    boolean override,
    boolean keepOriginalFilename,
    boolean useProxy) {}
