package io.b2mash.filegate.upload;

import java.util.UUID;

public record CommitCommand(
    UUID fileId,
    String etag,
    Long size,
    String password,
    Integer expiresInHours,
    String remark,
    Integer maxViews) {}
