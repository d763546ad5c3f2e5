package io.b2mash.filegate.upload;

import java.util.UUID;

public record PresignCommand(
    UUID storageConfigId,
    String filename,
    Long size,
    String path,
    String slug,
    boolean override) {}
