package io.b2mash.filegate.upload;

import io.b2mash.filegate.storageconfig.ProviderKind;
import java.util.UUID;

public record PresignResult(
    UUID fileId,
    String uploadUrl,
    String storagePath,
    String s3Url,
    String slug,
    ProviderKind providerKind,
    String contentType) {}
