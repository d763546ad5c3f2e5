package io.b2mash.filegate.storage;

import java.time.Instant;

public record PresignedUrl(String url, Instant expiresAt) {}
