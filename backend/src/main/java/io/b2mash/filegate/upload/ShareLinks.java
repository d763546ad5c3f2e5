package io.b2mash.filegate.upload;

/**
 * Every way a committed file can be reached. {@code previewUrl}/{@code downloadUrl} repeat either
 * the proxy or the direct pair depending on the record's proxy flag.
 */
public record ShareLinks(
    String proxyPreviewUrl,
    String proxyDownloadUrl,
    String directPreviewUrl,
    String directDownloadUrl,
    String previewUrl,
    String downloadUrl) {}
