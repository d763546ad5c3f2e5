package io.b2mash.filegate.upload;

import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storageconfig.StorageConfig;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

@Component
public class ShareLinkBuilder {

  private final ObjectStorage objectStorage;

  public ShareLinkBuilder(ObjectStorage objectStorage) {
    this.objectStorage = objectStorage;
  }

  /**
   * @param baseUrl scheme and host the proxy endpoints are served from, without trailing slash
   * @param password plaintext set on this request, appended to proxy links; may be null
   */
  public ShareLinks build(
      StorageConfig config, FileRecord record, String baseUrl, String password) {
    String query =
        password == null || password.isEmpty()
            ? ""
            : "?password=" + UriUtils.encodeQueryParam(password, StandardCharsets.UTF_8);
    String proxyPreview = baseUrl + "/api/file-view/" + record.getSlug() + query;
    String proxyDownload = baseUrl + "/api/file-download/" + record.getSlug() + query;

    String directPreview =
        objectStorage
            .presignGet(
                config,
                record.getStoragePath(),
                record.getFilename(),
                false,
                record.getMimetype(),
                false)
            .url();
    String directDownload =
        objectStorage
            .presignGet(
                config,
                record.getStoragePath(),
                record.getFilename(),
                true,
                record.getMimetype(),
                false)
            .url();

    return record.isUseProxy()
        ? new ShareLinks(
            proxyPreview, proxyDownload, directPreview, directDownload, proxyPreview, proxyDownload)
        : new ShareLinks(
            proxyPreview,
            proxyDownload,
            directPreview,
            directDownload,
            directPreview,
            directDownload);
  }
}
