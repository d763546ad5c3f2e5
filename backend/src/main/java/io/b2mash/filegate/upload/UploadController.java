package io.b2mash.filegate.upload;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.filegate.file.FileValues;
import io.b2mash.filegate.security.Uploader;
import io.b2mash.filegate.storageconfig.ProviderKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class UploadController {

  private final UploadIntentService uploadIntentService;
  private final CommitCoordinator commitCoordinator;
  private final DirectUploadService directUploadService;
  private final BaseUrlResolver baseUrlResolver;

  public UploadController(
      UploadIntentService uploadIntentService,
      CommitCoordinator commitCoordinator,
      DirectUploadService directUploadService,
      BaseUrlResolver baseUrlResolver) {
    this.uploadIntentService = uploadIntentService;
    this.commitCoordinator = commitCoordinator;
    this.directUploadService = directUploadService;
    this.baseUrlResolver = baseUrlResolver;
  }

  @PostMapping("/api/s3/presign")
  @PreAuthorize("hasAnyAuthority('ROLE_ADMIN', 'PERM_FILE')")
  public ResponseEntity<PresignResponse> presign(
      @Valid @RequestBody PresignRequest request, @AuthenticationPrincipal Uploader uploader) {
    var result =
        uploadIntentService.presign(
            uploader,
            new PresignCommand(
                request.storageConfigId(),
                request.filename(),
                request.size(),
                request.path(),
                request.slug(),
                Boolean.TRUE.equals(request.override())));
    return ResponseEntity.ok(PresignResponse.from(result));
  }

  @PostMapping("/api/s3/commit")
  @PreAuthorize("hasAnyAuthority('ROLE_ADMIN', 'PERM_FILE')")
  public ResponseEntity<UploadResponse> commit(
      @Valid @RequestBody CommitRequest request, @AuthenticationPrincipal Uploader uploader) {
    var receipt =
        commitCoordinator.commit(
            uploader,
            new CommitCommand(
                request.fileId(),
                request.etag(),
                request.size(),
                request.password(),
                request.expiresIn(),
                request.remark(),
                request.maxViews()),
            baseUrlResolver.currentBaseUrl());
    return ResponseEntity.ok(UploadResponse.from(receipt));
  }

  @PutMapping("/api/upload-direct/{filename}")
  @PreAuthorize("hasAnyAuthority('ROLE_ADMIN', 'PERM_FILE')")
  public ResponseEntity<UploadResponse> uploadDirect(
      @PathVariable String filename,
      @RequestBody(required = false) byte[] body,
      @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
      @RequestParam(name = "s3_config_id", required = false) UUID storageConfigId,
      @RequestParam(required = false) String slug,
      @RequestParam(required = false) String path,
      @RequestParam(required = false) String remark,
      @RequestParam(required = false) String password,
      @RequestParam(name = "expires_in", required = false) Integer expiresIn,
      @RequestParam(name = "max_views", required = false) Integer maxViews,
      @RequestParam(required = false) String override,
      @RequestParam(name = "original_filename", required = false) String originalFilename,
      @RequestParam(name = "use_proxy", required = false) String useProxy,
      @AuthenticationPrincipal Uploader uploader) {
    var receipt =
        directUploadService.upload(
            uploader,
            new DirectUploadCommand(
                filename,
                body,
                contentType,
                storageConfigId,
                slug,
                path,
                remark,
                password,
                expiresIn,
                maxViews,
                FileValues.flag(override, false),
                "true".equalsIgnoreCase(originalFilename),
                FileValues.flag(useProxy, true)),
            baseUrlResolver.currentBaseUrl());
    return ResponseEntity.ok(UploadResponse.from(receipt));
  }

  public record PresignRequest(
      @NotNull(message = "s3_config_id is required") @JsonProperty("s3_config_id")
          UUID storageConfigId,
      @NotBlank(message = "filename is required")
          @Size(max = 500, message = "filename must be at most 500 characters")
          String filename,
      Long size,
      String path,
      String slug,
      Boolean override) {}

  public record CommitRequest(
      @NotNull(message = "file_id is required") @JsonProperty("file_id") UUID fileId,
      String etag,
      Long size,
      String password,
      @JsonProperty("expires_in") Integer expiresIn,
      String remark,
      @JsonProperty("max_views") Integer maxViews) {}

  public record PresignResponse(
      @JsonProperty("file_id") UUID fileId,
      @JsonProperty("upload_url") String uploadUrl,
      @JsonProperty("storage_path") String storagePath,
      @JsonProperty("s3_url") String s3Url,
      String slug,
      @JsonProperty("provider_type") ProviderKind providerType,
      String contentType) {

    public static PresignResponse from(PresignResult result) {
      return new PresignResponse(
          result.fileId(),
          result.uploadUrl(),
          result.storagePath(),
          result.s3Url(),
          result.slug(),
          result.providerKind(),
          result.contentType());
    }
  }

  public record UploadResponse(
      UUID id,
      String slug,
      String filename,
      String mimetype,
      long size,
      String remark,
      @JsonProperty("storage_path") String storagePath,
      @JsonProperty("s3_url") String s3Url,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("updated_at") Instant updatedAt,
      @JsonProperty("requires_password") boolean requiresPassword,
      int views,
      @JsonProperty("max_views") Integer maxViews,
      @JsonProperty("expires_at") Instant expiresAt,
      String url,
      String previewUrl,
      String downloadUrl,
      @JsonProperty("s3_direct_preview_url") String directPreviewUrl,
      @JsonProperty("s3_direct_download_url") String directDownloadUrl,
      @JsonProperty("proxy_preview_url") String proxyPreviewUrl,
      @JsonProperty("proxy_download_url") String proxyDownloadUrl,
      @JsonProperty("use_proxy") boolean useProxy,
      @JsonProperty("created_by") String createdBy,
      @JsonProperty("used_original_filename") boolean usedOriginalFilename) {

    public static UploadResponse from(UploadReceipt receipt) {
      var record = receipt.record();
      var links = receipt.links();
      return new UploadResponse(
          record.getId(),
          record.getSlug(),
          record.getFilename(),
          record.getMimetype(),
          record.getSize(),
          record.getRemark(),
          record.getStoragePath(),
          record.getS3Url(),
          record.getCreatedAt(),
          record.getUpdatedAt(),
          record.requiresPassword(),
          record.getViews(),
          record.getMaxViews(),
          record.getExpiresAt(),
          "/file/" + record.getSlug(),
          links.previewUrl(),
          links.downloadUrl(),
          links.directPreviewUrl(),
          links.directDownloadUrl(),
          links.proxyPreviewUrl(),
          links.proxyDownloadUrl(),
          record.isUseProxy(),
          record.getCreatedBy(),
          receipt.usedOriginalFilename());
    }
  }
}
