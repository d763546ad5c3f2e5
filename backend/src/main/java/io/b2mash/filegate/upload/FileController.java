package io.b2mash.filegate.upload;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.file.FileRecordUpdate;
import io.b2mash.filegate.security.Uploader;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FileController {

  private final FileMaintenanceService fileMaintenanceService;

  public FileController(FileMaintenanceService fileMaintenanceService) {
    this.fileMaintenanceService = fileMaintenanceService;
  }

  @PatchMapping("/api/files/{id}")
  @PreAuthorize("hasAnyAuthority('ROLE_ADMIN', 'PERM_FILE')")
  public ResponseEntity<FileResponse> updateFile(
      @PathVariable UUID id,
      @RequestBody Map<String, Object> body,
      @AuthenticationPrincipal Uploader uploader) {
    var updated = fileMaintenanceService.update(uploader, id, FileRecordUpdate.fromFields(body));
    return ResponseEntity.ok(FileResponse.from(updated));
  }

  @DeleteMapping("/api/files/{id}")
  @PreAuthorize("hasAnyAuthority('ROLE_ADMIN', 'PERM_FILE')")
  public ResponseEntity<Void> deleteFile(
      @PathVariable UUID id, @AuthenticationPrincipal Uploader uploader) {
    fileMaintenanceService.delete(uploader, id);
    return ResponseEntity.noContent().build();
  }

  public record FileResponse(
      UUID id,
      String slug,
      String filename,
      String mimetype,
      long size,
      String remark,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("updated_at") Instant updatedAt,
      @JsonProperty("requires_password") boolean requiresPassword,
      int views,
      @JsonProperty("max_views") Integer maxViews,
      @JsonProperty("expires_at") Instant expiresAt,
      @JsonProperty("use_proxy") boolean useProxy,
      @JsonProperty("created_by") String createdBy) {

    public static FileResponse from(FileRecord record) {
      return new FileResponse(
          record.getId(),
          record.getSlug(),
          record.getFilename(),
          record.getMimetype(),
          record.getSize(),
          record.getRemark(),
          record.getCreatedAt(),
          record.getUpdatedAt(),
          record.requiresPassword(),
          record.getViews(),
          record.getMaxViews(),
          record.getExpiresAt(),
          record.isUseProxy(),
          record.getCreatedBy());
    }
  }
}
