package io.b2mash.filegate.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.filegate.apikey.ApiKeyScope;
import io.b2mash.filegate.exception.ForbiddenException;
import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.exception.StorageCapacityExceededException;
import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.file.FileRecordService;
import io.b2mash.filegate.file.NewFileRecord;
import io.b2mash.filegate.file.QuotaGuard;
import io.b2mash.filegate.file.ShortIdGenerator;
import io.b2mash.filegate.file.SlugAllocator;
import io.b2mash.filegate.mount.MountPathResolver;
import io.b2mash.filegate.security.Uploader;
import io.b2mash.filegate.settings.UploadLimits;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storage.PresignedUrl;
import io.b2mash.filegate.storageconfig.ProviderKind;
import io.b2mash.filegate.storageconfig.StorageConfig;
import io.b2mash.filegate.storageconfig.StorageConfigSelector;
import io.b2mash.filegate.testutil.TestEntities;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UploadIntentServiceTest {

  @Mock private StorageConfigSelector storageConfigSelector;
  @Mock private MountPathResolver mountPathResolver;
  @Mock private UploadLimits uploadLimits;
  @Mock private QuotaGuard quotaGuard;
  @Mock private SlugAllocator slugAllocator;
  @Mock private OverrideCleaner overrideCleaner;
  @Mock private ShortIdGenerator shortIdGenerator;
  @Mock private ObjectStorage objectStorage;
  @Mock private FileRecordService fileRecordService;

  private UploadIntentService service;

  private final ApiKeyScope scope = new ApiKeyScope("/team/c", false, true, false);
  private final Uploader uploader = Uploader.apiKey(UUID.randomUUID(), scope);
  private final StorageConfig config = TestEntities.publicConfig(null);

  @BeforeEach
  void setUp() {
    service =
        new UploadIntentService(
            storageConfigSelector,
            mountPathResolver,
            uploadLimits,
            quotaGuard,
            slugAllocator,
            overrideCleaner,
            new StorageKeyBuilder(shortIdGenerator),
            objectStorage,
            fileRecordService);
  }

  private PresignCommand command(String slug, boolean override) {
    return new PresignCommand(config.getId(), "notes.txt", 42L, "drafts", slug, override);
  }

  private void stubResolution(String slug, boolean override) {
    when(storageConfigSelector.select(uploader, config.getId())).thenReturn(config);
    when(mountPathResolver.resolvePrefix(scope, config)).thenReturn("c/");
    when(slugAllocator.allocate(slug, override)).thenReturn(slug == null ? "Gen123" : slug);
  }

  private void stubPresign() {
    when(shortIdGenerator.generate(6)).thenReturn("Ab12Cd");
    when(objectStorage.presignPut(config, "c/drafts/Ab12Cd-notes.txt", "text/plain"))
        .thenReturn(new PresignedUrl("https://signed/put", Instant.now().plusSeconds(3600)));
    when(objectStorage.buildPublicUrl(config, "c/drafts/Ab12Cd-notes.txt"))
        .thenReturn("https://bucket/c/drafts/Ab12Cd-notes.txt");
    when(fileRecordService.insertPlaceholder(any()))
        .thenAnswer(
            inv -> {
              NewFileRecord values = inv.getArgument(0);
              var record =
                  new FileRecord(
                      values.slug(),
                      values.filename(),
                      values.storagePath(),
                      values.s3Url(),
                      values.storageConfigId(),
                      values.mimetype(),
                      values.createdBy());
              return TestEntities.withId(record, UUID.randomUUID());
            });
  }

  @Test
  void presign_reservesPlaceholderUnderMountPrefix() {
    stubResolution(null, false);
    stubPresign();

    var result = service.presign(uploader, command(null, false));

    assertThat(result.fileId()).isNotNull();
    assertThat(result.uploadUrl()).isEqualTo("https://signed/put");
    assertThat(result.storagePath()).isEqualTo("c/drafts/Ab12Cd-notes.txt");
    assertThat(result.slug()).isEqualTo("Gen123");
    assertThat(result.contentType()).isEqualTo("text/plain");
    assertThat(result.providerKind()).isEqualTo(ProviderKind.AWS_S3);

    var values = ArgumentCaptor.forClass(NewFileRecord.class);
    verify(fileRecordService).insertPlaceholder(values.capture());
    assertThat(values.getValue().createdBy()).isEqualTo(uploader.creatorTag());
    assertThat(values.getValue().size()).isZero();
    assertThat(values.getValue().etag()).isNull();
    verify(uploadLimits).checkSize(42);
    verify(quotaGuard).admit(config, 42);
  }

  @Test
  void presign_overrideClaimsAndRemovesOwnRecordFirst() {
    var existing = TestEntities.fileRecord("mine", config, uploader.creatorTag());
    stubResolution("mine", true);
    stubPresign();
    when(overrideCleaner.claim("mine", uploader)).thenReturn(Optional.of(existing));

    service.presign(uploader, command("mine", true));

    verify(overrideCleaner).remove(existing);
  }

  @Test
  void presign_overrideOfForeignSlugIsForbidden() {
    stubResolution("theirs", true);
    when(overrideCleaner.claim("theirs", uploader))
        .thenThrow(new ForbiddenException("Override not allowed", "not yours"));

    assertThatThrownBy(() -> service.presign(uploader, command("theirs", true)))
        .isInstanceOf(ForbiddenException.class);
    verify(fileRecordService, never()).insertPlaceholder(any());
  }

  @Test
  void presign_quotaRejectionStopsBeforeSlugAllocation() {
    when(storageConfigSelector.select(uploader, config.getId())).thenReturn(config);
    when(mountPathResolver.resolvePrefix(scope, config)).thenReturn("c/");
    when(quotaGuard.admit(config, 42))
        .thenThrow(new StorageCapacityExceededException(10, 42, 100, "full"));

    assertThatThrownBy(() -> service.presign(uploader, command(null, false)))
        .isInstanceOf(StorageCapacityExceededException.class);
    verify(slugAllocator, never()).allocate(any(), anyBoolean());
    verify(objectStorage, never()).presignPut(any(), any(), any());
  }

  @Test
  void presign_requiresStorageConfigId() {
    var command = new PresignCommand(null, "notes.txt", 1L, null, null, false);

    assertThatThrownBy(() -> service.presign(uploader, command))
        .isInstanceOf(InvalidRequestException.class);
    verify(storageConfigSelector, never()).select(any(), any());
  }

  @Test
  void presign_rejectsMountOutsideBasicPath() {
    when(storageConfigSelector.select(uploader, config.getId())).thenReturn(config);
    doThrow(new ForbiddenException("Storage config not accessible", "outside"))
        .when(mountPathResolver)
        .resolvePrefix(scope, config);

    assertThatThrownBy(() -> service.presign(uploader, command(null, false)))
        .isInstanceOf(ForbiddenException.class);
    verify(quotaGuard, never()).admit(any(), anyLong());
  }
}
