package io.b2mash.filegate.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.filegate.apikey.ApiKeyScope;
import io.b2mash.filegate.exception.ForbiddenException;
import io.b2mash.filegate.exception.InvalidRequestException;
import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.file.FileRecordService;
import io.b2mash.filegate.file.FileValues;
import io.b2mash.filegate.file.NewFileRecord;
import io.b2mash.filegate.file.QuotaGuard;
import io.b2mash.filegate.file.ShortIdGenerator;
import io.b2mash.filegate.file.SlugAllocator;
import io.b2mash.filegate.mount.MountPathResolver;
import io.b2mash.filegate.security.Uploader;
import io.b2mash.filegate.settings.UploadLimits;
import io.b2mash.filegate.storage.ObjectStorage;
import io.b2mash.filegate.storage.PresignedUrl;
import io.b2mash.filegate.storageconfig.StorageConfig;
import io.b2mash.filegate.storageconfig.StorageConfigSelector;
import io.b2mash.filegate.testutil.TestEntities;
import io.b2mash.filegate.upload.dispatch.UploadDispatcher;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class DirectUploadServiceTest {

  private static final String BASE_URL = "http://localhost:8080";
  private static final byte[] TEN_BYTES = "0123456789".getBytes();

  @Mock private StorageConfigSelector storageConfigSelector;
  @Mock private MountPathResolver mountPathResolver;
  @Mock private UploadLimits uploadLimits;
  @Mock private QuotaGuard quotaGuard;
  @Mock private SlugAllocator slugAllocator;
  @Mock private OverrideCleaner overrideCleaner;
  @Mock private ShortIdGenerator shortIdGenerator;
  @Mock private UploadDispatcher uploadDispatcher;
  @Mock private ObjectStorage objectStorage;
  @Mock private FileRecordService fileRecordService;
  @Mock private DirectoryRefresher directoryRefresher;

  private DirectUploadService service;

  private final Uploader uploader =
      Uploader.apiKey(UUID.randomUUID(), new ApiKeyScope("/", false, true, false));
  private final StorageConfig config = TestEntities.publicConfig(null);

  @BeforeEach
  void setUp() {
    service =
        new DirectUploadService(
            storageConfigSelector,
            mountPathResolver,
            uploadLimits,
            quotaGuard,
            slugAllocator,
            overrideCleaner,
            new StorageKeyBuilder(shortIdGenerator),
            uploadDispatcher,
            objectStorage,
            fileRecordService,
            directoryRefresher,
            new ShareLinkBuilder(objectStorage));
  }

  private static DirectUploadCommand command(String slug, boolean override) {
    return new DirectUploadCommand(
        "report.pdf",
        TEN_BYTES,
        "application/octet-stream",
        null,
        slug,
        null,
        null,
        null,
        null,
        null,
        override,
        false,
        true);
  }

  /** Mirrors what the record service persists for a complete insert. */
  private static FileRecord persisted(NewFileRecord values) {
    var record =
        new FileRecord(
            values.slug(),
            values.filename(),
            values.storagePath(),
            values.s3Url(),
            values.storageConfigId(),
            values.mimetype(),
            values.createdBy());
    record.completeUpload(values.etag(), values.size());
    record.expireAt(values.expiresAt());
    record.limitViews(FileValues.maxViews(values.maxViews()));
    record.routeThroughProxy(values.useProxy());
    return TestEntities.withId(record, UUID.randomUUID());
  }

  private void stubResolution(String slug, boolean override) {
    when(storageConfigSelector.select(uploader, null)).thenReturn(config);
    when(mountPathResolver.resolvePrefix(uploader.effectiveScope(), config)).thenReturn("");
    when(slugAllocator.allocate(slug, override)).thenReturn(slug == null ? "Xy12Ab" : slug);
  }

  private void stubTransfer() {
    when(shortIdGenerator.generate(6)).thenReturn("k9k9k9");
    when(uploadDispatcher.put(config, "k9k9k9-report.pdf", TEN_BYTES, "application/pdf"))
        .thenReturn("etag-1");
    when(objectStorage.buildPublicUrl(config, "k9k9k9-report.pdf"))
        .thenReturn("https://bucket.s3.us-east-1.amazonaws.com/k9k9k9-report.pdf");
  }

  private void stubShareLinks() {
    when(objectStorage.presignGet(
            eq(config),
            eq("k9k9k9-report.pdf"),
            eq("report.pdf"),
            eq(false),
            anyString(),
            eq(false)))
        .thenReturn(new PresignedUrl("https://signed/inline", Instant.now()));
    when(objectStorage.presignGet(
            eq(config),
            eq("k9k9k9-report.pdf"),
            eq("report.pdf"),
            eq(true),
            anyString(),
            eq(false)))
        .thenReturn(new PresignedUrl("https://signed/attachment", Instant.now()));
  }

  @Test
  void upload_storesRecordWithInferredMimeTypeAndReturnsBothLinkSets() {
    stubResolution(null, false);
    stubTransfer();
    when(fileRecordService.insertComplete(any()))
        .thenAnswer(inv -> persisted(inv.getArgument(0)));
    stubShareLinks();

    var receipt = service.upload(uploader, command(null, false), BASE_URL);

    var record = receipt.record();
    assertThat(record.getSlug()).isEqualTo("Xy12Ab");
    assertThat(record.getMimetype()).isEqualTo("application/pdf");
    assertThat(record.getSize()).isEqualTo(10);
    assertThat(record.getEtag()).isEqualTo("etag-1");
    assertThat(record.getExpiresAt()).isNull();
    assertThat(record.getMaxViews()).isNull();
    assertThat(record.getCreatedBy()).isEqualTo(uploader.creatorTag());
    assertThat(receipt.links().proxyPreviewUrl()).isEqualTo(BASE_URL + "/api/file-view/Xy12Ab");
    assertThat(receipt.links().directDownloadUrl()).isEqualTo("https://signed/attachment");
    assertThat(receipt.links().previewUrl()).isEqualTo(receipt.links().proxyPreviewUrl());
    verify(uploadLimits).checkSize(10);
    verify(quotaGuard).admit(config, 10);
    verify(directoryRefresher).afterWrite(config, "k9k9k9-report.pdf");
  }

  @Test
  void upload_overrideReplacesUploadersOwnRecord() {
    var existing = TestEntities.fileRecord("keep", config, uploader.creatorTag());
    stubResolution("keep", true);
    stubTransfer();
    when(overrideCleaner.claim("keep", uploader)).thenReturn(Optional.of(existing));
    when(fileRecordService.insertComplete(any()))
        .thenAnswer(inv -> persisted(inv.getArgument(0)));
    stubShareLinks();

    var receipt = service.upload(uploader, command("keep", true), BASE_URL);

    assertThat(receipt.record().getSlug()).isEqualTo("keep");
    assertThat(receipt.record().getId()).isNotEqualTo(existing.getId());
    verify(overrideCleaner).remove(existing);
  }

  @Test
  void upload_overrideOfAnotherUploadersSlugIsForbiddenAndDeletesNothing() {
    stubResolution("theirs", true);
    when(overrideCleaner.claim("theirs", uploader))
        .thenThrow(new ForbiddenException("Override not allowed", "not yours"));

    assertThatThrownBy(() -> service.upload(uploader, command("theirs", true), BASE_URL))
        .isInstanceOf(ForbiddenException.class);

    verify(overrideCleaner, never()).remove(any());
    verify(uploadDispatcher, never()).put(any(), any(), any(), any());
    verify(fileRecordService, never()).insertComplete(any());
  }

  @Test
  void upload_sizeLimitRejectionHappensBeforeAnyTransfer() {
    when(storageConfigSelector.select(uploader, null)).thenReturn(config);
    when(mountPathResolver.resolvePrefix(uploader.effectiveScope(), config)).thenReturn("");
    doThrow(new InvalidRequestException("File too large", "too big"))
        .when(uploadLimits)
        .checkSize(10);

    assertThatThrownBy(() -> service.upload(uploader, command(null, false), BASE_URL))
        .isInstanceOf(InvalidRequestException.class);

    verify(quotaGuard, never()).admit(any(), anyLong());
    verify(uploadDispatcher, never()).put(any(), any(), any(), any());
  }

  @Test
  void upload_lostSlugRaceDeletesTransferredObject() {
    stubResolution(null, false);
    stubTransfer();
    when(fileRecordService.insertComplete(any()))
        .thenThrow(new DataIntegrityViolationException("uq_files_slug"));

    assertThatThrownBy(() -> service.upload(uploader, command(null, false), BASE_URL))
        .isInstanceOf(DataIntegrityViolationException.class);

    verify(objectStorage).deleteObject(config, "k9k9k9-report.pdf");
    verify(directoryRefresher, never()).afterWrite(any(), any());
  }

  @Test
  void upload_passesExpiryAndViewLimitThrough() {
    stubResolution(null, false);
    stubTransfer();
    var values = ArgumentCaptor.forClass(NewFileRecord.class);
    when(fileRecordService.insertComplete(values.capture()))
        .thenAnswer(inv -> persisted(inv.getArgument(0)));
    stubShareLinks();

    var command =
        new DirectUploadCommand(
            "report.pdf",
            TEN_BYTES,
            null,
            null,
            null,
            null,
            "q3",
            "pw",
            24,
            3,
            false,
            false,
            false);
    service.upload(uploader, command, BASE_URL);

    assertThat(values.getValue().expiresAt()).isAfter(Instant.now().plusSeconds(23 * 3600));
    assertThat(values.getValue().maxViews()).isEqualTo(3);
    assertThat(values.getValue().password()).isEqualTo("pw");
    assertThat(values.getValue().remark()).isEqualTo("q3");
    assertThat(values.getValue().useProxy()).isFalse();
  }

  @Test
  void upload_requiresFilename() {
    var command =
        new DirectUploadCommand(
            " ", TEN_BYTES, null, null, null, null, null, null, null, null, false, false, true);

    assertThatThrownBy(() -> service.upload(uploader, command, BASE_URL))
        .isInstanceOf(InvalidRequestException.class);
    verify(storageConfigSelector, never()).select(any(), any());
  }
}
