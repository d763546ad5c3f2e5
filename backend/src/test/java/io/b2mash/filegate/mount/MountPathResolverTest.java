package io.b2mash.filegate.mount;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.filegate.apikey.ApiKeyScope;
import io.b2mash.filegate.exception.ForbiddenException;
import io.b2mash.filegate.storageconfig.StorageConfig;
import io.b2mash.filegate.testutil.TestEntities;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MountPathResolverTest {

  @Mock private StorageMountRepository storageMountRepository;
  @InjectMocks private MountPathResolver resolver;

  private final StorageConfig config = TestEntities.publicConfig(null);

  private MountCandidate mount(String name, String path, UUID configId, Boolean configPublic) {
    return new MountCandidate(
        UUID.randomUUID(), name, StorageMount.STORAGE_TYPE_S3, configId, path, configPublic);
  }

  private static ApiKeyScope scope(String basicPath) {
    return new ApiKeyScope(basicPath, false, true, false);
  }

  @Test
  void accessibleMounts_rootSeesEveryPublicMount() {
    when(storageMountRepository.findActiveCandidates())
        .thenReturn(
            List.of(
                mount("docs", "/docs", config.getId(), true),
                mount("media", "/media", config.getId(), true)));

    assertThat(resolver.accessibleMounts("/")).hasSize(2);
  }

  @Test
  void accessibleMounts_dropsS3MountsOfPrivateConfigs() {
    when(storageMountRepository.findActiveCandidates())
        .thenReturn(
            List.of(
                mount("public", "/public", config.getId(), true),
                mount("private", "/private", UUID.randomUUID(), false),
                mount("orphan", "/orphan", null, null)));

    assertThat(resolver.accessibleMounts("/"))
        .extracting(MountCandidate::name)
        .containsExactly("public");
  }

  @Test
  void accessibleMounts_matchesDescendantsAndAncestorsOfBasicPath() {
    when(storageMountRepository.findActiveCandidates())
        .thenReturn(
            List.of(
                mount("ancestor", "/a", config.getId(), true),
                mount("exact", "/a/b/", config.getId(), true),
                mount("descendant", "/a/b/c", config.getId(), true),
                mount("sibling", "/a/bc", config.getId(), true),
                mount("unrelated", "/x", config.getId(), true)));

    assertThat(resolver.accessibleMounts("/a/b/"))
        .extracting(MountCandidate::name)
        .containsExactly("ancestor", "exact", "descendant");
  }

  @Test
  void accessibleMounts_deeperBasicPathNeverSeesMore() {
    var mounts =
        List.of(
            mount("a", "/a", config.getId(), true),
            mount("ab", "/a/b", config.getId(), true),
            mount("abc", "/a/b/c", config.getId(), true),
            mount("x", "/x", config.getId(), true));
    when(storageMountRepository.findActiveCandidates()).thenReturn(mounts);

    var shallow = resolver.accessibleMounts("/a");
    var deep = resolver.accessibleMounts("/a/b/c/d");

    assertThat(shallow).containsAll(deep);
  }

  @Test
  void resolvePrefix_rootBasicPathSkipsMountLookup() {
    assertThat(resolver.resolvePrefix(scope("/"), config)).isEmpty();
    verify(storageMountRepository, never()).findActiveCandidates();
  }

  @Test
  void resolvePrefix_prefersLongestMatchingMount() {
    when(storageMountRepository.findActiveCandidates())
        .thenReturn(
            List.of(
                mount("short", "/a", config.getId(), true),
                mount("long", "/a/b", config.getId(), true)));

    assertThat(resolver.resolvePrefix(scope("/a/b/c"), config)).isEqualTo("c/");
  }

  @Test
  void resolvePrefix_exactMountMatchYieldsEmptyPrefix() {
    when(storageMountRepository.findActiveCandidates())
        .thenReturn(List.of(mount("docs", "/docs/", config.getId(), true)));

    assertThat(resolver.resolvePrefix(scope("/docs"), config)).isEmpty();
  }

  @Test
  void resolvePrefix_rootMountPassesWholeBasicPath() {
    when(storageMountRepository.findActiveCandidates())
        .thenReturn(List.of(mount("root", "/", config.getId(), true)));

    assertThat(resolver.resolvePrefix(scope("/team/alpha"), config)).isEqualTo("team/alpha/");
  }

  @Test
  void resolvePrefix_mountBelowBasicPathDoesNotConstrain() {
    when(storageMountRepository.findActiveCandidates())
        .thenReturn(List.of(mount("nested", "/a/b/c", config.getId(), true)));

    assertThat(resolver.resolvePrefix(scope("/a"), config)).isEmpty();
  }

  @Test
  void resolvePrefix_throwsWhenConfigNotMountedUnderBasicPath() {
    when(storageMountRepository.findActiveCandidates())
        .thenReturn(List.of(mount("other", "/a", UUID.randomUUID(), true)));

    assertThatThrownBy(() -> resolver.resolvePrefix(scope("/a/b"), config))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void subPathNormalizer_stripsLeadingAndCollapsesSlashes() {
    assertThat(S3SubPathNormalizer.normalize("//x//y")).isEqualTo("x/y/");
    assertThat(S3SubPathNormalizer.normalize("/")).isEmpty();
    assertThat(S3SubPathNormalizer.normalize(null)).isEmpty();
    assertThat(S3SubPathNormalizer.normalize("/c/")).isEqualTo("c/");
  }
}
