package io.b2mash.filegate.mount;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface StorageMountRepository extends JpaRepository<StorageMount, UUID> {

  /** Active mounts in display order, each with its config's public flag. */
  @Query(
      """
      SELECT new io.b2mash.filegate.mount.MountCandidate(
          m.id, m.name, m.storageType, m.storageConfigId, m.mountPath, c.publicAccess)
      FROM StorageMount m
      LEFT JOIN StorageConfig c ON c.id = m.storageConfigId
      WHERE m.active = true
      ORDER BY m.sortOrder ASC, m.name ASC
      """)
  List<MountCandidate> findActiveCandidates();

  List<StorageMount> findByStorageConfigId(UUID storageConfigId);
}
