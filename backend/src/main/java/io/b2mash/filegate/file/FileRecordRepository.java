package io.b2mash.filegate.file;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FileRecordRepository extends JpaRepository<FileRecord, UUID> {

  Optional<FileRecord> findBySlug(String slug);

  boolean existsBySlug(String slug);

  /** Bytes currently accounted to a storage config. */
  @Query("SELECT COALESCE(SUM(f.size), 0) FROM FileRecord f WHERE f.storageConfigId = :configId")
  long sumSizeByStorageConfigId(@Param("configId") UUID configId);

  /** As {@link #sumSizeByStorageConfigId} but without the record being committed. */
  @Query(
      "SELECT COALESCE(SUM(f.size), 0) FROM FileRecord f"
          + " WHERE f.storageConfigId = :configId AND f.id <> :excludedId")
  long sumSizeByStorageConfigIdExcluding(
      @Param("configId") UUID configId, @Param("excludedId") UUID excludedId);
}
