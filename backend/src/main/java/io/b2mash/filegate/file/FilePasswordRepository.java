package io.b2mash.filegate.file;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FilePasswordRepository extends JpaRepository<FilePassword, UUID> {

  Optional<FilePassword> findByFileId(UUID fileId);

  @Modifying
  @Query("DELETE FROM FilePassword p WHERE p.fileId = :fileId")
  int deleteByFileId(@Param("fileId") UUID fileId);
}
