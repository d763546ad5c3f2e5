package io.b2mash.filegate.storageconfig;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StorageConfigRepository extends JpaRepository<StorageConfig, UUID> {

  Optional<StorageConfig> findFirstByAdminIdAndDefaultConfigTrue(UUID adminId);

  Optional<StorageConfig> findFirstByAdminId(UUID adminId);

  Optional<StorageConfig> findFirstByPublicAccessTrueAndDefaultConfigTrue();

  Optional<StorageConfig> findFirstByPublicAccessTrue();
}
