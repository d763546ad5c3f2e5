package io.b2mash.filegate.apikey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApiKeyRepository extends JpaRepository<ApiKey, UUID> {

  Optional<ApiKey> findByKeyValue(String keyValue);

  boolean existsByKeyValue(String keyValue);

  boolean existsByName(String name);

  boolean existsByNameAndIdNot(String name, UUID id);

  List<ApiKey> findAllByOrderByCreatedAtDesc();

  @Modifying
  @Query("DELETE FROM ApiKey k WHERE k.expiresAt < :now")
  int deleteExpired(@Param("now") Instant now);
}
