package io.b2mash.filegate.security;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AdminTokenRepository extends JpaRepository<AdminToken, String> {}
