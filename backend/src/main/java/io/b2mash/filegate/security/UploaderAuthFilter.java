package io.b2mash.filegate.security;

import io.b2mash.filegate.apikey.ApiKeyScope;
import io.b2mash.filegate.apikey.ApiKeyService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves {@code X-API-KEY} against issued API keys, or {@code Authorization: Bearer} against
 * admin session tokens. Requests with neither continue unauthenticated and are rejected by the
 * authorization rules.
 */
@Component
public class UploaderAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(UploaderAuthFilter.class);

  static final String API_KEY_HEADER = "X-API-KEY";
  private static final String BEARER_PREFIX = "Bearer ";

  private final ApiKeyService apiKeyService;
  private final AdminTokenRepository adminTokenRepository;

  public UploaderAuthFilter(
      ApiKeyService apiKeyService, AdminTokenRepository adminTokenRepository) {
    this.apiKeyService = apiKeyService;
    this.adminTokenRepository = adminTokenRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    resolve(request)
        .ifPresent(
            uploader ->
                SecurityContextHolder.getContext()
                    .setAuthentication(new UploaderAuthentication(uploader)));
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }

  private Optional<Uploader> resolve(HttpServletRequest request) {
    String apiKey = request.getHeader(API_KEY_HEADER);
    if (apiKey != null && !apiKey.isBlank()) {
      var resolved =
          apiKeyService
              .authenticate(apiKey)
              .map(key -> Uploader.apiKey(key.getId(), ApiKeyScope.of(key)));
      if (resolved.isEmpty()) {
        log.debug("Unknown or expired API key presented on {}", request.getRequestURI());
      }
      return resolved;
    }

    String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
      String token = authorization.substring(BEARER_PREFIX.length()).trim();
      return adminTokenRepository
          .findById(token)
          .filter(adminToken -> !adminToken.isExpired())
          .map(adminToken -> Uploader.admin(adminToken.getAdminId()));
    }
    return Optional.empty();
  }
}
