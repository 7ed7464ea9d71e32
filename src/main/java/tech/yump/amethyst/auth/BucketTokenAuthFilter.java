package tech.yump.amethyst.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Authenticates {@code Authorization: Bearer <token>} requests with {@link BucketTokenService}
 * and tags every request with a request id in the MDC.
 */
@Slf4j
public class BucketTokenAuthFilter extends OncePerRequestFilter {

  public static final String BEARER_PREFIX = "Bearer ";
  public static final String REQUEST_ID_ATTR = "requestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";
  public static final String AUTH_FAILURE_ATTR = "amethystAuthFailure";
  public static final String BUCKET_CLIENT_AUTHORITY = "ROLE_BUCKET_CLIENT";

  private static final List<GrantedAuthority> AUTHORITIES = List.of(new SimpleGrantedAuthority(BUCKET_CLIENT_AUTHORITY));

  private final BucketTokenService bucketTokenService;

  public BucketTokenAuthFilter(BucketTokenService bucketTokenService) {
    this.bucketTokenService = bucketTokenService;
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);

    try {
      String header = request.getHeader(HttpHeaders.AUTHORIZATION);
      if (!StringUtils.hasText(header) || !header.startsWith(BEARER_PREFIX)
              || SecurityContextHolder.getContext().getAuthentication() != null) {
        log.trace("No bearer token or authentication already present for {}. Proceeding.", request.getRequestURI());
        filterChain.doFilter(request, response);
        return;
      }

      String token = header.substring(BEARER_PREFIX.length()).trim();
      try {
        BucketPrincipal principal = bucketTokenService.verify(token);
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, null, AUTHORITIES);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated request {} {} for bucket {}", request.getMethod(), request.getRequestURI(), principal.bucket());
      } catch (AuthException e) {
        // Left unauthenticated; the entry point answers 401 for protected paths.
        request.setAttribute(AUTH_FAILURE_ATTR, e.getReason());
        log.warn("Bearer token rejected for {} {}: {}", request.getMethod(), request.getRequestURI(), e.getReason());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }
}
