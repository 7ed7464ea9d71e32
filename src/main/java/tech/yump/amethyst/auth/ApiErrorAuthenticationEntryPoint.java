package tech.yump.amethyst.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import tech.yump.amethyst.api.ApiError;

import java.io.IOException;

/**
 * Answers unauthenticated requests to protected paths with 401 and an {@link ApiError} body.
 * The body is the same for a missing, invalid, expired or mismatched token.
 */
@Slf4j
@RequiredArgsConstructor
public class ApiErrorAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String MESSAGE = "Authentication required: provide a valid bearer token for this bucket.";

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        log.debug("Unauthenticated request to {} {} (token failure: {})", request.getMethod(), request.getRequestURI(),
                request.getAttribute(BucketTokenAuthFilter.AUTH_FAILURE_ATTR));
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("WWW-Authenticate", "Bearer");
        response.getWriter().write(objectMapper.writeValueAsString(new ApiError(MESSAGE)));
    }
}
