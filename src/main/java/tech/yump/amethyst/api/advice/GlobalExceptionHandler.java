package tech.yump.amethyst.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.amethyst.auth.AuthException;
import tech.yump.amethyst.bucket.BucketException;
import tech.yump.amethyst.crypto.EncryptionService;
import tech.yump.amethyst.secrets.SecretException;
import tech.yump.amethyst.storage.StorageException;
import tech.yump.amethyst.store.StoreException;
import tech.yump.amethyst.store.StoreUnavailableException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    static final String BEARER_CHALLENGE = "Bearer";

    // --- Access control ---

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemDetail> handleAuthException(AuthException ex, HttpServletRequest request) {
        HttpStatus status = switch (ex.getReason()) {
            case INVALID_TOKEN, EXPIRED_TOKEN, CLIENT_MISMATCH -> HttpStatus.UNAUTHORIZED;
            case SCOPE_MISMATCH, IP_NOT_ALLOWED -> HttpStatus.FORBIDDEN;
        };
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(status == HttpStatus.UNAUTHORIZED ? "Unauthorized" : "Forbidden");
        problemDetail.setProperty("reason", ex.getReason().name());
        log.warn("Access denied ({}): {}. Request: {} {}", ex.getReason(), ex.getMessage(), request.getMethod(), request.getRequestURI());

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (status == HttpStatus.UNAUTHORIZED) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        }
        return builder.body(problemDetail);
    }

    // --- Domain errors ---

    @ExceptionHandler(BucketException.class)
    public ResponseEntity<ProblemDetail> handleBucketException(BucketException ex, HttpServletRequest request) {
        HttpStatus status = switch (ex.getReason()) {
            case NOT_FOUND, POLICY_MISSING -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case CREATION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bucket Error");
        problemDetail.setProperty("reason", ex.getReason().name());
        if (status.is5xxServerError()) {
            log.error("Bucket operation failed: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        } else {
            log.warn("Bucket operation rejected ({}): {}. Request: {} {}", ex.getReason(), ex.getMessage(), request.getMethod(), request.getRequestURI());
        }
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(SecretException.class)
    public ResponseEntity<ProblemDetail> handleSecretException(SecretException ex, HttpServletRequest request) {
        HttpStatus status = switch (ex.getReason()) {
            case NOT_FOUND, BUCKET_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS -> HttpStatus.CONFLICT;
        };
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(status == HttpStatus.CONFLICT ? "Secret Already Exists" : "Not Found");
        problemDetail.setProperty("reason", ex.getReason().name());
        log.warn("Secret operation rejected ({}): {}. Request: {} {}", ex.getReason(), ex.getMessage(), request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(status).body(problemDetail);
    }

    // --- Infrastructure errors ---

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleStoreUnavailable(StoreUnavailableException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "The secret store is temporarily unavailable. Retry later.");
        problemDetail.setTitle("Store Unavailable");
        log.error("Store unavailable: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler({StoreException.class, StorageException.class})
    public ResponseEntity<ProblemDetail> handlePersistenceException(RuntimeException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String title = (ex instanceof StoreException) ? "Store Error" : "Storage Error";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "Internal error while accessing secret storage.");
        problemDetail.setTitle(title);
        log.error("{}: {}. Request: {} {}", title, ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(EncryptionService.EncryptionException.class)
    public ResponseEntity<ProblemDetail> handleEncryptionException(EncryptionService.EncryptionException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "Internal cryptographic error.");
        problemDetail.setTitle("Encryption Error");
        log.error("Cryptographic failure ({}): {}. Request: {} {}",
                ex.getClass().getSimpleName(), ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }

    // --- Request errors ---

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}", request.getDescription(false), ex.getMessage());
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = "Request validation failed.";
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: validation failed. Request: {}. Details: {}", request.getDescription(false), message);
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "An unexpected internal error occurred.");
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }
}
