package tech.yump.amethyst.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.amethyst.api.ApiError;
import tech.yump.amethyst.api.dto.SecretListResponse;
import tech.yump.amethyst.api.dto.SecretResponse;
import tech.yump.amethyst.api.dto.StoreSecretRequest;
import tech.yump.amethyst.api.dto.UpdateSecretRequest;
import tech.yump.amethyst.auth.AccessGuard;
import tech.yump.amethyst.auth.BucketPrincipal;
import tech.yump.amethyst.auth.ClientAddresses;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.secrets.SecretStore;

@RestController
@RequestMapping("/v1/secrets/{appName}/{bucketName}")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Secrets", description = "Named secrets inside a bucket. Requires a token scoped to the bucket.")
public class SecretController {

    private final SecretStore secretStore;
    private final AccessGuard accessGuard;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List secrets", description = "Lists the secret names of the bucket.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secret names."),
            @ApiResponse(responseCode = "401", description = "Missing or invalid token.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "403", description = "Token scoped to another bucket, or caller address not allowed.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretListResponse listSecrets(
            @Parameter(description = "Application namespace.", example = "billing") @PathVariable String appName,
            @Parameter(description = "Bucket name.", example = "prod") @PathVariable String bucketName,
            @AuthenticationPrincipal BucketPrincipal principal,
            HttpServletRequest request) {
        BucketId bucket = authorize(appName, bucketName, principal, request);
        return new SecretListResponse(bucket.appName(), bucket.bucketName(), secretStore.listSecrets(bucket));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Store secret", description = "Stores a new secret. Fails if a secret with the same name exists.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Secret stored."),
            @ApiResponse(responseCode = "404", description = "Bucket not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "Secret already exists.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> storeSecret(
            @PathVariable String appName,
            @PathVariable String bucketName,
            @Valid @RequestBody StoreSecretRequest body,
            @AuthenticationPrincipal BucketPrincipal principal,
            HttpServletRequest request) {
        BucketId bucket = authorize(appName, bucketName, principal, request);
        secretStore.store(bucket, body.name(), body.value());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping(value = "/{secretName}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Read secret", description = "Decrypts and returns a secret.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secret value."),
            @ApiResponse(responseCode = "404", description = "Bucket or secret not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretResponse readSecret(
            @PathVariable String appName,
            @PathVariable String bucketName,
            @Parameter(description = "Secret name.", example = "db_password") @PathVariable String secretName,
            @AuthenticationPrincipal BucketPrincipal principal,
            HttpServletRequest request) {
        BucketId bucket = authorize(appName, bucketName, principal, request);
        return new SecretResponse(secretName, secretStore.retrieve(bucket, secretName));
    }

    @PutMapping(value = "/{secretName}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update secret", description = "Replaces the value of an existing secret.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Secret updated."),
            @ApiResponse(responseCode = "404", description = "Bucket or secret not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> updateSecret(
            @PathVariable String appName,
            @PathVariable String bucketName,
            @PathVariable String secretName,
            @Valid @RequestBody UpdateSecretRequest body,
            @AuthenticationPrincipal BucketPrincipal principal,
            HttpServletRequest request) {
        BucketId bucket = authorize(appName, bucketName, principal, request);
        secretStore.update(bucket, secretName, body.value());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{secretName}")
    @Operation(summary = "Delete secret")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Secret deleted."),
            @ApiResponse(responseCode = "404", description = "Bucket or secret not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> deleteSecret(
            @PathVariable String appName,
            @PathVariable String bucketName,
            @PathVariable String secretName,
            @AuthenticationPrincipal BucketPrincipal principal,
            HttpServletRequest request) {
        BucketId bucket = authorize(appName, bucketName, principal, request);
        secretStore.delete(bucket, secretName);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(value = "/{secretName}/generate", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Generate secret", description = "Stores a random 32-character secret under the name and returns it.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Secret generated and stored."),
            @ApiResponse(responseCode = "409", description = "Secret already exists.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<SecretResponse> generateSecret(
            @PathVariable String appName,
            @PathVariable String bucketName,
            @PathVariable String secretName,
            @AuthenticationPrincipal BucketPrincipal principal,
            HttpServletRequest request) {
        BucketId bucket = authorize(appName, bucketName, principal, request);
        String value = secretStore.generate(bucket, secretName);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SecretResponse(secretName, value));
    }

    private BucketId authorize(String appName, String bucketName, BucketPrincipal principal, HttpServletRequest request) {
        BucketId bucket = BucketId.of(appName, bucketName);
        accessGuard.authorize(principal, bucket, ClientAddresses.resolve(request));
        log.debug("Request {} {} authorized for {}", request.getMethod(), request.getRequestURI(), bucket);
        return bucket;
    }
}
