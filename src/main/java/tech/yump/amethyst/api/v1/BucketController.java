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
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.amethyst.api.ApiError;
import tech.yump.amethyst.api.dto.BucketCreatedResponse;
import tech.yump.amethyst.api.dto.BucketDetailsResponse;
import tech.yump.amethyst.api.dto.BucketSummary;
import tech.yump.amethyst.api.dto.CreateBucketRequest;
import tech.yump.amethyst.auth.AccessGuard;
import tech.yump.amethyst.auth.ClientAddresses;
import tech.yump.amethyst.bucket.BucketCreation;
import tech.yump.amethyst.bucket.BucketDetails;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.bucket.BucketManager;

import java.util.List;

@RestController
@RequestMapping("/v1/buckets")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Buckets", description = "Bucket creation and client credentials")
public class BucketController {

    private final BucketManager bucketManager;
    private final AccessGuard accessGuard;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Create bucket",
            description = "Creates a bucket with a fresh key and client id. The bucket needs a configured policy and the caller must pass its IP allow-list.",
            security = {}
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Bucket created."),
            @ApiResponse(responseCode = "400", description = "Invalid app or bucket name.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "403", description = "Caller address not allowed.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "Bucket already exists.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "503", description = "Database unavailable.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<BucketCreatedResponse> createBucket(
            @Valid @RequestBody CreateBucketRequest body,
            HttpServletRequest request) {
        BucketId bucket = BucketId.of(body.appName(), body.bucketName());
        accessGuard.authorizeAddress(bucket, ClientAddresses.resolve(request));

        BucketCreation creation = bucketManager.createBucket(bucket);
        log.info("Bucket {} created via API.", bucket);
        return ResponseEntity.status(HttpStatus.CREATED).body(new BucketCreatedResponse(
                bucket.appName(), bucket.bucketName(), creation.clientId(), creation.mirrored()));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List buckets", description = "Lists the buckets present in the local mirror.")
    @ApiResponse(responseCode = "200", description = "Bucket list.")
    public List<BucketSummary> listBuckets() {
        return bucketManager.listBuckets().stream()
                .map(b -> new BucketSummary(b.appName(), b.bucketName()))
                .toList();
    }

    @PostMapping(value = "/{appName}/{bucketName}/details", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Resend bucket details",
            description = "Returns the client id and owner contact of an existing bucket. Gated by the bucket's IP allow-list.",
            security = {}
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Bucket details."),
            @ApiResponse(responseCode = "403", description = "Caller address not allowed.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Bucket not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public BucketDetailsResponse bucketDetails(
            @Parameter(description = "Application namespace.", example = "billing") @PathVariable String appName,
            @Parameter(description = "Bucket name.", example = "prod") @PathVariable String bucketName,
            HttpServletRequest request) {
        BucketId bucket = BucketId.of(appName, bucketName);
        accessGuard.authorizeAddress(bucket, ClientAddresses.resolve(request));

        BucketDetails details = bucketManager.bucketDetails(bucket);
        return new BucketDetailsResponse(bucket.appName(), bucket.bucketName(), details.clientId(), details.ownerEmail());
    }
}
