package tech.yump.amethyst.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.amethyst.api.ApiError;
import tech.yump.amethyst.api.dto.TokenRequest;
import tech.yump.amethyst.api.dto.TokenResponse;
import tech.yump.amethyst.api.dto.VerifyTokenRequest;
import tech.yump.amethyst.api.dto.VerifyTokenResponse;
import tech.yump.amethyst.auth.BucketPrincipal;
import tech.yump.amethyst.auth.BucketTokenService;
import tech.yump.amethyst.auth.IssuedToken;
import tech.yump.amethyst.bucket.BucketId;

@RestController
@RequestMapping("/v1/auth")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Bucket token issuance and verification")
public class AuthController {

    private final BucketTokenService bucketTokenService;

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Issue token", description = "Exchanges a bucket's client id for a signed, time-limited token.", security = {})
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Token issued."),
            @ApiResponse(responseCode = "401", description = "Unknown bucket or wrong client id.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public TokenResponse issueToken(@Valid @RequestBody TokenRequest body) {
        BucketId bucket = BucketId.of(body.appName(), body.bucketName());
        IssuedToken issued = bucketTokenService.issue(bucket, body.clientId());
        return TokenResponse.bearer(issued.token(), issued.expiresAt());
    }

    @PostMapping(value = "/verify", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Verify token", description = "Checks a token's signature, expiry and client id.", security = {})
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Token is valid."),
            @ApiResponse(responseCode = "401", description = "Token is invalid, expired or no longer matches its bucket.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public VerifyTokenResponse verifyToken(@Valid @RequestBody VerifyTokenRequest body) {
        BucketPrincipal principal = bucketTokenService.verify(body.token());
        return new VerifyTokenResponse(true, principal.bucket().appName(), principal.bucket().bucketName(), principal.expiresAt());
    }
}
