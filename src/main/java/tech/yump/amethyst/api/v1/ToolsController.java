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
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.amethyst.api.ApiError;
import tech.yump.amethyst.api.dto.DecryptTextRequest;
import tech.yump.amethyst.api.dto.DecryptTextResponse;
import tech.yump.amethyst.api.dto.EncryptTextRequest;
import tech.yump.amethyst.api.dto.EncryptTextResponse;
import tech.yump.amethyst.api.dto.PasswordRequest;
import tech.yump.amethyst.api.dto.PasswordResponse;
import tech.yump.amethyst.crypto.EncryptionService;
import tech.yump.amethyst.crypto.SecretGenerator;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

@RestController
@RequestMapping("/v1/tools")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Tools", description = "Stand-alone password generation and string encryption")
public class ToolsController {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretGenerator secretGenerator;
    private final EncryptionService encryptionService;

    @PostMapping(value = "/password", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Generate password", description = "Random password of letters, digits and punctuation.", security = {})
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Generated password."),
            @ApiResponse(responseCode = "400", description = "Length outside 1..1024.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public PasswordResponse generatePassword(@Valid @RequestBody PasswordRequest body) {
        return new PasswordResponse(secretGenerator.generatePassword(body.length()));
    }

    @PostMapping(value = "/encrypt", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Encrypt text", description = "Encrypts text under a fresh salt. Keep the returned salt to decrypt.", security = {})
    @ApiResponse(responseCode = "200", description = "Ciphertext and salt, URL-safe Base64.")
    public EncryptTextResponse encrypt(@Valid @RequestBody EncryptTextRequest body) {
        byte[] salt = encryptionService.generateSalt();
        byte[] ciphertext = encryptionService.encrypt(body.text().getBytes(StandardCharsets.UTF_8), salt);
        return new EncryptTextResponse(ENCODER.encodeToString(ciphertext), ENCODER.encodeToString(salt));
    }

    @PostMapping(value = "/decrypt", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Decrypt text", description = "Decrypts text produced by the encrypt endpoint.", security = {})
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Decrypted text."),
            @ApiResponse(responseCode = "400", description = "Text or salt is not URL-safe Base64.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "422", description = "Ciphertext does not authenticate under the salt.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public DecryptTextResponse decrypt(@Valid @RequestBody DecryptTextRequest body) {
        byte[] ciphertext = decodeBase64(body.text(), "text");
        byte[] salt = decodeBase64(body.salt(), "salt");
        byte[] plaintext = encryptionService.decrypt(ciphertext, salt);
        return new DecryptTextResponse(new String(plaintext, StandardCharsets.UTF_8));
    }

    private static byte[] decodeBase64(String value, String field) {
        try {
            return DECODER.decode(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Field '" + field + "' is not valid URL-safe Base64.", e);
        }
    }

    // --- Exception Handlers ---

    @ExceptionHandler(EncryptionService.DecryptionException.class)
    public ResponseEntity<ApiError> handleDecryptionException(EncryptionService.DecryptionException ex) {
        log.warn("Text decryption rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiError("Decryption failed: the text was tampered with or the salt does not match."));
    }
}
