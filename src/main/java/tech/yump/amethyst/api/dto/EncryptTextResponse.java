package tech.yump.amethyst.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record EncryptTextResponse(
        @Schema(description = "URL-safe Base64 of nonce || ciphertext || tag.")
        String encryptedText,
        @Schema(description = "URL-safe Base64 of the salt; required for decryption.")
        String salt
) {
}
