package tech.yump.amethyst.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import tech.yump.amethyst.crypto.SecretGenerator;

public record PasswordRequest(
        @Schema(description = "Number of characters.", example = "24")
        @Min(SecretGenerator.MIN_PASSWORD_LENGTH) @Max(SecretGenerator.MAX_PASSWORD_LENGTH) int length
) {
}
