package tech.yump.amethyst.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(description = "A new secret")
public record StoreSecretRequest(
        @Schema(description = "Secret name.", example = "db_password", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank String name,
        @Schema(description = "Plaintext value.", example = "s3cr3t", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull String value
) {
    @Override
    public String toString() {
        return "StoreSecretRequest[name=" + name + ", value=******]";
    }
}
