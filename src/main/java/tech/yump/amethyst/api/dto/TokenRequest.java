package tech.yump.amethyst.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(description = "Client credentials exchanged for a bucket token")
public record TokenRequest(
        @NotBlank String appName,
        @NotBlank String bucketName,
        @NotNull UUID clientId
) {
}
