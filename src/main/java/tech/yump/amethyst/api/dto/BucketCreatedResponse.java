package tech.yump.amethyst.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(description = "A newly created bucket and its client id")
public record BucketCreatedResponse(
        String appName,
        String bucketName,
        @Schema(description = "Client id to exchange for bucket tokens. Keep it secret.")
        UUID clientId,
        @Schema(description = "False when the local key file will only appear after the next reconciliation.")
        boolean mirrored
) {
}
