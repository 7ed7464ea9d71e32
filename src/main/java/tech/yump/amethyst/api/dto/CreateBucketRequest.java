package tech.yump.amethyst.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Request to create a bucket")
public record CreateBucketRequest(
        @Schema(description = "Application namespace.", example = "billing", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank String appName,
        @Schema(description = "Bucket name inside the namespace.", example = "prod", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank String bucketName
) {
}
