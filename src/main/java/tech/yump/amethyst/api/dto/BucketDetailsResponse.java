package tech.yump.amethyst.api.dto;

import java.util.UUID;

public record BucketDetailsResponse(String appName, String bucketName, UUID clientId, String ownerEmail) {
}
