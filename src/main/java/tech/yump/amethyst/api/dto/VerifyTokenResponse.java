package tech.yump.amethyst.api.dto;

import java.time.Instant;

public record VerifyTokenResponse(boolean valid, String appName, String bucketName, Instant expiresAt) {
}
