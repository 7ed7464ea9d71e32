package tech.yump.amethyst.api.dto;

public record BucketSummary(String appName, String bucketName) {
}
