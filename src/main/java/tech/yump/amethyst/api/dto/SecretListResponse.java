package tech.yump.amethyst.api.dto;

import java.util.List;

public record SecretListResponse(String appName, String bucketName, List<String> secrets) {
}
