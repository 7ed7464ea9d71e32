package tech.yump.amethyst.api.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyTokenRequest(@NotBlank String token) {
}
