package tech.yump.amethyst.api.dto;

import jakarta.validation.constraints.NotBlank;

public record DecryptTextRequest(@NotBlank String text, @NotBlank String salt) {
}
