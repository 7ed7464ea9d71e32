package tech.yump.amethyst.api.dto;

import jakarta.validation.constraints.NotNull;

public record EncryptTextRequest(@NotNull String text) {
}
