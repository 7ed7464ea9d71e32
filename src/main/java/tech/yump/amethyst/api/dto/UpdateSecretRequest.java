package tech.yump.amethyst.api.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateSecretRequest(@NotNull String value) {

    @Override
    public String toString() {
        return "UpdateSecretRequest[value=******]";
    }
}
