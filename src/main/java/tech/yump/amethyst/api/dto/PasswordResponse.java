package tech.yump.amethyst.api.dto;

public record PasswordResponse(String password) {
}
