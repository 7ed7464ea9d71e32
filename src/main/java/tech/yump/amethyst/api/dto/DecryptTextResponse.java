package tech.yump.amethyst.api.dto;

public record DecryptTextResponse(String decryptedText) {
}
