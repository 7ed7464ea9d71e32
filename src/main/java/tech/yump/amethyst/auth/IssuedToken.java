package tech.yump.amethyst.auth;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedToken[token=******, expiresAt=" + expiresAt + ']';
    }
}
