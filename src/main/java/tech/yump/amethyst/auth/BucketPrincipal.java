package tech.yump.amethyst.auth;

import tech.yump.amethyst.bucket.BucketId;

import java.time.Instant;
import java.util.UUID;

/**
 * The authenticated caller of a request: the bucket its token is scoped to.
 */
public record BucketPrincipal(BucketId bucket, UUID clientId, Instant expiresAt) {

    @Override
    public String toString() {
        return bucket.toString();
    }
}
