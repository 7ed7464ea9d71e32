package tech.yump.amethyst.bucket;

import java.util.UUID;

/**
 * Credentials of an existing bucket as handed back to its owner.
 */
public record BucketDetails(BucketId bucket, UUID clientId, String ownerEmail) {
}
