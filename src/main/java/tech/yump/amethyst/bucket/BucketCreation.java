package tech.yump.amethyst.bucket;

import java.util.UUID;

/**
 * Outcome of a successful bucket creation.
 *
 * @param bucket   The created bucket.
 * @param clientId The client identity issued for it.
 * @param mirrored false when the database row was written but the local key file was not; the next
 *                 reconciliation writes the file.
 */
public record BucketCreation(BucketId bucket, UUID clientId, boolean mirrored) {
}
