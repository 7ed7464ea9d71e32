package tech.yump.amethyst.store;

import tech.yump.amethyst.bucket.BucketId;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Row of {@code bucket_keys}: the encoded key blob and client id of one bucket.
 */
public record BucketKeyRecord(BucketId bucket, byte[] keyBlob, UUID clientId) {

    public BucketKeyRecord {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(keyBlob, "keyBlob");
        Objects.requireNonNull(clientId, "clientId");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BucketKeyRecord that)) return false;
        return bucket.equals(that.bucket) && Arrays.equals(keyBlob, that.keyBlob) && clientId.equals(that.clientId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, clientId) * 31 + Arrays.hashCode(keyBlob);
    }

    @Override
    public String toString() {
        return "BucketKeyRecord[bucket=" + bucket + ", keyBlob=******, clientId=" + clientId + ']';
    }
}
