package tech.yump.amethyst.store;

import tech.yump.amethyst.bucket.BucketId;

import java.util.Arrays;
import java.util.Objects;

/**
 * Row of {@code secrets}: the ciphertext of one named secret.
 */
public record SecretRecord(BucketId bucket, String secretName, byte[] encryptedSecret) {

    public SecretRecord {
        Objects.requireNonNull(bucket, "bucket");
        BucketId.requireValidName(secretName, "secret name");
        Objects.requireNonNull(encryptedSecret, "encryptedSecret");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecretRecord that)) return false;
        return bucket.equals(that.bucket) && secretName.equals(that.secretName)
                && Arrays.equals(encryptedSecret, that.encryptedSecret);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, secretName) * 31 + Arrays.hashCode(encryptedSecret);
    }

    @Override
    public String toString() {
        return "SecretRecord[bucket=" + bucket + ", secretName=" + secretName
                + ", encryptedSecret=" + encryptedSecret.length + " bytes]";
    }
}
