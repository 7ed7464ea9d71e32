package tech.yump.amethyst.secrets;

import lombok.Getter;
import tech.yump.amethyst.bucket.BucketId;

/**
 * Failure of a secret operation that the caller can act on.
 */
@Getter
public class SecretException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        ALREADY_EXISTS,
        BUCKET_NOT_FOUND
    }

    private final Reason reason;

    public SecretException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static SecretException notFound(BucketId bucket, String secretName) {
        return new SecretException(Reason.NOT_FOUND, "Secret '" + secretName + "' not found in bucket " + bucket);
    }

    public static SecretException alreadyExists(BucketId bucket, String secretName) {
        return new SecretException(Reason.ALREADY_EXISTS,
                "Secret '" + secretName + "' already exists in bucket " + bucket + ". Use update to change it.");
    }

    public static SecretException bucketNotFound(BucketId bucket) {
        return new SecretException(Reason.BUCKET_NOT_FOUND, "Bucket not found: " + bucket);
    }
}
