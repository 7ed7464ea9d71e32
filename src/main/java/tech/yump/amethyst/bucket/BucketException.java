package tech.yump.amethyst.bucket;

import lombok.Getter;

/**
 * Failure of a bucket lifecycle operation.
 */
@Getter
public class BucketException extends RuntimeException {

    public enum Reason {
        ALREADY_EXISTS,
        NOT_FOUND,
        POLICY_MISSING,
        CREATION_FAILED
    }

    private final Reason reason;
    private final transient BucketId bucket;

    public BucketException(Reason reason, BucketId bucket, String message) {
        super(message);
        this.reason = reason;
        this.bucket = bucket;
    }

    public BucketException(Reason reason, BucketId bucket, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.bucket = bucket;
    }

    public static BucketException alreadyExists(BucketId bucket) {
        return new BucketException(Reason.ALREADY_EXISTS, bucket, "Bucket already exists: " + bucket);
    }

    public static BucketException notFound(BucketId bucket) {
        return new BucketException(Reason.NOT_FOUND, bucket, "Bucket not found: " + bucket);
    }

    public static BucketException policyMissing(BucketId bucket) {
        return new BucketException(Reason.POLICY_MISSING, bucket,
                "No bucket policy configured for " + bucket + ". Add it under amethyst.buckets before creating the bucket.");
    }

    public static BucketException creationFailed(BucketId bucket, Throwable cause) {
        return new BucketException(Reason.CREATION_FAILED, bucket, "Failed to create bucket " + bucket, cause);
    }
}
