package tech.yump.amethyst.auth.policy;

import tech.yump.amethyst.bucket.BucketId;

import java.util.List;

/**
 * Access policy of one bucket: the client addresses allowed to use it and the owner contact.
 *
 * @param bucket     The bucket the policy applies to.
 * @param allowedIps Literal client addresses, or the single entry {@value #ANY} to allow every address.
 *                   An empty list allows nobody.
 * @param ownerEmail Contact of the bucket owner, may be null.
 */
public record BucketPolicy(BucketId bucket, List<String> allowedIps, String ownerEmail) {

    public static final String ANY = "ANY";

    public BucketPolicy {
        allowedIps = allowedIps == null ? List.of() : List.copyOf(allowedIps);
    }

    public boolean allowsAnyAddress() {
        return allowedIps.contains(ANY);
    }
}
