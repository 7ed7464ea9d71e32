package tech.yump.amethyst.support;

import tech.yump.amethyst.config.AmethystProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Builds {@link AmethystProperties} for unit tests without a Spring context.
 */
public final class TestProperties {

    public static final String PASSPHRASE = "unit-test-passphrase";
    public static final String SIGNING_KEY = "YW1ldGh5c3QtdGVzdC1zaWduaW5nLWtleS0wMTIzNDU2Nzg5YWJjZGVm";

    private TestProperties() {
    }

    public static AmethystProperties withMirrorAt(Path mirrorRoot, AmethystProperties.BucketPolicyDefinition... policies) {
        return build(mirrorRoot, new AmethystProperties.SyncProperties(false, null, null), List.of(policies));
    }

    public static AmethystProperties build(Path mirrorRoot,
                                           AmethystProperties.SyncProperties sync,
                                           List<AmethystProperties.BucketPolicyDefinition> policies) {
        return new AmethystProperties(
                new AmethystProperties.CryptoProperties(PASSPHRASE.toCharArray()),
                new AmethystProperties.StorageProperties(
                        new AmethystProperties.StorageProperties.FileSystemProperties(mirrorRoot.toString())),
                new AmethystProperties.StoreProperties(postgres()),
                new AmethystProperties.AuthProperties(SIGNING_KEY, Duration.ofHours(1)),
                sync,
                policies);
    }

    public static AmethystProperties.PostgresProperties postgres() {
        return new AmethystProperties.PostgresProperties(
                "jdbc:postgresql://localhost:5432/amethyst", "amethyst", "secret".toCharArray(),
                null, null, null, null);
    }

    public static AmethystProperties.BucketPolicyDefinition policy(String app, String bucket, String... allowedIps) {
        return new AmethystProperties.BucketPolicyDefinition(app, bucket, List.of(allowedIps), app + "-owner@example.com");
    }
}
