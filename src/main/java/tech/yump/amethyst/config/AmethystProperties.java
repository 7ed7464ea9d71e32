package tech.yump.amethyst.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration properties for AmethystKey under the 'amethyst' prefix.
 */
@ConfigurationProperties(prefix = "amethyst")
@Validated
public record AmethystProperties(

        @Valid
        @NotNull(message = "Crypto configuration (amethyst.crypto) is required.")
        CryptoProperties crypto,

        @Valid
        @NotNull(message = "Storage configuration (amethyst.storage) is required.")
        StorageProperties storage,

        @Valid
        @NotNull(message = "Store configuration (amethyst.store) is required.")
        StoreProperties store,

        @Valid
        @NotNull(message = "Auth configuration (amethyst.auth) is required.")
        AuthProperties auth,

        @Valid
        SyncProperties sync,

        @Valid
        List<BucketPolicyDefinition> buckets
) {

    public AmethystProperties {
        if (sync == null) {
            sync = SyncProperties.defaults();
        }
        if (buckets == null) {
            buckets = Collections.emptyList();
        }
    }

    // --- CryptoProperties ---
    @Validated
    public record CryptoProperties(
            @NotNull(message = "Key derivation passphrase (amethyst.crypto.passphrase) must be provided.")
            char[] passphrase
    ) {
        @AssertTrue(message = "Key derivation passphrase (amethyst.crypto.passphrase) must not be empty.")
        private boolean isPassphraseNotEmpty() {
            return passphrase != null && passphrase.length > 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Arrays.equals(passphrase, ((CryptoProperties) o).passphrase);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(passphrase);
        }

        @Override
        public String toString() {
            return "CryptoProperties[passphrase=******]";
        }
    }

    // --- StorageProperties ---
    @Validated
    public record StorageProperties(
            @Valid
            @NotNull(message = "Filesystem mirror configuration (amethyst.storage.filesystem) is required.")
            FileSystemProperties filesystem
    ) {
        @Validated
        public record FileSystemProperties(
                @NotBlank(message = "Filesystem mirror path (amethyst.storage.filesystem.path) must be provided.")
                String path
        ) {}
    }

    // --- StoreProperties ---
    @Validated
    public record StoreProperties(
            @Valid
            @NotNull(message = "PostgreSQL configuration (amethyst.store.postgres) is required.")
            PostgresProperties postgres
    ) {}

    @Validated
    public record PostgresProperties(
            @NotBlank(message = "PostgreSQL connection URL (amethyst.store.postgres.connection-url) must be provided.")
            String connectionUrl,

            @NotBlank(message = "PostgreSQL username (amethyst.store.postgres.username) must be provided.")
            String username,

            @NotNull(message = "PostgreSQL password (amethyst.store.postgres.password) must be provided.")
            char[] password,

            @Min(value = 0, message = "Minimum idle connections cannot be negative.")
            Integer minimumIdle,

            @Min(value = 1, message = "Maximum pool size must be at least 1.")
            Integer maximumPoolSize,

            Duration connectionTimeout,

            Boolean initializeSchema
    ) {
        public static final int DEFAULT_MINIMUM_IDLE = 2;
        public static final int DEFAULT_MAXIMUM_POOL_SIZE = 8;
        public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);

        public PostgresProperties {
            if (minimumIdle == null) {
                minimumIdle = DEFAULT_MINIMUM_IDLE;
            }
            if (maximumPoolSize == null) {
                maximumPoolSize = DEFAULT_MAXIMUM_POOL_SIZE;
            }
            if (connectionTimeout == null) {
                connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
            }
            if (initializeSchema == null) {
                initializeSchema = Boolean.TRUE;
            }
        }

        @AssertTrue(message = "PostgreSQL password (amethyst.store.postgres.password) must not be empty.")
        private boolean isPasswordNotEmpty() {
            return password != null && password.length > 0;
        }

        @AssertTrue(message = "Minimum idle connections cannot exceed the maximum pool size.")
        private boolean isPoolSizingValid() {
            return minimumIdle <= maximumPoolSize;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PostgresProperties that = (PostgresProperties) o;
            return Objects.equals(connectionUrl, that.connectionUrl) &&
                    Objects.equals(username, that.username) &&
                    Arrays.equals(password, that.password) &&
                    Objects.equals(minimumIdle, that.minimumIdle) &&
                    Objects.equals(maximumPoolSize, that.maximumPoolSize) &&
                    Objects.equals(connectionTimeout, that.connectionTimeout) &&
                    Objects.equals(initializeSchema, that.initializeSchema);
        }

        @Override
        public int hashCode() {
            int result = Objects.hash(connectionUrl, username, minimumIdle, maximumPoolSize, connectionTimeout, initializeSchema);
            result = 31 * result + Arrays.hashCode(password);
            return result;
        }

        @Override
        public String toString() {
            // Avoid logging the password in toString()
            return "PostgresProperties[" +
                    "connectionUrl='" + connectionUrl + '\'' +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ", minimumIdle=" + minimumIdle +
                    ", maximumPoolSize=" + maximumPoolSize +
                    ", connectionTimeout=" + connectionTimeout +
                    ", initializeSchema=" + initializeSchema +
                    ']';
        }
    }

    // --- AuthProperties ---
    @Validated
    public record AuthProperties(
            @NotBlank(message = "Token signing key (amethyst.auth.token-signing-key) must be provided as Base64.")
            String tokenSigningKey,

            Duration tokenTtl
    ) {
        public static final Duration DEFAULT_TOKEN_TTL = Duration.ofDays(1);

        public AuthProperties {
            if (tokenTtl == null) {
                tokenTtl = DEFAULT_TOKEN_TTL;
            }
        }

        @AssertTrue(message = "Token TTL (amethyst.auth.token-ttl) must be positive.")
        private boolean isTokenTtlPositive() {
            return !tokenTtl.isNegative() && !tokenTtl.isZero();
        }

        @Override
        public String toString() {
            return "AuthProperties[tokenSigningKey=******, tokenTtl=" + tokenTtl + ']';
        }
    }

    // --- SyncProperties ---
    @Validated
    public record SyncProperties(
            Boolean enabled,
            Duration interval,
            Duration initialDelay
    ) {
        public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(10);

        public SyncProperties {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (interval == null) {
                interval = DEFAULT_INTERVAL;
            }
            if (initialDelay == null) {
                initialDelay = Duration.ZERO;
            }
        }

        static SyncProperties defaults() {
            return new SyncProperties(Boolean.TRUE, DEFAULT_INTERVAL, Duration.ZERO);
        }

        @AssertTrue(message = "Sync interval (amethyst.sync.interval) must be positive.")
        private boolean isIntervalPositive() {
            return !interval.isNegative() && !interval.isZero();
        }

        @AssertTrue(message = "Sync initial delay (amethyst.sync.initial-delay) cannot be negative.")
        private boolean isInitialDelayValid() {
            return !initialDelay.isNegative();
        }
    }

    /**
     * Access policy for one bucket, looked up by (app-name, bucket-name).
     */
    @Validated
    public record BucketPolicyDefinition(
            @NotBlank(message = "Bucket policy app-name cannot be blank")
            String appName,

            @NotBlank(message = "Bucket policy bucket-name cannot be blank")
            String bucketName,

            List<String> allowedIps,

            String ownerEmail
    ) {
        public BucketPolicyDefinition {
            allowedIps = allowedIps == null ? Collections.emptyList() : List.copyOf(allowedIps);
        }
    }
}
