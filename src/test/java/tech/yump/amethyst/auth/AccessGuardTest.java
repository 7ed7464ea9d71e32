package tech.yump.amethyst.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.amethyst.auth.policy.BucketPolicyRepository;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.support.TestProperties;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessGuardTest {

    private final BucketId openBucket = BucketId.of("app1", "bucketA");
    private final BucketId restrictedBucket = BucketId.of("app1", "bucketB");

    private IpAllowListEnforcer enforcer;
    private AccessGuard accessGuard;

    @BeforeEach
    void setUp() {
        BucketPolicyRepository policyRepository = new BucketPolicyRepository(TestProperties.build(Path.of("unused"), null, List.of(
                TestProperties.policy("app1", "bucketA", "ANY"),
                TestProperties.policy("app1", "bucketB", "10.0.0.1", "10.0.0.2"))));
        policyRepository.initialize();
        enforcer = new IpAllowListEnforcer(policyRepository);
        accessGuard = new AccessGuard(enforcer);
    }

    @Test
    @DisplayName("ANY allows every address; a literal list allows only its entries")
    void allowList() {
        assertThat(enforcer.isAllowed(openBucket, "203.0.113.7")).isTrue();
        assertThat(enforcer.isAllowed(openBucket, null)).isTrue();
        assertThat(enforcer.isAllowed(restrictedBucket, "10.0.0.1")).isTrue();
        assertThat(enforcer.isAllowed(restrictedBucket, " 10.0.0.2 ")).isTrue();
        assertThat(enforcer.isAllowed(restrictedBucket, "10.0.0.3")).isFalse();
        assertThat(enforcer.isAllowed(restrictedBucket, null)).isFalse();
    }

    @Test
    @DisplayName("A bucket without policy allows nobody")
    void noPolicy() {
        assertThat(enforcer.isAllowed(BucketId.of("app1", "bucketC"), "10.0.0.1")).isFalse();
        assertThatThrownBy(() -> accessGuard.authorizeAddress(BucketId.of("app1", "bucketC"), "10.0.0.1"))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getReason())
                .isEqualTo(AuthException.Reason.IP_NOT_ALLOWED);
    }

    @Test
    @DisplayName("A token for bucketA cannot be used against bucketB")
    void scopeMismatch() {
        BucketPrincipal principal = new BucketPrincipal(openBucket, UUID.randomUUID(), Instant.now().plusSeconds(60));

        assertThatThrownBy(() -> accessGuard.authorize(principal, restrictedBucket, "10.0.0.1"))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getReason())
                .isEqualTo(AuthException.Reason.SCOPE_MISMATCH);
        assertThatThrownBy(() -> accessGuard.authorize(null, openBucket, "10.0.0.1"))
                .isInstanceOf(AuthException.class);
    }

    @Test
    @DisplayName("A valid token does not bypass the address check")
    void tokenAndAddressAreIndependent() {
        BucketPrincipal principal = new BucketPrincipal(restrictedBucket, UUID.randomUUID(), Instant.now().plusSeconds(60));

        assertThatCode(() -> accessGuard.authorize(principal, restrictedBucket, "10.0.0.1")).doesNotThrowAnyException();
        assertThatThrownBy(() -> accessGuard.authorize(principal, restrictedBucket, "192.168.1.5"))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getReason())
                .isEqualTo(AuthException.Reason.IP_NOT_ALLOWED);
    }
}
