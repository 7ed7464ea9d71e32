package tech.yump.amethyst.auth.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.config.AmethystProperties;
import tech.yump.amethyst.support.TestProperties;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BucketPolicyRepositoryTest {

    @Test
    @DisplayName("Policies are looked up by app and bucket name")
    void findPolicy() {
        BucketPolicyRepository repository = repositoryWith(
                TestProperties.policy("billing", "prod", "10.0.0.1", "10.0.0.2"),
                TestProperties.policy("reporting", "dev", BucketPolicy.ANY));

        BucketPolicy policy = repository.findPolicy(BucketId.of("billing", "prod")).orElseThrow();
        assertThat(policy.allowedIps()).containsExactly("10.0.0.1", "10.0.0.2");
        assertThat(policy.allowsAnyAddress()).isFalse();
        assertThat(repository.findPolicy(BucketId.of("reporting", "dev")).orElseThrow().allowsAnyAddress()).isTrue();
        assertThat(repository.findPolicy(BucketId.of("billing", "dev"))).isEmpty();
    }

    @Test
    @DisplayName("The first of two duplicate policies wins")
    void duplicatePolicies() {
        BucketPolicyRepository repository = repositoryWith(
                TestProperties.policy("billing", "prod", "10.0.0.1"),
                TestProperties.policy("billing", "prod", BucketPolicy.ANY));

        assertThat(repository.findPolicy(BucketId.of("billing", "prod")).orElseThrow().allowedIps())
                .containsExactly("10.0.0.1");
    }

    @Test
    @DisplayName("Without configured policies nothing is found")
    void noPolicies() {
        BucketPolicyRepository repository = repositoryWith();

        assertThat(repository.findPolicy(BucketId.of("billing", "prod"))).isEmpty();
    }

    private static BucketPolicyRepository repositoryWith(AmethystProperties.BucketPolicyDefinition... definitions) {
        AmethystProperties properties = TestProperties.build(Path.of("unused"), null, List.of(definitions));
        BucketPolicyRepository repository = new BucketPolicyRepository(properties);
        repository.initialize();
        return repository;
    }
}
