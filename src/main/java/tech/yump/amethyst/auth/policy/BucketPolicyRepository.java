package tech.yump.amethyst.auth.policy;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.config.AmethystProperties;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bucket policies loaded from {@code amethyst.buckets}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BucketPolicyRepository {

    private final AmethystProperties amethystProperties;
    private Map<BucketId, BucketPolicy> policyMap = Collections.emptyMap();

    @PostConstruct
    public void initialize() {
        List<AmethystProperties.BucketPolicyDefinition> definitions = Optional.ofNullable(amethystProperties.buckets())
                .orElse(Collections.emptyList());

        if (definitions.isEmpty()) {
            log.warn("No bucket policies defined in configuration (amethyst.buckets). Bucket creation and IP-gated endpoints will be denied.");
            return;
        }
        this.policyMap = definitions.stream()
                .map(def -> new BucketPolicy(BucketId.of(def.appName(), def.bucketName()), def.allowedIps(), def.ownerEmail()))
                .collect(Collectors.toUnmodifiableMap(BucketPolicy::bucket, Function.identity(), (existing, replacement) -> {
                    log.warn("Duplicate bucket policy found in configuration for '{}'. Using the first occurrence.", existing.bucket());
                    return existing;
                }));
        log.info("Loaded {} bucket policies from configuration.", this.policyMap.size());
        log.debug("Loaded bucket policies for: {}", this.policyMap.keySet());
    }

    public Optional<BucketPolicy> findPolicy(BucketId bucket) {
        return Optional.ofNullable(policyMap.get(bucket));
    }
}
