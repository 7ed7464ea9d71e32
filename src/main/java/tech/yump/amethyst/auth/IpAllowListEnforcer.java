package tech.yump.amethyst.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.amethyst.auth.policy.BucketPolicy;
import tech.yump.amethyst.auth.policy.BucketPolicyRepository;
import tech.yump.amethyst.bucket.BucketId;

import java.util.List;

/**
 * Checks a caller address against the allow-list of the target bucket's policy.
 * No policy means an empty list, which allows nobody.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IpAllowListEnforcer {

    private final BucketPolicyRepository bucketPolicyRepository;

    public boolean isAllowed(BucketId bucket, String clientAddress) {
        List<String> allowed = bucketPolicyRepository.findPolicy(bucket)
                .map(BucketPolicy::allowedIps)
                .orElse(List.of());
        if (allowed.contains(BucketPolicy.ANY)) {
            return true;
        }
        if (!StringUtils.hasText(clientAddress)) {
            return false;
        }
        String address = clientAddress.trim();
        return allowed.stream().anyMatch(ip -> ip.trim().equals(address));
    }

    /**
     * @throws AuthException IP_NOT_ALLOWED when the address is not on the list.
     */
    public void enforce(BucketId bucket, String clientAddress) {
        if (!isAllowed(bucket, clientAddress)) {
            log.warn("Address {} is not allowed to access {}", clientAddress, bucket);
            throw AuthException.ipNotAllowed(clientAddress);
        }
    }
}
