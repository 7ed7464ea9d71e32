package tech.yump.amethyst.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.amethyst.bucket.BucketId;

/**
 * Gate in front of every bucket-scoped operation. The token scope check and the address check
 * are independent; a request has to pass both.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessGuard {

    private final IpAllowListEnforcer ipAllowListEnforcer;

    /**
     * @throws AuthException SCOPE_MISMATCH when the token belongs to another bucket,
     *                       IP_NOT_ALLOWED when the address fails the allow-list.
     */
    public void authorize(BucketPrincipal principal, BucketId target, String clientAddress) {
        if (principal == null || !principal.bucket().equals(target)) {
            log.warn("Token scoped to {} used against {}", principal, target);
            throw AuthException.scopeMismatch();
        }
        ipAllowListEnforcer.enforce(target, clientAddress);
    }

    /**
     * Address check alone, for operations that run before a client holds a token.
     */
    public void authorizeAddress(BucketId target, String clientAddress) {
        ipAllowListEnforcer.enforce(target, clientAddress);
    }
}
