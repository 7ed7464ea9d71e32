package tech.yump.amethyst.support;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tech.yump.amethyst.api.advice.GlobalExceptionHandler;
import tech.yump.amethyst.auth.AccessGuard;
import tech.yump.amethyst.auth.BucketPrincipal;
import tech.yump.amethyst.auth.BucketTokenAuthFilter;
import tech.yump.amethyst.auth.IpAllowListEnforcer;
import tech.yump.amethyst.auth.policy.BucketPolicyRepository;
import tech.yump.amethyst.bucket.BucketId;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Standalone MockMvc wiring shared by the controller tests.
 * <p>
 * Policies: {@code billing/prod} allows any address, {@code billing/restricted} allows 10.0.0.1 only.
 */
public final class ControllerTestSupport {

    public static final BucketId OPEN_BUCKET = BucketId.of("billing", "prod");
    public static final BucketId RESTRICTED_BUCKET = BucketId.of("billing", "restricted");

    private ControllerTestSupport() {
    }

    public static MockMvc mockMvc(Object controller) {
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
    }

    public static AccessGuard accessGuard() {
        BucketPolicyRepository policyRepository = new BucketPolicyRepository(TestProperties.build(Path.of("unused"), null, List.of(
                TestProperties.policy(OPEN_BUCKET.appName(), OPEN_BUCKET.bucketName(), "ANY"),
                TestProperties.policy(RESTRICTED_BUCKET.appName(), RESTRICTED_BUCKET.bucketName(), "10.0.0.1"))));
        policyRepository.initialize();
        return new AccessGuard(new IpAllowListEnforcer(policyRepository));
    }

    public static BucketPrincipal authenticateAs(BucketId bucket) {
        BucketPrincipal principal = new BucketPrincipal(bucket, UUID.randomUUID(), Instant.now().plusSeconds(300));
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority(BucketTokenAuthFilter.BUCKET_CLIENT_AUTHORITY))));
        return principal;
    }
}
