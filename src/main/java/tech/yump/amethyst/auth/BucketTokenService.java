package tech.yump.amethyst.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.bucket.CredentialCache;
import tech.yump.amethyst.config.AmethystProperties;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS256 tokens scoped to one bucket.
 * <p>
 * A token carries {@code app_name}, {@code bucket_name}, {@code client_id} and an expiry. It is
 * accepted only while the credential cache maps its bucket to the same client id.
 */
@Slf4j
@Service
public class BucketTokenService {

    static final String CLAIM_APP_NAME = "app_name";
    static final String CLAIM_BUCKET_NAME = "bucket_name";
    static final String CLAIM_CLIENT_ID = "client_id";

    private final CredentialCache credentialCache;
    private final SecretKey signingKey;
    private final Duration tokenTtl;
    private final Clock clock;
    private final JwtParser parser;

    @Autowired
    public BucketTokenService(CredentialCache credentialCache, AmethystProperties properties) {
        this(credentialCache, properties.auth().tokenSigningKey(), properties.auth().tokenTtl(), Clock.systemUTC());
    }

    public BucketTokenService(CredentialCache credentialCache, String base64SigningKey, Duration tokenTtl, Clock clock) {
        this.credentialCache = credentialCache;
        this.signingKey = decodeSigningKey(base64SigningKey);
        this.tokenTtl = tokenTtl;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
        log.debug("BucketTokenService initialized with token TTL {}", tokenTtl);
    }

    private static SecretKey decodeSigningKey(String base64SigningKey) {
        try {
            return Keys.hmacShaKeyFor(Decoders.BASE64.decode(base64SigningKey));
        } catch (JwtException | IllegalArgumentException e) {
            throw new IllegalStateException(
                    "Token signing key (amethyst.auth.token-signing-key) must be Base64 and at least 256 bits long.", e);
        }
    }

    /**
     * Issues a token after checking the client id against the credential cache.
     *
     * @throws AuthException CLIENT_MISMATCH when the bucket is unknown or the client id differs.
     */
    public IssuedToken issue(BucketId bucket, UUID clientId) {
        if (!credentialCache.matches(bucket, clientId)) {
            log.warn("Token request for {} rejected: unknown bucket or client id mismatch.", bucket);
            throw AuthException.clientMismatch();
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(tokenTtl);
        String token = Jwts.builder()
                .subject(clientId.toString())
                .claim(CLAIM_APP_NAME, bucket.appName())
                .claim(CLAIM_BUCKET_NAME, bucket.bucketName())
                .claim(CLAIM_CLIENT_ID, clientId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
        log.info("Issued token for {} valid until {}", bucket, expiresAt);
        return new IssuedToken(token, expiresAt);
    }

    /**
     * Verifies signature, expiry and payload, then requires a credential cache match.
     * Any decode problem is a rejection.
     *
     * @throws AuthException INVALID_TOKEN, EXPIRED_TOKEN or CLIENT_MISMATCH.
     */
    public BucketPrincipal verify(String token) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token: {}", e.getMessage());
            throw AuthException.expiredToken(e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected invalid token: {}", e.getMessage());
            throw AuthException.invalidToken(e);
        }

        BucketPrincipal principal;
        try {
            BucketId bucket = BucketId.of(requireClaim(claims, CLAIM_APP_NAME), requireClaim(claims, CLAIM_BUCKET_NAME));
            UUID clientId = UUID.fromString(requireClaim(claims, CLAIM_CLIENT_ID));
            Date expiration = claims.getExpiration();
            if (expiration == null) {
                throw new IllegalArgumentException("Token has no expiration claim.");
            }
            principal = new BucketPrincipal(bucket, clientId, expiration.toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token with malformed payload: {}", e.getMessage());
            throw AuthException.invalidToken(e);
        }

        if (!credentialCache.matches(principal.bucket(), principal.clientId())) {
            log.warn("Rejected token for {}: client id no longer matches the credential cache.", principal.bucket());
            throw AuthException.clientMismatch();
        }
        return principal;
    }

    private static String requireClaim(Claims claims, String name) {
        String value = claims.get(name, String.class);
        if (value == null) {
            throw new IllegalArgumentException("Token has no '" + name + "' claim.");
        }
        return value;
    }
}
