package tech.yump.amethyst.secrets;

import org.springframework.stereotype.Component;
import tech.yump.amethyst.bucket.BucketId;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks keyed by {@code (bucket, secret name)}.
 * <p>
 * Every writer of a secret's database row or local file holds the lock for that name, so a
 * request and a reconciliation cycle never interleave on the same secret.
 */
@Component
public class SecretLocks {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public SecretLocks() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(BucketId bucket, String secretName, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(Objects.hash(bucket, secretName), STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
