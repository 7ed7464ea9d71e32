package tech.yump.amethyst.bucket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory map of {@code (app, bucket) -> client_id}, consulted by token issuance and validation.
 * <p>
 * Readers take the read lock; {@link #underWriteLock(Supplier)} lets a caller run a multi-step
 * update that no reader can observe half-done.
 */
@Slf4j
@Component
public class CredentialCache {

  private final Map<BucketId, UUID> entries = new HashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public Optional<UUID> lookup(BucketId bucket) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(entries.get(bucket));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return true if the bucket is cached with exactly this client id.
   */
  public boolean matches(BucketId bucket, UUID clientId) {
    return clientId != null && lookup(bucket).map(clientId::equals).orElse(false);
  }

  /**
   * Adds an entry for a newly created bucket.
   */
  public void register(BucketId bucket, UUID clientId) {
    lock.writeLock().lock();
    try {
      entries.put(bucket, clientId);
      log.debug("Registered client id for {} in credential cache.", bucket);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Sets the entry to the authoritative value, replacing whatever was cached.
   *
   * @return true if the cached value changed.
   */
  public boolean refresh(BucketId bucket, UUID clientId) {
    lock.writeLock().lock();
    try {
      UUID previous = entries.put(bucket, clientId);
      boolean changed = !clientId.equals(previous);
      if (changed) {
        log.debug("Credential cache entry for {} refreshed.", bucket);
      }
      return changed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Drops the entry of a removed bucket. Reconciliation never calls this.
   */
  public boolean invalidate(BucketId bucket) {
    lock.writeLock().lock();
    try {
      boolean removed = entries.remove(bucket) != null;
      if (removed) {
        log.info("Credential cache entry for {} invalidated.", bucket);
      }
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Runs the action while holding the write lock. The lock is reentrant, so the action may call
   * {@link #refresh} or {@link #register}.
   */
  public <T> T underWriteLock(Supplier<T> action) {
    lock.writeLock().lock();
    try {
      return action.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Map<BucketId, UUID> snapshot() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableMap(new HashMap<>(entries));
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return entries.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
