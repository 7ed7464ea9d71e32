package tech.yump.amethyst.sync;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.bucket.CredentialCache;
import tech.yump.amethyst.config.AmethystProperties;
import tech.yump.amethyst.secrets.SecretLocks;
import tech.yump.amethyst.storage.MirrorBackend;
import tech.yump.amethyst.store.BucketKeyRecord;
import tech.yump.amethyst.store.SecretRecord;
import tech.yump.amethyst.store.SecretRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Copies authoritative database state into the credential cache and the local mirror.
 * <p>
 * A cycle reads every bucket row, writes missing key files and refreshes the cache under the cache
 * write lock, then writes every missing secret file. A secret file is written under the same
 * {@link SecretLocks} lock that request writes take, and only if its row still exists at that point,
 * so a secret deleted during the scan is not brought back. Existing files are never overwritten. A
 * database error aborts the cycle and leaves local state as it was; the next cycle starts over.
 * Only one cycle runs at a time; a trigger that arrives while a cycle is running is skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final SecretRepository secretRepository;
    private final MirrorBackend mirrorBackend;
    private final CredentialCache credentialCache;
    private final AmethystProperties properties;
    private final ThreadPoolTaskScheduler syncTaskScheduler;
    private final SecretLocks secretLocks;

    private final ReentrantLock runLock = new ReentrantLock();
    private volatile ScheduledFuture<?> scheduledTask;
    private volatile SyncReport lastReport;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        AmethystProperties.SyncProperties sync = properties.sync();
        if (!Boolean.TRUE.equals(sync.enabled())) {
            log.warn("Periodic reconciliation is disabled (amethyst.sync.enabled=false). Running one startup cycle; afterwards the local mirror is only repaired on demand.");
            runScheduledCycle();
            return;
        }
        Instant firstRun = Instant.now().plus(sync.initialDelay());
        scheduledTask = syncTaskScheduler.scheduleWithFixedDelay(this::runScheduledCycle, firstRun, sync.interval());
        log.info("Reconciliation scheduled every {} (first run at {}).", sync.interval(), firstRun);
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> task = scheduledTask;
        if (task != null) {
            task.cancel(false);
            scheduledTask = null;
            log.info("Reconciliation schedule cancelled.");
        }
    }

    /**
     * Runs one cycle on demand and propagates any failure to the caller.
     *
     * @return The cycle report, or empty if another cycle was already running.
     */
    public Optional<SyncReport> reconcileNow() {
        if (!runLock.tryLock()) {
            log.info("Reconciliation already in progress, skipping this trigger.");
            return Optional.empty();
        }
        try {
            SyncReport report = runCycle();
            lastReport = report;
            return Optional.of(report);
        } finally {
            runLock.unlock();
        }
    }

    public Optional<SyncReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    boolean isRunning() {
        return runLock.isLocked();
    }

    /**
     * Entry point of the scheduler. Errors end this cycle only.
     */
    void runScheduledCycle() {
        try {
            reconcileNow();
        } catch (RuntimeException e) {
            log.error("Reconciliation cycle aborted, local state left untouched until the next cycle: {}", e.getMessage(), e);
        }
    }

    private SyncReport runCycle() {
        Instant startedAt = Instant.now();
        log.debug("Reconciliation cycle started.");

        List<BucketKeyRecord> buckets = secretRepository.findAllBucketKeys();

        int[] keyCounters = credentialCache.underWriteLock(() -> {
            int keysWritten = 0;
            int cacheRefreshed = 0;
            for (BucketKeyRecord record : buckets) {
                if (mirrorBackend.writeKeyIfAbsent(record.bucket(), record.keyBlob())) {
                    keysWritten++;
                    log.info("Restored missing key file for {}", record.bucket());
                }
                if (credentialCache.refresh(record.bucket(), record.clientId())) {
                    cacheRefreshed++;
                }
            }
            return new int[] { keysWritten, cacheRefreshed };
        });

        AtomicInteger secretsSeen = new AtomicInteger();
        AtomicInteger secretsWritten = new AtomicInteger();
        secretRepository.forEachSecret(record -> {
            secretsSeen.incrementAndGet();
            if (restoreSecret(record)) {
                secretsWritten.incrementAndGet();
                log.debug("Restored missing secret file '{}' of {}", record.secretName(), record.bucket());
            }
        });

        SyncReport report = new SyncReport(
                startedAt,
                Duration.between(startedAt, Instant.now()),
                buckets.size(),
                keyCounters[0],
                keyCounters[1],
                secretsSeen.get(),
                secretsWritten.get());
        log.info("Reconciliation cycle finished in {} ms: {} buckets ({} key files written, {} cache entries changed), {} secrets ({} files written).",
                report.duration().toMillis(), report.bucketsSeen(), report.keysWritten(), report.cacheRefreshed(),
                report.secretsSeen(), report.secretsWritten());
        return report;
    }

    private boolean restoreSecret(SecretRecord scanned) {
        BucketId bucket = scanned.bucket();
        String secretName = scanned.secretName();
        return secretLocks.withLock(bucket, secretName, () -> {
            if (mirrorBackend.secretExists(bucket, secretName)) {
                return false;
            }
            // The scanned row may be older than a delete or update that finished since.
            Optional<SecretRecord> current = secretRepository.findSecret(bucket, secretName);
            if (current.isEmpty()) {
                log.debug("Secret '{}' of {} was deleted after the scan, not restoring it.", secretName, bucket);
                return false;
            }
            return mirrorBackend.writeSecretIfAbsent(bucket, secretName, current.get().encryptedSecret());
        });
    }
}
