package tech.yump.amethyst.sync;

import java.time.Duration;
import java.time.Instant;

/**
 * Counters of one reconciliation cycle.
 *
 * @param bucketsSeen    Bucket rows read from the database.
 * @param keysWritten    Key files that were missing and have been written.
 * @param cacheRefreshed Credential cache entries whose value changed.
 * @param secretsSeen    Secret rows read from the database.
 * @param secretsWritten Secret files that were missing and have been written.
 */
public record SyncReport(
        Instant startedAt,
        Duration duration,
        int bucketsSeen,
        int keysWritten,
        int cacheRefreshed,
        int secretsSeen,
        int secretsWritten
) {
}
