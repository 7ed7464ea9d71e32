package tech.yump.amethyst.store;

import tech.yump.amethyst.bucket.BucketId;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Authoritative store of bucket keys and secret ciphertexts.
 * <p>
 * Every method throws {@link StoreUnavailableException} when the database cannot be reached and
 * {@link StoreException} for any other database failure.
 */
public interface SecretRepository {

    /**
     * Inserts a new bucket row.
     *
     * @return false if a row for the same (app, bucket) already exists; nothing is written then.
     */
    boolean insertBucketKey(BucketKeyRecord record);

    Optional<BucketKeyRecord> findBucketKey(BucketId bucket);

    /**
     * @return Every bucket row. Rows whose names are not valid bucket names are skipped.
     */
    List<BucketKeyRecord> findAllBucketKeys();

    /**
     * Inserts the secret or replaces the ciphertext of an existing row.
     */
    void upsertSecret(SecretRecord record);

    /**
     * @return true if an existing row was updated, false if there was no such secret.
     */
    boolean updateSecret(SecretRecord record);

    Optional<SecretRecord> findSecret(BucketId bucket, String secretName);

    /**
     * @return true if a row was deleted.
     */
    boolean deleteSecret(BucketId bucket, String secretName);

    /**
     * Streams every secret row to the consumer, reading in fixed-size batches. Rows whose names
     * are not valid bucket or secret names are skipped.
     * Exceptions thrown by the consumer abort the scan and propagate unchanged.
     */
    void forEachSecret(Consumer<SecretRecord> consumer);
}
