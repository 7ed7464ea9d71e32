package tech.yump.amethyst.bucket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.amethyst.auth.policy.BucketPolicy;
import tech.yump.amethyst.auth.policy.BucketPolicyRepository;
import tech.yump.amethyst.crypto.EncryptionService;
import tech.yump.amethyst.crypto.KeyBlob;
import tech.yump.amethyst.storage.MirrorBackend;
import tech.yump.amethyst.storage.StorageException;
import tech.yump.amethyst.store.BucketKeyRecord;
import tech.yump.amethyst.store.SecretRepository;
import tech.yump.amethyst.store.StoreException;
import tech.yump.amethyst.store.StoreUnavailableException;

import java.util.List;
import java.util.UUID;

/**
 * Creates buckets and gives access to their key material.
 * <p>
 * The database row is written first and decides whether a bucket exists. The local key file is
 * written afterwards on a best-effort basis; if that write fails the bucket still exists and
 * reconciliation restores the file from the database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BucketManager {

    private final SecretRepository secretRepository;
    private final MirrorBackend mirrorBackend;
    private final EncryptionService encryptionService;
    private final CredentialCache credentialCache;
    private final BucketPolicyRepository bucketPolicyRepository;

    /**
     * Creates a bucket exactly once.
     *
     * @return The new client id and whether the local key file was written.
     * @throws BucketException            ALREADY_EXISTS when the bucket exists, POLICY_MISSING when no policy
     *                                    is configured for it, CREATION_FAILED on a database error.
     * @throws StoreUnavailableException When the database cannot be reached.
     */
    public BucketCreation createBucket(BucketId bucket) {
        log.info("Creating bucket {}", bucket);
        if (bucketPolicyRepository.findPolicy(bucket).isEmpty()) {
            log.warn("Refusing to create bucket {}: no policy configured.", bucket);
            throw BucketException.policyMissing(bucket);
        }
        if (mirrorBackend.keyExists(bucket)) {
            log.warn("Refusing to create bucket {}: key file already present.", bucket);
            throw BucketException.alreadyExists(bucket);
        }

        KeyBlob keyBlob = new KeyBlob(encryptionService.generateKey(), encryptionService.generateSalt());
        byte[] encoded = keyBlob.encode();
        UUID clientId = UUID.randomUUID();

        boolean inserted;
        try {
            inserted = secretRepository.insertBucketKey(new BucketKeyRecord(bucket, encoded, clientId));
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (StoreException e) {
            throw BucketException.creationFailed(bucket, e);
        }
        if (!inserted) {
            log.warn("Refusing to create bucket {}: database row already exists.", bucket);
            throw BucketException.alreadyExists(bucket);
        }

        boolean mirrored = credentialCache.underWriteLock(() -> {
            credentialCache.register(bucket, clientId);
            return writeKeyFile(bucket, encoded);
        });
        log.info("Bucket {} created (key file written: {}).", bucket, mirrored);
        return new BucketCreation(bucket, clientId, mirrored);
    }

    private boolean writeKeyFile(BucketId bucket, byte[] encoded) {
        try {
            mirrorBackend.writeKey(bucket, encoded);
            return true;
        } catch (StorageException e) {
            log.warn("Bucket {} created in the database but its key file could not be written; reconciliation will restore it. Cause: {}",
                    bucket, e.getMessage());
            return false;
        }
    }

    /**
     * Local fast path: a bucket exists when its key file is present.
     */
    public boolean bucketExists(BucketId bucket) {
        return mirrorBackend.keyExists(bucket);
    }

    public List<BucketId> listBuckets() {
        return mirrorBackend.listBuckets();
    }

    /**
     * Reads the key blob of a bucket from the local mirror.
     *
     * @throws BucketException  NOT_FOUND when no key file exists.
     * @throws StorageException When the file cannot be read or is malformed.
     */
    public KeyBlob readBucketKey(BucketId bucket) {
        byte[] encoded = mirrorBackend.readKey(bucket)
                .orElseThrow(() -> BucketException.notFound(bucket));
        try {
            return KeyBlob.decode(encoded);
        } catch (IllegalArgumentException e) {
            log.error("Key file of {} is malformed: {}", bucket, e.getMessage());
            throw new StorageException("Key file of " + bucket + " is malformed", e);
        }
    }

    /**
     * Returns the client id and owner contact of an existing bucket.
     *
     * @throws BucketException NOT_FOUND when the bucket is not in the credential cache.
     */
    public BucketDetails bucketDetails(BucketId bucket) {
        UUID clientId = credentialCache.lookup(bucket)
                .orElseThrow(() -> BucketException.notFound(bucket));
        String ownerEmail = bucketPolicyRepository.findPolicy(bucket)
                .map(BucketPolicy::ownerEmail)
                .orElse(null);
        return new BucketDetails(bucket, clientId, ownerEmail);
    }
}
