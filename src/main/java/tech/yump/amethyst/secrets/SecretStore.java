package tech.yump.amethyst.secrets;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.bucket.BucketManager;
import tech.yump.amethyst.crypto.EncryptionService;
import tech.yump.amethyst.crypto.KeyBlob;
import tech.yump.amethyst.crypto.SecretGenerator;
import tech.yump.amethyst.storage.MirrorBackend;
import tech.yump.amethyst.store.SecretRecord;
import tech.yump.amethyst.store.SecretRepository;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Named secrets inside a bucket.
 * <p>
 * Writes go to the database first and then to the local mirror. Reads and listings use the local
 * mirror only. The bucket key is always read from the mirror. Writes to one secret are serialized
 * through {@link SecretLocks}, shared with reconciliation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecretStore {

    private final BucketManager bucketManager;
    private final SecretRepository secretRepository;
    private final MirrorBackend mirrorBackend;
    private final EncryptionService encryptionService;
    private final SecretGenerator secretGenerator;
    private final SecretLocks secretLocks;

    /**
     * Stores a new secret.
     *
     * @throws SecretException BUCKET_NOT_FOUND if the bucket does not exist, ALREADY_EXISTS if a
     *                         secret with this name is present.
     */
    public void store(BucketId bucket, String secretName, String plaintext) {
        BucketId.requireValidName(secretName, "secret name");
        Objects.requireNonNull(plaintext, "plaintext");
        secretLocks.withLock(bucket, secretName, () -> {
            requireBucket(bucket);
            if (mirrorBackend.secretExists(bucket, secretName)) {
                log.warn("Secret '{}' already exists in {}, refusing to overwrite.", secretName, bucket);
                throw SecretException.alreadyExists(bucket, secretName);
            }
            byte[] ciphertext = encrypt(bucket, plaintext);
            secretRepository.upsertSecret(new SecretRecord(bucket, secretName, ciphertext));
            mirrorBackend.writeSecret(bucket, secretName, ciphertext);
            log.info("Stored secret '{}' in {}", secretName, bucket);
            return null;
        });
    }

    /**
     * Stores a freshly generated random secret under the given name.
     *
     * @return The generated value.
     */
    public String generate(BucketId bucket, String secretName) {
        String value = secretGenerator.generateRandomSecret();
        store(bucket, secretName, value);
        return value;
    }

    /**
     * Reads and decrypts a secret from the local mirror.
     *
     * @throws SecretException BUCKET_NOT_FOUND or NOT_FOUND.
     * @throws EncryptionService.DecryptionException if the ciphertext fails authentication.
     */
    public String retrieve(BucketId bucket, String secretName) {
        BucketId.requireValidName(secretName, "secret name");
        requireBucket(bucket);
        byte[] ciphertext = mirrorBackend.readSecret(bucket, secretName)
                .orElseThrow(() -> SecretException.notFound(bucket, secretName));
        KeyBlob keyBlob = bucketManager.readBucketKey(bucket);
        byte[] plaintext = encryptionService.decrypt(ciphertext, keyBlob.salt());
        log.debug("Retrieved secret '{}' from {}", secretName, bucket);
        return new String(plaintext, StandardCharsets.UTF_8);
    }

    /**
     * Re-encrypts an existing secret and overwrites both copies.
     *
     * @throws SecretException NOT_FOUND if the database has no such secret.
     */
    public void update(BucketId bucket, String secretName, String plaintext) {
        BucketId.requireValidName(secretName, "secret name");
        Objects.requireNonNull(plaintext, "plaintext");
        secretLocks.withLock(bucket, secretName, () -> {
            requireBucket(bucket);
            byte[] ciphertext = encrypt(bucket, plaintext);
            if (!secretRepository.updateSecret(new SecretRecord(bucket, secretName, ciphertext))) {
                log.warn("Cannot update secret '{}' in {}: it does not exist.", secretName, bucket);
                throw SecretException.notFound(bucket, secretName);
            }
            mirrorBackend.writeSecret(bucket, secretName, ciphertext);
            log.info("Updated secret '{}' in {}", secretName, bucket);
            return null;
        });
    }

    /**
     * Deletes the database row, then the local file.
     *
     * @throws SecretException NOT_FOUND if neither copy existed.
     */
    public void delete(BucketId bucket, String secretName) {
        BucketId.requireValidName(secretName, "secret name");
        secretLocks.withLock(bucket, secretName, () -> {
            requireBucket(bucket);
            boolean rowDeleted = secretRepository.deleteSecret(bucket, secretName);
            boolean fileDeleted = mirrorBackend.deleteSecret(bucket, secretName);
            if (!rowDeleted && !fileDeleted) {
                throw SecretException.notFound(bucket, secretName);
            }
            log.info("Deleted secret '{}' from {} (database row: {}, local file: {})", secretName, bucket, rowDeleted, fileDeleted);
            return null;
        });
    }

    /**
     * Lists secret names from the local mirror.
     */
    public List<String> listSecrets(BucketId bucket) {
        requireBucket(bucket);
        return mirrorBackend.listSecrets(bucket);
    }

    public boolean exists(BucketId bucket, String secretName) {
        BucketId.requireValidName(secretName, "secret name");
        return mirrorBackend.secretExists(bucket, secretName);
    }

    private void requireBucket(BucketId bucket) {
        if (!bucketManager.bucketExists(bucket)) {
            throw SecretException.bucketNotFound(bucket);
        }
    }

    private byte[] encrypt(BucketId bucket, String plaintext) {
        KeyBlob keyBlob = bucketManager.readBucketKey(bucket);
        return encryptionService.encrypt(plaintext.getBytes(StandardCharsets.UTF_8), keyBlob.salt());
    }
}
