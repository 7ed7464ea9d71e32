package tech.yump.amethyst.storage;

import tech.yump.amethyst.bucket.BucketId;

import java.util.List;
import java.util.Optional;

/**
 * Contract for the local mirror of bucket keys and secret ciphertexts.
 * The database is authoritative; the mirror is the read path for keys and secrets.
 */
public interface MirrorBackend {

  /**
   * Reads the encoded key blob of a bucket.
   *
   * @return The blob bytes, or Optional.empty() when the bucket has no key file.
   * @throws StorageException On I/O failure.
   */
  Optional<byte[]> readKey(BucketId bucket) throws StorageException;

  /**
   * Writes the key file, creating the bucket directory if needed. Overwrites an existing file.
   */
  void writeKey(BucketId bucket, byte[] blob) throws StorageException;

  /**
   * Writes the key file only when none exists.
   *
   * @return true if the file was written, false if it was already present.
   */
  boolean writeKeyIfAbsent(BucketId bucket, byte[] blob) throws StorageException;

  boolean keyExists(BucketId bucket) throws StorageException;

  Optional<byte[]> readSecret(BucketId bucket, String secretName) throws StorageException;

  void writeSecret(BucketId bucket, String secretName, byte[] ciphertext) throws StorageException;

  /**
   * @return true if the file was written, false if a file for this secret already existed.
   */
  boolean writeSecretIfAbsent(BucketId bucket, String secretName, byte[] ciphertext) throws StorageException;

  /**
   * Deletes a secret file. Missing files are not an error.
   *
   * @return true if a file was removed.
   */
  boolean deleteSecret(BucketId bucket, String secretName) throws StorageException;

  boolean secretExists(BucketId bucket, String secretName) throws StorageException;

  /**
   * @return Secret names (without extension) present in the bucket directory, sorted.
   */
  List<String> listSecrets(BucketId bucket) throws StorageException;

  /**
   * @return Every bucket directory that holds a key file, sorted by app then bucket.
   */
  List<BucketId> listBuckets() throws StorageException;
}
