package tech.yump.amethyst.storage;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.config.AmethystProperties;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * File mirror laid out as {@code {root}/{app}/{bucket}/secret.key} and
 * {@code {root}/{app}/{bucket}/{secret}.json}. Secret files hold the raw ciphertext bytes.
 */
@Slf4j
@Component
public class FileSystemMirrorBackend implements MirrorBackend {

  public static final String KEY_FILE_NAME = "secret.key";
  public static final String SECRET_FILE_SUFFIX = ".json";
  static final String TEMP_FILE_PREFIX = ".tmp-";
  static final String TEMP_FILE_SUFFIX = ".part";

  private final Path basePath;

  @Autowired
  public FileSystemMirrorBackend(final AmethystProperties properties) {
    this(Paths.get(properties.storage().filesystem().path()));
  }

  FileSystemMirrorBackend(final Path basePath) {
    this.basePath = basePath.toAbsolutePath().normalize();
    log.info("FileSystemMirrorBackend initialized with base path: {}", this.basePath);
  }

  /**
   * Validates the base path after bean creation, creating it when absent.
   */
  @PostConstruct
  void validateBasePath() {
    try {
      if (Files.exists(basePath)) {
        if (!Files.isDirectory(basePath)) {
          throw new StorageException("Configured mirror path exists but is not a directory: " + basePath);
        }
        if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
          throw new StorageException("Configured mirror directory lacks read/write permissions: " + basePath);
        }
        log.debug("Mirror base path validation successful: {}", basePath);
      } else {
        log.warn("Mirror base path does not exist, attempting to create: {}", basePath);
        Files.createDirectories(basePath);
        log.info("Successfully created mirror base path: {}", basePath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create mirror base path: {}", basePath, e);
      throw new StorageException("Failed to initialize mirror base path: " + basePath, e);
    }
  }

  // --- Keys ---

  @Override
  public Optional<byte[]> readKey(BucketId bucket) throws StorageException {
    return readFile(keyPath(bucket), "key of " + bucket);
  }

  @Override
  public void writeKey(BucketId bucket, byte[] blob) throws StorageException {
    replaceFile(keyPath(bucket), blob, "key of " + bucket);
  }

  @Override
  public boolean writeKeyIfAbsent(BucketId bucket, byte[] blob) throws StorageException {
    return createFile(keyPath(bucket), blob, "key of " + bucket);
  }

  @Override
  public boolean keyExists(BucketId bucket) throws StorageException {
    return Files.isRegularFile(keyPath(bucket), LinkOption.NOFOLLOW_LINKS);
  }

  // --- Secrets ---

  @Override
  public Optional<byte[]> readSecret(BucketId bucket, String secretName) throws StorageException {
    return readFile(secretPath(bucket, secretName), describe(bucket, secretName));
  }

  @Override
  public void writeSecret(BucketId bucket, String secretName, byte[] ciphertext) throws StorageException {
    replaceFile(secretPath(bucket, secretName), ciphertext, describe(bucket, secretName));
  }

  @Override
  public boolean writeSecretIfAbsent(BucketId bucket, String secretName, byte[] ciphertext) throws StorageException {
    return createFile(secretPath(bucket, secretName), ciphertext, describe(bucket, secretName));
  }

  @Override
  public boolean deleteSecret(BucketId bucket, String secretName) throws StorageException {
    Path filePath = secretPath(bucket, secretName);
    try {
      boolean deleted = Files.deleteIfExists(filePath);
      if (deleted) {
        log.info("Deleted mirror file for {}", describe(bucket, secretName));
      } else {
        log.debug("No mirror file to delete for {} (path {} did not exist)", describe(bucket, secretName), filePath);
      }
      return deleted;
    } catch (AccessDeniedException e) {
      log.error("Permission denied deleting {} at {}: {}", describe(bucket, secretName), filePath, e.getMessage(), e);
      throw new StorageException("Permission denied deleting " + describe(bucket, secretName), e);
    } catch (IOException e) {
      log.error("Failed to delete {} at {}: {}", describe(bucket, secretName), filePath, e.getMessage(), e);
      throw new StorageException("Failed to delete " + describe(bucket, secretName), e);
    }
  }

  @Override
  public boolean secretExists(BucketId bucket, String secretName) throws StorageException {
    return Files.isRegularFile(secretPath(bucket, secretName), LinkOption.NOFOLLOW_LINKS);
  }

  @Override
  public List<String> listSecrets(BucketId bucket) throws StorageException {
    Path dir = bucketDir(bucket);
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      log.debug("Bucket directory {} does not exist, no secrets to list.", dir);
      return List.of();
    }
    List<String> names = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SECRET_FILE_SUFFIX)) {
      for (Path entry : stream) {
        if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
          String fileName = entry.getFileName().toString();
          names.add(fileName.substring(0, fileName.length() - SECRET_FILE_SUFFIX.length()));
        }
      }
    } catch (IOException e) {
      log.error("Failed to list secrets of {} in {}: {}", bucket, dir, e.getMessage(), e);
      throw new StorageException("Failed to list secrets of " + bucket, e);
    }
    names.sort(Comparator.naturalOrder());
    return names;
  }

  @Override
  public List<BucketId> listBuckets() throws StorageException {
    List<BucketId> buckets = new ArrayList<>();
    if (!Files.isDirectory(basePath)) {
      return buckets;
    }
    try (DirectoryStream<Path> apps = Files.newDirectoryStream(basePath, Files::isDirectory)) {
      for (Path appDir : apps) {
        try (DirectoryStream<Path> bucketDirs = Files.newDirectoryStream(appDir, Files::isDirectory)) {
          for (Path bucketDir : bucketDirs) {
            if (!Files.isRegularFile(bucketDir.resolve(KEY_FILE_NAME))) {
              continue;
            }
            toBucketId(appDir, bucketDir).ifPresent(buckets::add);
          }
        }
      }
    } catch (IOException e) {
      log.error("Failed to list buckets under {}: {}", basePath, e.getMessage(), e);
      throw new StorageException("Failed to list buckets", e);
    }
    buckets.sort(Comparator.comparing(BucketId::appName).thenComparing(BucketId::bucketName));
    return buckets;
  }

  private Optional<BucketId> toBucketId(Path appDir, Path bucketDir) {
    try {
      return Optional.of(BucketId.of(appDir.getFileName().toString(), bucketDir.getFileName().toString()));
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring mirror directory with an invalid name: {}", bucketDir);
      return Optional.empty();
    }
  }

  // --- File helpers ---

  private Optional<byte[]> readFile(Path filePath, String what) {
    if (!Files.isRegularFile(filePath, LinkOption.NOFOLLOW_LINKS)) {
      log.debug("Mirror file for {} not found at {}", what, filePath);
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readAllBytes(filePath));
    } catch (NoSuchFileException e) {
      log.debug("Mirror file for {} disappeared before it could be read: {}", what, filePath);
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to read {} from {}: {}", what, filePath, e.getMessage(), e);
      throw new StorageException("Failed to read " + what, e);
    }
  }

  /**
   * Writes to a temporary sibling and moves it into place so readers never see a partial file.
   */
  private void replaceFile(Path filePath, byte[] content, String what) {
    Path tmp = null;
    try {
      Files.createDirectories(filePath.getParent());
      tmp = Files.createTempFile(filePath.getParent(), TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
      Files.write(tmp, content, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
      Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      tmp = null;
      log.debug("Wrote mirror file for {} at {}", what, filePath);
    } catch (IOException e) {
      log.error("Failed to write {} to {}: {}", what, filePath, e.getMessage(), e);
      throw new StorageException("Failed to write " + what, e);
    } finally {
      cleanupTemp(tmp);
    }
  }

  /**
   * Publishes the content under {@code filePath} only if nothing is there yet. The bytes are written to a
   * temporary sibling first and then hard-linked into place, so readers see either no file or the whole file.
   */
  private boolean createFile(Path filePath, byte[] content, String what) {
    Path tmp = null;
    try {
      Path parent = filePath.getParent();
      Files.createDirectories(parent);
      if (Files.exists(filePath, LinkOption.NOFOLLOW_LINKS)) {
        log.trace("Mirror file for {} already exists at {}", what, filePath);
        return false;
      }
      tmp = Files.createTempFile(parent, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
      Files.write(tmp, content);
      try {
        Files.createLink(filePath, tmp);
      } catch (UnsupportedOperationException e) {
        // No hard links on this file system; a rename is still atomic, it just cannot refuse an existing target.
        Files.move(tmp, filePath, StandardCopyOption.ATOMIC_MOVE);
        tmp = null;
      }
      log.debug("Created mirror file for {} at {}", what, filePath);
      return true;
    } catch (FileAlreadyExistsException e) {
      log.trace("Mirror file for {} already exists at {}", what, filePath);
      return false;
    } catch (IOException e) {
      log.error("Failed to create {} at {}: {}", what, filePath, e.getMessage(), e);
      throw new StorageException("Failed to create " + what, e);
    } finally {
      cleanupTemp(tmp);
    }
  }

  private void cleanupTemp(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Could not remove temporary mirror file {}: {}", tmp, e.getMessage());
    }
  }

  // --- Path resolution ---

  private Path bucketDir(BucketId bucket) {
    return resolvePath(bucket.appName() + "/" + bucket.bucketName());
  }

  private Path keyPath(BucketId bucket) {
    return resolvePath(bucket.appName() + "/" + bucket.bucketName() + "/" + KEY_FILE_NAME);
  }

  private Path secretPath(BucketId bucket, String secretName) {
    BucketId.requireValidName(secretName, "secret name");
    return resolvePath(bucket.appName() + "/" + bucket.bucketName() + "/" + secretName + SECRET_FILE_SUFFIX);
  }

  /**
   * Resolves a relative path against the base path and rejects anything that escapes it.
   *
   * @throws StorageException if the path is malformed or resolves outside the base directory.
   */
  private Path resolvePath(String relativePath) throws StorageException {
    String sanitizedPath = relativePath.replace('\\', '/').trim();
    if (sanitizedPath.startsWith("/") || sanitizedPath.endsWith("/") || sanitizedPath.contains("..") || sanitizedPath.isEmpty()) {
      log.error("Invalid mirror path provided: '{}'", relativePath);
      throw new StorageException("Invalid mirror path format: " + relativePath);
    }

    Path absolutePath = this.basePath.resolve(sanitizedPath).normalize();
    if (!absolutePath.startsWith(this.basePath)) {
      log.error("Path traversal attempt detected for path '{}', resolved path '{}' is outside base path '{}'", relativePath, absolutePath, this.basePath);
      throw new StorageException("Invalid path resulting in path traversal attempt: " + relativePath);
    }
    return absolutePath;
  }

  private static String describe(BucketId bucket, String secretName) {
    return "secret '" + secretName + "' of " + bucket;
  }

  Path basePath() {
    return basePath;
  }
}
