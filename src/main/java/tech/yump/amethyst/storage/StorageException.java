package tech.yump.amethyst.storage;

/**
 * Runtime exception for I/O errors of the local file mirror.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
