package tech.yump.amethyst.bucket;

import java.util.regex.Pattern;

/**
 * Identity of a tenant: a bucket name inside an app namespace.
 */
public record BucketId(String appName, String bucketName) {

  private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

  public BucketId {
    requireValidName(appName, "app name");
    requireValidName(bucketName, "bucket name");
  }

  public static BucketId of(String appName, String bucketName) {
    return new BucketId(appName, bucketName);
  }

  /**
   * Rejects names that could escape the mirror directory or collide with its own files.
   *
   * @throws IllegalArgumentException when the name is null or does not match the allowed pattern.
   */
  public static String requireValidName(String name, String label) {
    if (!isValidName(name)) {
      throw new IllegalArgumentException("Invalid " + label + ": '" + name
              + "'. Use 1-128 characters from [A-Za-z0-9._-], starting with a letter or digit.");
    }
    return name;
  }

  public static boolean isValidName(String name) {
    return name != null && NAME_PATTERN.matcher(name).matches() && !name.contains("..");
  }

  @Override
  public String toString() {
    return appName + "/" + bucketName;
  }
}
