package tech.yump.amethyst.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * A bucket's key and salt persisted as one opaque unit.
 * <p>
 * Encoded form: {@code base64url(key) + "$" + base64url(salt)} as UTF-8 bytes. The same bytes go to
 * the database row and to the {@code secret.key} file of the local mirror.
 */
public record KeyBlob(byte[] key, byte[] salt) {

  private static final char SEPARATOR = '$';
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  public KeyBlob {
    if (key == null || key.length == 0) {
      throw new IllegalArgumentException("Key blob key cannot be null or empty.");
    }
    if (salt == null || salt.length == 0) {
      throw new IllegalArgumentException("Key blob salt cannot be null or empty.");
    }
    key = key.clone();
    salt = salt.clone();
  }

  @Override
  public byte[] key() {
    return key.clone();
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  public byte[] encode() {
    String text = ENCODER.encodeToString(key) + SEPARATOR + ENCODER.encodeToString(salt);
    return text.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * @throws IllegalArgumentException if the bytes are not a well-formed blob.
   */
  public static KeyBlob decode(byte[] encoded) {
    if (encoded == null || encoded.length == 0) {
      throw new IllegalArgumentException("Encoded key blob cannot be null or empty.");
    }
    String text = new String(encoded, StandardCharsets.UTF_8).trim();
    int idx = text.indexOf(SEPARATOR);
    if (idx <= 0 || idx == text.length() - 1 || text.indexOf(SEPARATOR, idx + 1) >= 0) {
      throw new IllegalArgumentException("Malformed key blob: expected '<key>$<salt>'.");
    }
    return new KeyBlob(DECODER.decode(text.substring(0, idx)), DECODER.decode(text.substring(idx + 1)));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof KeyBlob other)) return false;
    return Arrays.equals(key, other.key) && Arrays.equals(salt, other.salt);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(key) + Arrays.hashCode(salt);
  }

  @Override
  public String toString() {
    return "KeyBlob[key=******, saltLength=" + salt.length + ']';
  }
}
