package tech.yump.amethyst.crypto;

import java.nio.ByteBuffer;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tech.yump.amethyst.config.AmethystProperties;

/**
 * Key generation, key derivation and authenticated encryption for bucket secrets.
 * <p>
 * Every bucket owns a salt. The working AES key for that bucket is derived from the server
 * passphrase and the salt with PBKDF2-HMAC-SHA256, so the same salt always yields the same key.
 */
@Slf4j
@Component
public class EncryptionService {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final String AES = "AES";
  public static final int TAG_LENGTH_BIT = 128; // Standard for GCM
  public static final int NONCE_LENGTH_BYTE = 12; // Recommended for GCM
  public static final int KEY_LENGTH_BYTE = 32;
  public static final int SALT_LENGTH_BYTE = 16;
  public static final int PBKDF2_ITERATIONS = 100_000;

  private final SecureRandom secureRandom = new SecureRandom();
  private final byte[] passphraseBytes;

  @Autowired
  public EncryptionService(AmethystProperties properties) {
    this(properties.crypto().passphrase());
  }

  public EncryptionService(char[] passphrase) {
    if (passphrase == null || passphrase.length == 0) {
      throw new IllegalArgumentException("Key derivation passphrase cannot be null or empty.");
    }
    this.passphraseBytes = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(passphrase);
    log.debug("EncryptionService initialized (PBKDF2-HMAC-SHA256, {} iterations, AES-256-GCM).", PBKDF2_ITERATIONS);
  }

  /**
   * @return 32 bytes from a CSPRNG, suitable as an AES-256 key.
   */
  public byte[] generateKey() {
    byte[] key = new byte[KEY_LENGTH_BYTE];
    secureRandom.nextBytes(key);
    return key;
  }

  /**
   * @return 16 random bytes.
   */
  public byte[] generateSalt() {
    byte[] salt = new byte[SALT_LENGTH_BYTE];
    secureRandom.nextBytes(salt);
    return salt;
  }

  /**
   * Derives a 256-bit key from the server passphrase and the given salt.
   * Deterministic: the same salt always produces the same key.
   *
   * @param salt The salt. Must not be null or empty.
   * @return The derived key bytes.
   */
  public byte[] deriveKey(byte[] salt) {
    if (salt == null || salt.length == 0) {
      throw new EncryptionException("Salt cannot be null or empty.");
    }
    PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
    generator.init(passphraseBytes, salt, PBKDF2_ITERATIONS);
    KeyParameter keyParameter = (KeyParameter) generator.generateDerivedParameters(KEY_LENGTH_BYTE * 8);
    return keyParameter.getKey();
  }

  /**
   * Encrypts the given plaintext using AES-GCM keyed by {@code deriveKey(salt)} and a fresh nonce.
   * The nonce is prepended to the resulting ciphertext.
   *
   * @param plaintext The byte array to encrypt. Cannot be null.
   * @param salt      The bucket salt.
   * @return A byte array containing the nonce prepended to the ciphertext (nonce || ciphertext || tag).
   * @throws EncryptionException If any cryptographic error occurs during encryption.
   */
  public byte[] encrypt(byte[] plaintext, byte[] salt) {
    if (plaintext == null) {
      throw new EncryptionException("Plaintext cannot be null.");
    }
    log.debug("Attempting to encrypt {} bytes of data.", plaintext.length);

    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    secureRandom.nextBytes(nonce);
    GCMParameterSpec gcmParameterSpec = new GCMParameterSpec(TAG_LENGTH_BIT, nonce);

    byte[] derived = deriveKey(salt);
    try {
      SecretKey aesKey = new SecretKeySpec(derived, AES);
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, aesKey, gcmParameterSpec);

      byte[] ciphertext = cipher.doFinal(plaintext);
      log.debug("Encryption successful, ciphertext length: {} bytes.", ciphertext.length);

      ByteBuffer byteBuffer = ByteBuffer.allocate(nonce.length + ciphertext.length);
      byteBuffer.put(nonce);
      byteBuffer.put(ciphertext);
      return byteBuffer.array();

    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Encryption failed: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to encrypt data.", e);
    } finally {
      Arrays.fill(derived, (byte) 0);
    }
  }

  /**
   * Decrypts the given byte array (expected format: nonce || ciphertext) using AES-GCM keyed by
   * {@code deriveKey(salt)}. Verifies integrity using the embedded GCM tag.
   *
   * @param nonceAndCiphertext The byte array containing the nonce prepended to the ciphertext.
   * @param salt               The salt the data was encrypted with.
   * @return The original plaintext.
   * @throws DecryptionException If the input is malformed, the salt is wrong or the data was tampered with.
   * @throws EncryptionException On any other cryptographic failure.
   */
  public byte[] decrypt(byte[] nonceAndCiphertext, byte[] salt) {
    if (nonceAndCiphertext == null || nonceAndCiphertext.length < NONCE_LENGTH_BYTE + TAG_LENGTH_BIT / 8) {
      throw new DecryptionException("Invalid input: Nonce and ciphertext array is null or too short.");
    }
    log.debug("Attempting to decrypt {} bytes of combined nonce and ciphertext.", nonceAndCiphertext.length);

    ByteBuffer bb = ByteBuffer.wrap(nonceAndCiphertext);
    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    bb.get(nonce);
    byte[] ciphertext = new byte[bb.remaining()];
    bb.get(ciphertext);

    GCMParameterSpec gcmParameterSpec = new GCMParameterSpec(TAG_LENGTH_BIT, nonce);

    byte[] derived = deriveKey(salt);
    try {
      SecretKey aesKey = new SecretKeySpec(derived, AES);
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, aesKey, gcmParameterSpec);

      byte[] plaintext = cipher.doFinal(ciphertext);
      log.debug("Decryption successful, plaintext length: {} bytes.", plaintext.length);
      return plaintext;

    } catch (AEADBadTagException e) {
      log.error("Decryption failed due to invalid authentication tag (tampered data or wrong salt).");
      throw new DecryptionException("Decryption failed: Invalid authentication tag. Data may be corrupt, tampered with, or encrypted under a different salt.", e);
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Decryption failed due to other cryptographic error: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to decrypt data.", e);
    } finally {
      Arrays.fill(derived, (byte) 0);
    }
  }

  // --- Helper Exception Classes ---

  /**
   * Runtime exception for encryption and key derivation errors.
   */
  public static class EncryptionException extends RuntimeException {
    public EncryptionException(String message) {
      super(message);
    }
    public EncryptionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Raised when ciphertext cannot be authenticated: wrong salt, tampering, or truncated input.
   */
  public static class DecryptionException extends EncryptionException {
    public DecryptionException(String message) {
      super(message);
    }
    public DecryptionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

}
