package tech.yump.amethyst.crypto;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Random passwords and secrets drawn from ASCII letters, digits and punctuation.
 */
@Slf4j
@Component
public class SecretGenerator {

  public static final String ALPHABET =
          "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";
  public static final int RANDOM_SECRET_LENGTH = 32;
  public static final int MIN_PASSWORD_LENGTH = 1;
  public static final int MAX_PASSWORD_LENGTH = 1024;

  private final SecureRandom secureRandom = new SecureRandom();

  public String generatePassword(int length) {
    if (length < MIN_PASSWORD_LENGTH || length > MAX_PASSWORD_LENGTH) {
      throw new IllegalArgumentException(
              "Password length must be between " + MIN_PASSWORD_LENGTH + " and " + MAX_PASSWORD_LENGTH + ", got " + length + ".");
    }
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length())));
    }
    log.debug("Generated random value of length {}.", length);
    return sb.toString();
  }

  public String generateRandomSecret() {
    return generatePassword(RANDOM_SECRET_LENGTH);
  }
}
