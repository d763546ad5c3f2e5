package io.b2mash.filegate.file;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/** Salted SHA-256 password hashes, stored as {@code <salt-hex>$<digest-hex>}. */
@Component
public class PasswordHasher {

  private static final int SALT_BYTES = 16;

  private final SecureRandom secureRandom = new SecureRandom();

  public String hash(String password) {
    byte[] salt = new byte[SALT_BYTES];
    secureRandom.nextBytes(salt);
    return HexFormat.of().formatHex(salt) + "$" + digest(salt, password);
  }

  public boolean matches(String password, String storedHash) {
    if (password == null || storedHash == null) {
      return false;
    }
    int separator = storedHash.indexOf('$');
    if (separator <= 0) {
      return false;
    }
    byte[] salt = HexFormat.of().parseHex(storedHash.substring(0, separator));
    String expected = storedHash.substring(separator + 1);
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        digest(salt, password).getBytes(StandardCharsets.UTF_8));
  }

  private static String digest(byte[] salt, String password) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      digest.update(salt);
      byte[] hashBytes = digest.digest(password.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hashBytes);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
