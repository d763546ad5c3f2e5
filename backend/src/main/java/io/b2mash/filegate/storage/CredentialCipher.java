package io.b2mash.filegate.storage;

import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * AES-GCM for storage-config secrets at rest. Ciphertexts are stored as {@code
 * base64(iv):base64(ciphertext)}.
 */
@Component
public class CredentialCipher {

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int IV_LENGTH = 12; // bytes (96 bits)

  private final SecretKeySpec encryptionKey;
  private final SecureRandom secureRandom = new SecureRandom();

  public CredentialCipher(@Value("${filegate.encryption-key:}") String encodedKey) {
    if (encodedKey == null || encodedKey.isBlank()) {
      this.encryptionKey = null; // Will fail at @PostConstruct
    } else {
      byte[] keyBytes = Base64.getDecoder().decode(encodedKey.trim());
      this.encryptionKey = new SecretKeySpec(keyBytes, "AES");
    }
  }

  @PostConstruct
  void validateKey() {
    if (encryptionKey == null) {
      throw new IllegalStateException(
          "FILEGATE_ENCRYPTION_KEY environment variable is not set. "
              + "Cannot start without the key that protects storage credentials.");
    }
    if (encryptionKey.getEncoded().length != 32) {
      throw new IllegalStateException(
          "FILEGATE_ENCRYPTION_KEY must be a Base64-encoded 256-bit (32-byte) key. "
              + "Got "
              + encryptionKey.getEncoded().length
              + " bytes.");
    }
  }

  public String encrypt(String plaintext) {
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(iv)
          + ":"
          + Base64.getEncoder().encodeToString(ciphertext);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  public String decrypt(String encrypted) {
    int separator = encrypted == null ? -1 : encrypted.indexOf(':');
    if (separator <= 0) {
      throw new IllegalStateException("Stored credential is not in iv:ciphertext form");
    }
    byte[] iv = Base64.getDecoder().decode(encrypted.substring(0, separator));
    byte[] ciphertext = Base64.getDecoder().decode(encrypted.substring(separator + 1));
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Decryption failed", e);
    }
  }
}
