package io.b2mash.filegate.file;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

/** Random alphanumeric identifiers for slugs and storage-key prefixes. */
@Component
public class ShortIdGenerator {

  private static final String ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

  private final SecureRandom secureRandom = new SecureRandom();

  public String generate(int length) {
    var sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }
}
