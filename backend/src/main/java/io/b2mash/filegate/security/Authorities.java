package io.b2mash.filegate.security;

/**
 * Granted authorities installed by {@link UploaderAuthFilter}. Administrators hold every
 * capability; API keys hold the {@code PERM_*} authorities matching their flags.
 */
public final class Authorities {

  public static final String ADMIN = "ROLE_ADMIN";
  public static final String API_KEY = "ROLE_API_KEY";
  public static final String PERM_FILE = "PERM_FILE";
  public static final String PERM_TEXT = "PERM_TEXT";
  public static final String PERM_MOUNT = "PERM_MOUNT";

  private Authorities() {}
}
