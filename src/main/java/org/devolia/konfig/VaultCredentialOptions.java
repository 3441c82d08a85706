package org.devolia.konfig;

/**
 * Names of the options holding the Vault address and credentials.
 *
 * <p>The credentials are read through {@link Konfig#get(String)}, so they can be declared in the
 * settings, taken from environment variables or overridden like any other option.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class VaultCredentialOptions {

  private static final VaultCredentialOptions DEFAULTS =
      new VaultCredentialOptions("VAULT_ADDR", "VAULT_TOKEN", "VAULT_USERNAME", "VAULT_PASSWORD");

  private final String address;
  private final String token;
  private final String username;
  private final String password;

  public VaultCredentialOptions(String address, String token, String username, String password) {
    this.address = address;
    this.token = token;
    this.username = username;
    this.password = password;
  }

  /** {@code VAULT_ADDR}, {@code VAULT_TOKEN}, {@code VAULT_USERNAME} and {@code VAULT_PASSWORD}. */
  public static VaultCredentialOptions defaults() {
    return DEFAULTS;
  }

  public String getAddress() {
    return address;
  }

  public String getToken() {
    return token;
  }

  public String getUsername() {
    return username;
  }

  public String getPassword() {
    return password;
  }
}
