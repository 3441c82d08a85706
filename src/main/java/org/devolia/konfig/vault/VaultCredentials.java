package org.devolia.konfig.vault;

/**
 * Server address and credentials used for one secret read.
 *
 * <p>Either a token or a complete username and password pair must be present.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class VaultCredentials {

  private final String address;
  private final String token;
  private final String username;
  private final String password;

  public VaultCredentials(String address, String token, String username, String password) {
    if (address == null || address.trim().isEmpty()) {
      throw new IllegalArgumentException("Vault address cannot be null or empty");
    }
    this.address = address;
    this.token = token;
    this.username = username;
    this.password = password;
  }

  /** Credentials with a static token. */
  public static VaultCredentials ofToken(String address, String token) {
    return new VaultCredentials(address, token, null, null);
  }

  /** Credentials for userpass authentication. */
  public static VaultCredentials ofUserpass(String address, String username, String password) {
    return new VaultCredentials(address, null, username, password);
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

  public boolean hasToken() {
    return token != null && !token.isEmpty();
  }

  /**
   * Checks if both username and password are present.
   *
   * @return true when userpass login (and re-login on a rejected token) is possible
   */
  public boolean hasUserpass() {
    return username != null && !username.isEmpty() && password != null && !password.isEmpty();
  }

  @Override
  public String toString() {
    // Never print the token or password
    return "VaultCredentials{address="
        + address
        + ", token="
        + (hasToken() ? "****" : "none")
        + ", username="
        + username
        + "}";
  }
}
