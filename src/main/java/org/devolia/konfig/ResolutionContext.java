package org.devolia.konfig;

/**
 * Flags that steer option evaluation, read once when a {@link Konfig} is built.
 *
 * <p>This class holds:
 *
 * <ul>
 *   <li>The environment used for variable lookups and secret overrides
 *   <li>The secrets kill-switch: when set, every secret not satisfied by an environment override
 *       fails
 *   <li>The defaults switch: when set, secret defaults are ignored and a missing key fails
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class ResolutionContext {

  public static final String SECRETS_DISABLED_VARIABLE = "KONFIG_DISABLE_SECRETS";
  public static final String DEFAULTS_DISABLED_VARIABLE = "VAULT_DISABLE_DEFAULTS";

  private final Environment environment;
  private final boolean secretsDisabled;
  private final boolean defaultsDisabled;

  public ResolutionContext(
      Environment environment, boolean secretsDisabled, boolean defaultsDisabled) {
    this.environment = environment;
    this.secretsDisabled = secretsDisabled;
    this.defaultsDisabled = defaultsDisabled;
  }

  /**
   * Reads both flags from the given environment.
   *
   * @param environment the environment
   * @return the context
   * @throws IllegalArgumentException if a flag is set to something that is not a boolean
   */
  public static ResolutionContext fromEnvironment(Environment environment) {
    return new ResolutionContext(
        environment,
        flag(environment, SECRETS_DISABLED_VARIABLE),
        flag(environment, DEFAULTS_DISABLED_VARIABLE));
  }

  public Environment getEnvironment() {
    return environment;
  }

  public boolean isSecretsDisabled() {
    return secretsDisabled;
  }

  public boolean isDefaultsDisabled() {
    return defaultsDisabled;
  }

  private static boolean flag(Environment environment, String name) {
    String value = environment.get(name);
    return value != null && Casts.toBoolean(value);
  }
}
