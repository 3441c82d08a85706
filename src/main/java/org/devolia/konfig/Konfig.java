package org.devolia.konfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;
import org.devolia.konfig.exception.MissingOptionException;
import org.devolia.konfig.exception.VaultBackendMissingException;
import org.devolia.konfig.source.LayeredSettings;
import org.devolia.konfig.source.SettingsLoader;
import org.devolia.konfig.source.SettingsLoaders;
import org.devolia.konfig.vault.VaultBackend;
import org.devolia.konfig.vault.VaultCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading configuration options.
 *
 * <p>An option is resolved in this order:
 *
 * <ol>
 *   <li>Active overrides, newest first (see {@link #override(Map)})
 *   <li>The settings layers, newest first, loaded once on first access
 * </ol>
 *
 * <p>Values found in the settings are then evaluated by kind: {@link EnvVariable}, {@link
 * SecretVariable}, {@link LazyVariable}, nested {@link Map} (evaluated recursively into an
 * immutable copy) or a plain value returned as is. Overridden values are returned as is.
 *
 * <p>With an asynchronous Vault backend, secret options and maps containing them evaluate to a
 * {@link CompletableFuture}.
 *
 * <pre>
 * Konfig config = Konfig.builder()
 *     .settings(ProductionSettings.class)
 *     .vaultBackend(new SyncVaultBackend(VaultBackendConfig.builder().prefix("team").build()))
 *     .build();
 * String password = (String) config.get("DATABASE_PASSWORD");
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class Konfig {

  private static final Logger logger = LoggerFactory.getLogger(Konfig.class);

  public static final String DEFAULT_SETTINGS_VARIABLE = "KONFIG_SETTINGS";

  private final LayeredSettings settings;
  private final OverrideStack overrides;
  private final VaultBackend vaultBackend;
  private final ResolutionContext context;
  private final VaultCredentialOptions credentialOptions;
  private volatile KonfigVault vault;

  private Konfig(Builder builder) {
    Environment environment =
        builder.environment != null ? builder.environment : Environment.system();
    SettingsLoader loader =
        builder.loader != null
            ? builder.loader
            : SettingsLoaders.fromEnvironment(builder.settingsVariable, environment);

    this.settings = new LayeredSettings(loader);
    this.overrides = new OverrideStack(builder.strictOverride, settings::getOptionNames);
    this.vaultBackend = builder.vaultBackend;
    this.context =
        builder.context != null ? builder.context : ResolutionContext.fromEnvironment(environment);
    this.credentialOptions = builder.credentialOptions;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration from a settings object.
   *
   * @param settings a class name, a {@link Class}, a {@link Map}, a {@link
   *     org.devolia.konfig.source.SettingsSource} or any object with public fields
   * @return the configuration, without a Vault backend
   */
  public static Konfig fromObject(Object settings) {
    return builder().settings(settings).build();
  }

  /** Creates a configuration from a JSON file. The file is read on first access. */
  public static Konfig fromJson(Path path) {
    return builder().loader(SettingsLoaders.fromJson(path)).build();
  }

  /** Adds a JSON file on top of the existing settings. */
  public void extendWithJson(Path path) {
    settings.append(SettingsLoaders.fromJson(path));
  }

  /** Adds a settings object on top of the existing settings. */
  public void extendWithObject(Object settingsObject) {
    settings.append(SettingsLoaders.forObject(settingsObject));
  }

  /**
   * Gets an option.
   *
   * @param name the option name
   * @return the evaluated value; a {@link CompletableFuture} for secrets of an async backend
   * @throws MissingOptionException if the option is not declared
   */
  public Object get(String name) {
    logger.debug("Accessing \"{}\" option", name);
    Optional<Object> overridden = overrides.resolve(name);
    if (overridden.isPresent()) {
      return overridden.get();
    }
    if (!settings.contains(name)) {
      throw new MissingOptionException(
          String.format("Option `%s` is not present in `%s`", name, settings.getName()));
    }
    return evaluate(settings.get(name));
  }

  /**
   * Gets an option converted to the given type.
   *
   * @throws ClassCastException if the value is not of that type
   */
  public <T> T get(String name, Class<T> type) {
    return type.cast(get(name));
  }

  /**
   * Gets an option as a future, whatever the backend.
   *
   * @param name the option name
   * @return a future of the evaluated value; failures complete it exceptionally
   */
  public CompletableFuture<Object> getAsync(String name) {
    try {
      Object value = get(name);
      if (value instanceof CompletableFuture<?> future) {
        return future.thenApply(result -> (Object) result);
      }
      return CompletableFuture.completedFuture(value);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Checks if an option is set. Never evaluates the option.
   *
   * @param name the option name
   * @return true if it is overridden or declared with a non-null value
   */
  public boolean contains(String name) {
    if (overrides.resolve(name).isPresent()) {
      return true;
    }
    return settings.contains(name) && settings.get(name) != null;
  }

  /**
   * Checks that options can be resolved.
   *
   * @param keys option names
   * @throws IllegalArgumentException if no key is given
   * @throws MissingOptionException naming every option that cannot be resolved
   */
  public void require(String... keys) {
    if (keys.length == 0) {
      throw new IllegalArgumentException("You need to specify at least one key");
    }
    List<String> missing = new ArrayList<>();
    for (String key : keys) {
      try {
        get(key);
      } catch (MissingOptionException e) {
        missing.add(key);
      }
    }
    if (!missing.isEmpty()) {
      throw new MissingOptionException(String.format("Options %s are required", missing));
    }
  }

  /**
   * Reads a whole secret payload, bypassing the settings.
   *
   * @param path the secret path, without prefix
   * @return the payload, or a future of it for an async backend
   */
  public Object getSecret(String path) {
    logger.info("Access secret \"{}\"", path);
    return evaluateSecret(SecretVariable.vault(path));
  }

  /**
   * Evaluates every declared option.
   *
   * @return option name mapped to its value, as an immutable copy
   * @throws IllegalStateException with an async backend; use {@link #asMapAsync()}
   */
  public Map<String, Object> asMap() {
    if (isAsync()) {
      throw new IllegalStateException("The Vault backend is asynchronous, use asMapAsync()");
    }
    return rebuild(collectOptions(), UnaryOperator.identity());
  }

  /**
   * Evaluates every declared option, waiting for all secrets concurrently.
   *
   * @return a future of option name mapped to its value, as an immutable copy
   */
  public CompletableFuture<Map<String, Object>> asMapAsync() {
    try {
      return resolveFutures(collectOptions());
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Creates overrides for the given options. Nothing is activated until the returned context is
   * enabled.
   */
  public OverrideContext override(Map<String, ?> values) {
    return new OverrideContext(overrides, values);
  }

  public OverrideContext override(String name, Object value) {
    return override(Collections.singletonMap(name, value));
  }

  /** Removes every active override. */
  public void unconfigureAll() {
    overrides.deactivateAll();
  }

  public KonfigVault vault() {
    KonfigVault result = vault;
    if (result == null) {
      result = new KonfigVault(this);
      vault = result;
    }
    return result;
  }

  public VaultBackend getVaultBackend() {
    return vaultBackend;
  }

  public ResolutionContext getContext() {
    return context;
  }

  LayeredSettings getSettings() {
    return settings;
  }

  private boolean isAsync() {
    return vaultBackend != null && vaultBackend.isAsync();
  }

  private Map<String, Object> collectOptions() {
    Map<String, Object> options = new LinkedHashMap<>();
    for (String name : settings.getOptionNames()) {
      options.put(name, get(name));
    }
    return options;
  }

  private Object evaluate(Object value) {
    if (value instanceof EnvVariable variable) {
      return variable.evaluate(context.getEnvironment());
    }
    if (value instanceof SecretVariable variable) {
      return evaluateSecret(variable);
    }
    if (value instanceof LazyVariable variable) {
      return variable.evaluate(this);
    }
    if (value instanceof Map<?, ?> map) {
      if (isAsync()) {
        return resolveFutures(map);
      }
      return rebuild(map, this::evaluateLeaf);
    }
    return value;
  }

  private Object evaluateLeaf(Object value) {
    if (value instanceof EnvVariable
        || value instanceof SecretVariable
        || value instanceof LazyVariable) {
      return evaluate(value);
    }
    return value;
  }

  private Object evaluateSecret(SecretVariable variable) {
    if (vaultBackend == null) {
      throw new VaultBackendMissingException(
          "Vault backend is not configured. "
              + "Please specify `vaultBackend` option in your `Konfig` initialization");
    }
    return variable.evaluate(vaultBackend, this::loadCredentials, context);
  }

  private VaultCredentials loadCredentials() {
    String address = String.valueOf(get(credentialOptions.getAddress()));
    String token = optionalString(credentialOptions.getToken());
    String username = optionalString(credentialOptions.getUsername());
    String password = optionalString(credentialOptions.getPassword());
    if (token == null && (username == null || password == null)) {
      throw new MissingOptionException("Neither a Vault token nor a username and password is set");
    }
    return new VaultCredentials(address, token, username, password);
  }

  private String optionalString(String name) {
    try {
      Object value = get(name);
      return value != null ? String.valueOf(value) : null;
    } catch (MissingOptionException e) {
      return null;
    }
  }

  /** Evaluates a map and waits for every asynchronous leaf, then substitutes the results. */
  private CompletableFuture<Map<String, Object>> resolveFutures(Map<?, ?> data) {
    List<CompletableFuture<?>> pending = new ArrayList<>();
    Map<String, Object> collected =
        rebuild(
            data,
            value -> {
              Object evaluated = evaluateLeaf(value);
              if (evaluated instanceof CompletableFuture<?> future) {
                pending.add(future);
              }
              return evaluated;
            });
    if (pending.isEmpty()) {
      return CompletableFuture.completedFuture(collected);
    }
    return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
        .thenApply(
            ignored ->
                rebuild(
                    collected,
                    value -> value instanceof CompletableFuture<?> future ? future.join() : value));
  }

  /** Copies a nested map, applying the callback to every leaf. */
  private static Map<String, Object> rebuild(Map<?, ?> data, UnaryOperator<Object> callback) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : data.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
        copy.put(String.valueOf(entry.getKey()), rebuild(nested, callback));
      } else {
        copy.put(String.valueOf(entry.getKey()), callback.apply(value));
      }
    }
    return Collections.unmodifiableMap(copy);
  }

  /** Builder for {@link Konfig}. */
  public static final class Builder {

    private SettingsLoader loader;
    private VaultBackend vaultBackend;
    private boolean strictOverride = true;
    private String settingsVariable = DEFAULT_SETTINGS_VARIABLE;
    private Environment environment;
    private ResolutionContext context;
    private VaultCredentialOptions credentialOptions = VaultCredentialOptions.defaults();

    private Builder() {}

    /**
     * Sets how the base settings are loaded. By default, the class named by the settings
     * environment variable is loaded.
     */
    public Builder loader(SettingsLoader loader) {
      this.loader = loader;
      return this;
    }

    /** Uses a settings object as base settings; see {@link Konfig#fromObject(Object)}. */
    public Builder settings(Object settings) {
      this.loader = SettingsLoaders.forObject(settings);
      return this;
    }

    public Builder vaultBackend(VaultBackend vaultBackend) {
      this.vaultBackend = vaultBackend;
      return this;
    }

    /** Rejects overrides of options that are not declared. Enabled by default. */
    public Builder strictOverride(boolean strictOverride) {
      this.strictOverride = strictOverride;
      return this;
    }

    public Builder settingsVariable(String settingsVariable) {
      this.settingsVariable = settingsVariable;
      return this;
    }

    public Builder environment(Environment environment) {
      this.environment = environment;
      return this;
    }

    /** Sets the evaluation flags explicitly instead of reading them from the environment. */
    public Builder context(ResolutionContext context) {
      this.context = context;
      return this;
    }

    public Builder credentialOptions(VaultCredentialOptions credentialOptions) {
      this.credentialOptions = credentialOptions;
      return this;
    }

    public Konfig build() {
      return new Konfig(this);
    }
  }
}
