package org.devolia.konfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vault-related helpers of a {@link Konfig}, reached through {@link Konfig#vault()}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class KonfigVault {

  private final Konfig konfig;
  private volatile Map<String, Map<String, String>> overrideExamples;

  KonfigVault(Konfig konfig) {
    this.konfig = konfig;
  }

  /**
   * Shows how each declared secret option can be overridden through the environment.
   *
   * <p>Computed once and memoized.
   *
   * @return option name mapped to its {@link SecretVariable#overrideExample()}
   */
  public Map<String, Map<String, String>> getOverrideExamples() {
    Map<String, Map<String, String>> result = overrideExamples;
    if (result == null) {
      Map<String, Map<String, String>> examples = new LinkedHashMap<>();
      for (String name : konfig.getSettings().getOptionNames()) {
        if (konfig.getSettings().get(name) instanceof SecretVariable variable) {
          examples.put(name, variable.overrideExample());
        }
      }
      result = Collections.unmodifiableMap(examples);
      overrideExamples = result;
    }
    return result;
  }
}
