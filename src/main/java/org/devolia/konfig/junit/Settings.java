package org.devolia.konfig.junit;

import org.devolia.konfig.Konfig;

/**
 * Per-test handle for changing options, injected by {@link SettingsExtension}.
 *
 * <p>Every {@link #set(String, Object)} stays in effect until the end of the current test.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class Settings {

  private final Konfig konfig;

  Settings(Konfig konfig) {
    this.konfig = konfig;
  }

  /**
   * Overrides an option until the end of the test.
   *
   * @throws org.devolia.konfig.exception.ForbiddenOverrideException if the option is not declared
   *     and overrides are strict
   */
  public void set(String name, Object value) {
    konfig.override(name, value).enable();
  }

  public Object get(String name) {
    return konfig.get(name);
  }

  public Konfig getKonfig() {
    return konfig;
  }
}
