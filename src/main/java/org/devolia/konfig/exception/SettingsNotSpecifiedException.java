package org.devolia.konfig.exception;

/** The environment variable pointing to the settings class is not set. */
public class SettingsNotSpecifiedException extends KonfigException {

  public SettingsNotSpecifiedException(String message) {
    super(message);
  }
}
