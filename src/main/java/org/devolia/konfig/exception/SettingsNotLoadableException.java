package org.devolia.konfig.exception;

/** The settings source is named but cannot be found or read. */
public class SettingsNotLoadableException extends KonfigException {

  public SettingsNotLoadableException(String message, Throwable cause) {
    super(message, cause);
  }
}
