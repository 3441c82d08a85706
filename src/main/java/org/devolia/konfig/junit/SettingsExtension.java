package org.devolia.konfig.junit;

import org.devolia.konfig.Konfig;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;

/**
 * Injects a {@link Settings} parameter into test methods and removes every override of the
 * configuration after each test.
 *
 * <pre>
 * &#64;RegisterExtension
 * SettingsExtension settings = new SettingsExtension(config);
 *
 * &#64;Test
 * void debugMode(Settings settings) {
 *   settings.set("DEBUG", true);
 *   ...
 * }
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SettingsExtension implements ParameterResolver, AfterEachCallback {

  private final Konfig konfig;

  public SettingsExtension(Konfig konfig) {
    this.konfig = konfig;
  }

  @Override
  public boolean supportsParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext) {
    return parameterContext.getParameter().getType() == Settings.class;
  }

  @Override
  public Object resolveParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext) {
    return new Settings(konfig);
  }

  @Override
  public void afterEach(ExtensionContext context) {
    konfig.unconfigureAll();
  }
}
