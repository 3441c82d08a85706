package org.devolia.konfig.junit;

import org.devolia.konfig.OverrideContext;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps overrides active for a whole test class.
 *
 * <p>Register it on a static field so the overrides are enabled before any {@code @BeforeAll}
 * method of the class and disabled after every {@code @AfterAll} method:
 *
 * <pre>
 * &#64;RegisterExtension
 * static OverrideExtension overrides = OverrideExtension.of(config.override("DEBUG", true));
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class OverrideExtension implements BeforeAllCallback, AfterAllCallback {

  private static final Logger logger = LoggerFactory.getLogger(OverrideExtension.class);

  private final OverrideContext override;

  private OverrideExtension(OverrideContext override) {
    this.override = override;
  }

  public static OverrideExtension of(OverrideContext override) {
    return new OverrideExtension(override);
  }

  @Override
  public void beforeAll(ExtensionContext context) {
    logger.debug("Enabling overrides for {}", context.getDisplayName());
    override.enable();
  }

  @Override
  public void afterAll(ExtensionContext context) {
    if (override.isEnabled()) {
      override.disable();
    }
  }
}
