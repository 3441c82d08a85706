package org.devolia.konfig.source;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.devolia.konfig.Environment;
import org.devolia.konfig.SampleSettings;
import org.devolia.konfig.exception.SettingsNotLoadableException;
import org.devolia.konfig.exception.SettingsNotSpecifiedException;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SettingsLoaders and ClassSettingsSource.
 *
 * @author Devolia
 * @since 1.0.0
 */
class SettingsLoadersTest {

  /** Instance settings, as used by {@link SettingsLoaders#forObject(Object)}. */
  public static class InstanceSettings {
    public String HOST = "instance";
    public static final String SHARED = "static";
  }

  @Test
  void testFromEnvironment() {
    SettingsSource source =
        SettingsLoaders.fromEnvironment(
                "SETTINGS", Environment.of(Map.of("SETTINGS", SampleSettings.class.getName())))
            .load();

    assertEquals(SampleSettings.class.getName(), source.getName());
    assertEquals(false, source.get("DEBUG"));
  }

  @Test
  void testFromEnvironmentWithoutVariable() {
    SettingsLoader unset = SettingsLoaders.fromEnvironment("SETTINGS", Environment.of(Map.of()));
    SettingsLoader empty =
        SettingsLoaders.fromEnvironment("SETTINGS", Environment.of(Map.of("SETTINGS", "")));

    SettingsNotSpecifiedException exception =
        assertThrows(SettingsNotSpecifiedException.class, unset::load);
    assertTrue(exception.getMessage().startsWith("The environment variable `SETTINGS`"));
    assertThrows(SettingsNotSpecifiedException.class, empty::load);
  }

  @Test
  void testFromUnknownClassName() {
    SettingsLoader loader = SettingsLoaders.fromClassName("org.devolia.konfig.DoesNotExist");

    SettingsNotLoadableException exception =
        assertThrows(SettingsNotLoadableException.class, loader::load);
    assertEquals(
        "Unable to load configuration file `org.devolia.konfig.DoesNotExist`",
        exception.getMessage());
  }

  @Test
  void testClassSettingsReadPublicStaticFields() {
    SettingsSource source = SettingsLoaders.forObject(SampleSettings.class).load();

    assertTrue(source.contains("DEBUG"));
    assertTrue(source.contains("lowercase"));
    assertFalse(source.contains("instanceField"));
  }

  @Test
  void testInstanceSettingsReadAllPublicFields() {
    SettingsSource source = SettingsLoaders.forObject(new InstanceSettings()).load();

    assertEquals("instance", source.get("HOST"));
    assertEquals("static", source.get("SHARED"));
  }

  @Test
  void testForObject() {
    SettingsSource fromMap = SettingsLoaders.forObject(Map.of("DEBUG", true)).load();
    assertEquals("Config", fromMap.getName());
    assertEquals(true, fromMap.get("DEBUG"));

    SettingsSource custom = new MapSettingsSource("custom", Map.of());
    assertSame(custom, SettingsLoaders.forObject(custom).load());

    SettingsSource fromName = SettingsLoaders.forObject(SampleSettings.class.getName()).load();
    assertEquals(false, fromName.get("DEBUG"));

    assertThrows(IllegalArgumentException.class, () -> SettingsLoaders.forObject(null));
  }
}
