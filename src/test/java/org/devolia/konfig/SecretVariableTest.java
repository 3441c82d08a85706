package org.devolia.konfig;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.devolia.konfig.exception.InvalidSecretOverrideException;
import org.devolia.konfig.exception.MissingOptionException;
import org.devolia.konfig.exception.SecretKeyMissingException;
import org.devolia.konfig.exception.SecretsDisabledException;
import org.devolia.konfig.metrics.VaultMetrics;
import org.devolia.konfig.vault.AsyncVaultBackend;
import org.devolia.konfig.vault.SyncVaultBackend;
import org.devolia.konfig.vault.VaultBackendConfig;
import org.devolia.konfig.vault.VaultCredentials;
import org.devolia.konfig.vault.VaultTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for SecretVariable.
 *
 * @author Devolia
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SecretVariableTest {

  private static final String ADDRESS = "http://vault.local:8200";
  private static final Map<String, Object> PAYLOAD =
      Map.of(
          "SECRET", "value",
          "IS_SECRET", true,
          "DECIMAL", "1.3",
          "nested", Map.of("key", "deep"));

  @Mock private VaultTransport transport;

  private SyncVaultBackend backend;
  private final Supplier<VaultCredentials> credentials =
      () -> VaultCredentials.ofToken(ADDRESS, "s.token");

  @BeforeEach
  void setUp() {
    backend =
        new SyncVaultBackend(
            VaultBackendConfig.builder().retryWait(Duration.ofMillis(10)).build(),
            transport,
            VaultMetrics.standalone("test"),
            Clock.systemUTC());
  }

  private static ResolutionContext context(Map<String, String> env) {
    return ResolutionContext.fromEnvironment(Environment.of(env));
  }

  private void stubPayload() {
    when(transport.read(ADDRESS, "path/to", "s.token")).thenReturn(Map.of("data", PAYLOAD));
  }

  @Test
  void testValueFromVault() {
    stubPayload();

    Object value =
        SecretVariable.vault("path/to")
            .key("SECRET")
            .evaluate(backend, credentials, context(Map.of()));

    assertEquals("value", value);
  }

  @Test
  void testWholePayloadWithoutKeys() {
    stubPayload();

    assertEquals(
        PAYLOAD, SecretVariable.vault("path/to").evaluate(backend, credentials, context(Map.of())));
  }

  @Test
  void testNestedKeyPath() {
    stubPayload();

    Object value =
        SecretVariable.vault("path/to")
            .key("nested")
            .key("key")
            .evaluate(backend, credentials, context(Map.of()));

    assertEquals("deep", value);
  }

  @Test
  void testCastIsApplied() {
    stubPayload();

    Object value =
        SecretVariable.vault("path/to")
            .key("DECIMAL")
            .withCast(Casts::toDecimal)
            .evaluate(backend, credentials, context(Map.of()));

    assertEquals(new BigDecimal("1.3"), value);
  }

  @Test
  void testMissingKeyUsesDefaultWithoutCast() {
    stubPayload();

    Object value =
        SecretVariable.vault("path/to")
            .key("MISSING")
            .withCast(Casts::toInteger)
            .withDefault("fallback")
            .evaluate(backend, credentials, context(Map.of()));

    assertEquals("fallback", value);
  }

  @Test
  void testMissingKeyWithoutDefault() {
    stubPayload();
    SecretVariable variable = SecretVariable.vault("path/to").key("nested").key("other");

    SecretKeyMissingException exception =
        assertThrows(
            SecretKeyMissingException.class,
            () -> variable.evaluate(backend, credentials, context(Map.of())));

    assertEquals(
        "Path `path/to` exists in Vault but does not contain given key path - `nested.other`",
        exception.getMessage());
  }

  @Test
  void testDefaultsCanBeDisabled() {
    stubPayload();
    SecretVariable variable = SecretVariable.vault("path/to").key("MISSING").withDefault("x");

    assertThrows(
        SecretKeyMissingException.class,
        () ->
            variable.evaluate(
                backend,
                credentials,
                context(Map.of(ResolutionContext.DEFAULTS_DISABLED_VARIABLE, "1"))));
  }

  @Test
  void testEnvironmentOverrideSkipsVault() {
    // Setup
    Supplier<VaultCredentials> failing =
        () -> {
          throw new AssertionError("Credentials should not be loaded");
        };
    ResolutionContext context = context(Map.of("PATH__TO", "{\"SECRET\": \"overridden\"}"));

    // Execute
    Object value =
        SecretVariable.vault("/path/to/").key("SECRET").evaluate(backend, failing, context);

    // Verify
    assertEquals("overridden", value);
    verifyNoInteractions(transport);
  }

  @Test
  void testEnvironmentOverrideWorksWithSecretsDisabled() {
    ResolutionContext context =
        context(
            Map.of(
                "PATH__TO", "{\"SECRET\": \"overridden\"}",
                ResolutionContext.SECRETS_DISABLED_VARIABLE, "true"));

    assertEquals(
        "overridden",
        SecretVariable.vault("path/to").key("SECRET").evaluate(backend, credentials, context));
  }

  @Test
  void testEnvironmentOverrideMissingKey() {
    ResolutionContext context = context(Map.of("PATH__TO", "{\"OTHER\": 1}"));

    assertEquals(
        "default",
        SecretVariable.vault("path/to")
            .key("SECRET")
            .withDefault("default")
            .evaluate(backend, credentials, context));
    assertThrows(
        SecretKeyMissingException.class,
        () ->
            SecretVariable.vault("path/to")
                .key("SECRET")
                .evaluate(backend, credentials, context));
  }

  @Test
  void testEnvironmentOverrideIgnoredWhenTryEnvFirstIsOff() {
    // Setup
    SyncVaultBackend vaultOnly =
        new SyncVaultBackend(
            VaultBackendConfig.builder().tryEnvFirst(false).build(),
            transport,
            VaultMetrics.standalone("test"),
            Clock.systemUTC());
    stubPayload();

    // Execute
    Object value =
        SecretVariable.vault("path/to")
            .key("SECRET")
            .evaluate(vaultOnly, credentials, context(Map.of("PATH__TO", "{\"SECRET\": \"x\"}")));

    // Verify
    assertEquals("value", value);
  }

  @Test
  void testInvalidEnvironmentOverride() {
    SecretVariable variable = SecretVariable.vault("path/to").key("SECRET");

    for (String raw : List.of("[1, 2]", "not json", "\"text\"", "42")) {
      InvalidSecretOverrideException exception =
          assertThrows(
              InvalidSecretOverrideException.class,
              () -> variable.evaluate(backend, credentials, context(Map.of("PATH__TO", raw))));
      assertEquals(
          "`PATH__TO` variable should be a JSON-encoded dictionary, got: `" + raw + "`",
          exception.getMessage());
    }
    verifyNoInteractions(transport);
  }

  @Test
  void testSecretsDisabled() {
    ResolutionContext context =
        context(Map.of(ResolutionContext.SECRETS_DISABLED_VARIABLE, "yes"));

    assertThrows(
        SecretsDisabledException.class,
        () -> SecretVariable.vault("path/to").evaluate(backend, credentials, context));
    verifyNoInteractions(transport);
  }

  @Test
  void testCredentialsFailure() {
    Supplier<VaultCredentials> missing =
        () -> {
          throw new MissingOptionException("Option `VAULT_ADDR` is not present");
        };

    MissingOptionException exception =
        assertThrows(
            MissingOptionException.class,
            () -> SecretVariable.vault("path/to").evaluate(backend, missing, context(Map.of())));

    assertEquals(
        "Can't access secret `path/to` due to failing to load Vault config",
        exception.getMessage());
    assertInstanceOf(MissingOptionException.class, exception.getCause());
  }

  @Test
  void testAsyncBackendReturnsFutures() {
    // Setup
    AsyncVaultBackend async =
        new AsyncVaultBackend(
            VaultBackendConfig.builder().retryWait(Duration.ofMillis(10)).build(),
            transport,
            VaultMetrics.standalone("test"),
            Clock.systemUTC());
    when(transport.readAsync(ADDRESS, "path/to", "s.token"))
        .thenReturn(CompletableFuture.completedFuture(Map.of("data", PAYLOAD)));

    try (async) {
      // Execute
      Object fromVault =
          SecretVariable.vault("path/to")
              .key("SECRET")
              .evaluate(async, credentials, context(Map.of()));
      Object fromEnv =
          SecretVariable.vault("other")
              .key("SECRET")
              .evaluate(async, credentials, context(Map.of("OTHER", "{\"SECRET\": \"env\"}")));

      // Verify
      assertEquals("value", ((CompletableFuture<?>) fromVault).join());
      assertEquals("env", ((CompletableFuture<?>) fromEnv).join());
    }
  }

  @Test
  void testVaultFile() throws Exception {
    stubPayload();

    Object value =
        SecretVariable.vaultFile("path/to")
            .key("SECRET")
            .evaluate(backend, credentials, context(Map.of()));

    InputStream stream = assertInstanceOf(InputStream.class, value);
    assertEquals("value", new String(stream.readAllBytes(), StandardCharsets.UTF_8));
  }

  @Test
  void testOverrideVariableName() {
    assertEquals("PATH__TO", SecretVariable.vault("path/to").overrideVariableName());
    assertEquals("PATH__TO", SecretVariable.vault("//path/to/").overrideVariableName());
    assertEquals("SECRET", SecretVariable.vault("secret").overrideVariableName());
  }

  @Test
  void testOverrideExample() {
    assertEquals(
        Map.of("PATH__TO", "{\"k1\":{\"k2\":\"example_value\"}}"),
        SecretVariable.vault("path/to").key("k1").key("k2").overrideExample());
    assertEquals(Map.of("PATH__TO", "{}"), SecretVariable.vault("path/to").overrideExample());
  }

  @Test
  void testVariablesAreImmutable() {
    SecretVariable base = SecretVariable.vault("path/to");
    SecretVariable derived = base.key("a").key("b");

    assertEquals(List.of(), base.getKeys());
    assertEquals(List.of("a", "b"), derived.getKeys());
    assertThrows(UnsupportedOperationException.class, () -> derived.getKeys().add("c"));
    assertThrows(IllegalArgumentException.class, () -> SecretVariable.vault(""));
  }
}
