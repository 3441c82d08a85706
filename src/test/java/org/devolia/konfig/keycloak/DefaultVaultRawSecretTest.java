package org.devolia.konfig.keycloak;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DefaultVaultRawSecret.
 *
 * @author Devolia
 * @since 1.0.0
 */
class DefaultVaultRawSecretTest {

  @Test
  void testCreateWithString() {
    DefaultVaultRawSecret secret = DefaultVaultRawSecret.of("test-secret-value");

    Optional<ByteBuffer> byteBuffer = secret.get();
    assertTrue(byteBuffer.isPresent());
    assertEquals("test-secret-value", StandardCharsets.UTF_8.decode(byteBuffer.get()).toString());

    Optional<byte[]> byteArray = secret.getAsArray();
    assertTrue(byteArray.isPresent());
    assertEquals("test-secret-value", new String(byteArray.get(), StandardCharsets.UTF_8));

    secret.close();
  }

  @Test
  void testCreateWithOtherValues() {
    assertEquals("5432", text(DefaultVaultRawSecret.of(5432)));
    assertEquals("true", text(DefaultVaultRawSecret.of(Boolean.TRUE)));
    assertEquals(
        "file content",
        text(
            DefaultVaultRawSecret.of(
                new ByteArrayInputStream("file content".getBytes(StandardCharsets.UTF_8)))));
  }

  @Test
  void testByteArrayIsCopied() {
    byte[] source = "abc".getBytes(StandardCharsets.UTF_8);
    DefaultVaultRawSecret secret = DefaultVaultRawSecret.of(source);
    source[0] = 'x';

    byte[] first = secret.getAsArray().orElseThrow();
    first[1] = 'y';

    assertEquals("abc", text(secret));
  }

  @Test
  void testNullAndEmptyValues() {
    assertFalse(DefaultVaultRawSecret.of(null).get().isPresent());
    assertFalse(DefaultVaultRawSecret.of("").getAsArray().isPresent());
  }

  @Test
  void testCloseClearsSecret() {
    DefaultVaultRawSecret secret = DefaultVaultRawSecret.of("sensitive-data");
    assertTrue(secret.getAsArray().isPresent());

    secret.close();

    assertFalse(secret.get().isPresent());
    assertFalse(secret.getAsArray().isPresent());
  }

  private static String text(DefaultVaultRawSecret secret) {
    return new String(secret.getAsArray().orElseThrow(), StandardCharsets.UTF_8);
  }
}
