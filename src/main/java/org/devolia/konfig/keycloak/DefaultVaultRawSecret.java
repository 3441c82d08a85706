package org.devolia.konfig.keycloak;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import org.keycloak.vault.VaultRawSecret;

/**
 * Raw bytes of a resolved option, handed to Keycloak.
 *
 * <p>Strings are encoded as UTF-8, byte arrays are copied and streams (as produced by {@link
 * org.devolia.konfig.SecretVariable#vaultFile(String)}) are read fully. Callers get copies of the
 * bytes; {@link #close()} zeroes the internal buffer, after which the secret reads as empty.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class DefaultVaultRawSecret implements VaultRawSecret {

  private final byte[] secretBytes;
  private volatile boolean closed;

  private DefaultVaultRawSecret(byte[] secretBytes) {
    this.secretBytes = secretBytes;
  }

  /**
   * Wraps an option value.
   *
   * @param value a string, byte array, input stream or any value converted with {@code toString}
   * @return the raw secret; empty for null
   */
  public static DefaultVaultRawSecret of(Object value) {
    if (value == null) {
      return new DefaultVaultRawSecret(new byte[0]);
    }
    if (value instanceof byte[] bytes) {
      return new DefaultVaultRawSecret(bytes.clone());
    }
    if (value instanceof InputStream stream) {
      try (stream) {
        return new DefaultVaultRawSecret(stream.readAllBytes());
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to read secret stream", e);
      }
    }
    return new DefaultVaultRawSecret(String.valueOf(value).getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public Optional<ByteBuffer> get() {
    return getAsArray().map(ByteBuffer::wrap);
  }

  @Override
  public Optional<byte[]> getAsArray() {
    if (closed || secretBytes.length == 0) {
      return Optional.empty();
    }
    return Optional.of(secretBytes.clone());
  }

  @Override
  public void close() {
    closed = true;
    Arrays.fill(secretBytes, (byte) 0);
  }
}
