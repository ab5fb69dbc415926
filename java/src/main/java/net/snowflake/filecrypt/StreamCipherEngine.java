package net.snowflake.filecrypt;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.GeneralSecurityException;
import java.util.function.IntConsumer;

/**
 * Encrypts and decrypts whole streams chunk by chunk. Encrypted output is framed as
 * {@code IV || ciphertext}.
 *
 * <p>Both operations consume the input fully and close both streams on every exit path,
 * including failures and cancellation. Progress is reported as a percentage in [0, 100] of
 * {@code totalSize}; {@code totalSize} is used only for progress and must be positive.
 */
public interface StreamCipherEngine {
  /**
   * Encrypts input to output. Progress is reported after every chunk.
   *
   * @param input plaintext source, closed on return.
   * @param output destination for IV and ciphertext, closed on return.
   * @param totalSize size of the input in bytes.
   * @param onProgress receives progress updates (0-100).
   * @param cancellationToken checked before every chunk.
   * @throws IOException if reading or writing fails.
   * @throws GeneralSecurityException if the cipher cannot be initialized or applied.
   */
  void encrypt(
      InputStream input,
      OutputStream output,
      long totalSize,
      IntConsumer onProgress,
      CancellationToken cancellationToken)
      throws IOException, GeneralSecurityException;

  /**
   * Decrypts input produced by {@link #encrypt} to output. Progress is reported only when the
   * percentage grows.
   *
   * @param input IV and ciphertext source, closed on return.
   * @param output plaintext destination, closed on return.
   * @param totalSize size of the input in bytes, including the IV.
   * @param onProgress receives progress updates (0-100).
   * @param cancellationToken checked before every chunk.
   * @throws IOException if reading or writing fails, or the input is shorter than the IV.
   * @throws GeneralSecurityException if the key, IV or padding is invalid.
   */
  void decrypt(
      InputStream input,
      OutputStream output,
      long totalSize,
      IntConsumer onProgress,
      CancellationToken cancellationToken)
      throws IOException, GeneralSecurityException;

  default void encrypt(InputStream input, OutputStream output, long totalSize, IntConsumer onProgress)
      throws IOException, GeneralSecurityException {
    encrypt(input, output, totalSize, onProgress, CancellationToken.NONE);
  }

  default void decrypt(InputStream input, OutputStream output, long totalSize, IntConsumer onProgress)
      throws IOException, GeneralSecurityException {
    decrypt(input, output, totalSize, onProgress, CancellationToken.NONE);
  }
}
