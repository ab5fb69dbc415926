package net.snowflake.filecrypt;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.function.IntConsumer;

import static net.snowflake.filecrypt.OperationResult.TOTAL_PROGRESS;

/**
 * {@link StreamCipherEngine} running a block cipher (AES/CBC/PKCS7 by default) over a fixed size
 * buffer. Both directions drive the cipher with explicit {@code update}/{@code doFinal} calls,
 * one per chunk.
 *
 * <p>Instances are thread safe as long as the {@link KeyProvider} is; every call uses its own
 * {@link Cipher}.
 */
public class StreamCipherEngineImpl implements StreamCipherEngine {
  private static final Logger logger = LoggerFactory.getLogger(StreamCipherEngineImpl.class);

  private final KeyProvider keyProvider;
  private final CipherParameterSpec parameterSpec;
  private final SecureRandom random;

  public StreamCipherEngineImpl(KeyProvider keyProvider) {
    this(keyProvider, CipherParameterSpec.AES_CBC_PKCS7, new SecureRandom());
  }

  public StreamCipherEngineImpl(KeyProvider keyProvider, CipherParameterSpec parameterSpec, SecureRandom random) {
    this.keyProvider = Objects.requireNonNull(keyProvider, "keyProvider");
    this.parameterSpec = Objects.requireNonNull(parameterSpec, "parameterSpec");
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public void encrypt(
      InputStream input,
      OutputStream output,
      long totalSize,
      IntConsumer onProgress,
      CancellationToken cancellationToken)
      throws IOException, GeneralSecurityException {
    try (InputStream in = input; OutputStream out = output) {
      verifyTotalSize(totalSize);
      byte[] iv = new byte[parameterSpec.getIvLength()];
      random.nextBytes(iv);
      Cipher cipher = initCipher(Cipher.ENCRYPT_MODE, iv);
      out.write(iv);

      byte[] buffer = new byte[parameterSpec.getBufferSize()];
      long totalRead = 0;
      int read;
      while (true) {
        cancellationToken.throwIfCancelled();
        read = in.read(buffer);
        if (read == -1) {
          break;
        }
        totalRead += read;
        writeIfPresent(out, cipher.update(buffer, 0, read));
        onProgress.accept(percentOf(totalRead, totalSize));
      }
      cancellationToken.throwIfCancelled();
      writeIfPresent(out, cipher.doFinal());
      out.flush();
      logger.debug("Encrypted {} bytes", totalRead);
    }
  }

  @Override
  public void decrypt(
      InputStream input,
      OutputStream output,
      long totalSize,
      IntConsumer onProgress,
      CancellationToken cancellationToken)
      throws IOException, GeneralSecurityException {
    try (InputStream in = input; OutputStream out = output) {
      verifyTotalSize(totalSize);
      byte[] iv = new byte[parameterSpec.getIvLength()];
      // throws EOFException for inputs shorter than the IV
      IOUtils.readFully(in, iv);
      Cipher cipher = initCipher(Cipher.DECRYPT_MODE, iv);

      byte[] buffer = new byte[parameterSpec.getBufferSize()];
      long totalRead = iv.length;
      int lastReportedProgress = 0;
      int read;
      while (true) {
        cancellationToken.throwIfCancelled();
        read = in.read(buffer);
        if (read == -1) {
          break;
        }
        totalRead += read;
        writeIfPresent(out, cipher.update(buffer, 0, read));

        int currentProgress = percentOf(totalRead, totalSize);
        if (currentProgress > lastReportedProgress) {
          onProgress.accept(currentProgress);
          lastReportedProgress = currentProgress;
        }
      }
      cancellationToken.throwIfCancelled();
      writeIfPresent(out, cipher.doFinal());
      out.flush();
      if (lastReportedProgress < TOTAL_PROGRESS) {
        onProgress.accept(TOTAL_PROGRESS);
      }
      logger.debug("Decrypted {} bytes", totalRead);
    }
  }

  private Cipher initCipher(int mode, byte[] iv) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(parameterSpec.getTransformation());
    cipher.init(mode, keyProvider.getKey(), new IvParameterSpec(iv));
    return cipher;
  }

  private static void verifyTotalSize(long totalSize) {
    if (totalSize <= 0) {
      throw new IllegalArgumentException(String.format("totalSize must be > 0, got %d", totalSize));
    }
  }

  private static void writeIfPresent(OutputStream out, byte[] bytes) throws IOException {
    if (bytes != null && bytes.length > 0) {
      out.write(bytes);
    }
  }

  static int percentOf(long processed, long totalSize) {
    return (int) Math.min(TOTAL_PROGRESS, processed * TOTAL_PROGRESS / totalSize);
  }
}
