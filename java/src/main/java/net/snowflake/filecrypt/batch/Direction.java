package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.CancellationToken;
import net.snowflake.filecrypt.StreamCipherEngine;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.GeneralSecurityException;
import java.util.function.IntConsumer;

public enum Direction {
  ENCRYPT {
    @Override
    void transform(
        StreamCipherEngine engine,
        InputStream input,
        OutputStream output,
        long totalSize,
        IntConsumer onProgress,
        CancellationToken cancellationToken)
        throws IOException, GeneralSecurityException {
      engine.encrypt(input, output, totalSize, onProgress, cancellationToken);
    }
  },
  DECRYPT {
    @Override
    void transform(
        StreamCipherEngine engine,
        InputStream input,
        OutputStream output,
        long totalSize,
        IntConsumer onProgress,
        CancellationToken cancellationToken)
        throws IOException, GeneralSecurityException {
      engine.decrypt(input, output, totalSize, onProgress, cancellationToken);
    }
  };

  abstract void transform(
      StreamCipherEngine engine,
      InputStream input,
      OutputStream output,
      long totalSize,
      IntConsumer onProgress,
      CancellationToken cancellationToken)
      throws IOException, GeneralSecurityException;
}
