package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.CancellationToken;
import net.snowflake.filecrypt.StreamCipherEngine;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Copies input to output unchanged, but only after {@link #release()} was called. Reports 10
 * percent while waiting and honours cancellation.
 */
class BlockingEngine implements StreamCipherEngine {
  private final CountDownLatch started;
  private final CountDownLatch released = new CountDownLatch(1);
  private final AtomicInteger running = new AtomicInteger();
  private final AtomicInteger maxRunning = new AtomicInteger();

  BlockingEngine(int expectedStarts) {
    this.started = new CountDownLatch(expectedStarts);
  }

  @Override
  public void encrypt(
      InputStream input, OutputStream output, long totalSize, IntConsumer onProgress, CancellationToken cancellationToken)
      throws IOException {
    copyWhenReleased(input, output, onProgress, cancellationToken);
  }

  @Override
  public void decrypt(
      InputStream input, OutputStream output, long totalSize, IntConsumer onProgress, CancellationToken cancellationToken)
      throws IOException {
    copyWhenReleased(input, output, onProgress, cancellationToken);
  }

  private void copyWhenReleased(
      InputStream input, OutputStream output, IntConsumer onProgress, CancellationToken cancellationToken)
      throws IOException {
    try (InputStream in = input; OutputStream out = output) {
      maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
      try {
        onProgress.accept(10);
        started.countDown();
        while (!released.await(5, TimeUnit.MILLISECONDS)) {
          cancellationToken.throwIfCancelled();
        }
        IOUtils.copy(in, out);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException("interrupted while blocked");
      } finally {
        running.decrementAndGet();
      }
    }
  }

  boolean awaitStarted() throws InterruptedException {
    return started.await(10, TimeUnit.SECONDS);
  }

  void release() {
    released.countDown();
  }

  int getRunning() {
    return running.get();
  }

  int getMaxRunning() {
    return maxRunning.get();
  }
}
