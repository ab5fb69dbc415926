package net.snowflake.filecrypt;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

// Accepts the first failAfter bytes, then throws on every write.
class FailingOutputStream extends OutputStream {
  private final int failAfter;
  private final ByteArrayOutputStream written = new ByteArrayOutputStream();
  private boolean closed;

  FailingOutputStream(int failAfter) {
    this.failAfter = failAfter;
  }

  @Override
  public void write(int b) throws IOException {
    if (written.size() >= failAfter) {
      throw new IOException("disk full");
    }
    written.write(b);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    if (written.size() + len > failAfter) {
      throw new IOException("disk full");
    }
    written.write(b, off, len);
  }

  @Override
  public void close() {
    closed = true;
  }

  boolean isClosed() {
    return closed;
  }

  byte[] toByteArray() {
    return written.toByteArray();
  }
}
