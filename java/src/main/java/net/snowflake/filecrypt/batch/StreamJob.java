package net.snowflake.filecrypt.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Transform of a single file. The total size is captured when the job is created and is used
 * only to compute progress.
 */
final class StreamJob {
  private final Path source;
  private final Direction direction;
  private final long totalSize;

  StreamJob(Path source, Direction direction, long totalSize) {
    this.source = Objects.requireNonNull(source, "source");
    this.direction = Objects.requireNonNull(direction, "direction");
    this.totalSize = totalSize;
  }

  static StreamJob of(Path source, Direction direction) throws IOException {
    return new StreamJob(source, direction, Files.size(source));
  }

  Path getSource() {
    return source;
  }

  Direction getDirection() {
    return direction;
  }

  long getTotalSize() {
    return totalSize;
  }

  @Override
  public String toString() {
    return direction + " " + source + " (" + totalSize + " bytes)";
  }
}
