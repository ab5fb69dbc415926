package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.FileOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Replaces a file with a transformed copy written next to it.
 *
 * <p>The original is deleted only once the temporary file has been fully written and closed.
 * A crash between deleting the original and renaming the temporary file leaves the data only in
 * the temporary file; keeping both in one directory keeps that window to a single rename.
 */
public class AtomicFileReplacer {
  private static final Logger logger = LoggerFactory.getLogger(AtomicFileReplacer.class);

  static final String TEMP_FILE_PREFIX = ".tmp_";

  /**
   * Returns the temporary file used while transforming {@code target}.
   *
   * @param target file to be replaced.
   * @return sibling of target with a distinguishing prefix.
   */
  public Path tempFileFor(Path target) {
    Path absolute = target.toAbsolutePath();
    return absolute.resolveSibling(TEMP_FILE_PREFIX + absolute.getFileName());
  }

  public void commit(Path target, Path tempFile) throws FileOperationException.ReplacementFailed {
    try {
      Files.delete(target);
    } catch (IOException e) {
      throw new FileOperationException.ReplacementFailed("File replacement failed: " + target, false, e);
    }
    try {
      move(tempFile, target);
    } catch (IOException e) {
      throw new FileOperationException.ReplacementFailed("File replacement failed: " + target, true, e);
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target);
    }
  }

  /**
   * Deletes the temporary file, if present. Failure to delete is logged, the caller already
   * reports the operation as failed.
   *
   * @param tempFile temporary file to remove.
   * @return true if no temporary file remains.
   */
  public boolean discard(Path tempFile) {
    try {
      Files.deleteIfExists(tempFile);
      return true;
    } catch (IOException e) {
      logger.warn("Unable to delete temporary file {}", tempFile, e);
      return false;
    }
  }
}
