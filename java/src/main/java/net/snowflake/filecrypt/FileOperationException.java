package net.snowflake.filecrypt;

/**
 * Failure of a single file operation. Instances are created by {@link Failures#classify(Throwable)}
 * or directly by the component that detected the failure.
 */
public abstract class FileOperationException extends FileCryptException {
  FileOperationException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract FailureKind getKind();

  /**
   * Returns true if the operation did not fail on its own but was cancelled.
   * Cancellations are reported with {@link FailureKind#IO}.
   *
   * @return if the operation was cancelled.
   */
  public boolean isCancellation() {
    return false;
  }

  public static class Io extends FileOperationException {
    public Io(String message, Throwable cause) {
      super(message, cause);
    }

    @Override
    public FailureKind getKind() {
      return FailureKind.IO;
    }
  }

  public static final class Cancelled extends Io {
    public Cancelled(String message, Throwable cause) {
      super(message, cause);
    }

    @Override
    public boolean isCancellation() {
      return true;
    }
  }

  /**
   * The transformed file was written but could not be swapped in place of the original.
   */
  public static final class ReplacementFailed extends Io {
    private final boolean originalDeleted;

    public ReplacementFailed(String message, boolean originalDeleted, Throwable cause) {
      super(message, cause);
      this.originalDeleted = originalDeleted;
    }

    /**
     * Returns true if the original file was already removed when the rename failed.
     * In that case the temporary file holds the only copy of the data.
     *
     * @return if the original file no longer exists.
     */
    public boolean isOriginalDeleted() {
      return originalDeleted;
    }
  }

  public static final class Security extends FileOperationException {
    public Security(String message, Throwable cause) {
      super(message, cause);
    }

    @Override
    public FailureKind getKind() {
      return FailureKind.SECURITY;
    }
  }

  public static final class Unknown extends FileOperationException {
    public Unknown(String message, Throwable cause) {
      super(message, cause);
    }

    @Override
    public FailureKind getKind() {
      return FailureKind.UNKNOWN;
    }
  }
}
