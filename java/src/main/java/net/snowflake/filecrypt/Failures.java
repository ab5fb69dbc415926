package net.snowflake.filecrypt;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.security.GeneralSecurityException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps arbitrary failures to {@link FileOperationException}s. The mapping is total: every
 * throwable yields exactly one kind, {@link FailureKind#UNKNOWN} being the default.
 */
public final class Failures {
  static final String CANCELLED_MESSAGE = "Operation cancelled";

  private Failures() {}

  public static FileOperationException classify(Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof FileOperationException) {
      return (FileOperationException) cause;
    }
    if (isCancellation(cause)) {
      return new FileOperationException.Cancelled(CANCELLED_MESSAGE, cause);
    }
    if (cause instanceof IOException) {
      return new FileOperationException.Io("I/O error: " + cause.getMessage(), cause);
    }
    if (cause instanceof GeneralSecurityException || cause instanceof SecurityException) {
      return new FileOperationException.Security("Security violation: " + cause.getMessage(), cause);
    }
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    return new FileOperationException.Unknown("Unexpected error: " + message, cause);
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  // ClosedByInterruptException is an IOException, so this must be checked first
  private static boolean isCancellation(Throwable cause) {
    return cause instanceof CancellationException
        || cause instanceof InterruptedException
        || cause instanceof ClosedByInterruptException;
  }
}
