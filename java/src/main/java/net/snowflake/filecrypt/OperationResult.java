package net.snowflake.filecrypt;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Event reported for a single file: {@link Progress}, {@link Completed} or {@link Error}.
 * Exactly one terminal event ({@link Completed} or {@link Error}) is reported per file.
 * Use {@link #accept(Visitor)} to handle every variant.
 */
public abstract class OperationResult {
  public static final int TOTAL_PROGRESS = 100;

  private OperationResult() {}

  public static Progress progress(int percent) {
    return new Progress(percent);
  }

  public static Completed completed() {
    return Completed.INSTANCE;
  }

  public static Error error(FileOperationException cause, Integer lastPercent) {
    return new Error(cause, lastPercent);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public abstract boolean isTerminal();

  public interface Visitor<R> {
    R visitProgress(Progress progress);

    R visitCompleted(Completed completed);

    R visitError(Error error);
  }

  public static final class Progress extends OperationResult {
    private final int percent;

    private Progress(int percent) {
      if (percent < 0 || percent > TOTAL_PROGRESS) {
        throw new IllegalArgumentException("Progress must be between 0 and 100, got " + percent);
      }
      this.percent = percent;
    }

    public int getPercent() {
      return percent;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitProgress(this);
    }

    @Override
    public boolean isTerminal() {
      return false;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Progress && ((Progress) o).percent == percent;
    }

    @Override
    public int hashCode() {
      return Integer.hashCode(percent);
    }

    @Override
    public String toString() {
      return "Progress(" + percent + ")";
    }
  }

  public static final class Completed extends OperationResult {
    private static final Completed INSTANCE = new Completed();

    private Completed() {}

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCompleted(this);
    }

    @Override
    public boolean isTerminal() {
      return true;
    }

    @Override
    public String toString() {
      return "Completed";
    }
  }

  public static final class Error extends OperationResult {
    private final FileOperationException cause;
    private final Integer lastPercent;

    private Error(FileOperationException cause, Integer lastPercent) {
      this.cause = Objects.requireNonNull(cause, "cause");
      if (lastPercent != null && (lastPercent < 0 || lastPercent > TOTAL_PROGRESS)) {
        throw new IllegalArgumentException("Progress must be between 0 and 100, got " + lastPercent);
      }
      this.lastPercent = lastPercent;
    }

    public FileOperationException getCause() {
      return cause;
    }

    public FailureKind getKind() {
      return cause.getKind();
    }

    /**
     * Returns the last progress reported before the failure, empty if no progress was reported.
     *
     * @return last reported progress.
     */
    public OptionalInt getLastPercent() {
      return lastPercent == null ? OptionalInt.empty() : OptionalInt.of(lastPercent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitError(this);
    }

    @Override
    public boolean isTerminal() {
      return true;
    }

    @Override
    public String toString() {
      return "Error(" + cause.getKind() + ", " + cause.getMessage()
          + (lastPercent == null ? "" : ", " + lastPercent) + ")";
    }
  }
}
