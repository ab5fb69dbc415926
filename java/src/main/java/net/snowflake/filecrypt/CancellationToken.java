package net.snowflake.filecrypt;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag. Long running operations call {@link #throwIfCancelled()}
 * before each unit of work. A child token is cancelled whenever its parent is.
 */
public final class CancellationToken {
  /** Token that is never cancelled. */
  public static final CancellationToken NONE = new CancellationToken(null, false);

  private final CancellationToken parent;
  private final boolean cancellable;
  private volatile boolean cancelled;

  private CancellationToken(CancellationToken parent, boolean cancellable) {
    this.parent = parent;
    this.cancellable = cancellable;
  }

  public static CancellationToken create() {
    return new CancellationToken(null, true);
  }

  public CancellationToken child() {
    return new CancellationToken(this, true);
  }

  public void cancel() {
    if (!cancellable) {
      throw new IllegalStateException("token cannot be cancelled");
    }
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled || (parent != null && parent.isCancelled());
  }

  /**
   * Throws if this token was cancelled or the current thread was interrupted.
   *
   * @throws CancellationException if the operation should stop.
   */
  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new CancellationException(Failures.CANCELLED_MESSAGE);
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Operation interrupted");
    }
  }
}
