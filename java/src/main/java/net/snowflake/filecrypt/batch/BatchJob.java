package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Handle of a running batch.
 */
public final class BatchJob {
  public enum State {
    IDLE,
    RUNNING,
    FINISHED
  }

  private final Direction direction;
  private final int groupCount;
  private final CancellationToken cancellationToken = CancellationToken.create();
  private final CompletableFuture<BatchResult> completion = new CompletableFuture<>();

  private volatile State state = State.IDLE;
  private volatile int currentGroup;

  BatchJob(Direction direction, int groupCount) {
    this.direction = direction;
    this.groupCount = groupCount;
  }

  /**
   * Stops scheduling further groups and makes running transforms fail as cancelled.
   * Every file is still reported, {@link BatchCompletionListener} is still called.
   */
  public void cancel() {
    cancellationToken.cancel();
  }

  public boolean isCancelled() {
    return cancellationToken.isCancelled();
  }

  public boolean isActive() {
    return state == State.RUNNING;
  }

  public State getState() {
    return state;
  }

  public Direction getDirection() {
    return direction;
  }

  public int getGroupCount() {
    return groupCount;
  }

  /**
   * Returns the 1-based index of the group being processed, 0 before the first group starts.
   *
   * @return current group.
   */
  public int getCurrentGroup() {
    return currentGroup;
  }

  /**
   * Returns a future completed after {@link BatchCompletionListener#onAllCompleted} has returned.
   * If the listener throws, the future completes exceptionally with that exception.
   *
   * @return completion of this batch.
   */
  public CompletableFuture<BatchResult> completion() {
    return completion.thenApply(result -> result);
  }

  CancellationToken cancellationToken() {
    return cancellationToken;
  }

  void start() {
    state = State.RUNNING;
  }

  void enterGroup(int group) {
    currentGroup = group;
  }

  void finish(BatchResult result, Throwable listenerFailure) {
    state = State.FINISHED;
    if (listenerFailure != null) {
      completion.completeExceptionally(listenerFailure);
    } else {
      completion.complete(result);
    }
  }
}
