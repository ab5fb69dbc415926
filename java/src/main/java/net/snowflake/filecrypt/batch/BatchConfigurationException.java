package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.FileCryptException;

/**
 * Thrown synchronously by {@link BatchOrchestrator} when a run is started in a way that can never
 * succeed. Nothing has been read or written when this is thrown.
 */
public class BatchConfigurationException extends FileCryptException {
  public enum Reason {
    UI_AFFINE_EXECUTOR,
    RUN_IN_PROGRESS
  }

  private final Reason reason;

  public BatchConfigurationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
