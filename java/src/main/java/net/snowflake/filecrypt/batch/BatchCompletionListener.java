package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.OperationResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface BatchCompletionListener {
  /**
   * Called once per batch, on the orchestrator's completion executor.
   *
   * @param succeeded files transformed successfully, in completion order.
   * @param failed failed files with their terminal error.
   */
  void onAllCompleted(List<Path> succeeded, Map<Path, OperationResult.Error> failed);
}
