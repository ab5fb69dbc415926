package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.OperationResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class BatchResult {
  private final List<Path> succeeded;
  private final Map<Path, OperationResult.Error> failed;

  BatchResult(List<Path> succeeded, Map<Path, OperationResult.Error> failed) {
    this.succeeded = Collections.unmodifiableList(new ArrayList<>(succeeded));
    this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
  }

  /**
   * Returns successfully transformed files in completion order.
   *
   * @return succeeded files.
   */
  public List<Path> getSucceeded() {
    return succeeded;
  }

  public Map<Path, OperationResult.Error> getFailed() {
    return failed;
  }

  public int size() {
    return succeeded.size() + failed.size();
  }

  @Override
  public String toString() {
    return "BatchResult(succeeded=" + succeeded.size() + ", failed=" + failed.size() + ")";
  }
}
