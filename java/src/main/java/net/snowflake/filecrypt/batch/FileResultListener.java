package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.OperationResult;

import java.nio.file.Path;

/**
 * Receives every event of every file in a batch. Called from the worker executor, possibly from
 * several threads at once; events of a single file are delivered in order.
 */
@FunctionalInterface
public interface FileResultListener {
  void onResult(Path file, OperationResult result);
}
