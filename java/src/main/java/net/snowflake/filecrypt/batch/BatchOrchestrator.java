package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.CancellationToken;
import net.snowflake.filecrypt.FileOperationException;
import net.snowflake.filecrypt.Failures;
import net.snowflake.filecrypt.OperationResult;
import net.snowflake.filecrypt.StreamCipherEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.IntConsumer;

import static net.snowflake.filecrypt.OperationResult.TOTAL_PROGRESS;

/**
 * Encrypts or decrypts a list of files in place.
 *
 * <p>Files are processed in groups of {@link #GROUP_SIZE}. Groups run one after another; the files
 * of a group run concurrently on the given executor and the next group starts only when every
 * file of the current one has finished. A failing file never affects the others: each file ends
 * with exactly one {@link OperationResult.Completed} or {@link OperationResult.Error} event and
 * appears in exactly one of the two collections passed to {@link BatchCompletionListener}.
 *
 * <p>Each file is written to a temporary sibling first and swapped in by
 * {@link AtomicFileReplacer} only after the transform succeeded, so a failed transform never
 * touches the original. Batches are not transactional: a cancelled batch leaves the files
 * finished so far transformed.
 *
 * <p>At most one encryption and one decryption batch run at a time per instance.
 */
public class BatchOrchestrator {
  private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

  static final int GROUP_SIZE = 5;
  static final int PROGRESS_STEP = 5;

  private final StreamCipherEngine engine;
  private final AtomicFileReplacer replacer;
  private final Executor completionExecutor;

  private final Map<Direction, BatchJob> activeJobs = new EnumMap<>(Direction.class);

  public BatchOrchestrator(StreamCipherEngine engine) {
    this(engine, Runnable::run);
  }

  /**
   * @param engine engine used for every file.
   * @param completionExecutor executor {@link BatchCompletionListener} is called on, typically the
   *     caller's own event loop.
   */
  public BatchOrchestrator(StreamCipherEngine engine, Executor completionExecutor) {
    this(engine, new AtomicFileReplacer(), completionExecutor);
  }

  BatchOrchestrator(StreamCipherEngine engine, AtomicFileReplacer replacer, Executor completionExecutor) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.replacer = Objects.requireNonNull(replacer, "replacer");
    this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor");
  }

  public BatchJob encrypt(
      List<Path> files,
      Executor executor,
      FileResultListener onEachFileResult,
      BatchCompletionListener onAllCompleted) {
    return run(files, Direction.ENCRYPT, executor, onEachFileResult, onAllCompleted);
  }

  public BatchJob decrypt(
      List<Path> files,
      Executor executor,
      FileResultListener onEachFileResult,
      BatchCompletionListener onAllCompleted) {
    return run(files, Direction.DECRYPT, executor, onEachFileResult, onAllCompleted);
  }

  /**
   * Starts transforming the given files and returns immediately.
   *
   * @param files files to transform in place; paths naming the same file are processed once.
   * @param direction encrypt or decrypt.
   * @param executor executor the transforms and {@code onEachFileResult} run on.
   * @param onEachFileResult receives progress and the terminal event of every file.
   * @param onAllCompleted called once, on the completion executor, after the last file finished.
   * @return handle of the started batch.
   * @throws BatchConfigurationException if {@code executor} is a {@link UiAffineExecutor} or a
   *     batch in the same direction is still running.
   */
  public BatchJob run(
      List<Path> files,
      Direction direction,
      Executor executor,
      FileResultListener onEachFileResult,
      BatchCompletionListener onAllCompleted) {
    Objects.requireNonNull(files, "files");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(onEachFileResult, "onEachFileResult");
    Objects.requireNonNull(onAllCompleted, "onAllCompleted");
    if (executor instanceof UiAffineExecutor) {
      throw new BatchConfigurationException(
          BatchConfigurationException.Reason.UI_AFFINE_EXECUTOR,
          "UI-affine executors are not allowed for " + direction + " operations, use a background executor");
    }

    List<Path> uniqueFiles = distinctFiles(files);
    List<List<Path>> groups = partition(uniqueFiles);
    BatchJob job;
    synchronized (activeJobs) {
      BatchJob active = activeJobs.get(direction);
      if (active != null && active.isActive()) {
        logger.debug("{} already in progress", direction);
        throw new BatchConfigurationException(
            BatchConfigurationException.Reason.RUN_IN_PROGRESS, direction + " already in progress");
      }
      job = new BatchJob(direction, groups.size());
      job.start();
      activeJobs.put(direction, job);
    }
    logger.info("Starting {} of {} files in {} groups", direction, uniqueFiles.size(), groups.size());

    BatchAccumulator accumulator = new BatchAccumulator();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (int i = 0; i < groups.size(); i++) {
      int groupIndex = i;
      List<Path> group = groups.get(i);
      chain = chain.thenCompose(ignored -> runGroup(job, group, groupIndex, executor, onEachFileResult, accumulator));
    }
    chain.whenCompleteAsync(
        (ignored, throwable) -> finish(job, uniqueFiles, throwable, onEachFileResult, onAllCompleted, accumulator),
        completionExecutor);
    return job;
  }

  public boolean isRunning(Direction direction) {
    synchronized (activeJobs) {
      BatchJob active = activeJobs.get(direction);
      return active != null && active.isActive();
    }
  }

  /**
   * Drops paths naming a file already in the list, keeping the first spelling. Two spellings of
   * one file would share a temporary file and race on the replacement.
   */
  static List<Path> distinctFiles(List<Path> files) {
    Map<Path, Path> byIdentity = new LinkedHashMap<>();
    for (Path file : files) {
      byIdentity.putIfAbsent(identityOf(Objects.requireNonNull(file, "file")), file);
    }
    return new ArrayList<>(byIdentity.values());
  }

  private static Path identityOf(Path file) {
    try {
      return file.toRealPath();
    } catch (IOException e) {
      // missing files fail later with their own error
      return file.toAbsolutePath().normalize();
    }
  }

  private static List<List<Path>> partition(List<Path> files) {
    List<List<Path>> groups = new ArrayList<>();
    for (int start = 0; start < files.size(); start += GROUP_SIZE) {
      groups.add(new ArrayList<>(files.subList(start, Math.min(start + GROUP_SIZE, files.size()))));
    }
    return groups;
  }

  private CompletableFuture<Void> runGroup(
      BatchJob job,
      List<Path> group,
      int groupIndex,
      Executor executor,
      FileResultListener listener,
      BatchAccumulator accumulator) {
    if (job.isCancelled()) {
      logger.debug("Skipping group {} of {}, batch cancelled", groupIndex + 1, job.getGroupCount());
      for (Path file : group) {
        reportFailure(job, file, new CancellationException("Operation cancelled"), null, listener, accumulator);
      }
      return CompletableFuture.completedFuture(null);
    }
    job.enterGroup(groupIndex + 1);
    logger.debug("Running group {} of {} ({} files)", groupIndex + 1, job.getGroupCount(), group.size());
    List<CompletableFuture<Void>> tasks = new ArrayList<>(group.size());
    for (Path file : group) {
      tasks.add(submit(job, file, executor, listener, accumulator));
    }
    return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
  }

  private CompletableFuture<Void> submit(
      BatchJob job,
      Path file,
      Executor executor,
      FileResultListener listener,
      BatchAccumulator accumulator) {
    CompletableFuture<Void> task;
    try {
      task = CompletableFuture.runAsync(() -> processFile(job, file, listener, accumulator), executor);
    } catch (RejectedExecutionException e) {
      reportFailure(job, file, e, null, listener, accumulator);
      return CompletableFuture.completedFuture(null);
    }
    // processFile handles every Exception, only Errors get here
    return task.exceptionally(throwable -> {
      replacer.discard(replacer.tempFileFor(file));
      reportFailure(job, file, throwable, null, listener, accumulator);
      return null;
    });
  }

  private void processFile(BatchJob job, Path file, FileResultListener listener, BatchAccumulator accumulator) {
    CancellationToken cancellationToken = job.cancellationToken().child();
    Path tempFile = replacer.tempFileFor(file);
    ProgressForwarder progress = new ProgressForwarder(file, listener);
    try {
      cancellationToken.throwIfCancelled();
      StreamJob streamJob = StreamJob.of(file, job.getDirection());
      logger.debug("Starting {}", streamJob);
      try (InputStream input = Files.newInputStream(streamJob.getSource());
          OutputStream output = Files.newOutputStream(tempFile)) {
        streamJob.getDirection().transform(
            engine, input, output, streamJob.getTotalSize(), progress, cancellationToken);
      }
      replacer.commit(file, tempFile);
      accumulator.succeeded(file);
      deliver(listener, file, OperationResult.completed());
    } catch (Exception e) {
      FileOperationException failure = Failures.classify(e);
      if (failure instanceof FileOperationException.ReplacementFailed
          && ((FileOperationException.ReplacementFailed) failure).isOriginalDeleted()) {
        logger.warn("{} was removed but could not be replaced, transformed data kept in {}", file, tempFile);
      } else {
        replacer.discard(tempFile);
      }
      reportFailure(job, file, failure, progress.lastPercent(), listener, accumulator);
    }
  }

  private void reportFailure(
      BatchJob job,
      Path file,
      Throwable throwable,
      Integer lastPercent,
      FileResultListener listener,
      BatchAccumulator accumulator) {
    FileOperationException failure = Failures.classify(throwable);
    OperationResult.Error error = OperationResult.error(failure, lastPercent);
    if (failure.isCancellation()) {
      logger.debug("{} of {} cancelled", job.getDirection(), file);
    } else {
      logger.warn("{} of {} failed: {}", job.getDirection(), file, failure.getMessage());
    }
    if (accumulator.failed(file, error)) {
      deliver(listener, file, error);
    }
  }

  private void finish(
      BatchJob job,
      List<Path> files,
      Throwable throwable,
      FileResultListener listener,
      BatchCompletionListener onAllCompleted,
      BatchAccumulator accumulator) {
    if (throwable != null) {
      logger.warn("{} batch stopped unexpectedly", job.getDirection(), throwable);
    }
    // every file must be reported, even if the group chain broke off
    for (Path file : files) {
      if (!accumulator.contains(file)) {
        Throwable cause = throwable != null ? throwable : new CancellationException("Operation cancelled");
        reportFailure(job, file, cause, null, listener, accumulator);
      }
    }
    BatchResult result = accumulator.toResult();
    logger.info("{} finished: {} succeeded, {} failed",
        job.getDirection(), result.getSucceeded().size(), result.getFailed().size());
    Throwable listenerFailure = null;
    try {
      onAllCompleted.onAllCompleted(result.getSucceeded(), result.getFailed());
    } catch (RuntimeException e) {
      logger.warn("Batch completion listener failed", e);
      listenerFailure = e;
    } finally {
      synchronized (activeJobs) {
        activeJobs.remove(job.getDirection(), job);
      }
    }
    job.finish(result, listenerFailure);
  }

  private static void deliver(FileResultListener listener, Path file, OperationResult result) {
    try {
      listener.onResult(file, result);
    } catch (RuntimeException e) {
      logger.warn("Result listener failed for {} on {}", file, result, e);
    }
  }

  /**
   * Forwards engine progress to the listener in steps of at least {@link #PROGRESS_STEP} percent,
   * plus the final 100. Used by a single task, so needs no synchronization.
   */
  private static final class ProgressForwarder implements IntConsumer {
    private final Path file;
    private final FileResultListener listener;
    private int lastForwarded = -1;

    ProgressForwarder(Path file, FileResultListener listener) {
      this.file = file;
      this.listener = listener;
    }

    @Override
    public void accept(int percent) {
      boolean complete = percent == TOTAL_PROGRESS && lastForwarded < TOTAL_PROGRESS;
      if (complete || percent >= Math.max(lastForwarded, 0) + PROGRESS_STEP) {
        deliver(listener, file, OperationResult.progress(percent));
        lastForwarded = percent;
      }
    }

    Integer lastPercent() {
      return lastForwarded < 0 ? null : lastForwarded;
    }
  }

  private static final class BatchAccumulator {
    private final List<Path> succeeded = new ArrayList<>();
    private final Map<Path, OperationResult.Error> failed = new LinkedHashMap<>();

    synchronized void succeeded(Path file) {
      succeeded.add(file);
    }

    /**
     * Records a failure unless the file already has an outcome.
     *
     * @return true if the failure was recorded.
     */
    synchronized boolean failed(Path file, OperationResult.Error error) {
      if (succeeded.contains(file) || failed.containsKey(file)) {
        return false;
      }
      failed.put(file, error);
      return true;
    }

    synchronized boolean contains(Path file) {
      return succeeded.contains(file) || failed.containsKey(file);
    }

    synchronized BatchResult toResult() {
      return new BatchResult(succeeded, failed);
    }
  }
}
