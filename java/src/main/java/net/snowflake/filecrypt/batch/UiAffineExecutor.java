package net.snowflake.filecrypt.batch;

import java.util.concurrent.Executor;

/**
 * Marker for executors bound to a latency sensitive thread, such as a UI event loop.
 * {@link BatchOrchestrator} refuses to run file transforms on them.
 */
public interface UiAffineExecutor extends Executor {
}
