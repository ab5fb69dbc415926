package net.snowflake.filecrypt.batch;

import net.snowflake.filecrypt.OperationResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

/** Records every event per file. */
class RecordingListener implements FileResultListener {
  private final Map<Path, List<OperationResult>> events = new ConcurrentHashMap<>();

  @Override
  public void onResult(Path file, OperationResult result) {
    events.computeIfAbsent(file, f -> Collections.synchronizedList(new ArrayList<>())).add(result);
  }

  List<OperationResult> eventsFor(Path file) {
    List<OperationResult> recorded = events.get(file);
    return recorded == null ? new ArrayList<>() : new ArrayList<>(recorded);
  }

  List<Integer> progressFor(Path file) {
    return eventsFor(file).stream()
        .filter(OperationResult.Progress.class::isInstance)
        .map(event -> ((OperationResult.Progress) event).getPercent())
        .collect(Collectors.toList());
  }

  /** Asserts the file has exactly one terminal event, the last one, and returns it. */
  OperationResult terminalFor(Path file) {
    List<OperationResult> recorded = eventsFor(file);
    List<OperationResult> terminal = recorded.stream().filter(OperationResult::isTerminal).collect(Collectors.toList());
    assertEquals(1, terminal.size(), "terminal events of " + file + ": " + recorded);
    assertEquals(terminal.get(0), recorded.get(recorded.size() - 1));
    return terminal.get(0);
  }

  OperationResult.Error errorFor(Path file) {
    return assertInstanceOf(OperationResult.Error.class, terminalFor(file));
  }
}
