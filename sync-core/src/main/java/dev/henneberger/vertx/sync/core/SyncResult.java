package dev.henneberger.vertx.sync.core;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class SyncResult {

  private final StopReason stopReason;
  private final List<String> completedStreams;
  private final Map<String, Throwable> failedStreams;
  private final JsonObject finalState;
  private final Throwable fatalError;

  public SyncResult(StopReason stopReason,
                    List<String> completedStreams,
                    Map<String, Throwable> failedStreams,
                    JsonObject finalState,
                    Throwable fatalError) {
    this.stopReason = Objects.requireNonNull(stopReason, "stopReason");
    this.completedStreams = List.copyOf(completedStreams);
    this.failedStreams = Collections.unmodifiableMap(new LinkedHashMap<>(failedStreams));
    this.finalState = finalState;
    this.fatalError = fatalError;
  }

  public StopReason stopReason() {
    return stopReason;
  }

  public List<String> completedStreams() {
    return completedStreams;
  }

  public Map<String, Throwable> failedStreams() {
    return failedStreams;
  }

  public JsonObject finalState() {
    return finalState;
  }

  public Throwable fatalError() {
    return fatalError;
  }

  public boolean succeeded() {
    return fatalError == null && failedStreams.isEmpty();
  }

  /**
   * Process exit code for a caller: 0 on success, 1 otherwise.
   */
  public int exitCode() {
    return succeeded() ? 0 : 1;
  }
}
