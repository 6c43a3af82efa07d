package dev.henneberger.vertx.sync.core;

import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class InMemoryStateStore implements StateStore {
  private final List<JsonObject> history = Collections.synchronizedList(new ArrayList<>());
  private volatile JsonObject current;

  public InMemoryStateStore() {
  }

  public InMemoryStateStore(JsonObject initial) {
    this.current = initial == null ? null : initial.copy();
  }

  @Override
  public Optional<JsonObject> load() {
    JsonObject snapshot = current;
    return snapshot == null ? Optional.empty() : Optional.of(snapshot.copy());
  }

  @Override
  public void save(JsonObject state) {
    JsonObject copy = state.copy();
    current = copy;
    history.add(copy);
  }

  /**
   * Every snapshot saved so far, oldest first.
   */
  public List<JsonObject> history() {
    synchronized (history) {
      return List.copyOf(history);
    }
  }
}
