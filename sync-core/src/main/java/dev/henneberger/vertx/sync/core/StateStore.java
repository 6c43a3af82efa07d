package dev.henneberger.vertx.sync.core;

import io.vertx.core.json.JsonObject;
import java.util.Optional;

/**
 * Persisted sync state: the combined bookmark snapshot of every stream.
 */
public interface StateStore {
  Optional<JsonObject> load() throws Exception;
  void save(JsonObject state) throws Exception;
}
