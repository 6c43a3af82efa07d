package dev.henneberger.vertx.sync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Downstream message protocol. Records and state snapshots are written in source order and a
 * state is only written after every record it covers has been accepted.
 */
public interface SyncOutput {
  Future<Void> emitRecord(ChangeRecord record);
  Future<Void> emitState(JsonObject state);
}
