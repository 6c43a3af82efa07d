package dev.henneberger.vertx.sync.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One decoded row change, produced from a WAL message or a scanned row.
 */
public final class ChangeRecord {

  /**
   * The row operation type. Scanned rows are reported as inserts.
   */
  public enum Operation {
    INSERT,
    UPDATE,
    DELETE
  }

  private final String stream;
  private final Operation operation;
  private final Map<String, Object> data;
  private final Map<String, Object> oldKeys;
  private final String position;
  private final Instant sourceTimestamp;

  public ChangeRecord(String stream,
                      Operation operation,
                      Map<String, Object> data,
                      Map<String, Object> oldKeys,
                      String position,
                      Instant sourceTimestamp) {
    this.stream = Objects.requireNonNull(stream, "stream");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.data = unmodifiableCopy(data);
    this.oldKeys = unmodifiableCopy(oldKeys);
    this.position = position;
    this.sourceTimestamp = sourceTimestamp;
  }

  public String getStream() {
    return stream;
  }

  public Operation getOperation() {
    return operation;
  }

  public Map<String, Object> getData() {
    return data;
  }

  public Map<String, Object> getOldKeys() {
    return oldKeys;
  }

  /**
   * LSN for log-based records, replication key value or ordering checkpoint for scanned rows.
   */
  public String getPosition() {
    return position;
  }

  public Instant getSourceTimestamp() {
    return sourceTimestamp;
  }

  public Map<String, Object> rowOrKeys() {
    return !data.isEmpty() ? data : oldKeys;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("stream", stream)
      .put("operation", operation.name())
      .put("data", new JsonObject(new LinkedHashMap<>(data)));
    if (!oldKeys.isEmpty()) {
      json.put("oldKeys", new JsonObject(new LinkedHashMap<>(oldKeys)));
    }
    if (position != null) {
      json.put("position", position);
    }
    if (sourceTimestamp != null) {
      json.put("sourceTimestamp", sourceTimestamp.toString());
    }
    return json;
  }

  @Override
  public String toString() {
    return "ChangeRecord{" +
      "stream='" + stream + '\'' +
      ", operation=" + operation +
      ", data=" + data +
      ", oldKeys=" + oldKeys +
      ", position='" + position + '\'' +
      ", sourceTimestamp=" + sourceTimestamp +
      '}';
  }

  private static Map<String, Object> unmodifiableCopy(Map<String, Object> values) {
    if (values == null || values.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
