package dev.henneberger.vertx.sync.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * How far one stream has progressed. Exactly one of the position kinds is set.
 *
 * <p>An ordering checkpoint may also carry the WAL position captured before the initial scan of a
 * log-based stream; log streaming resumes from it once the scan completes.
 */
public final class StreamBookmark {

  public enum Kind {
    LSN,
    REPLICATION_KEY,
    ORDERING_CHECKPOINT
  }

  static final String LSN_FIELD = "lsn";
  static final String REPLICATION_KEY_FIELD = "replication_key";
  static final String REPLICATION_KEY_VALUE_FIELD = "replication_key_value";
  static final String ORDERING_CHECKPOINT_FIELD = "ordering_checkpoint";

  private static final long NO_LSN = -1L;

  private final Kind kind;
  private final long lsn;
  private final String replicationKey;
  private final String value;

  private StreamBookmark(Kind kind, long lsn, String replicationKey, String value) {
    this.kind = kind;
    this.lsn = lsn;
    this.replicationKey = replicationKey;
    this.value = value;
  }

  public static StreamBookmark lsn(long lsn) {
    if (lsn < 0) {
      throw new IllegalArgumentException("lsn must be >= 0");
    }
    return new StreamBookmark(Kind.LSN, lsn, null, null);
  }

  public static StreamBookmark replicationKey(String replicationKey, String value) {
    OptionValidation.require("replicationKey", replicationKey);
    return new StreamBookmark(Kind.REPLICATION_KEY, NO_LSN, replicationKey, Objects.requireNonNull(value, "value"));
  }

  public static StreamBookmark orderingCheckpoint(String checkpoint) {
    OptionValidation.require("checkpoint", checkpoint);
    return new StreamBookmark(Kind.ORDERING_CHECKPOINT, NO_LSN, null, checkpoint);
  }

  public static StreamBookmark orderingCheckpoint(String checkpoint, long initialLsn) {
    OptionValidation.require("checkpoint", checkpoint);
    OptionValidation.requireMin("initialLsn", initialLsn, 0L);
    return new StreamBookmark(Kind.ORDERING_CHECKPOINT, initialLsn, null, checkpoint);
  }

  public static StreamBookmark fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    if (json.containsKey(ORDERING_CHECKPOINT_FIELD)) {
      String checkpoint = json.getString(ORDERING_CHECKPOINT_FIELD);
      Long initialLsn = json.getLong(LSN_FIELD);
      return initialLsn == null ? orderingCheckpoint(checkpoint) : orderingCheckpoint(checkpoint, initialLsn);
    }
    if (json.containsKey(LSN_FIELD)) {
      return lsn(json.getLong(LSN_FIELD));
    }
    if (json.containsKey(REPLICATION_KEY_FIELD)) {
      Object raw = json.getValue(REPLICATION_KEY_VALUE_FIELD);
      if (raw == null) {
        throw new IllegalArgumentException("bookmark has replication_key but no replication_key_value");
      }
      return replicationKey(json.getString(REPLICATION_KEY_FIELD), String.valueOf(raw));
    }
    throw new IllegalArgumentException("Unrecognized bookmark: " + json.encode());
  }

  public Kind kind() {
    return kind;
  }

  public long lsnValue() {
    requireKind(Kind.LSN);
    return lsn;
  }

  public String replicationKeyName() {
    requireKind(Kind.REPLICATION_KEY);
    return replicationKey;
  }

  public String replicationKeyValue() {
    requireKind(Kind.REPLICATION_KEY);
    return value;
  }

  public String checkpoint() {
    requireKind(Kind.ORDERING_CHECKPOINT);
    return value;
  }

  public OptionalLong initialLsn() {
    requireKind(Kind.ORDERING_CHECKPOINT);
    return lsn == NO_LSN ? OptionalLong.empty() : OptionalLong.of(lsn);
  }

  public JsonObject toJson() {
    switch (kind) {
      case LSN:
        return new JsonObject().put(LSN_FIELD, lsn);
      case REPLICATION_KEY:
        return new JsonObject()
          .put(REPLICATION_KEY_FIELD, replicationKey)
          .put(REPLICATION_KEY_VALUE_FIELD, value);
      default:
        JsonObject json = new JsonObject().put(ORDERING_CHECKPOINT_FIELD, value);
        if (lsn != NO_LSN) {
          json.put(LSN_FIELD, lsn);
        }
        return json;
    }
  }

  private void requireKind(Kind expected) {
    if (kind != expected) {
      throw new IllegalStateException("bookmark is " + kind + ", not " + expected);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof StreamBookmark)) {
      return false;
    }
    StreamBookmark other = (StreamBookmark) o;
    return kind == other.kind
      && lsn == other.lsn
      && Objects.equals(replicationKey, other.replicationKey)
      && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, lsn, replicationKey, value);
  }

  @Override
  public String toString() {
    return toJson().encode();
  }
}
