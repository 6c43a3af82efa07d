package dev.henneberger.vertx.sync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

class StreamBookmarkTest {

  @Test
  void serializesEachKind() {
    assertEquals(new JsonObject().put("lsn", 42L), StreamBookmark.lsn(42L).toJson());
    assertEquals(new JsonObject().put("replication_key", "updated_at").put("replication_key_value", "2024-01-01"),
      StreamBookmark.replicationKey("updated_at", "2024-01-01").toJson());
    assertEquals(new JsonObject().put("ordering_checkpoint", "[\"7\"]"),
      StreamBookmark.orderingCheckpoint("[\"7\"]").toJson());
  }

  @Test
  void orderingCheckpointKeepsCapturedLsn() {
    StreamBookmark bookmark = StreamBookmark.fromJson(
      new JsonObject().put("ordering_checkpoint", "[\"7\"]").put("lsn", 1000L));

    assertEquals(StreamBookmark.Kind.ORDERING_CHECKPOINT, bookmark.kind());
    assertEquals(1000L, bookmark.initialLsn().getAsLong());
    assertFalse(StreamBookmark.orderingCheckpoint("[]").initialLsn().isPresent());
  }

  @Test
  void numericReplicationKeyValueIsReadAsText() {
    StreamBookmark bookmark = StreamBookmark.fromJson(
      new JsonObject().put("replication_key", "id").put("replication_key_value", 500));

    assertEquals("500", bookmark.replicationKeyValue());
  }

  @Test
  void rejectsUnknownShapes() {
    assertThrows(IllegalArgumentException.class, () -> StreamBookmark.fromJson(new JsonObject().put("foo", 1)));
    assertThrows(IllegalArgumentException.class, () -> StreamBookmark.lsn(-1L));
    assertThrows(IllegalStateException.class, () -> StreamBookmark.lsn(1L).checkpoint());
  }
}
