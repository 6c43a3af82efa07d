package dev.henneberger.vertx.sync.core;

/**
 * Observes a sync run. Callbacks run on the sync thread and must not block.
 */
public interface SyncListener {

  SyncListener NOOP = new SyncListener() {
  };

  default void onRecord(ChangeRecord record) {
  }

  default void onParseFailure(String payload, Throwable error) {
  }

  default void onStateChange(ConsumerStateChange stateChange) {
  }

  default void onBookmarkCommitted(String stream, StreamBookmark bookmark) {
  }

  default void onKeepalive(long flushedLsn) {
  }

  default void onBatch(String stream, int rows, long fetchMillis) {
  }

  default void onSnapshot(SnapshotReason reason, int streams) {
  }
}
