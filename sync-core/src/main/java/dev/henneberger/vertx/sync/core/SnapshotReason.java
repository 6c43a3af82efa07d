package dev.henneberger.vertx.sync.core;

public enum SnapshotReason {
  BATCH,
  INTERVAL,
  KEEPALIVE,
  FINAL
}
