package dev.henneberger.vertx.sync.core;

public enum ReplicationMethod {
  FULL_TABLE,
  INCREMENTAL,
  LOG_BASED
}
