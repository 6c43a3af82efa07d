package dev.henneberger.vertx.sync.core;

public enum ConsumerState {
  INIT,
  SLOT_ATTACHED,
  STREAMING,
  STOPPING,
  CLOSED,
  ERROR
}
