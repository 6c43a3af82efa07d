package dev.henneberger.vertx.sync.core;

/**
 * Why a run (or its log-based pass) stopped. Every reason except {@link #FAILED} is a success.
 */
public enum StopReason {
  COMPLETED,
  END_LSN_REACHED,
  POLL_WINDOW_EXCEEDED,
  RUN_CEILING_EXCEEDED,
  STOP_REQUESTED,
  FAILED
}
