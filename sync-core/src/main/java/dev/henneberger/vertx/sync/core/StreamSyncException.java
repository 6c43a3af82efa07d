package dev.henneberger.vertx.sync.core;

import java.util.Objects;

/**
 * A single stream could not be synced. Sibling streams are unaffected.
 */
public class StreamSyncException extends SyncException {

  private final String stream;

  public StreamSyncException(String stream, String message, Throwable cause) {
    super("stream " + stream + ": " + message, cause);
    this.stream = Objects.requireNonNull(stream, "stream");
  }

  public String stream() {
    return stream;
  }
}
