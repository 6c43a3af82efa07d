package dev.henneberger.vertx.sync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single exit point of a run: forwards records to the {@link SyncOutput}, counts them per stream,
 * and writes combined state snapshots to the output and the {@link StateStore}.
 *
 * <p>A snapshot always carries the bookmarks of all streams. Snapshots are written on a wall-clock
 * interval, after each scan batch, and once more at shutdown.
 */
public final class CheckpointEmitter {

  private static final Logger LOG = LoggerFactory.getLogger(CheckpointEmitter.class);

  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);

  private final SyncState state;
  private final SyncOutput output;
  private final StateStore store;
  private final SyncListener listener;
  private final SyncClock clock;
  private final long intervalMillis;
  private final long startedAt;
  private final Map<String, Long> rowCounts = new LinkedHashMap<>();

  private long messages;
  private long lastEmittedAt;
  private long snapshots;
  private JsonObject lastSnapshot;

  public CheckpointEmitter(SyncState state,
                           SyncOutput output,
                           StateStore store,
                           SyncListener listener,
                           SyncClock clock,
                           Duration interval) {
    this.state = Objects.requireNonNull(state, "state");
    this.output = Objects.requireNonNull(output, "output");
    this.store = Objects.requireNonNull(store, "store");
    this.listener = listener == null ? SyncListener.NOOP : listener;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.intervalMillis = Objects.requireNonNull(interval, "interval").toMillis();
    this.startedAt = clock.millis();
    this.lastEmittedAt = startedAt;
  }

  public SyncState state() {
    return state;
  }

  public void emitRecord(ChangeRecord record) throws Exception {
    await(output.emitRecord(record));
    rowCounts.merge(record.getStream(), 1L, Long::sum);
    listener.onRecord(record);
  }

  public void countMessage() {
    messages++;
  }

  /**
   * Emits a snapshot when the interval has elapsed since the previous one.
   *
   * @return whether a snapshot was written
   */
  public boolean maybeEmit() throws Exception {
    if (clock.millis() - lastEmittedAt < intervalMillis) {
      return false;
    }
    emitNow(SnapshotReason.INTERVAL);
    return true;
  }

  public JsonObject emitNow(SnapshotReason reason) throws Exception {
    JsonObject snapshot = state.toJson();
    await(output.emitState(snapshot.copy()));
    store.save(snapshot.copy());
    lastEmittedAt = clock.millis();
    lastSnapshot = snapshot;
    snapshots++;
    listener.onSnapshot(reason, state.bookmarks().size());
    if (reason == SnapshotReason.BATCH) {
      LOG.debug("snapshot reason={} elapsedMs={} messages={} rows={}", reason, elapsedMillis(), messages, rowCounts);
    } else {
      LOG.info("snapshot reason={} elapsedMs={} messages={} rows={}", reason, elapsedMillis(), messages, rowCounts);
    }
    return snapshot;
  }

  public JsonObject emitFinal() throws Exception {
    state.setCurrentlySyncing(null);
    return emitNow(SnapshotReason.FINAL);
  }

  public long elapsedMillis() {
    return clock.millis() - startedAt;
  }

  public long startedAt() {
    return startedAt;
  }

  public long messages() {
    return messages;
  }

  public long snapshots() {
    return snapshots;
  }

  public long rows(String stream) {
    return rowCounts.getOrDefault(stream, 0L);
  }

  public Map<String, Long> rowCounts() {
    return Collections.unmodifiableMap(rowCounts);
  }

  public JsonObject lastSnapshot() {
    return lastSnapshot == null ? null : lastSnapshot.copy();
  }

  private static void await(Future<Void> future) throws Exception {
    if (future == null) {
      return;
    }
    try {
      future.toCompletionStage().toCompletableFuture().get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      throw new SyncException("output failed", cause);
    }
  }
}
