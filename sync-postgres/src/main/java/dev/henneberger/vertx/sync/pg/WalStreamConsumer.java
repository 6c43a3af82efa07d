/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.sync.pg;

import dev.henneberger.vertx.sync.core.ChangeRecord;
import dev.henneberger.vertx.sync.core.CheckpointEmitter;
import dev.henneberger.vertx.sync.core.ConsumerState;
import dev.henneberger.vertx.sync.core.ConsumerStateChange;
import dev.henneberger.vertx.sync.core.ErrorClassifier;
import dev.henneberger.vertx.sync.core.RetryPolicy;
import dev.henneberger.vertx.sync.core.SnapshotReason;
import dev.henneberger.vertx.sync.core.StopReason;
import dev.henneberger.vertx.sync.core.StreamBookmark;
import dev.henneberger.vertx.sync.core.StreamSyncException;
import dev.henneberger.vertx.sync.core.SyncClock;
import dev.henneberger.vertx.sync.core.SyncListener;
import dev.henneberger.vertx.sync.core.SyncState;
import dev.henneberger.vertx.sync.core.SyncStream;
import dev.henneberger.vertx.sync.core.TargetIdentity;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the logical replication slot for all log-based streams of a run.
 *
 * <p>Runs on one thread with bounded-wait reads. Each loop iteration checks the termination
 * conditions, sends a keepalive when one is due, then handles at most one message. The slot is
 * acknowledged up to the lowest bookmark of the selected streams in the last snapshot written to
 * the state store. A stream that failed keeps the WAL it still needs.
 */
public class WalStreamConsumer {

  private static final Logger LOG = LoggerFactory.getLogger(WalStreamConsumer.class);

  static final long READ_WAIT_MILLIS = 50L;

  private final PostgresSyncOptions options;
  private final ReplicationSource source;
  private final PostgresTypeDecoder decoder;
  private final CheckpointEmitter emitter;
  private final SyncListener listener;
  private final SyncClock clock;
  private final TargetIdentity target;
  private final ErrorClassifier classifier;
  private final BooleanSupplier stopRequested;
  private final List<Handler<ConsumerStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final Map<String, Throwable> failedStreams = new LinkedHashMap<>();

  private volatile ConsumerState state = ConsumerState.INIT;
  private volatile boolean stopped;
  private long flushedLsn;
  private long persistedLsn;
  private long endLsn = Long.MAX_VALUE;
  private boolean bookmarksAdvanced;
  private long keepalives;

  public WalStreamConsumer(PostgresSyncOptions options,
                           ReplicationSource source,
                           PostgresTypeDecoder decoder,
                           CheckpointEmitter emitter,
                           SyncListener listener,
                           SyncClock clock,
                           TargetIdentity target,
                           BooleanSupplier stopRequested) {
    this.options = Objects.requireNonNull(options, "options");
    this.source = Objects.requireNonNull(source, "source");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    this.listener = listener == null ? SyncListener.NOOP : listener;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.target = Objects.requireNonNull(target, "target");
    this.classifier = options.errorClassifier();
    this.stopRequested = Objects.requireNonNull(stopRequested, "stopRequested");
  }

  public WalStreamConsumer onStateChange(Handler<ConsumerStateChange> handler) {
    stateHandlers.add(Objects.requireNonNull(handler, "handler"));
    return this;
  }

  /**
   * Requests a cooperative stop; the loop exits at its next termination check.
   */
  public void stop() {
    stopped = true;
  }

  public ConsumerState state() {
    return state;
  }

  /**
   * Streams that failed during the pass, keyed by stream id. Their bookmarks stay where they were.
   */
  public Map<String, Throwable> failedStreams() {
    return Collections.unmodifiableMap(failedStreams);
  }

  public long flushedLsn() {
    return flushedLsn;
  }

  /**
   * Highest position confirmed to the server. Never ahead of the last saved snapshot.
   */
  public long persistedLsn() {
    return persistedLsn;
  }

  public long endLsn() {
    return endLsn;
  }

  public long keepalives() {
    return keepalives;
  }

  /**
   * Replicates changes for {@code streams}, each of which must already have an LSN bookmark.
   *
   * @throws SlotPluginMismatchException when the slot belongs to another output plugin
   * @throws SlotInUseException when another process holds the slot
   * @throws SQLException when reading fails and retries are exhausted or the error is not transient
   */
  public StopReason run(List<SyncStream> streams) throws Exception {
    Map<String, SyncStream> selected = new LinkedHashMap<>();
    for (SyncStream stream : streams) {
      selected.put(stream.id(), stream);
    }
    if (selected.isEmpty()) {
      return StopReason.COMPLETED;
    }

    String slotName = options.resolveSlotName();
    Map<String, Object> slotOptions = slotOptions(options, streams);
    RetryPolicy retryPolicy = options.getRetryPolicy();
    long pollStarted = clock.millis();
    long failures = 0;

    try {
      ensureSlot(slotName);
      flushedLsn = lowestBookmark(selected);
      persistedLsn = flushedLsn;
      if (options.isBreakAtEndLsn()) {
        endLsn = source.currentWalLsn();
      }
      LOG.info("slot={} streams={} startLsn={} endLsn={}", slotName, selected.keySet(), Lsn.format(flushedLsn),
        endLsn == Long.MAX_VALUE ? "none" : Lsn.format(endLsn));

      while (true) {
        long sessionStartLsn = flushedLsn;
        try (WalReader reader = source.open(slotName, flushedLsn, slotOptions)) {
          transition(ConsumerState.SLOT_ATTACHED, null, failures + 1);
          acknowledge(reader);
          transition(ConsumerState.STREAMING, null, failures + 1);

          StopReason reason = stream(reader, selected, pollStarted);

          transition(ConsumerState.STOPPING, null, failures + 1);
          commitBookmarks(selected);
          emitter.emitFinal();
          notePersisted(selected);
          acknowledge(reader);
          LOG.info("slot={} stopped reason={} flushedLsn={} keepalives={}", slotName, reason, Lsn.format(flushedLsn), keepalives);
          transition(ConsumerState.CLOSED, null, failures + 1);
          return reason;
        } catch (SQLException e) {
          if (flushedLsn > sessionStartLsn) {
            failures = 0;
          }
          failures++;
          if (!retryPolicy.shouldRetry(e, failures, classifier)) {
            throw e;
          }
          long delay = retryPolicy.computeDelayMillis(failures);
          LOG.warn("slot={} read failed, reopening from {} in {}ms (attempt {}/{}): {}", slotName,
            Lsn.format(flushedLsn), delay, failures, retryPolicy.getMaxAttempts(), e.getMessage());
          transition(ConsumerState.INIT, e, failures);
          clock.sleep(delay);
        }
      }
    } catch (Exception e) {
      transition(ConsumerState.ERROR, e, failures);
      throw e;
    }
  }

  private StopReason stream(WalReader reader, Map<String, SyncStream> selected, long pollStarted) throws Exception {
    long keepaliveMillis = options.getPollIntervalSeconds() * 1000L;
    long lastKeepalive = clock.millis();
    try {
      while (true) {
        StopReason stop = terminationReason(reader, selected, pollStarted);
        if (stop != null) {
          return stop;
        }

        if (clock.millis() - lastKeepalive >= keepaliveMillis) {
          keepalive(reader, selected);
          lastKeepalive = clock.millis();
        }

        WalMessage message = reader.readPending();
        if (message == null) {
          if (emitter.maybeEmit()) {
            notePersisted(selected);
          }
          long untilKeepalive = keepaliveMillis - (clock.millis() - lastKeepalive);
          clock.sleep(Math.max(1L, Math.min(READ_WAIT_MILLIS, untilKeepalive)));
          continue;
        }

        handle(message, selected);
        if (emitter.maybeEmit()) {
          notePersisted(selected);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return StopReason.STOP_REQUESTED;
    }
  }

  StopReason terminationReason(WalReader reader, Map<String, SyncStream> selected, long pollStarted) {
    long now = clock.millis();
    if (options.isBreakAtEndLsn() && Math.max(flushedLsn, reader.lastReceivedLsn()) >= endLsn) {
      return StopReason.END_LSN_REACHED;
    }
    if (now - pollStarted >= options.getMaxPollSeconds() * 1000L) {
      return StopReason.POLL_WINDOW_EXCEEDED;
    }
    if (now - emitter.startedAt() >= options.getMaxRunSeconds() * 1000L) {
      return StopReason.RUN_CEILING_EXCEEDED;
    }
    if (stopped || stopRequested.getAsBoolean()) {
      return StopReason.STOP_REQUESTED;
    }
    if (failedStreams.size() == selected.size()) {
      return StopReason.FAILED;
    }
    return null;
  }

  private void handle(WalMessage message, Map<String, SyncStream> selected) throws Exception {
    emitter.countMessage();
    long lsn = message.lsn();
    SyncState syncState = emitter.state();

    List<WalChange> changes;
    try {
      changes = Wal2JsonParser.parse(message.payload());
    } catch (MalformedWalMessageException e) {
      LOG.warn("Skipping malformed wal2json message at {}: {}", Lsn.format(lsn), e.getMessage());
      listener.onParseFailure(message.payload(), e);
      changes = List.of();
    }

    for (WalChange change : changes) {
      SyncStream stream = selected.get(change.streamId());
      if (stream == null || failedStreams.containsKey(stream.id())) {
        continue;
      }
      if (lsn <= lsnBookmark(syncState, stream)) {
        continue;
      }
      ChangeRecord record;
      try {
        record = toRecord(stream, change, lsn);
      } catch (TypeDecodeException e) {
        LOG.error("stream={} failed at {}: {}", stream.id(), Lsn.format(lsn), e.getMessage());
        failedStreams.put(stream.id(), new StreamSyncException(stream.id(), "change at " + Lsn.format(lsn) + " could not be decoded", e));
        continue;
      }
      emitter.emitRecord(record);
    }

    for (SyncStream stream : selected.values()) {
      if (!failedStreams.containsKey(stream.id()) && lsn > lsnBookmark(syncState, stream)) {
        bookmarksAdvanced |= syncState.advanceLsn(stream.id(), lsn);
      }
    }
    flushedLsn = Math.max(flushedLsn, lowestBookmark(selected));
  }

  private ChangeRecord toRecord(SyncStream stream, WalChange change, long lsn) throws SQLException {
    Map<String, Object> data = new LinkedHashMap<>();
    for (Map.Entry<String, Object> value : change.values().entrySet()) {
      String column = value.getKey();
      if (!stream.columnTypes().containsKey(column)) {
        continue;
      }
      data.put(column, decoder.decode(target, column, declaredType(stream, change.types(), column), value.getValue()));
    }
    Map<String, Object> oldKeys = new LinkedHashMap<>();
    for (Map.Entry<String, Object> value : change.oldKeys().entrySet()) {
      String column = value.getKey();
      if (!stream.columnTypes().containsKey(column)) {
        continue;
      }
      oldKeys.put(column, decoder.decode(target, column, declaredType(stream, change.oldKeyTypes(), column), value.getValue()));
    }
    return new ChangeRecord(stream.id(), change.operation(), data, oldKeys, Lsn.format(lsn), change.timestamp());
  }

  private static String declaredType(SyncStream stream, Map<String, String> reported, String column) {
    String type = reported.get(column);
    return type != null ? type : stream.columnTypes().get(column);
  }

  private void keepalive(WalReader reader, Map<String, SyncStream> selected) throws Exception {
    if (bookmarksAdvanced) {
      commitBookmarks(selected);
      emitter.emitNow(SnapshotReason.KEEPALIVE);
      notePersisted(selected);
    }
    acknowledge(reader);
    keepalives++;
    listener.onKeepalive(persistedLsn);
    LOG.debug("keepalive persistedLsn={} flushedLsn={} receivedLsn={}", Lsn.format(persistedLsn),
      Lsn.format(flushedLsn), Lsn.format(reader.lastReceivedLsn()));
  }

  private void acknowledge(WalReader reader) throws SQLException {
    if (persistedLsn > 0) {
      reader.acknowledge(persistedLsn);
    }
    reader.sendStatus();
  }

  // Only positions contained in a snapshot the store has accepted may be confirmed to the server.
  private void notePersisted(Map<String, SyncStream> selected) {
    JsonObject snapshot = emitter.lastSnapshot();
    if (snapshot == null) {
      return;
    }
    SyncState saved = SyncState.fromJson(snapshot);
    long lowest = Long.MAX_VALUE;
    for (SyncStream stream : selected.values()) {
      lowest = Math.min(lowest, lsnBookmark(saved, stream));
    }
    persistedLsn = Math.max(persistedLsn, lowest);
  }

  private void commitBookmarks(Map<String, SyncStream> selected) {
    SyncState syncState = emitter.state();
    for (SyncStream stream : selected.values()) {
      syncState.bookmark(stream.id()).ifPresent(bookmark -> listener.onBookmarkCommitted(stream.id(), bookmark));
    }
    bookmarksAdvanced = false;
  }

  private void ensureSlot(String slotName) throws SQLException {
    String plugin = options.getPlugin();
    SlotInfo slot = source.inspectSlot(slotName);
    if (slot.status() == SlotInfo.Status.ABSENT) {
      source.createSlot(slotName, plugin);
      slot = source.inspectSlot(slotName);
    }
    if (slot.status() != SlotInfo.Status.ABSENT && !plugin.equalsIgnoreCase(slot.plugin())) {
      throw new SlotPluginMismatchException(slotName, slot.plugin(), plugin);
    }
    LOG.debug("Using {}", slot);
  }

  private long lowestBookmark(Map<String, SyncStream> selected) {
    SyncState syncState = emitter.state();
    long lowest = Long.MAX_VALUE;
    for (SyncStream stream : selected.values()) {
      StreamBookmark bookmark = syncState.bookmark(stream.id())
        .filter(b -> b.kind() == StreamBookmark.Kind.LSN)
        .orElseThrow(() -> new IllegalStateException("stream " + stream.id() + " has no LSN bookmark"));
      lowest = Math.min(lowest, bookmark.lsnValue());
    }
    return lowest;
  }

  private static long lsnBookmark(SyncState syncState, SyncStream stream) {
    return syncState.bookmark(stream.id())
      .filter(b -> b.kind() == StreamBookmark.Kind.LSN)
      .map(StreamBookmark::lsnValue)
      .orElse(0L);
  }

  private void transition(ConsumerState next, Throwable cause, long attempt) {
    ConsumerState previous = state;
    if (previous == next && cause == null) {
      return;
    }
    state = next;
    ConsumerStateChange change = new ConsumerStateChange(previous, next, cause, attempt);
    LOG.debug("{}", change);
    listener.onStateChange(change);
    for (Handler<ConsumerStateChange> handler : stateHandlers) {
      handler.handle(change);
    }
  }

  /**
   * Slot options for wal2json. Format version 1 sends one message per transaction stamped with the
   * commit position, which keeps message LSNs monotonic. User supplied plugin options replace
   * these defaults entirely.
   */
  static Map<String, Object> slotOptions(PostgresSyncOptions options, List<SyncStream> streams) {
    if (!options.getPluginOptions().isEmpty()) {
      return options.getPluginOptions();
    }
    Map<String, Object> slotOptions = new LinkedHashMap<>();
    slotOptions.put("format-version", 1);
    slotOptions.put("include-timestamp", true);
    slotOptions.put("include-types", true);
    slotOptions.put("include-typmod", false);
    slotOptions.put("include-xids", false);
    slotOptions.put("write-in-chunks", false);
    List<String> tables = new ArrayList<>();
    for (SyncStream stream : streams) {
      tables.add(escapeTableName(stream.schema()) + '.' + escapeTableName(stream.table()));
    }
    if (!tables.isEmpty()) {
      slotOptions.put("add-tables", String.join(",", tables));
    }
    return slotOptions;
  }

  // wal2json splits add-tables on unescaped commas and dots.
  static String escapeTableName(String name) {
    StringBuilder escaped = new StringBuilder(name.length());
    for (char c : name.toCharArray()) {
      if (c == ',' || c == '.' || c == ' ' || c == '\'' || c == '*' || c == '\\') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
