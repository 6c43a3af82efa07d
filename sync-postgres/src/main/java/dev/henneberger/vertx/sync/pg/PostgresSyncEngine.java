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

import dev.henneberger.vertx.sync.core.CapabilityCache;
import dev.henneberger.vertx.sync.core.CheckpointEmitter;
import dev.henneberger.vertx.sync.core.ConnectionFactory;
import dev.henneberger.vertx.sync.core.ConnectionManager;
import dev.henneberger.vertx.sync.core.ConsumerStateChange;
import dev.henneberger.vertx.sync.core.PreflightFailedException;
import dev.henneberger.vertx.sync.core.PreflightReport;
import dev.henneberger.vertx.sync.core.PreflightReports;
import dev.henneberger.vertx.sync.core.ReplicationMethod;
import dev.henneberger.vertx.sync.core.StateStore;
import dev.henneberger.vertx.sync.core.StopReason;
import dev.henneberger.vertx.sync.core.StreamBookmark;
import dev.henneberger.vertx.sync.core.StreamSyncException;
import dev.henneberger.vertx.sync.core.SyncClock;
import dev.henneberger.vertx.sync.core.SyncListener;
import dev.henneberger.vertx.sync.core.SyncOutput;
import dev.henneberger.vertx.sync.core.SyncResult;
import dev.henneberger.vertx.sync.core.SyncState;
import dev.henneberger.vertx.sync.core.SyncStream;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one sync: full-table and incremental streams first, one at a time, then a single WAL pass
 * for every log-based stream.
 *
 * <p>A stream that fails is reported in the {@link SyncResult} while its siblings continue. Fatal
 * errors (preflight, slot configuration, exhausted retries) end the run after a final snapshot.
 * Connections opened during the run are closed when it returns, on every path.
 */
public class PostgresSyncEngine {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresSyncEngine.class);

  private final Vertx vertx;
  private final PostgresSyncOptions options;
  private final List<SyncStream> streams;
  private final StateStore stateStore;
  private final SyncOutput output;
  private final ConnectionFactory connectionFactory;
  private final CursorOpener cursorOpener;
  private final ReplicationSource replicationSource;
  private final SyncClock clock;
  private final SyncListener listener;
  private final List<Handler<ConsumerStateChange>> stateHandlers = new CopyOnWriteArrayList<>();

  private volatile boolean stopRequested;
  private volatile ConnectionManager connections;
  private long runStartedAt;

  public PostgresSyncEngine(Vertx vertx,
                            PostgresSyncOptions options,
                            List<SyncStream> streams,
                            StateStore stateStore,
                            SyncOutput output) {
    this(vertx, options, streams, stateStore, output, SyncListener.NOOP);
  }

  public PostgresSyncEngine(Vertx vertx,
                            PostgresSyncOptions options,
                            List<SyncStream> streams,
                            StateStore stateStore,
                            SyncOutput output,
                            SyncListener listener) {
    this(vertx, options, streams, stateStore, output, new PostgresConnectionFactory(options), listener);
  }

  private PostgresSyncEngine(Vertx vertx,
                             PostgresSyncOptions options,
                             List<SyncStream> streams,
                             StateStore stateStore,
                             SyncOutput output,
                             PostgresConnectionFactory factory,
                             SyncListener listener) {
    this(vertx, options, streams, stateStore, output, factory,
      new PostgresCursorOpener(factory),
      new PostgresReplicationSource(factory, options.primaryTarget(), Duration.ofSeconds(options.getPollIntervalSeconds())),
      SyncClock.SYSTEM, listener);
  }

  PostgresSyncEngine(Vertx vertx,
                     PostgresSyncOptions options,
                     List<SyncStream> streams,
                     StateStore stateStore,
                     SyncOutput output,
                     ConnectionFactory connectionFactory,
                     CursorOpener cursorOpener,
                     ReplicationSource replicationSource,
                     SyncClock clock,
                     SyncListener listener) {
    this.vertx = vertx;
    this.options = new PostgresSyncOptions(Objects.requireNonNull(options, "options"));
    this.streams = List.copyOf(Objects.requireNonNull(streams, "streams"));
    this.stateStore = Objects.requireNonNull(stateStore, "stateStore");
    this.output = Objects.requireNonNull(output, "output");
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.cursorOpener = Objects.requireNonNull(cursorOpener, "cursorOpener");
    this.replicationSource = Objects.requireNonNull(replicationSource, "replicationSource");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = listener == null ? SyncListener.NOOP : listener;
  }

  /**
   * Registers a handler for state changes of the WAL consumer.
   */
  public PostgresSyncEngine onStateChange(Handler<ConsumerStateChange> handler) {
    stateHandlers.add(Objects.requireNonNull(handler, "handler"));
    return this;
  }

  /**
   * Runs the sync on a worker thread.
   */
  public Future<SyncResult> run() {
    Objects.requireNonNull(vertx, "vertx");
    return vertx.executeBlocking(this::runBlocking);
  }

  /**
   * Requests a cooperative stop. Scans stop between batches, the WAL consumer at its next loop
   * iteration; a final snapshot is still written.
   */
  public void stop() {
    stopRequested = true;
  }

  public boolean isStopRequested() {
    return stopRequested;
  }

  /**
   * Connection manager of the current or last run, for diagnostics.
   */
  public ConnectionManager connections() {
    return connections;
  }

  /**
   * Runs the sync on the calling thread.
   *
   * @throws IllegalArgumentException when the options are invalid
   */
  public SyncResult runBlocking() {
    options.validate();

    ConnectionManager manager = new ConnectionManager(connectionFactory);
    connections = manager;
    List<String> completed = new ArrayList<>();
    Map<String, Throwable> failed = new LinkedHashMap<>();
    CheckpointEmitter emitter = null;

    try {
      SyncState state = loadState();
      emitter = new CheckpointEmitter(state, output, stateStore, listener, clock,
        Duration.ofSeconds(options.getSnapshotIntervalSeconds()));
      runStartedAt = emitter.startedAt();

      List<SyncStream> scanned = new ArrayList<>();
      List<SyncStream> logBased = new ArrayList<>();
      for (SyncStream stream : ordered(state)) {
        (stream.method() == ReplicationMethod.LOG_BASED ? logBased : scanned).add(stream);
      }
      LOG.info("Sync starting: {} scanned stream(s), {} log-based stream(s), target {}",
        scanned.size(), logBased.size(), options.primaryTarget());

      if (options.isPreflightEnabled()) {
        preflight(!logBased.isEmpty());
      }

      PostgresTypeDecoder decoder = new PostgresTypeDecoder(manager, new CapabilityCache(),
        options.getDecodeStrictness(), options.errorClassifier());
      CursorScanner scanner = new CursorScanner(options, cursorOpener, decoder, emitter, listener, clock,
        options.scanTarget(), this::scanStopRequested);
      // The initial LSN is read from the primary, so the scan before it must see the primary too.
      CursorScanner initialScanner = new CursorScanner(options, cursorOpener, decoder, emitter, listener, clock,
        options.primaryTarget(), this::scanStopRequested);

      StopReason reason = StopReason.COMPLETED;
      for (SyncStream stream : scanned) {
        reason = scan(scanner, stream, completed, failed);
        if (reason != StopReason.COMPLETED) {
          break;
        }
      }

      List<SyncStream> replicating = new ArrayList<>();
      for (SyncStream stream : logBased) {
        if (reason != StopReason.COMPLETED) {
          break;
        }
        if (hasLsnBookmark(state, stream)) {
          replicating.add(stream);
          continue;
        }
        prepareInitialScan(state, stream);
        reason = scan(initialScanner, stream, new ArrayList<>(), failed);
        if (reason == StopReason.COMPLETED && hasLsnBookmark(state, stream)) {
          replicating.add(stream);
        }
      }
      state.setCurrentlySyncing(null);

      if (reason == StopReason.COMPLETED && !replicating.isEmpty()) {
        WalStreamConsumer consumer = new WalStreamConsumer(options, replicationSource, decoder, emitter, listener,
          clock, options.primaryTarget(), () -> stopRequested);
        stateHandlers.forEach(consumer::onStateChange);
        reason = consumer.run(replicating);
        failed.putAll(consumer.failedStreams());
        for (SyncStream stream : replicating) {
          if (!consumer.failedStreams().containsKey(stream.id())) {
            completed.add(stream.id());
          }
        }
      } else {
        emitter.emitFinal();
      }

      LOG.info("Sync finished reason={} completed={} failed={} elapsedMs={} rows={}", reason, completed,
        failed.keySet(), emitter.elapsedMillis(), emitter.rowCounts());
      return new SyncResult(reason, completed, failed, emitter.lastSnapshot(), null);
    } catch (Exception e) {
      LOG.error("Sync failed", e);
      JsonObject finalState = null;
      if (emitter != null) {
        try {
          emitter.emitFinal();
          finalState = emitter.lastSnapshot();
        } catch (Exception emitError) {
          e.addSuppressed(emitError);
        }
      }
      return new SyncResult(StopReason.FAILED, completed, failed, finalState, e);
    } finally {
      manager.dispose();
    }
  }

  private StopReason scan(CursorScanner scanner,
                          SyncStream stream,
                          List<String> completed,
                          Map<String, Throwable> failed) throws Exception {
    if (scanStopRequested()) {
      return scanStopReason();
    }
    try {
      if (scanner.sync(stream) == CursorScanner.Outcome.STOPPED) {
        return scanStopReason();
      }
      completed.add(stream.id());
    } catch (StreamSyncException e) {
      LOG.error("stream={} failed: {}", stream.id(), e.getMessage(), e);
      failed.put(stream.id(), e);
    }
    return StopReason.COMPLETED;
  }

  // The WAL position is captured before the scan so changes made during it are replayed.
  private void prepareInitialScan(SyncState state, SyncStream stream) throws Exception {
    Optional<StreamBookmark> bookmark = state.bookmark(stream.id());
    if (bookmark.isPresent() && bookmark.get().kind() == StreamBookmark.Kind.ORDERING_CHECKPOINT
      && bookmark.get().initialLsn().isPresent()) {
      LOG.info("stream={} resuming initial scan", stream.id());
      return;
    }
    createSlotIfAbsent();
    long lsn = replicationSource.currentWalLsn();
    state.setBookmark(stream.id(), StreamBookmark.orderingCheckpoint(CursorScanner.checkpoint(List.of()), lsn));
    LOG.info("stream={} has no log position, running an initial scan from {}", stream.id(), Lsn.format(lsn));
  }

  // Changes are only retained from the moment the slot exists.
  private void createSlotIfAbsent() throws Exception {
    String slotName = options.resolveSlotName();
    if (replicationSource.inspectSlot(slotName).status() == SlotInfo.Status.ABSENT) {
      LOG.info("Creating replication slot {} before the initial scan", slotName);
      replicationSource.createSlot(slotName, options.getPlugin());
    }
  }

  private static boolean hasLsnBookmark(SyncState state, SyncStream stream) {
    return state.bookmark(stream.id()).filter(b -> b.kind() == StreamBookmark.Kind.LSN).isPresent();
  }

  // An interrupted stream is resumed first.
  private List<SyncStream> ordered(SyncState state) {
    List<SyncStream> ordered = new ArrayList<>(streams);
    state.currentlySyncing().ifPresent(current -> {
      for (int i = 0; i < ordered.size(); i++) {
        if (ordered.get(i).id().equals(current)) {
          ordered.add(0, ordered.remove(i));
          break;
        }
      }
    });
    return ordered;
  }

  private SyncState loadState() throws Exception {
    Optional<JsonObject> stored = stateStore.load();
    if (stored.isEmpty()) {
      return new SyncState();
    }
    SyncState state = SyncState.fromJson(stored.get());
    LOG.info("Loaded state with {} bookmark(s)", state.bookmarks().size());
    return state;
  }

  private void preflight(boolean logBased) {
    PreflightReport report = new PostgresPreflight(options, connectionFactory).run(logBased);
    if (!report.warnings().isEmpty()) {
      LOG.warn("Preflight warnings: {}", PreflightReports.describeWarnings(report));
    }
    if (!report.ok()) {
      throw new PreflightFailedException(report);
    }
  }

  private boolean scanStopRequested() {
    return stopRequested || runCeilingExceeded();
  }

  private StopReason scanStopReason() {
    return stopRequested ? StopReason.STOP_REQUESTED : StopReason.RUN_CEILING_EXCEEDED;
  }

  private boolean runCeilingExceeded() {
    return clock.millis() - runStartedAt >= options.getMaxRunSeconds() * 1000L;
  }
}
