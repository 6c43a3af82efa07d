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
import dev.henneberger.vertx.sync.core.ReplicationMethod;
import dev.henneberger.vertx.sync.core.SnapshotReason;
import dev.henneberger.vertx.sync.core.StreamBookmark;
import dev.henneberger.vertx.sync.core.StreamSyncException;
import dev.henneberger.vertx.sync.core.SyncClock;
import dev.henneberger.vertx.sync.core.SyncListener;
import dev.henneberger.vertx.sync.core.SyncState;
import dev.henneberger.vertx.sync.core.SyncStream;
import dev.henneberger.vertx.sync.core.TargetIdentity;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads full-table and incremental streams through server-side cursors, one batch at a time.
 *
 * <p>The stream's bookmark is updated and a combined snapshot emitted after every batch, so an
 * interrupted ordered or incremental scan resumes after the last emitted row. A failed scan is
 * reopened once from its last bookmark; a second failure fails the stream.
 */
public class CursorScanner {

  private static final Logger LOG = LoggerFactory.getLogger(CursorScanner.class);

  static final int MAX_ATTEMPTS = 2;

  public enum Outcome {
    COMPLETED,
    STOPPED
  }

  private final PostgresSyncOptions options;
  private final CursorOpener opener;
  private final PostgresTypeDecoder decoder;
  private final CheckpointEmitter emitter;
  private final SyncListener listener;
  private final SyncClock clock;
  private final TargetIdentity target;
  private final BooleanSupplier stopRequested;

  public CursorScanner(PostgresSyncOptions options,
                       CursorOpener opener,
                       PostgresTypeDecoder decoder,
                       CheckpointEmitter emitter,
                       SyncListener listener,
                       SyncClock clock,
                       TargetIdentity target,
                       BooleanSupplier stopRequested) {
    this.options = Objects.requireNonNull(options, "options");
    this.opener = Objects.requireNonNull(opener, "opener");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    this.listener = listener == null ? SyncListener.NOOP : listener;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.target = Objects.requireNonNull(target, "target");
    this.stopRequested = Objects.requireNonNull(stopRequested, "stopRequested");
  }

  /**
   * Scans one stream until its cursor is exhausted or a stop is requested.
   *
   * @throws StreamSyncException when the scan fails twice or a row cannot be decoded
   */
  public Outcome sync(SyncStream stream) throws Exception {
    SyncState state = emitter.state();
    state.setCurrentlySyncing(stream.id());
    ScanRequest.Mode mode = modeFor(stream);
    if (mode == ScanRequest.Mode.FAST) {
      // fast scans persist no checkpoint
      state.clearBookmark(stream.id());
    }
    long started = clock.millis();
    int attempt = 0;

    while (true) {
      attempt++;
      ScanRequest request = request(stream, mode, state);
      LOG.info("stream={} scan starting mode={} attempt={} resumeAfter={}", stream.id(), mode, attempt,
        mode == ScanRequest.Mode.INCREMENTAL ? request.replicationKeyResume() : request.resumeAfter());
      try (BatchCursor cursor = opener.open(target, request)) {
        Outcome outcome = drain(stream, request, cursor);
        if (outcome == Outcome.COMPLETED) {
          complete(stream, mode, state);
        }
        LOG.info("stream={} scan {} elapsedMs={} rowsEmitted={}", stream.id(),
          outcome == Outcome.COMPLETED ? "complete" : "stopped", clock.millis() - started, emitter.rows(stream.id()));
        return outcome;
      } catch (TypeDecodeException e) {
        throw new StreamSyncException(stream.id(), "row could not be decoded", e);
      } catch (SQLException e) {
        if (attempt >= MAX_ATTEMPTS) {
          throw new StreamSyncException(stream.id(), "scan failed after " + attempt + " attempts", e);
        }
        LOG.warn("stream={} scan failed, reopening from last checkpoint: {}", stream.id(), e.getMessage());
      }
    }
  }

  private Outcome drain(SyncStream stream, ScanRequest request, BatchCursor cursor) throws Exception {
    int batchSize = options.getCursorBatchSize();
    long batch = 0;
    while (true) {
      if (stopRequested.getAsBoolean()) {
        return Outcome.STOPPED;
      }
      long fetchStarted = clock.millis();
      List<ScannedRow> rows = cursor.fetch(batchSize);
      long fetchMillis = clock.millis() - fetchStarted;
      batch++;
      listener.onBatch(stream.id(), rows.size(), fetchMillis);
      logBatch(stream, batch, rows.size(), fetchMillis);
      if (rows.isEmpty()) {
        return Outcome.COMPLETED;
      }

      ScannedRow last = null;
      for (ScannedRow row : rows) {
        emitter.emitRecord(toRecord(stream, request, row));
        last = row;
      }
      advanceBookmark(stream, request, last);
      emitter.emitNow(SnapshotReason.BATCH);
    }
  }

  private ChangeRecord toRecord(SyncStream stream, ScanRequest request, ScannedRow row) throws SQLException {
    Map<String, Object> data = new LinkedHashMap<>();
    for (Map.Entry<String, Object> value : row.values().entrySet()) {
      String declaredType = stream.columnTypes().get(value.getKey());
      data.put(value.getKey(), decoder.decode(target, value.getKey(), declaredType, value.getValue()));
    }
    return new ChangeRecord(stream.id(), ChangeRecord.Operation.INSERT, data, null, position(request, row), null);
  }

  private static String position(ScanRequest request, ScannedRow row) {
    switch (request.mode()) {
      case INCREMENTAL:
        return row.replicationKeyValue();
      case ORDERED:
        return checkpoint(row.orderingValues());
      default:
        return null;
    }
  }

  private void advanceBookmark(SyncStream stream, ScanRequest request, ScannedRow last) {
    SyncState state = emitter.state();
    switch (request.mode()) {
      case INCREMENTAL:
        if (last.replicationKeyValue() != null) {
          state.setBookmark(stream.id(), StreamBookmark.replicationKey(stream.replicationKey(), last.replicationKeyValue()));
        }
        break;
      case ORDERED:
        String checkpoint = checkpoint(last.orderingValues());
        OptionalLong initialLsn = initialLsn(state, stream);
        state.setBookmark(stream.id(), initialLsn.isPresent()
          ? StreamBookmark.orderingCheckpoint(checkpoint, initialLsn.getAsLong())
          : StreamBookmark.orderingCheckpoint(checkpoint));
        break;
      default:
        break;
    }
  }

  private void complete(SyncStream stream, ScanRequest.Mode mode, SyncState state) throws Exception {
    if (mode != ScanRequest.Mode.ORDERED) {
      return;
    }
    OptionalLong initialLsn = initialLsn(state, stream);
    if (stream.method() == ReplicationMethod.LOG_BASED && initialLsn.isPresent()) {
      state.setBookmark(stream.id(), StreamBookmark.lsn(initialLsn.getAsLong()));
      LOG.info("stream={} initial scan complete, log replication continues from {}", stream.id(),
        Lsn.format(initialLsn.getAsLong()));
    } else {
      state.clearBookmark(stream.id());
    }
    listener.onBookmarkCommitted(stream.id(), state.bookmark(stream.id()).orElse(null));
    emitter.emitNow(SnapshotReason.BATCH);
  }

  private ScanRequest request(SyncStream stream, ScanRequest.Mode mode, SyncState state) {
    Optional<StreamBookmark> bookmark = state.bookmark(stream.id());
    switch (mode) {
      case FAST:
        return ScanRequest.fast(stream);
      case INCREMENTAL:
        String resume = bookmark
          .filter(b -> b.kind() == StreamBookmark.Kind.REPLICATION_KEY)
          .filter(b -> stream.replicationKey().equals(b.replicationKeyName()))
          .map(StreamBookmark::replicationKeyValue)
          .orElse(null);
        return ScanRequest.incremental(stream, resume);
      default:
        List<String> resumeAfter = bookmark
          .filter(b -> b.kind() == StreamBookmark.Kind.ORDERING_CHECKPOINT)
          .map(b -> parseCheckpoint(stream, b.checkpoint()))
          .orElse(List.of());
        return ScanRequest.ordered(stream, resumeAfter, options.getWorkMemMb());
    }
  }

  ScanRequest.Mode modeFor(SyncStream stream) {
    switch (stream.method()) {
      case INCREMENTAL:
        return ScanRequest.Mode.INCREMENTAL;
      case FULL_TABLE:
        return options.isFastFullTableScan() ? ScanRequest.Mode.FAST : ScanRequest.Mode.ORDERED;
      default:
        return ScanRequest.Mode.ORDERED;
    }
  }

  private static OptionalLong initialLsn(SyncState state, SyncStream stream) {
    return state.bookmark(stream.id())
      .filter(b -> b.kind() == StreamBookmark.Kind.ORDERING_CHECKPOINT)
      .map(StreamBookmark::initialLsn)
      .orElse(OptionalLong.empty());
  }

  static String checkpoint(List<String> orderingValues) {
    return new JsonArray(new ArrayList<>(orderingValues)).encode();
  }

  static List<String> parseCheckpoint(SyncStream stream, String checkpoint) {
    try {
      JsonArray values = new JsonArray(checkpoint);
      List<String> parsed = new ArrayList<>(values.size());
      for (int i = 0; i < values.size(); i++) {
        Object value = values.getValue(i);
        parsed.add(value == null ? null : String.valueOf(value));
      }
      return parsed;
    } catch (DecodeException e) {
      throw new StreamSyncException(stream.id(), "stored ordering checkpoint is not valid: " + checkpoint, e);
    }
  }

  private void logBatch(SyncStream stream, long batch, int rows, long fetchMillis) {
    long rowsPerSecond = rows * 1000L / Math.max(1L, fetchMillis);
    if (options.isDebugLogging()) {
      LOG.info("stream={} batch={} rows={} fetchMs={} rowsPerSec={}", stream.id(), batch, rows, fetchMillis, rowsPerSecond);
    } else {
      LOG.debug("stream={} batch={} rows={} fetchMs={} rowsPerSec={}", stream.id(), batch, rows, fetchMillis, rowsPerSecond);
    }
  }
}
