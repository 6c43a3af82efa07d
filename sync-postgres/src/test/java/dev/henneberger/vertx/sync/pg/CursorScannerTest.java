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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.sync.core.CapabilityCache;
import dev.henneberger.vertx.sync.core.ChangeRecord;
import dev.henneberger.vertx.sync.core.CheckpointEmitter;
import dev.henneberger.vertx.sync.core.ConnectionManager;
import dev.henneberger.vertx.sync.core.ErrorClassifier;
import dev.henneberger.vertx.sync.core.InMemoryStateStore;
import dev.henneberger.vertx.sync.core.ReplicationMethod;
import dev.henneberger.vertx.sync.core.StreamBookmark;
import dev.henneberger.vertx.sync.core.StreamSyncException;
import dev.henneberger.vertx.sync.core.SyncListener;
import dev.henneberger.vertx.sync.core.SyncState;
import dev.henneberger.vertx.sync.core.SyncStream;
import dev.henneberger.vertx.sync.core.TargetIdentity;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CursorScannerTest {

  private static final TargetIdentity TARGET = new TargetIdentity("localhost", 5432, "app");

  private static final SyncStream USERS = SyncStream.builder("public", "users")
    .keyProperties("id")
    .column("id", "bigint")
    .column("name", "text")
    .build();

  private static final SyncStream EVENTS = SyncStream.builder("public", "events")
    .method(ReplicationMethod.INCREMENTAL)
    .replicationKey("id")
    .column("id", "bigint")
    .column("name", "text")
    .build();

  private PostgresSyncOptions options;
  private FakeCursorOpener opener;
  private RecordingOutput output;
  private InMemoryStateStore store;
  private ManualClock clock;
  private SyncState state;

  @BeforeEach
  void setUp() {
    options = new PostgresSyncOptions().setDatabase("app").setUser("sync").setCursorBatchSize(1000);
    opener = new FakeCursorOpener();
    output = new RecordingOutput();
    store = new InMemoryStateStore();
    clock = new ManualClock(1_000L);
    state = new SyncState();
  }

  private CursorScanner scanner(BooleanSupplier stopRequested, SyncListener listener) {
    PostgresTypeDecoder decoder = new PostgresTypeDecoder(
      new ConnectionManager(target -> {
        throw new SQLException("no database in this test");
      }),
      new CapabilityCache(), DecodeStrictness.STRICT, ErrorClassifier.defaults());
    CheckpointEmitter emitter = new CheckpointEmitter(state, output, store, listener, clock, Duration.ofSeconds(60));
    return new CursorScanner(options, opener, decoder, emitter, listener, clock, TARGET, stopRequested);
  }

  private CursorScanner scanner() {
    return scanner(() -> false, SyncListener.NOOP);
  }

  @Test
  void incrementalScanResumesAfterReplicationKey() throws Exception {
    opener.table(EVENTS.id(), 1000);
    state.setBookmark(EVENTS.id(), StreamBookmark.replicationKey("id", "500"));
    options.setCursorBatchSize(100);

    assertEquals(CursorScanner.Outcome.COMPLETED, scanner().sync(EVENTS));

    List<ChangeRecord> records = output.records(EVENTS.id());
    assertEquals(500, records.size());
    assertEquals(501L, records.get(0).getData().get("id"));
    assertEquals("501", records.get(0).getPosition());
    assertEquals(1000L, records.get(499).getData().get("id"));
    assertEquals(StreamBookmark.replicationKey("id", "1000"), state.bookmark(EVENTS.id()).orElseThrow());
    assertEquals(ScanRequest.Mode.INCREMENTAL, opener.requests.get(0).mode());
  }

  @Test
  void orderedScanResumesFromCheckpointAndClearsItWhenDone() throws Exception {
    opener.table(USERS.id(), 10_000);
    state.setBookmark(USERS.id(), StreamBookmark.orderingCheckpoint("[\"4000\"]"));

    assertEquals(CursorScanner.Outcome.COMPLETED, scanner().sync(USERS));

    List<ChangeRecord> records = output.records(USERS.id());
    assertEquals(6000, records.size());
    assertEquals(4001L, records.get(0).getData().get("id"));
    assertEquals("[\"4001\"]", records.get(0).getPosition());
    assertEquals(List.of("4000"), opener.requests.get(0).resumeAfter());
    assertFalse(state.bookmark(USERS.id()).isPresent());
    assertTrue(output.lastState().getJsonObject("bookmarks").isEmpty());
    assertEquals(1, opener.closed);
  }

  @Test
  void stoppedScanResumesWithoutDuplicates() throws Exception {
    opener.table(USERS.id(), 5000);
    AtomicBoolean stop = new AtomicBoolean();
    SyncListener stopAfterTwoBatches = new SyncListener() {
      @Override
      public void onRecord(ChangeRecord record) {
        if (Long.valueOf(2000L).equals(record.getData().get("id"))) {
          stop.set(true);
        }
      }
    };

    assertEquals(CursorScanner.Outcome.STOPPED, scanner(stop::get, stopAfterTwoBatches).sync(USERS));
    assertEquals(StreamBookmark.orderingCheckpoint("[\"2000\"]"), state.bookmark(USERS.id()).orElseThrow());
    assertEquals(USERS.id(), state.currentlySyncing().orElseThrow());

    assertEquals(CursorScanner.Outcome.COMPLETED, scanner().sync(USERS));

    assertEquals(List.of("2000"), opener.requests.get(1).resumeAfter());
    assertEquals(5000, output.records(USERS.id()).size());
    assertEquals(5000, distinctIds(output.records(USERS.id())).size());
  }

  @Test
  void fastScanDropsStaleCheckpoint() throws Exception {
    opener.table(USERS.id(), 10);
    options.setFastFullTableScan(true);
    state.setBookmark(USERS.id(), StreamBookmark.orderingCheckpoint("[\"3\"]"));

    assertEquals(CursorScanner.Outcome.COMPLETED, scanner().sync(USERS));

    assertEquals(ScanRequest.Mode.FAST, opener.requests.get(0).mode());
    assertEquals(10, output.records(USERS.id()).size());
    assertFalse(state.bookmark(USERS.id()).isPresent());
  }

  @Test
  void failedScanIsReopenedOnceFromCheckpoint() throws Exception {
    opener.table(USERS.id(), 5000).failing(USERS.id(), 1, 2500);

    assertEquals(CursorScanner.Outcome.COMPLETED, scanner().sync(USERS));

    assertEquals(2, opener.requests.size());
    assertEquals(List.of("3000"), opener.requests.get(1).resumeAfter());
    assertEquals(5000, output.records(USERS.id()).size());
    assertEquals(5000, distinctIds(output.records(USERS.id())).size());
    assertEquals(2, opener.closed);
  }

  @Test
  void secondFailureFailsTheStream() {
    opener.table(USERS.id(), 5000).failing(USERS.id(), 2, 500);

    StreamSyncException error = assertThrows(StreamSyncException.class, () -> scanner().sync(USERS));

    assertEquals(USERS.id(), error.stream());
    assertInstanceOf(SQLException.class, error.getCause());
    assertEquals(CursorScanner.MAX_ATTEMPTS, opener.requests.size());
    assertEquals(StreamBookmark.orderingCheckpoint("[\"2000\"]"), state.bookmark(USERS.id()).orElseThrow());
  }

  @Test
  void initialScanOfLogBasedStreamEndsAtCapturedLsn() throws Exception {
    SyncStream orders = SyncStream.builder("public", "orders")
      .method(ReplicationMethod.LOG_BASED)
      .keyProperties("id")
      .column("id", "bigint")
      .column("name", "text")
      .build();
    opener.table(orders.id(), 1500);
    state.setBookmark(orders.id(), StreamBookmark.orderingCheckpoint("[]", 0x1000L));

    assertEquals(CursorScanner.Outcome.COMPLETED, scanner().sync(orders));

    StreamBookmark midScan = StreamBookmark.fromJson(
      output.states.get(0).getJsonObject("bookmarks").getJsonObject(orders.id()));
    assertEquals("[\"1000\"]", midScan.checkpoint());
    assertEquals(0x1000L, midScan.initialLsn().getAsLong());
    assertEquals(StreamBookmark.lsn(0x1000L), state.bookmark(orders.id()).orElseThrow());
  }

  @Test
  void undecodableRowFailsWithoutRetry() {
    SyncStream tagged = SyncStream.builder("public", "tagged")
      .keyProperties("id")
      .column("id", "bigint")
      .column("tags", "integer[]")
      .build();
    opener.table(tagged.id(), List.of(row(1L, "{1,2}"), row(2L, "{1,x}")));

    StreamSyncException error = assertThrows(StreamSyncException.class, () -> scanner().sync(tagged));

    assertInstanceOf(TypeDecodeException.class, error.getCause());
    assertEquals(1, opener.requests.size());
    assertEquals(List.of(1L, 2L), output.records(tagged.id()).get(0).getData().get("tags"));
  }

  private static Map<String, Object> row(long id, String tags) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("tags", tags);
    return row;
  }

  private static Set<Object> distinctIds(List<ChangeRecord> records) {
    Set<Object> ids = new HashSet<>();
    for (ChangeRecord record : records) {
      ids.add(record.getData().get("id"));
    }
    return ids;
  }
}
