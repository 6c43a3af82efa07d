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

import dev.henneberger.vertx.sync.core.SyncStream;
import java.util.List;
import java.util.Objects;

/**
 * What one cursor should read: a stream, a scan mode and where to resume.
 */
public final class ScanRequest {

  public enum Mode {
    /** Full table ordered by the key properties (or {@code ctid}), resumable. */
    ORDERED,
    /** Full table in physical order, restarted from scratch after an interruption. */
    FAST,
    /** Rows whose replication key is greater than the bookmark, ordered by that key. */
    INCREMENTAL
  }

  static final String CTID = "ctid";

  private final SyncStream stream;
  private final Mode mode;
  private final List<String> orderingColumns;
  private final List<String> resumeAfter;
  private final String replicationKeyResume;
  private final int workMemMb;

  private ScanRequest(SyncStream stream,
                      Mode mode,
                      List<String> orderingColumns,
                      List<String> resumeAfter,
                      String replicationKeyResume,
                      int workMemMb) {
    this.stream = Objects.requireNonNull(stream, "stream");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.orderingColumns = List.copyOf(orderingColumns);
    this.resumeAfter = List.copyOf(resumeAfter);
    this.replicationKeyResume = replicationKeyResume;
    this.workMemMb = workMemMb;
  }

  /**
   * @param resumeAfter ordering values of the last emitted row, empty to start at the beginning
   */
  public static ScanRequest ordered(SyncStream stream, List<String> resumeAfter, int workMemMb) {
    List<String> ordering = stream.keyProperties().isEmpty() ? List.of(CTID) : stream.keyProperties();
    if (!resumeAfter.isEmpty() && resumeAfter.size() != ordering.size()) {
      throw new IllegalArgumentException("checkpoint for " + stream.id() + " has " + resumeAfter.size()
        + " values but the stream is ordered by " + ordering);
    }
    return new ScanRequest(stream, Mode.ORDERED, ordering, resumeAfter, null, workMemMb);
  }

  public static ScanRequest fast(SyncStream stream) {
    return new ScanRequest(stream, Mode.FAST, List.of(), List.of(), null, 0);
  }

  /**
   * @param resumeAfter text form of the last emitted replication key value, or {@code null}
   */
  public static ScanRequest incremental(SyncStream stream, String resumeAfter) {
    return new ScanRequest(stream, Mode.INCREMENTAL, List.of(stream.replicationKey()), List.of(), resumeAfter, 0);
  }

  public SyncStream stream() {
    return stream;
  }

  public Mode mode() {
    return mode;
  }

  /**
   * Columns the scan is ordered by; {@code ctid} for tables without key properties.
   */
  public List<String> orderingColumns() {
    return orderingColumns;
  }

  public boolean orderedByCtid() {
    return orderingColumns.equals(List.of(CTID));
  }

  public List<String> resumeAfter() {
    return resumeAfter;
  }

  public String replicationKeyResume() {
    return replicationKeyResume;
  }

  public int workMemMb() {
    return workMemMb;
  }

  @Override
  public String toString() {
    return "ScanRequest{" + stream.id() + ", " + mode + ", orderBy=" + orderingColumns
      + ", resumeAfter=" + (mode == Mode.INCREMENTAL ? replicationKeyResume : resumeAfter) + '}';
  }
}
