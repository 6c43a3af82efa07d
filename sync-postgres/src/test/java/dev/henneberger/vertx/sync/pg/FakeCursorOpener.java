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

import dev.henneberger.vertx.sync.core.TargetIdentity;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cursor opener over in-memory tables keyed by a numeric {@code id} column.
 */
final class FakeCursorOpener implements CursorOpener {

  private final Map<String, List<Map<String, Object>>> tables = new HashMap<>();
  private final Map<String, Integer> failuresRemaining = new HashMap<>();
  private final Map<String, Integer> failAfterRows = new HashMap<>();
  final List<ScanRequest> requests = new ArrayList<>();
  final List<TargetIdentity> targets = new ArrayList<>();
  int closed;

  FakeCursorOpener table(String streamId, int rows) {
    List<Map<String, Object>> table = new ArrayList<>();
    for (long id = 1; id <= rows; id++) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("id", id);
      row.put("name", "row-" + id);
      table.add(row);
    }
    tables.put(streamId, table);
    return this;
  }

  FakeCursorOpener table(String streamId, List<Map<String, Object>> rows) {
    tables.put(streamId, rows);
    return this;
  }

  /**
   * The next {@code times} cursors of the stream fail once they have returned {@code afterRows} rows.
   */
  FakeCursorOpener failing(String streamId, int times, int afterRows) {
    failuresRemaining.put(streamId, times);
    failAfterRows.put(streamId, afterRows);
    return this;
  }

  @Override
  public BatchCursor open(TargetIdentity target, ScanRequest request) {
    requests.add(request);
    targets.add(target);
    String streamId = request.stream().id();
    long after = resumeAfter(request);
    List<ScannedRow> remaining = new ArrayList<>();
    for (Map<String, Object> row : tables.getOrDefault(streamId, List.of())) {
      long id = ((Number) row.get("id")).longValue();
      if (id <= after) {
        continue;
      }
      String key = String.valueOf(id);
      switch (request.mode()) {
        case ORDERED:
          remaining.add(new ScannedRow(row, List.of(key), null));
          break;
        case INCREMENTAL:
          remaining.add(new ScannedRow(row, List.of(), key));
          break;
        default:
          remaining.add(new ScannedRow(row, List.of(), null));
          break;
      }
    }

    boolean fails = failuresRemaining.getOrDefault(streamId, 0) > 0;
    if (fails) {
      failuresRemaining.merge(streamId, -1, Integer::sum);
    }
    int failAt = fails ? failAfterRows.get(streamId) : Integer.MAX_VALUE;

    return new BatchCursor() {
      private int position;

      @Override
      public List<ScannedRow> fetch(int maxRows) throws SQLException {
        if (position >= failAt) {
          throw new SQLException("connection reset by peer", "08006");
        }
        int end = Math.min(remaining.size(), position + maxRows);
        List<ScannedRow> batch = new ArrayList<>(remaining.subList(position, end));
        position = end;
        return batch;
      }

      @Override
      public void close() {
        closed++;
      }
    };
  }

  private static long resumeAfter(ScanRequest request) {
    switch (request.mode()) {
      case ORDERED:
        return request.resumeAfter().isEmpty() ? Long.MIN_VALUE : Long.parseLong(request.resumeAfter().get(0));
      case INCREMENTAL:
        return request.replicationKeyResume() == null ? Long.MIN_VALUE : Long.parseLong(request.replicationKeyResume());
      default:
        return Long.MIN_VALUE;
    }
  }
}
