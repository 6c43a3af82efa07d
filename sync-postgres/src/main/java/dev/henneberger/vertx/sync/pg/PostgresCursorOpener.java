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

import dev.henneberger.vertx.sync.core.ConnectionFactory;
import dev.henneberger.vertx.sync.core.SyncStream;
import dev.henneberger.vertx.sync.core.TargetIdentity;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@code DECLARE ... NO SCROLL CURSOR} cursors on a dedicated connection. Each cursor owns its
 * connection and transaction and releases both on close.
 */
public class PostgresCursorOpener implements CursorOpener {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresCursorOpener.class);

  static final String ORDERING_ALIAS = "__sync_ord_";
  static final String REPLICATION_KEY_ALIAS = "__sync_rk";

  private static final AtomicLong CURSOR_IDS = new AtomicLong();

  private final ConnectionFactory connectionFactory;

  public PostgresCursorOpener(ConnectionFactory connectionFactory) {
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
  }

  @Override
  public BatchCursor open(TargetIdentity target, ScanRequest request) throws SQLException {
    Objects.requireNonNull(target, "target");
    ScanQuery query = buildQuery(request);
    String cursorName = "sync_cursor_" + CURSOR_IDS.incrementAndGet();

    Connection connection = connectionFactory.open(target);
    try {
      connection.setAutoCommit(false);
      if (request.mode() == ScanRequest.Mode.ORDERED) {
        PostgresConnectionFactory.applySessionTuning(connection, request.workMemMb());
      }
      try (PreparedStatement declare = connection.prepareStatement(
        "DECLARE " + cursorName + " NO SCROLL CURSOR FOR " + query.sql())) {
        List<String> parameters = query.parameters();
        for (int i = 0; i < parameters.size(); i++) {
          declare.setString(i + 1, parameters.get(i));
        }
        declare.execute();
      }
      LOG.debug("Declared cursor {} on {}: {}", cursorName, target, query.sql());
      return new PgBatchCursor(connection, cursorName, request);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  /**
   * SELECT for a scan request, with bind parameters for the resume predicate. Resume values are
   * bound as text and cast to the declared column type on the server.
   */
  static ScanQuery buildQuery(ScanRequest request) {
    SyncStream stream = request.stream();
    List<String> select = new ArrayList<>();
    for (String column : stream.columnTypes().keySet()) {
      select.add(PgTypes.quoteIdentifier(column));
    }

    List<String> orderExpressions = new ArrayList<>();
    for (String column : request.orderingColumns()) {
      orderExpressions.add(request.orderedByCtid() ? ScanRequest.CTID : PgTypes.quoteIdentifier(column));
    }

    StringBuilder where = new StringBuilder();
    List<String> parameters = new ArrayList<>();
    String orderBy = null;

    switch (request.mode()) {
      case ORDERED:
        for (int i = 0; i < orderExpressions.size(); i++) {
          select.add(orderExpressions.get(i) + "::text AS " + PgTypes.quoteIdentifier(ORDERING_ALIAS + i));
        }
        if (!request.resumeAfter().isEmpty()) {
          List<String> casts = new ArrayList<>();
          for (String column : request.orderingColumns()) {
            casts.add("CAST(? AS " + castType(stream, column, request) + ")");
          }
          where.append(row(orderExpressions)).append(" > ").append(row(casts));
          parameters.addAll(request.resumeAfter());
        }
        orderBy = String.join(", ", orderExpressions);
        break;
      case INCREMENTAL:
        String key = orderExpressions.get(0);
        select.add(key + "::text AS " + PgTypes.quoteIdentifier(REPLICATION_KEY_ALIAS));
        if (request.replicationKeyResume() != null) {
          where.append(key).append(" > CAST(? AS ")
            .append(PgTypes.castTarget(stream.columnTypes().get(stream.replicationKey()))).append(')');
          parameters.add(request.replicationKeyResume());
        }
        orderBy = key + " ASC";
        break;
      default:
        break;
    }

    StringBuilder sql = new StringBuilder("SELECT ")
      .append(String.join(", ", select))
      .append(" FROM ")
      .append(PgTypes.qualifiedTable(stream.schema(), stream.table()));
    if (where.length() > 0) {
      sql.append(" WHERE ").append(where);
    }
    if (orderBy != null) {
      sql.append(" ORDER BY ").append(orderBy);
    }
    return new ScanQuery(sql.toString(), parameters);
  }

  private static String castType(SyncStream stream, String column, ScanRequest request) {
    if (request.orderedByCtid()) {
      return "tid";
    }
    return PgTypes.castTarget(stream.columnTypes().get(column));
  }

  private static String row(List<String> expressions) {
    if (expressions.size() == 1) {
      return expressions.get(0);
    }
    return "(" + String.join(", ", expressions) + ")";
  }

  static final class ScanQuery {
    private final String sql;
    private final List<String> parameters;

    ScanQuery(String sql, List<String> parameters) {
      this.sql = sql;
      this.parameters = List.copyOf(parameters);
    }

    String sql() {
      return sql;
    }

    List<String> parameters() {
      return parameters;
    }
  }

  static final class PgBatchCursor implements BatchCursor {

    private final Connection connection;
    private final String cursorName;
    private final ScanRequest request;

    PgBatchCursor(Connection connection, String cursorName, ScanRequest request) {
      this.connection = connection;
      this.cursorName = cursorName;
      this.request = request;
    }

    @Override
    public List<ScannedRow> fetch(int maxRows) throws SQLException {
      List<ScannedRow> rows = new ArrayList<>(maxRows);
      try (Statement statement = connection.createStatement();
           ResultSet rs = statement.executeQuery("FETCH FORWARD " + maxRows + " FROM " + cursorName)) {
        while (rs.next()) {
          rows.add(readRow(rs));
        }
      }
      return rows;
    }

    private ScannedRow readRow(ResultSet rs) throws SQLException {
      Map<String, Object> values = new LinkedHashMap<>();
      int index = 1;
      for (Map.Entry<String, String> column : request.stream().columnTypes().entrySet()) {
        values.put(column.getKey(), readValue(rs, index++, column.getValue()));
      }

      List<String> ordering = new ArrayList<>();
      String replicationKey = null;
      if (request.mode() == ScanRequest.Mode.ORDERED) {
        for (int i = 0; i < request.orderingColumns().size(); i++) {
          ordering.add(rs.getString(index++));
        }
      } else if (request.mode() == ScanRequest.Mode.INCREMENTAL) {
        replicationKey = rs.getString(index);
      }
      return new ScannedRow(values, ordering, replicationKey);
    }

    // Composite and driver-specific values keep their PostgreSQL text form.
    private static Object readValue(ResultSet rs, int index, String declaredType) throws SQLException {
      if (PgTypes.isComposite(declaredType)) {
        return rs.getString(index);
      }
      Object value = rs.getObject(index);
      if (value == null || value instanceof Number || value instanceof Boolean
        || value instanceof String || value instanceof byte[]) {
        return value;
      }
      return rs.getString(index);
    }

    @Override
    public void close() throws SQLException {
      try {
        if (!connection.isClosed()) {
          try (Statement statement = connection.createStatement()) {
            statement.execute("CLOSE " + cursorName);
          }
          connection.commit();
        }
      } catch (SQLException e) {
        LOG.debug("Failed to close cursor {} cleanly", cursorName, e);
      } finally {
        connection.close();
      }
    }
  }
}
