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
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.postgresql.PGConnection;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.fluent.logical.ChainedLogicalStreamBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ReplicationSource} backed by the PostgreSQL JDBC replication API.
 */
public class PostgresReplicationSource implements ReplicationSource {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresReplicationSource.class);

  static final String OBJECT_IN_USE = "55006";
  static final String DUPLICATE_OBJECT = "42710";

  private final PostgresConnectionFactory connectionFactory;
  private final TargetIdentity target;
  private final Duration statusInterval;

  public PostgresReplicationSource(PostgresConnectionFactory connectionFactory,
                                   TargetIdentity target,
                                   Duration statusInterval) {
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.target = Objects.requireNonNull(target, "target");
    this.statusInterval = Objects.requireNonNull(statusInterval, "statusInterval");
  }

  @Override
  public SlotInfo inspectSlot(String slotName) throws SQLException {
    try (Connection conn = connectionFactory.open(target);
         PreparedStatement statement = conn.prepareStatement(
           "SELECT plugin, active, restart_lsn::text, confirmed_flush_lsn::text "
             + "FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return SlotInfo.absent(slotName);
        }
        SlotInfo.Status status = rs.getBoolean(2) ? SlotInfo.Status.ACTIVE : SlotInfo.Status.INACTIVE;
        return new SlotInfo(slotName, rs.getString(1), status, Lsn.parse(rs.getString(3)), Lsn.parse(rs.getString(4)));
      }
    }
  }

  @Override
  public void createSlot(String slotName, String plugin) throws SQLException {
    try (Connection conn = connectionFactory.open(target);
         PreparedStatement statement = conn.prepareStatement(
           "SELECT pg_create_logical_replication_slot(?, ?)")) {
      statement.setString(1, slotName);
      statement.setString(2, plugin);
      try {
        statement.execute();
        LOG.info("Created replication slot {} with plugin {} on {}", slotName, plugin, target);
      } catch (SQLException createError) {
        if (!isSlotAlreadyExists(createError)) {
          throw createError;
        }
        LOG.info("Replication slot {} was created concurrently", slotName);
      }
    }
  }

  @Override
  public long currentWalLsn() throws SQLException {
    try (Connection conn = connectionFactory.open(target);
         PreparedStatement statement = conn.prepareStatement(
           "SELECT (CASE WHEN pg_is_in_recovery() THEN pg_last_wal_receive_lsn() "
             + "ELSE pg_current_wal_lsn() END)::text");
         ResultSet rs = statement.executeQuery()) {
      if (!rs.next() || rs.getString(1) == null) {
        throw new SQLException("Could not read current WAL LSN");
      }
      return Lsn.parse(rs.getString(1));
    }
  }

  @Override
  public WalReader open(String slotName, long startLsn, Map<String, Object> slotOptions) throws SQLException {
    Connection replConn = connectionFactory.openReplication(target);
    try {
      PGConnection pgConnection = replConn.unwrap(PGConnection.class);
      ChainedLogicalStreamBuilder builder = pgConnection.getReplicationAPI()
        .replicationStream()
        .logical()
        .withSlotName(slotName)
        .withStartPosition(LogSequenceNumber.valueOf(startLsn))
        .withStatusInterval((int) statusInterval.toMillis(), TimeUnit.MILLISECONDS);
      for (Map.Entry<String, Object> entry : slotOptions.entrySet()) {
        applySlotOption(builder, entry.getKey(), entry.getValue());
      }
      PGReplicationStream stream = builder.start();
      LOG.info("Attached to replication slot {} on {} at {}", slotName, target, Lsn.format(startLsn));
      return new PgWalReader(replConn, stream);
    } catch (SQLException e) {
      closeQuietly(replConn);
      if (OBJECT_IN_USE.equals(e.getSQLState())) {
        throw new SlotInUseException(slotName, e);
      }
      throw e;
    } catch (RuntimeException e) {
      closeQuietly(replConn);
      throw e;
    }
  }

  static void applySlotOption(ChainedLogicalStreamBuilder builder, String key, Object value) {
    if (value instanceof Boolean) {
      builder.withSlotOption(key, (Boolean) value);
      return;
    }
    if (value instanceof Number) {
      builder.withSlotOption(key, ((Number) value).intValue());
      return;
    }
    builder.withSlotOption(key, String.valueOf(value));
  }

  static boolean isSlotAlreadyExists(SQLException error) {
    String state = error.getSQLState();
    if (DUPLICATE_OBJECT.equals(state)) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (SQLException closeError) {
      LOG.debug("Failed to close replication connection", closeError);
    }
  }

  static final class PgWalReader implements WalReader {

    private final Connection connection;
    private final PGReplicationStream stream;

    PgWalReader(Connection connection, PGReplicationStream stream) {
      this.connection = connection;
      this.stream = stream;
    }

    @Override
    public WalMessage readPending() throws SQLException {
      ByteBuffer buffer = stream.readPending();
      if (buffer == null) {
        return null;
      }
      return new WalMessage(lastReceivedLsn(), decode(buffer));
    }

    @Override
    public long lastReceivedLsn() {
      LogSequenceNumber lsn = stream.getLastReceiveLSN();
      return lsn == null ? 0L : lsn.asLong();
    }

    @Override
    public void acknowledge(long lsn) {
      LogSequenceNumber position = LogSequenceNumber.valueOf(lsn);
      stream.setAppliedLSN(position);
      stream.setFlushedLSN(position);
    }

    @Override
    public void sendStatus() throws SQLException {
      stream.forceUpdateStatus();
    }

    @Override
    public void close() throws SQLException {
      try {
        if (!stream.isClosed()) {
          stream.close();
        }
      } finally {
        connection.close();
      }
    }

    private static String decode(ByteBuffer buffer) {
      byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return new String(bytes, StandardCharsets.UTF_8);
    }
  }
}
