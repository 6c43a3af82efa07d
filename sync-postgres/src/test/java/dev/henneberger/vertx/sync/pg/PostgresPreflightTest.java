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
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.henneberger.vertx.sync.core.PreflightIssue;
import dev.henneberger.vertx.sync.core.PreflightReport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PostgresPreflightTest {

  private final PostgresSyncOptions options = new PostgresSyncOptions().setDatabase("app").setUser("sync");

  private String walLevel;
  private boolean replicationRole;
  private long maxReplicationSlots;
  private long maxWalSenders;
  private String slotPlugin;
  private boolean slotActive;
  private Long slotLagBytes;
  private boolean pluginVisible;
  private Connection connection;

  @BeforeEach
  void setUp() throws Exception {
    walLevel = "logical";
    replicationRole = true;
    maxReplicationSlots = 10;
    maxWalSenders = 10;
    slotPlugin = null;
    slotActive = false;
    slotLagBytes = null;
    pluginVisible = true;

    connection = mock(Connection.class);
    when(connection.prepareStatement(anyString())).thenAnswer(invocation -> statement(invocation.getArgument(0)));
  }

  @Test
  void healthyServerHasNoIssues() {
    PreflightReport report = preflight().run(true);

    assertTrue(report.ok());
    assertTrue(report.issues().isEmpty());
  }

  @Test
  void scanOnlyRunsSkipReplicationChecks() throws Exception {
    walLevel = "replica";

    PreflightReport report = preflight().run(false);

    assertTrue(report.ok());
    verify(connection, never()).prepareStatement(anyString());
    verify(connection).close();
  }

  @Test
  void reportsWalLevelAndSettingErrors() {
    walLevel = "replica";
    maxReplicationSlots = 0;
    maxWalSenders = 0;

    PreflightReport report = preflight().run(true);

    assertFalse(report.ok());
    assertEquals(List.of("WAL_LEVEL_INVALID", "MAX_REPLICATION_SLOTS_INVALID", "MAX_WAL_SENDERS_INVALID"),
      codes(report.errors()));
  }

  @Test
  void slotOfAnotherPluginIsAnError() {
    slotPlugin = "pgoutput";
    slotActive = true;

    PreflightReport report = preflight().run(true);

    assertEquals(List.of("SLOT_PLUGIN_MISMATCH"), codes(report.errors()));
    assertEquals(List.of("SLOT_ACTIVE"), codes(report.warnings()));
  }

  @Test
  void warnsAboutRoleLagAndPluginVisibility() {
    replicationRole = false;
    slotPlugin = "wal2json";
    slotLagBytes = PostgresPreflight.SLOT_LAG_WARNING_BYTES + 1;
    pluginVisible = false;

    PreflightReport report = preflight().run(true);

    assertTrue(report.ok());
    assertEquals(List.of("ROLE_NOT_REPLICATION", "SLOT_LAG_HIGH", "PLUGIN_NOT_VISIBLE_AS_EXTENSION"),
      codes(report.warnings()));
  }

  @Test
  void unreachableServerIsReported() {
    PostgresPreflight preflight = new PostgresPreflight(options, target -> {
      throw new SQLException("Connection refused", "08001");
    });

    PreflightReport report = preflight.run(true);

    assertEquals(List.of("CONNECTION_FAILED"), codes(report.errors()));
    assertTrue(report.errors().get(0).message().contains("Connection refused"));
  }

  private PostgresPreflight preflight() {
    return new PostgresPreflight(options, target -> connection);
  }

  private PreparedStatement statement(String sql) throws SQLException {
    PreparedStatement statement = mock(PreparedStatement.class);
    ResultSet rs = mock(ResultSet.class);
    when(statement.executeQuery()).thenReturn(rs);

    if (sql.equals("SHOW wal_level")) {
      when(rs.next()).thenReturn(true);
      when(rs.getString(1)).thenReturn(walLevel);
    } else if (sql.contains("FROM pg_roles")) {
      when(rs.next()).thenReturn(true);
      when(rs.getBoolean(1)).thenReturn(replicationRole);
    } else if (sql.equals("SHOW max_replication_slots")) {
      when(rs.next()).thenReturn(true);
      when(rs.getLong(1)).thenReturn(maxReplicationSlots);
    } else if (sql.equals("SHOW max_wal_senders")) {
      when(rs.next()).thenReturn(true);
      when(rs.getLong(1)).thenReturn(maxWalSenders);
    } else if (sql.startsWith("SELECT plugin, active")) {
      when(rs.next()).thenReturn(slotPlugin != null);
      when(rs.getString(1)).thenReturn(slotPlugin);
      when(rs.getBoolean(2)).thenReturn(slotActive);
    } else if (sql.contains("pg_wal_lsn_diff")) {
      when(rs.next()).thenReturn(slotLagBytes != null);
      when(rs.getLong(1)).thenReturn(slotLagBytes == null ? 0L : slotLagBytes);
    } else if (sql.contains("pg_available_extensions")) {
      when(rs.next()).thenReturn(pluginVisible);
    } else {
      throw new AssertionError("unexpected query " + sql);
    }
    return statement;
  }

  private static List<String> codes(List<PreflightIssue> issues) {
    return issues.stream().map(PreflightIssue::code).collect(Collectors.toList());
  }
}
