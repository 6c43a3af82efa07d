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
import dev.henneberger.vertx.sync.core.PreflightIssue;
import dev.henneberger.vertx.sync.core.PreflightReport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks the source server before a run starts. Errors abort the run, warnings are logged.
 */
public class PostgresPreflight {

  static final long SLOT_LAG_WARNING_BYTES = 128L * 1024L * 1024L;

  private final PostgresSyncOptions options;
  private final ConnectionFactory connectionFactory;

  public PostgresPreflight(PostgresSyncOptions options, ConnectionFactory connectionFactory) {
    this.options = Objects.requireNonNull(options, "options");
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
  }

  /**
   * @param logBased whether the run has log-based streams; replication checks are skipped otherwise
   */
  public PreflightReport run(boolean logBased) {
    List<PreflightIssue> issues = new ArrayList<>();

    try (Connection conn = connectionFactory.open(options.primaryTarget())) {
      if (logBased) {
        checkWalLevel(conn, issues);
        checkRolePrivileges(conn, issues);
        checkReplicationSettings(conn, issues);
        checkExistingSlot(conn, issues);
        checkSlotLag(conn, issues);
        checkPluginVisibility(conn, issues);
      }
    } catch (Exception e) {
      issues.add(PreflightIssue.error(
        "CONNECTION_FAILED",
        "Could not connect to PostgreSQL: " + e.getMessage(),
        "Verify host, port, database, user, password, and SSL settings."
      ));
    }

    return new PreflightReport(issues);
  }

  private void checkWalLevel(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      if (!rs.next()) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_UNKNOWN",
          "Could not read wal_level",
          "Set wal_level=logical and restart PostgreSQL."
        ));
        return;
      }

      String walLevel = rs.getString(1);
      if (!"logical".equalsIgnoreCase(walLevel)) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_INVALID",
          "wal_level is '" + walLevel + "'",
          "Set wal_level=logical and restart PostgreSQL."
        ));
      }
    }
  }

  private void checkRolePrivileges(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT (rolreplication OR rolsuper) FROM pg_roles WHERE rolname = current_user");
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && !rs.getBoolean(1)) {
        issues.add(PreflightIssue.warning(
          "ROLE_NOT_REPLICATION",
          "Current user does not have replication privileges",
          "Grant REPLICATION privilege or use a superuser role."
        ));
      }
    }
  }

  private void checkReplicationSettings(Connection conn, List<PreflightIssue> issues) throws SQLException {
    checkPositiveSetting(conn, "max_replication_slots", "MAX_REPLICATION_SLOTS_INVALID", issues);
    checkPositiveSetting(conn, "max_wal_senders", "MAX_WAL_SENDERS_INVALID", issues);
  }

  private void checkPositiveSetting(Connection conn, String setting, String code, List<PreflightIssue> issues)
    throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW " + setting);
         ResultSet rs = statement.executeQuery()) {
      if (rs.next()) {
        long value = rs.getLong(1);
        if (value < 1) {
          issues.add(PreflightIssue.error(
            code,
            setting + " is set to " + value,
            "Set " + setting + " to at least 1 and restart PostgreSQL."
          ));
        }
      }
    }
  }

  private void checkExistingSlot(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT plugin, active FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, options.resolveSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return;
        }
        String slotPlugin = rs.getString(1);
        if (!options.getPlugin().equalsIgnoreCase(slotPlugin)) {
          issues.add(PreflightIssue.error(
            "SLOT_PLUGIN_MISMATCH",
            "Replication slot uses plugin '" + slotPlugin + "' but configured plugin is '" + options.getPlugin() + "'",
            "Drop the slot or configure a different slotName."
          ));
        }
        if (rs.getBoolean(2)) {
          issues.add(PreflightIssue.warning(
            "SLOT_ACTIVE",
            "Replication slot " + options.resolveSlotName() + " is in use by another process",
            "Stop the other consumer before starting this run."
          ));
        }
      }
    }
  }

  private void checkSlotLag(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT pg_wal_lsn_diff(pg_current_wal_lsn(), restart_lsn) "
        + "FROM pg_replication_slots WHERE slot_name = ? AND restart_lsn IS NOT NULL")) {
      statement.setString(1, options.resolveSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          long lagBytes = rs.getLong(1);
          if (lagBytes > SLOT_LAG_WARNING_BYTES) {
            issues.add(PreflightIssue.warning(
              "SLOT_LAG_HIGH",
              "Replication slot lag is " + lagBytes + " bytes",
              "Run the sync more often or drop and recreate the slot with a fresh initial scan."
            ));
          }
        }
      }
    }
  }

  private void checkPluginVisibility(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT 1 FROM pg_available_extensions WHERE name = ?")) {
      statement.setString(1, options.getPlugin());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          issues.add(PreflightIssue.warning(
            "PLUGIN_NOT_VISIBLE_AS_EXTENSION",
            "Plugin '" + options.getPlugin() + "' is not listed in pg_available_extensions",
            "This is normal for output plugins; verify wal2json is installed if the slot cannot be created."
          ));
        }
      }
    }
  }
}
