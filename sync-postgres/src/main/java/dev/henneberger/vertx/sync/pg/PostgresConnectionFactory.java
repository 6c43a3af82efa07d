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
import dev.henneberger.vertx.sync.core.TargetIdentity;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Opens JDBC connections to a {@link TargetIdentity} with the credentials of a
 * {@link PostgresSyncOptions}.
 */
public class PostgresConnectionFactory implements ConnectionFactory {

  static final String APPLICATION_NAME = "vertx-pg-sync";

  private final PostgresSyncOptions options;
  private final Map<String, String> env;

  public PostgresConnectionFactory(PostgresSyncOptions options) {
    this(options, System.getenv());
  }

  PostgresConnectionFactory(PostgresSyncOptions options, Map<String, String> env) {
    this.options = Objects.requireNonNull(options, "options");
    this.env = Objects.requireNonNull(env, "env");
  }

  @Override
  public Connection open(TargetIdentity target) throws SQLException {
    Connection connection = DriverManager.getConnection(jdbcUrl(target), connectionProperties());
    try {
      applySessionTuning(connection, options.getWorkMemMb());
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
    return connection;
  }

  /**
   * Opens a walsender connection for logical replication. Replication connections only speak the
   * simple query protocol.
   */
  public Connection openReplication(TargetIdentity target) throws SQLException {
    Properties props = connectionProperties();
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "9.4");
    return DriverManager.getConnection(jdbcUrl(target), props);
  }

  /**
   * Sets {@code work_mem} for the session. Does nothing when {@code workMemMb} is 0.
   */
  static void applySessionTuning(Connection connection, int workMemMb) throws SQLException {
    if (workMemMb <= 0) {
      return;
    }
    try (Statement statement = connection.createStatement()) {
      statement.execute("SET work_mem = '" + workMemMb + "MB'");
    }
  }

  static String jdbcUrl(TargetIdentity target) {
    return "jdbc:postgresql://" + target.host() + ':' + target.port() + '/' + target.database();
  }

  Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());
    PGProperty.APPLICATION_NAME.set(props, APPLICATION_NAME);

    String password = resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    if (Boolean.TRUE.equals(options.getSsl())) {
      PGProperty.SSL.set(props, "true");
    }
    return props;
  }

  String resolvePassword() {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = env.get(envName);
      }
    }
    return password;
  }
}
