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

import dev.henneberger.vertx.sync.core.ErrorClassifier;
import dev.henneberger.vertx.sync.core.OptionValidation;
import dev.henneberger.vertx.sync.core.RetryPolicy;
import dev.henneberger.vertx.sync.core.TargetIdentity;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Connection, scan and replication configuration for one sync run.
 */
@DataObject
@JsonGen(publicConverter = false)
public class PostgresSyncOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_PLUGIN = "wal2json";
  public static final String DEFAULT_SLOT_PREFIX = "pgsync_";
  public static final int DEFAULT_CURSOR_BATCH_SIZE = 1000;
  public static final int DEFAULT_POLL_INTERVAL_SECONDS = 10;
  public static final long DEFAULT_MAX_POLL_SECONDS = 1800L;
  public static final long DEFAULT_MAX_RUN_SECONDS = 43200L;
  public static final int DEFAULT_SNAPSHOT_INTERVAL_SECONDS = 60;

  private static final int MAX_SLOT_NAME_LENGTH = 63;

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String replicaHost;
  private Integer replicaPort;

  private int cursorBatchSize;
  private int workMemMb;
  private boolean fastFullTableScan;
  private boolean debugLogging;

  private int pollIntervalSeconds;
  private String slotName;
  private String plugin;
  private Map<String, Object> pluginOptions;
  private long maxPollSeconds;
  private long maxRunSeconds;
  private boolean breakAtEndLsn;
  private int snapshotIntervalSeconds;

  private DecodeStrictness decodeStrictness;
  private List<String> transientSqlStates;
  private RetryPolicy retryPolicy;
  private boolean preflightEnabled;

  public PostgresSyncOptions() {
    init();
  }

  public PostgresSyncOptions(JsonObject json) {
    init();
    PostgresSyncOptionsConverter.fromJson(json, this);
  }

  public PostgresSyncOptions(PostgresSyncOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.replicaHost = other.replicaHost;
    this.replicaPort = other.replicaPort;
    this.cursorBatchSize = other.cursorBatchSize;
    this.workMemMb = other.workMemMb;
    this.fastFullTableScan = other.fastFullTableScan;
    this.debugLogging = other.debugLogging;
    this.pollIntervalSeconds = other.pollIntervalSeconds;
    this.slotName = other.slotName;
    this.plugin = other.plugin;
    this.pluginOptions = new LinkedHashMap<>(other.pluginOptions);
    this.maxPollSeconds = other.maxPollSeconds;
    this.maxRunSeconds = other.maxRunSeconds;
    this.breakAtEndLsn = other.breakAtEndLsn;
    this.snapshotIntervalSeconds = other.snapshotIntervalSeconds;
    this.decodeStrictness = other.decodeStrictness;
    this.transientSqlStates = new ArrayList<>(other.transientSqlStates);
    this.retryPolicy = other.retryPolicy.copy();
    this.preflightEnabled = other.preflightEnabled;
  }

  public String getHost() {
    return host;
  }

  public PostgresSyncOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresSyncOptions setPort(Integer port) {
    this.port = port == null ? DEFAULT_PORT : port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresSyncOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresSyncOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresSyncOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PostgresSyncOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresSyncOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getReplicaHost() {
    return replicaHost;
  }

  /**
   * Routes scan traffic to a read replica. Log-based replication always uses the primary.
   */
  public PostgresSyncOptions setReplicaHost(String replicaHost) {
    this.replicaHost = replicaHost;
    return this;
  }

  public Integer getReplicaPort() {
    return replicaPort;
  }

  public PostgresSyncOptions setReplicaPort(Integer replicaPort) {
    this.replicaPort = replicaPort;
    return this;
  }

  public int getCursorBatchSize() {
    return cursorBatchSize;
  }

  public PostgresSyncOptions setCursorBatchSize(int cursorBatchSize) {
    this.cursorBatchSize = cursorBatchSize;
    return this;
  }

  public int getWorkMemMb() {
    return workMemMb;
  }

  /**
   * Session {@code work_mem} for ordered scans in megabytes; {@code 0} keeps the server default.
   */
  public PostgresSyncOptions setWorkMemMb(int workMemMb) {
    this.workMemMb = workMemMb;
    return this;
  }

  public boolean isFastFullTableScan() {
    return fastFullTableScan;
  }

  public PostgresSyncOptions setFastFullTableScan(boolean fastFullTableScan) {
    this.fastFullTableScan = fastFullTableScan;
    return this;
  }

  public boolean isDebugLogging() {
    return debugLogging;
  }

  public PostgresSyncOptions setDebugLogging(boolean debugLogging) {
    this.debugLogging = debugLogging;
    return this;
  }

  public int getPollIntervalSeconds() {
    return pollIntervalSeconds;
  }

  public PostgresSyncOptions setPollIntervalSeconds(int pollIntervalSeconds) {
    this.pollIntervalSeconds = pollIntervalSeconds;
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresSyncOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPlugin() {
    return plugin;
  }

  public PostgresSyncOptions setPlugin(String plugin) {
    this.plugin = plugin;
    return this;
  }

  public Map<String, Object> getPluginOptions() {
    return Collections.unmodifiableMap(pluginOptions);
  }

  public PostgresSyncOptions setPluginOptions(Map<String, Object> options) {
    this.pluginOptions = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
    return this;
  }

  public long getMaxPollSeconds() {
    return maxPollSeconds;
  }

  public PostgresSyncOptions setMaxPollSeconds(long maxPollSeconds) {
    this.maxPollSeconds = maxPollSeconds;
    return this;
  }

  public long getMaxRunSeconds() {
    return maxRunSeconds;
  }

  public PostgresSyncOptions setMaxRunSeconds(long maxRunSeconds) {
    this.maxRunSeconds = maxRunSeconds;
    return this;
  }

  public boolean isBreakAtEndLsn() {
    return breakAtEndLsn;
  }

  public PostgresSyncOptions setBreakAtEndLsn(boolean breakAtEndLsn) {
    this.breakAtEndLsn = breakAtEndLsn;
    return this;
  }

  public int getSnapshotIntervalSeconds() {
    return snapshotIntervalSeconds;
  }

  public PostgresSyncOptions setSnapshotIntervalSeconds(int snapshotIntervalSeconds) {
    this.snapshotIntervalSeconds = snapshotIntervalSeconds;
    return this;
  }

  public DecodeStrictness getDecodeStrictness() {
    return decodeStrictness;
  }

  public PostgresSyncOptions setDecodeStrictness(DecodeStrictness decodeStrictness) {
    this.decodeStrictness = Objects.requireNonNull(decodeStrictness, "decodeStrictness");
    return this;
  }

  public List<String> getTransientSqlStates() {
    return Collections.unmodifiableList(transientSqlStates);
  }

  public PostgresSyncOptions setTransientSqlStates(List<String> transientSqlStates) {
    this.transientSqlStates = transientSqlStates == null
      ? new ArrayList<>(ErrorClassifier.DEFAULT_TRANSIENT_SQL_STATES)
      : new ArrayList<>(transientSqlStates);
    return this;
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  @GenIgnore
  public PostgresSyncOptions setRetryPolicy(RetryPolicy retryPolicy) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public PostgresSyncOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  /**
   * The configured slot name, or {@code pgsync_<database>} with anything outside
   * {@code [a-z0-9_]} replaced by an underscore.
   */
  @GenIgnore
  public String resolveSlotName() {
    if (slotName != null && !slotName.isBlank()) {
      return slotName;
    }
    OptionValidation.require("database", database);
    String derived = DEFAULT_SLOT_PREFIX + database.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    return derived.length() > MAX_SLOT_NAME_LENGTH ? derived.substring(0, MAX_SLOT_NAME_LENGTH) : derived;
  }

  @GenIgnore
  public TargetIdentity primaryTarget() {
    return new TargetIdentity(host, port, database);
  }

  /**
   * The target serving cursor scans: the replica when one is configured, else the primary.
   */
  @GenIgnore
  public TargetIdentity scanTarget() {
    if (replicaHost == null || replicaHost.isBlank()) {
      return primaryTarget();
    }
    return new TargetIdentity(replicaHost, replicaPort == null ? port : replicaPort, database);
  }

  @GenIgnore
  public ErrorClassifier errorClassifier() {
    return ErrorClassifier.sqlStates(transientSqlStates);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresSyncOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresSyncOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresSyncOptions(json);
  }

  public void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    if (replicaHost != null && !replicaHost.isBlank() && replicaPort != null) {
      OptionValidation.requirePort(replicaPort);
    }
    OptionValidation.requireMin("cursorBatchSize", cursorBatchSize, 1);
    OptionValidation.requireMin("workMemMb", workMemMb, 0);
    OptionValidation.requireMin("pollIntervalSeconds", pollIntervalSeconds, 1);
    OptionValidation.requireMin("maxPollSeconds", maxPollSeconds, 1L);
    OptionValidation.requireMin("maxRunSeconds", maxRunSeconds, 1L);
    OptionValidation.requireMin("snapshotIntervalSeconds", snapshotIntervalSeconds, 1);
    OptionValidation.require("plugin", plugin);
    if (!DEFAULT_PLUGIN.equalsIgnoreCase(plugin)) {
      throw new IllegalArgumentException("plugin " + plugin + " is not supported; only " + DEFAULT_PLUGIN + " payloads can be decoded");
    }
    if (slotName != null && !slotName.matches("[a-z0-9_]{1," + MAX_SLOT_NAME_LENGTH + "}")) {
      throw new IllegalArgumentException("slotName may only contain lower-case letters, digits and underscores");
    }
    Objects.requireNonNull(pluginOptions, "pluginOptions");
    Objects.requireNonNull(decodeStrictness, "decodeStrictness");
    for (String state : transientSqlStates) {
      OptionValidation.require("transientSqlStates entry", state);
    }
    Objects.requireNonNull(retryPolicy, "retryPolicy").validate();
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    cursorBatchSize = DEFAULT_CURSOR_BATCH_SIZE;
    workMemMb = 0;
    fastFullTableScan = false;
    debugLogging = false;
    pollIntervalSeconds = DEFAULT_POLL_INTERVAL_SECONDS;
    plugin = DEFAULT_PLUGIN;
    pluginOptions = new LinkedHashMap<>();
    maxPollSeconds = DEFAULT_MAX_POLL_SECONDS;
    maxRunSeconds = DEFAULT_MAX_RUN_SECONDS;
    breakAtEndLsn = true;
    snapshotIntervalSeconds = DEFAULT_SNAPSHOT_INTERVAL_SECONDS;
    decodeStrictness = DecodeStrictness.STRICT;
    transientSqlStates = new ArrayList<>(ErrorClassifier.DEFAULT_TRANSIENT_SQL_STATES);
    retryPolicy = RetryPolicy.exponentialBackoff();
    preflightEnabled = false;
  }
}
