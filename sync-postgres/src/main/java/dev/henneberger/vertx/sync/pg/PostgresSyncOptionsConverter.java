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

import dev.henneberger.vertx.sync.core.OptionValidation;
import dev.henneberger.vertx.sync.core.RetryPolicy;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

final class PostgresSyncOptionsConverter {

  static final Set<String> KNOWN_KEYS = Set.of(
    "host", "port", "database", "user", "password", "passwordEnv", "ssl",
    "replicaHost", "replicaPort",
    "cursorBatchSize", "workMemMb", "fastFullTableScan", "debugLogging",
    "pollIntervalSeconds", "slotName", "plugin", "pluginOptions",
    "maxPollSeconds", "maxRunSeconds", "breakAtEndLsn", "snapshotIntervalSeconds",
    "decodeStrictness", "transientSqlStates", "retryPolicy", "preflightEnabled");

  private static final Set<String> RETRY_POLICY_KEYS = Set.of(
    "enabled", "initialDelayMs", "maxDelayMs", "multiplier", "jitter", "maxAttempts");

  private PostgresSyncOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresSyncOptions options) {
    if (json == null) {
      return;
    }
    OptionValidation.requireKnownKeys("sync options", json.fieldNames(), KNOWN_KEYS);

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("replicaHost")) {
      options.setReplicaHost(json.getString("replicaHost"));
    }
    if (json.containsKey("replicaPort")) {
      options.setReplicaPort(json.getInteger("replicaPort"));
    }
    if (json.containsKey("cursorBatchSize")) {
      options.setCursorBatchSize(json.getInteger("cursorBatchSize"));
    }
    if (json.containsKey("workMemMb")) {
      options.setWorkMemMb(json.getInteger("workMemMb"));
    }
    if (json.containsKey("fastFullTableScan")) {
      options.setFastFullTableScan(json.getBoolean("fastFullTableScan"));
    }
    if (json.containsKey("debugLogging")) {
      options.setDebugLogging(json.getBoolean("debugLogging"));
    }
    if (json.containsKey("pollIntervalSeconds")) {
      options.setPollIntervalSeconds(json.getInteger("pollIntervalSeconds"));
    }
    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("plugin")) {
      options.setPlugin(json.getString("plugin"));
    }

    JsonObject pluginOptionsJson = json.getJsonObject("pluginOptions");
    if (pluginOptionsJson != null) {
      options.setPluginOptions(pluginOptionsJson.getMap());
    }

    if (json.containsKey("maxPollSeconds")) {
      options.setMaxPollSeconds(json.getLong("maxPollSeconds"));
    }
    if (json.containsKey("maxRunSeconds")) {
      options.setMaxRunSeconds(json.getLong("maxRunSeconds"));
    }
    if (json.containsKey("breakAtEndLsn")) {
      options.setBreakAtEndLsn(json.getBoolean("breakAtEndLsn"));
    }
    if (json.containsKey("snapshotIntervalSeconds")) {
      options.setSnapshotIntervalSeconds(json.getInteger("snapshotIntervalSeconds"));
    }
    if (json.containsKey("decodeStrictness")) {
      String strictness = json.getString("decodeStrictness");
      try {
        options.setDecodeStrictness(DecodeStrictness.valueOf(strictness.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException | NullPointerException e) {
        throw new IllegalArgumentException("decodeStrictness must be STRICT or PERMISSIVE, got " + strictness);
      }
    }

    JsonArray sqlStates = json.getJsonArray("transientSqlStates");
    if (sqlStates != null) {
      List<String> states = new ArrayList<>();
      for (int i = 0; i < sqlStates.size(); i++) {
        states.add(sqlStates.getString(i));
      }
      options.setTransientSqlStates(states);
    }

    if (json.containsKey("preflightEnabled")) {
      options.setPreflightEnabled(json.getBoolean("preflightEnabled"));
    }

    JsonObject retryPolicyJson = json.getJsonObject("retryPolicy");
    if (retryPolicyJson != null) {
      OptionValidation.requireKnownKeys("retryPolicy", retryPolicyJson.fieldNames(), RETRY_POLICY_KEYS);
      RetryPolicy parsed = retryPolicyJson.getBoolean("enabled", true)
        ? RetryPolicy.exponentialBackoff()
        : RetryPolicy.disabled();
      parsed.setInitialDelay(Duration.ofMillis(retryPolicyJson.getLong("initialDelayMs", 1000L)));
      parsed.setMaxDelay(Duration.ofMillis(retryPolicyJson.getLong("maxDelayMs", 30000L)));
      parsed.setMultiplier(retryPolicyJson.getDouble("multiplier", 2.0d));
      parsed.setJitter(retryPolicyJson.getDouble("jitter", 0.2d));
      parsed.setMaxAttempts(retryPolicyJson.getLong("maxAttempts", parsed.getMaxAttempts()));
      options.setRetryPolicy(parsed);
    }
  }

  static void toJson(PostgresSyncOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("database", options.getDatabase());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    if (options.getReplicaHost() != null) {
      json.put("replicaHost", options.getReplicaHost());
    }
    if (options.getReplicaPort() != null) {
      json.put("replicaPort", options.getReplicaPort());
    }
    json.put("cursorBatchSize", options.getCursorBatchSize());
    json.put("workMemMb", options.getWorkMemMb());
    json.put("fastFullTableScan", options.isFastFullTableScan());
    json.put("debugLogging", options.isDebugLogging());
    json.put("pollIntervalSeconds", options.getPollIntervalSeconds());
    json.put("slotName", options.getSlotName());
    json.put("plugin", options.getPlugin());

    Map<String, Object> pluginOptions = options.getPluginOptions();
    json.put("pluginOptions", pluginOptions == null ? new JsonObject() : new JsonObject(new LinkedHashMap<>(pluginOptions)));

    json.put("maxPollSeconds", options.getMaxPollSeconds());
    json.put("maxRunSeconds", options.getMaxRunSeconds());
    json.put("breakAtEndLsn", options.isBreakAtEndLsn());
    json.put("snapshotIntervalSeconds", options.getSnapshotIntervalSeconds());
    json.put("decodeStrictness", options.getDecodeStrictness().name());
    json.put("transientSqlStates", new JsonArray(new ArrayList<>(options.getTransientSqlStates())));
    json.put("preflightEnabled", options.isPreflightEnabled());

    RetryPolicy retryPolicy = options.getRetryPolicy();
    if (retryPolicy != null) {
      JsonObject retry = new JsonObject();
      retry.put("enabled", retryPolicy.isEnabled());
      retry.put("initialDelayMs", retryPolicy.getInitialDelay().toMillis());
      retry.put("maxDelayMs", retryPolicy.getMaxDelay().toMillis());
      retry.put("multiplier", retryPolicy.getMultiplier());
      retry.put("jitter", retryPolicy.getJitter());
      retry.put("maxAttempts", retryPolicy.getMaxAttempts());
      json.put("retryPolicy", retry);
    }
  }
}
