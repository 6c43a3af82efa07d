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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.sync.core.TargetIdentity;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

class PostgresSyncOptionsTest {

  @Test
  void readsFromJsonAndSerializesToJson() {
    JsonObject json = new JsonObject()
      .put("host", "db.internal")
      .put("port", 15432)
      .put("database", "app")
      .put("user", "service")
      .put("passwordEnv", "PG_PASSWORD")
      .put("ssl", true)
      .put("replicaHost", "replica.internal")
      .put("cursorBatchSize", 250)
      .put("workMemMb", 128)
      .put("fastFullTableScan", true)
      .put("pollIntervalSeconds", 5)
      .put("slotName", "app_slot")
      .put("pluginOptions", new JsonObject().put("include-lsn", true))
      .put("maxPollSeconds", 600L)
      .put("maxRunSeconds", 3600L)
      .put("breakAtEndLsn", false)
      .put("decodeStrictness", "permissive")
      .put("transientSqlStates", new JsonArray().add("08").add("40001"))
      .put("preflightEnabled", true)
      .put("retryPolicy", new JsonObject()
        .put("initialDelayMs", 250L)
        .put("maxDelayMs", 5000L)
        .put("multiplier", 1.5d)
        .put("jitter", 0.1d)
        .put("maxAttempts", 5L));

    PostgresSyncOptions options = new PostgresSyncOptions(json);

    assertEquals("db.internal", options.getHost());
    assertEquals(15432, options.getPort());
    assertEquals("app", options.getDatabase());
    assertTrue(options.getSsl());
    assertEquals(250, options.getCursorBatchSize());
    assertEquals(128, options.getWorkMemMb());
    assertTrue(options.isFastFullTableScan());
    assertFalse(options.isBreakAtEndLsn());
    assertEquals(DecodeStrictness.PERMISSIVE, options.getDecodeStrictness());
    assertEquals(List.of("08", "40001"), options.getTransientSqlStates());
    assertEquals(5L, options.getRetryPolicy().getMaxAttempts());
    assertEquals(new TargetIdentity("replica.internal", 15432, "app"), options.scanTarget());
    assertEquals(new TargetIdentity("db.internal", 15432, "app"), options.primaryTarget());

    JsonObject out = options.toJson();
    assertEquals("db.internal", out.getString("host"));
    assertEquals("PERMISSIVE", out.getString("decodeStrictness"));
    assertEquals(true, out.getJsonObject("pluginOptions").getBoolean("include-lsn"));
    assertEquals(250L, out.getJsonObject("retryPolicy").getLong("initialDelayMs"));
    assertEquals(out, new PostgresSyncOptions(out).toJson());
  }

  @Test
  void defaults() {
    PostgresSyncOptions options = new PostgresSyncOptions();

    assertEquals("localhost", options.getHost());
    assertEquals(5432, options.getPort());
    assertEquals(1000, options.getCursorBatchSize());
    assertEquals(10, options.getPollIntervalSeconds());
    assertEquals(1800L, options.getMaxPollSeconds());
    assertEquals(43200L, options.getMaxRunSeconds());
    assertTrue(options.isBreakAtEndLsn());
    assertEquals("wal2json", options.getPlugin());
    assertEquals(DecodeStrictness.STRICT, options.getDecodeStrictness());
    assertTrue(options.getPluginOptions().isEmpty());
    assertFalse(options.isPreflightEnabled());
    assertNull(options.getReplicaHost());
  }

  @Test
  void mergesWithJsonLikeOtherVertxOptions() {
    PostgresSyncOptions base = new PostgresSyncOptions()
      .setDatabase("db")
      .setUser("u")
      .setSlotName("slot");

    PostgresSyncOptions merged = base.merge(new JsonObject()
      .put("host", "replica")
      .put("ssl", true));

    assertEquals("replica", merged.getHost());
    assertTrue(merged.getSsl());
    assertEquals("slot", merged.getSlotName());
    assertEquals("localhost", base.getHost());
  }

  @Test
  void rejectsUnknownKeys() {
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
      () -> new PostgresSyncOptions(new JsonObject().put("database", "app").put("maxPollSecs", 10)));
    assertTrue(error.getMessage().contains("maxPollSecs"));

    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSyncOptions(new JsonObject().put("retryPolicy", new JsonObject().put("delay", 1))));
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSyncOptions(new JsonObject().put("decodeStrictness", "lenient")));
  }

  @Test
  void derivesSlotNameFromDatabase() {
    assertEquals("pgsync_app", new PostgresSyncOptions().setDatabase("app").resolveSlotName());
    assertEquals("pgsync_my_app_db", new PostgresSyncOptions().setDatabase("My-App.DB").resolveSlotName());
    assertEquals("custom", new PostgresSyncOptions().setDatabase("app").setSlotName("custom").resolveSlotName());

    String longName = new PostgresSyncOptions().setDatabase("d".repeat(100)).resolveSlotName();
    assertEquals(63, longName.length());
  }

  @Test
  void validatesSettings() {
    PostgresSyncOptions valid = new PostgresSyncOptions().setDatabase("app").setUser("sync");
    valid.validate();

    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSyncOptions(valid).setSlotName("Bad-Slot").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSyncOptions(valid).setPlugin("pgoutput").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSyncOptions(valid).setCursorBatchSize(0).validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSyncOptions(valid).setPollIntervalSeconds(0).validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSyncOptions().setUser("sync").validate());
  }

  @Test
  void copiesAreIndependent() {
    PostgresSyncOptions original = new PostgresSyncOptions().setDatabase("app");
    PostgresSyncOptions copy = new PostgresSyncOptions(original);

    copy.setTransientSqlStates(List.of("40001"));
    copy.getRetryPolicy().setMaxAttempts(9);

    assertFalse(original.getTransientSqlStates().contains("40001"));
    assertEquals(3L, original.getRetryPolicy().getMaxAttempts());
  }
}
