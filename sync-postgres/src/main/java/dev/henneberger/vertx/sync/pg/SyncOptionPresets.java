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

import dev.henneberger.vertx.sync.core.RetryPolicy;
import java.time.Duration;
import java.util.Objects;

/**
 * Option bundles for the ways a sync is usually scheduled. Each preset only touches the options it
 * names and returns the same instance.
 */
public final class SyncOptionPresets {

  static final int INITIAL_LOAD_BATCH_SIZE = 10_000;

  private SyncOptionPresets() {
  }

  /**
   * A cron-style run: preflight first, strict decoding, and the WAL pass ends at the position that
   * was current when it started.
   */
  public static PostgresSyncOptions scheduledRun(PostgresSyncOptions options) {
    Objects.requireNonNull(options, "options");
    return options
      .setPreflightEnabled(true)
      .setDecodeStrictness(DecodeStrictness.STRICT)
      .setBreakAtEndLsn(true)
      .setRetryPolicy(RetryPolicy.exponentialBackoff(5)
        .setInitialDelay(Duration.ofMillis(500))
        .setMaxDelay(Duration.ofSeconds(30))
        .setJitter(0.2d));
  }

  /**
   * A long-lived consumer that keeps reading the slot until {@code maxRunSeconds}, snapshotting
   * more often than a scheduled run.
   */
  public static PostgresSyncOptions continuousRun(PostgresSyncOptions options) {
    Objects.requireNonNull(options, "options");
    return options
      .setPreflightEnabled(true)
      .setBreakAtEndLsn(false)
      .setMaxPollSeconds(options.getMaxRunSeconds())
      .setSnapshotIntervalSeconds(30)
      .setRetryPolicy(RetryPolicy.exponentialBackoff(10)
        .setInitialDelay(Duration.ofSeconds(1))
        .setMaxDelay(Duration.ofMinutes(1))
        .setJitter(0.2d));
  }

  /**
   * First load of large tables: wide cursor batches and {@code work_mem} for ordered scans. Scans
   * go to the replica when one is given.
   */
  public static PostgresSyncOptions initialLoad(PostgresSyncOptions options, int workMemMb, String replicaHost) {
    Objects.requireNonNull(options, "options");
    options
      .setCursorBatchSize(INITIAL_LOAD_BATCH_SIZE)
      .setWorkMemMb(workMemMb)
      .setFastFullTableScan(false);
    if (replicaHost != null && !replicaHost.isBlank()) {
      options.setReplicaHost(replicaHost);
    }
    return options;
  }

  /**
   * Local development: no preflight, permissive decoding, verbose batch logging and a one minute
   * polling window.
   */
  public static PostgresSyncOptions localDev(PostgresSyncOptions options) {
    Objects.requireNonNull(options, "options");
    return options
      .setPreflightEnabled(false)
      .setDecodeStrictness(DecodeStrictness.PERMISSIVE)
      .setDebugLogging(true)
      .setMaxPollSeconds(60L)
      .setRetryPolicy(RetryPolicy.exponentialBackoff(3)
        .setInitialDelay(Duration.ofMillis(200))
        .setMaxDelay(Duration.ofSeconds(5)));
  }
}
