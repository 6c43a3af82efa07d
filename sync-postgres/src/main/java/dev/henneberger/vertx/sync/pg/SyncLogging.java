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

import dev.henneberger.vertx.sync.core.ConsumerState;
import dev.henneberger.vertx.sync.core.SyncResult;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Log lines for scheduled runs: WAL consumer transitions while a run is in progress, and one
 * summary per run once it returns.
 */
public final class SyncLogging {

  private SyncLogging() {
  }

  /**
   * Logs every state change of the WAL consumer. Reconnects are warnings, {@link ConsumerState#ERROR}
   * is an error.
   */
  public static PostgresSyncEngine attachDefaultLogging(PostgresSyncEngine engine,
                                                        Logger logger,
                                                        String runName) {
    Objects.requireNonNull(engine, "engine");
    Objects.requireNonNull(logger, "logger");
    String name = runName(runName);

    return engine.onStateChange(change -> {
      Throwable cause = change.cause();
      if (change.state() == ConsumerState.ERROR) {
        logger.error("run={} wal consumer failed from {} after {} attempt(s): {}",
          name, change.previousState(), change.attempt(), cause == null ? "unknown" : cause.toString());
      } else if (cause != null) {
        logger.warn("run={} wal consumer reconnecting from {} attempt={} cause={}",
          name, change.previousState(), change.attempt(), cause.toString());
      } else {
        logger.info("run={} wal consumer {} -> {} attempt={}",
          name, change.previousState(), change.state(), change.attempt());
      }
    });
  }

  /**
   * Logs the outcome of a run: the stop reason and stream counts, then one line per failed stream.
   *
   * @return the exit code of the result
   */
  public static int logResult(SyncResult result, Logger logger, String runName) {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(logger, "logger");
    String name = runName(runName);

    if (result.fatalError() != null) {
      logger.error("run={} aborted reason={} completed={} failed={}",
        name, result.stopReason(), result.completedStreams().size(), result.failedStreams().size(),
        result.fatalError());
    } else if (!result.failedStreams().isEmpty()) {
      logger.warn("run={} finished reason={} completed={} failed={}",
        name, result.stopReason(), result.completedStreams().size(), result.failedStreams().size());
    } else {
      logger.info("run={} finished reason={} completed={} failed=0",
        name, result.stopReason(), result.completedStreams().size());
    }
    for (Map.Entry<String, Throwable> failed : result.failedStreams().entrySet()) {
      logger.warn("run={} stream={} failed: {}", name, failed.getKey(), failed.getValue().getMessage());
    }
    return result.exitCode();
  }

  private static String runName(String runName) {
    return runName == null || runName.isBlank() ? "sync" : runName;
  }
}
