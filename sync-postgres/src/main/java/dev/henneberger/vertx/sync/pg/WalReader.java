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

import java.sql.SQLException;

/**
 * An open logical replication stream.
 */
public interface WalReader extends AutoCloseable {

  /**
   * Returns the next message without blocking, or {@code null} when none is pending.
   */
  WalMessage readPending() throws SQLException;

  /**
   * Highest WAL position the server has reported so far, from data or keepalive messages.
   */
  long lastReceivedLsn();

  /**
   * Records {@code lsn} as applied and flushed. Sent to the server with the next status update.
   */
  void acknowledge(long lsn);

  /**
   * Sends a standby status update immediately.
   */
  void sendStatus() throws SQLException;

  @Override
  void close() throws SQLException;
}
