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
import java.util.Map;

/**
 * Slot management and stream access for the log-based pass.
 */
public interface ReplicationSource {

  SlotInfo inspectSlot(String slotName) throws SQLException;

  /**
   * Creates a logical slot. Losing a creation race to another process is not an error.
   */
  void createSlot(String slotName, String plugin) throws SQLException;

  /**
   * Current WAL write position of the source, or the last received position on a standby.
   */
  long currentWalLsn() throws SQLException;

  /**
   * @throws SlotInUseException when another process is attached to the slot
   */
  WalReader open(String slotName, long startLsn, Map<String, Object> slotOptions) throws SQLException;
}
