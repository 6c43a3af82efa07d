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

import dev.henneberger.vertx.sync.core.SyncException;

/**
 * The replication slot exists but was created for a different output plugin.
 */
public class SlotPluginMismatchException extends SyncException {

  public SlotPluginMismatchException(String slotName, String slotPlugin, String expectedPlugin) {
    super("Replication slot " + slotName + " uses plugin '" + slotPlugin + "' but '" + expectedPlugin
      + "' is configured; drop the slot or configure a different slotName");
  }
}
