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
 * A single wal2json payload could not be parsed. The message is skipped.
 */
public class MalformedWalMessageException extends SyncException {

  public MalformedWalMessageException(String message) {
    super(message);
  }

  public MalformedWalMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
