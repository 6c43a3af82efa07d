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

import org.postgresql.replication.LogSequenceNumber;

/**
 * Conversions between numeric LSNs and the {@code XXX/XXX} text form.
 */
final class Lsn {

  private Lsn() {
  }

  static String format(long lsn) {
    return LogSequenceNumber.valueOf(lsn).asString();
  }

  static long parse(String text) {
    if (text == null || text.isBlank()) {
      return 0L;
    }
    LogSequenceNumber lsn = LogSequenceNumber.valueOf(text);
    if (LogSequenceNumber.INVALID_LSN.equals(lsn)) {
      throw new IllegalArgumentException("Invalid LSN '" + text + "'");
    }
    return lsn.asLong();
  }
}
