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

import java.util.Objects;

/**
 * A raw logical decoding message and the WAL position it was received at.
 */
public final class WalMessage {

  private final long lsn;
  private final String payload;

  public WalMessage(long lsn, String payload) {
    this.lsn = lsn;
    this.payload = Objects.requireNonNull(payload, "payload");
  }

  public long lsn() {
    return lsn;
  }

  public String payload() {
    return payload;
  }

  @Override
  public String toString() {
    return "WalMessage{lsn=" + Lsn.format(lsn) + ", bytes=" + payload.length() + '}';
  }
}
