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
 * What {@code pg_replication_slots} says about one slot.
 */
public final class SlotInfo {

  public enum Status {
    ABSENT,
    ACTIVE,
    INACTIVE
  }

  private final String name;
  private final String plugin;
  private final Status status;
  private final long restartLsn;
  private final long confirmedFlushLsn;

  public SlotInfo(String name, String plugin, Status status, long restartLsn, long confirmedFlushLsn) {
    this.name = Objects.requireNonNull(name, "name");
    this.plugin = plugin;
    this.status = Objects.requireNonNull(status, "status");
    this.restartLsn = restartLsn;
    this.confirmedFlushLsn = confirmedFlushLsn;
  }

  public static SlotInfo absent(String name) {
    return new SlotInfo(name, null, Status.ABSENT, 0L, 0L);
  }

  public String name() {
    return name;
  }

  public String plugin() {
    return plugin;
  }

  public Status status() {
    return status;
  }

  public long restartLsn() {
    return restartLsn;
  }

  public long confirmedFlushLsn() {
    return confirmedFlushLsn;
  }

  @Override
  public String toString() {
    return "SlotInfo{" + name + ", plugin=" + plugin + ", status=" + status
      + ", restartLsn=" + Lsn.format(restartLsn) + ", confirmedFlushLsn=" + Lsn.format(confirmedFlushLsn) + '}';
  }
}
