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

import dev.henneberger.vertx.sync.core.ChangeRecord;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row change parsed from a wal2json payload. Values are still in wal2json form; composite
 * values arrive as their PostgreSQL text representation.
 */
final class WalChange {

  private final String schema;
  private final String table;
  private final ChangeRecord.Operation operation;
  private final Map<String, Object> values;
  private final Map<String, String> types;
  private final Map<String, Object> oldKeys;
  private final Map<String, String> oldKeyTypes;
  private final Instant timestamp;

  WalChange(String schema,
            String table,
            ChangeRecord.Operation operation,
            Map<String, Object> values,
            Map<String, String> types,
            Map<String, Object> oldKeys,
            Map<String, String> oldKeyTypes,
            Instant timestamp) {
    this.schema = schema;
    this.table = Objects.requireNonNull(table, "table");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    this.oldKeys = Collections.unmodifiableMap(new LinkedHashMap<>(oldKeys));
    this.oldKeyTypes = Collections.unmodifiableMap(new LinkedHashMap<>(oldKeyTypes));
    this.timestamp = timestamp;
  }

  /**
   * Matches {@link dev.henneberger.vertx.sync.core.SyncStream#id()}.
   */
  String streamId() {
    return (schema == null || schema.isBlank() ? "public" : schema) + '-' + table;
  }

  String schema() {
    return schema;
  }

  String table() {
    return table;
  }

  ChangeRecord.Operation operation() {
    return operation;
  }

  Map<String, Object> values() {
    return values;
  }

  /**
   * Declared types reported in the payload; empty when the slot was opened without type output.
   */
  Map<String, String> types() {
    return types;
  }

  Map<String, Object> oldKeys() {
    return oldKeys;
  }

  Map<String, String> oldKeyTypes() {
    return oldKeyTypes;
  }

  Instant timestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return "WalChange{" + operation + " " + streamId() + " values=" + values + " oldKeys=" + oldKeys + '}';
  }
}
