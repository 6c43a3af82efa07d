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
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses wal2json payloads. Format version 1 carries a whole transaction in a {@code change}
 * array; format version 2 sends one {@code action} object per row plus begin and commit markers.
 */
final class Wal2JsonParser {

  // wal2json prints timestamps the way PostgreSQL does: 2024-03-01 10:15:30.123456+00
  private static final DateTimeFormatter PG_TIMESTAMP = new DateTimeFormatterBuilder()
    .appendPattern("yyyy-MM-dd HH:mm:ss")
    .optionalStart()
    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
    .optionalEnd()
    .appendPattern("[XXX][XX][X]")
    .toFormatter(Locale.ROOT);

  private Wal2JsonParser() {
  }

  static List<WalChange> parse(String message) {
    if (message == null || message.isBlank()) {
      return Collections.emptyList();
    }

    JsonObject payload;
    try {
      payload = new JsonObject(message);
    } catch (DecodeException e) {
      throw new MalformedWalMessageException("payload is not a JSON object", e);
    }
    Instant sourceTimestamp = parseTimestamp(payload.getValue("timestamp"));

    if (payload.containsKey("action")) {
      return parseAction(payload, sourceTimestamp);
    }

    JsonArray changes = array(payload, "change");
    if (changes == null || changes.isEmpty()) {
      return Collections.emptyList();
    }

    List<WalChange> parsed = new ArrayList<>();
    for (int i = 0; i < changes.size(); i++) {
      Object raw = changes.getValue(i);
      if (!(raw instanceof JsonObject)) {
        throw new MalformedWalMessageException("change entry " + i + " is not an object");
      }

      JsonObject change = (JsonObject) raw;
      ChangeRecord.Operation operation = mapOperation(string(change, "kind"));
      if (operation == null) {
        continue;
      }

      String table = requireTable(change);
      Map<String, Object> values = new LinkedHashMap<>();
      Map<String, String> types = new LinkedHashMap<>();
      zip(change, "columnnames", "columntypes", "columnvalues", values, types);

      Map<String, Object> oldKeys = new LinkedHashMap<>();
      Map<String, String> oldKeyTypes = new LinkedHashMap<>();
      Object oldKeysRaw = change.getValue("oldkeys");
      if (oldKeysRaw instanceof JsonObject) {
        zip((JsonObject) oldKeysRaw, "keynames", "keytypes", "keyvalues", oldKeys, oldKeyTypes);
      } else if (oldKeysRaw != null) {
        throw new MalformedWalMessageException("oldkeys of change entry " + i + " is not an object");
      }

      parsed.add(new WalChange(string(change, "schema"), table, operation, values, types, oldKeys, oldKeyTypes, sourceTimestamp));
    }
    return parsed;
  }

  private static List<WalChange> parseAction(JsonObject payload, Instant sourceTimestamp) {
    ChangeRecord.Operation operation = mapAction(string(payload, "action"));
    if (operation == null) {
      return Collections.emptyList();
    }

    String table = requireTable(payload);
    Map<String, Object> values = new LinkedHashMap<>();
    Map<String, String> types = new LinkedHashMap<>();
    columns(array(payload, "columns"), values, types);

    Map<String, Object> oldKeys = new LinkedHashMap<>();
    Map<String, String> oldKeyTypes = new LinkedHashMap<>();
    columns(array(payload, "identity"), oldKeys, oldKeyTypes);

    // Deletes without an identity array carry the key columns in "columns".
    if (operation == ChangeRecord.Operation.DELETE && oldKeys.isEmpty()) {
      oldKeys.putAll(values);
      oldKeyTypes.putAll(types);
      values.clear();
      types.clear();
    }

    return Collections.singletonList(
      new WalChange(string(payload, "schema"), table, operation, values, types, oldKeys, oldKeyTypes, sourceTimestamp));
  }

  private static void zip(JsonObject source,
                          String namesField,
                          String typesField,
                          String valuesField,
                          Map<String, Object> values,
                          Map<String, String> types) {
    JsonArray names = array(source, namesField);
    JsonArray declared = array(source, typesField);
    JsonArray raw = array(source, valuesField);
    if (names == null && raw == null) {
      return;
    }
    if (names == null || raw == null || names.size() != raw.size()) {
      throw new MalformedWalMessageException(namesField + " and " + valuesField + " do not line up");
    }
    if (declared != null && declared.size() != names.size()) {
      throw new MalformedWalMessageException(namesField + " and " + typesField + " do not line up");
    }
    for (int idx = 0; idx < names.size(); idx++) {
      Object name = names.getValue(idx);
      if (!(name instanceof String)) {
        throw new MalformedWalMessageException(namesField + "[" + idx + "] is not a string");
      }
      values.put((String) name, raw.getValue(idx));
      if (declared != null && declared.getValue(idx) instanceof String) {
        types.put((String) name, declared.getString(idx));
      }
    }
  }

  private static void columns(JsonArray columns, Map<String, Object> values, Map<String, String> types) {
    if (columns == null) {
      return;
    }
    for (int i = 0; i < columns.size(); i++) {
      Object raw = columns.getValue(i);
      if (!(raw instanceof JsonObject)) {
        throw new MalformedWalMessageException("column entry " + i + " is not an object");
      }
      JsonObject column = (JsonObject) raw;
      String name = string(column, "name");
      if (name == null) {
        throw new MalformedWalMessageException("column entry " + i + " has no name");
      }
      values.put(name, column.getValue("value"));
      String type = string(column, "type");
      if (type != null) {
        types.put(name, type);
      }
    }
  }

  private static String requireTable(JsonObject change) {
    String table = string(change, "table");
    if (table == null || table.isBlank()) {
      throw new MalformedWalMessageException("change has no table");
    }
    return table;
  }

  private static JsonArray array(JsonObject json, String field) {
    Object value = json.getValue(field);
    if (value == null || value instanceof JsonArray) {
      return (JsonArray) value;
    }
    throw new MalformedWalMessageException(field + " is not an array");
  }

  private static String string(JsonObject json, String field) {
    Object value = json.getValue(field);
    if (value == null || value instanceof String) {
      return (String) value;
    }
    throw new MalformedWalMessageException(field + " is not a string");
  }

  private static ChangeRecord.Operation mapOperation(String kind) {
    if (kind == null) {
      return null;
    }
    switch (kind.toLowerCase(Locale.ROOT)) {
      case "insert":
        return ChangeRecord.Operation.INSERT;
      case "update":
        return ChangeRecord.Operation.UPDATE;
      case "delete":
        return ChangeRecord.Operation.DELETE;
      default:
        return null;
    }
  }

  private static ChangeRecord.Operation mapAction(String action) {
    if (action == null) {
      return null;
    }
    switch (action.toUpperCase(Locale.ROOT)) {
      case "I":
        return ChangeRecord.Operation.INSERT;
      case "U":
        return ChangeRecord.Operation.UPDATE;
      case "D":
        return ChangeRecord.Operation.DELETE;
      default:
        return null;
    }
  }

  static Instant parseTimestamp(Object value) {
    if (!(value instanceof String) || ((String) value).isBlank()) {
      return null;
    }
    String ts = (String) value;
    try {
      return Instant.parse(ts);
    } catch (DateTimeParseException ignored) {
      // not ISO-8601, try the PostgreSQL text form
    }
    try {
      return OffsetDateTime.parse(ts, PG_TIMESTAMP).toInstant();
    } catch (DateTimeParseException ignored) {
      return null;
    }
  }
}
