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

import dev.henneberger.vertx.sync.core.CapabilityCache;
import dev.henneberger.vertx.sync.core.ConnectionManager;
import dev.henneberger.vertx.sync.core.ErrorClassifier;
import dev.henneberger.vertx.sync.core.TargetIdentity;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the text form of array and {@code hstore} values into Java lists and maps.
 *
 * <p>Arrays of numeric, boolean, text, date/time and uuid elements are parsed locally. Every other
 * array element type, and {@code hstore}, is decoded by the database with one query per non-null
 * value on the auxiliary connection of the current target. Other values are returned unchanged.
 */
public class PostgresTypeDecoder {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresTypeDecoder.class);

  static final String HSTORE_CAPABILITY = "hstore";

  private final ConnectionManager connections;
  private final CapabilityCache capabilities;
  private final DecodeStrictness strictness;
  private final ErrorClassifier classifier;
  private long slowPathQueries;

  public PostgresTypeDecoder(ConnectionManager connections,
                             CapabilityCache capabilities,
                             DecodeStrictness strictness,
                             ErrorClassifier classifier) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    this.strictness = Objects.requireNonNull(strictness, "strictness");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
  }

  /**
   * @param target the database the value was read from; slow-path queries run against it
   * @throws TypeDecodeException in {@link DecodeStrictness#STRICT} mode when the value cannot be decoded
   * @throws SQLException when the auxiliary connection fails with a transient error
   */
  public Object decode(TargetIdentity target, String column, String declaredType, Object raw) throws SQLException {
    if (!(raw instanceof String) || !PgTypes.isComposite(declaredType)) {
      return raw;
    }
    String text = (String) raw;
    try {
      if (PgTypes.isHstore(declaredType)) {
        return decodeHstore(target, column, declaredType, text);
      }
      PgTypes.ElementKind kind = PgTypes.fastElementKind(PgTypes.elementType(declaredType));
      if (kind != null) {
        return decodeFast(column, declaredType, text, kind);
      }
      return decodeArrayWithDatabase(target, column, declaredType, text);
    } catch (TypeDecodeException e) {
      if (strictness == DecodeStrictness.STRICT) {
        throw e;
      }
      LOG.warn("Replacing undecodable value with null: {}", e.getMessage());
      return null;
    }
  }

  /**
   * Number of values decoded by a database round trip so far.
   */
  public long slowPathQueries() {
    return slowPathQueries;
  }

  public DecodeStrictness strictness() {
    return strictness;
  }

  private List<Object> decodeFast(String column, String declaredType, String text, PgTypes.ElementKind kind) {
    List<Object> parsed;
    try {
      parsed = PgArrayLiteral.parse(text);
    } catch (IllegalArgumentException e) {
      throw new TypeDecodeException(column, declaredType, text, e.getMessage(), e);
    }
    return convertElements(parsed, column, declaredType, text, kind);
  }

  private List<Object> convertElements(List<Object> elements,
                                       String column,
                                       String declaredType,
                                       String text,
                                       PgTypes.ElementKind kind) {
    List<Object> converted = new ArrayList<>(elements.size());
    for (Object element : elements) {
      if (element == null) {
        converted.add(null);
      } else if (element instanceof List) {
        @SuppressWarnings("unchecked")
        List<Object> nested = (List<Object>) element;
        converted.add(convertElements(nested, column, declaredType, text, kind));
      } else {
        converted.add(convertElement((String) element, column, declaredType, text, kind));
      }
    }
    return converted;
  }

  private Object convertElement(String element,
                                String column,
                                String declaredType,
                                String text,
                                PgTypes.ElementKind kind) {
    try {
      switch (kind) {
        case INTEGER:
          return Long.parseLong(element);
        case DECIMAL:
          return "NaN".equals(element) ? (Object) Double.NaN : new BigDecimal(element);
        case FLOAT:
          return Double.parseDouble(element);
        case BOOLEAN:
          return parseBoolean(element);
        default:
          return element;
      }
    } catch (IllegalArgumentException e) {
      TypeDecodeException failure = new TypeDecodeException(
        column, declaredType, text, "bad " + kind.name().toLowerCase(Locale.ROOT) + " element '" + element + "'", e);
      if (strictness == DecodeStrictness.STRICT) {
        throw failure;
      }
      LOG.warn("Replacing undecodable array element with null: {}", failure.getMessage());
      return null;
    }
  }

  private static Boolean parseBoolean(String element) {
    switch (element) {
      case "t":
      case "true":
        return Boolean.TRUE;
      case "f":
      case "false":
        return Boolean.FALSE;
      default:
        throw new IllegalArgumentException("not a boolean");
    }
  }

  private List<Object> decodeArrayWithDatabase(TargetIdentity target,
                                               String column,
                                               String declaredType,
                                               String text) throws SQLException {
    String castTarget = castTarget(column, declaredType, text);
    String json = queryJson(target, column, declaredType, text,
      "SELECT array_to_json(CAST(? AS " + castTarget + "))::text");
    try {
      return unwrapList(new JsonArray(json));
    } catch (DecodeException e) {
      throw new TypeDecodeException(column, declaredType, text, "database returned invalid JSON", e);
    }
  }

  private Map<String, Object> decodeHstore(TargetIdentity target,
                                           String column,
                                           String declaredType,
                                           String text) throws SQLException {
    boolean available;
    try {
      available = capabilities.isAvailable(target, HSTORE_CAPABILITY, () -> probeHstore(target));
    } catch (SQLException e) {
      throw e;
    } catch (Exception e) {
      throw new TypeDecodeException(column, declaredType, text, "hstore probe failed", e);
    }
    if (!available) {
      throw new TypeDecodeException(column, declaredType, text, "the hstore extension is not installed on " + target, null);
    }
    String json = queryJson(target, column, declaredType, text, "SELECT hstore_to_json(CAST(? AS hstore))::text");
    try {
      return unwrapMap(new JsonObject(json));
    } catch (DecodeException e) {
      throw new TypeDecodeException(column, declaredType, text, "database returned invalid JSON", e);
    }
  }

  private boolean probeHstore(TargetIdentity target) throws SQLException {
    Connection connection = connections.acquire(target);
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = 'hstore')");
         ResultSet rs = statement.executeQuery()) {
      boolean installed = rs.next() && rs.getBoolean(1);
      LOG.debug("hstore extension on {}: {}", target, installed ? "installed" : "missing");
      return installed;
    }
  }

  private String queryJson(TargetIdentity target,
                           String column,
                           String declaredType,
                           String text,
                           String sql) throws SQLException {
    slowPathQueries++;
    try {
      Connection connection = connections.acquire(target);
      try (PreparedStatement statement = connection.prepareStatement(sql)) {
        statement.setString(1, text);
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next() || rs.getString(1) == null) {
            throw new TypeDecodeException(column, declaredType, text, "database returned no value", null);
          }
          return rs.getString(1);
        }
      }
    } catch (SQLException e) {
      connections.invalidate(target);
      if (classifier.isTransient(e)) {
        throw e;
      }
      throw new TypeDecodeException(column, declaredType, text, e.getMessage(), e);
    }
  }

  private static String castTarget(String column, String declaredType, String text) {
    try {
      return PgTypes.castTarget(declaredType);
    } catch (IllegalArgumentException e) {
      throw new TypeDecodeException(column, declaredType, text, e.getMessage(), e);
    }
  }

  private static List<Object> unwrapList(JsonArray array) {
    List<Object> values = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      values.add(unwrap(array.getValue(i)));
    }
    return values;
  }

  private static Map<String, Object> unwrapMap(JsonObject object) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (String key : object.fieldNames()) {
      values.put(key, unwrap(object.getValue(key)));
    }
    return values;
  }

  private static Object unwrap(Object value) {
    if (value instanceof JsonArray) {
      return unwrapList((JsonArray) value);
    }
    if (value instanceof JsonObject) {
      return unwrapMap((JsonObject) value);
    }
    return value;
  }
}
