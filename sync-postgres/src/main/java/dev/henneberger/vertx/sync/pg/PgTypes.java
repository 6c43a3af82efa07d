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

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Helpers for declared PostgreSQL type names and identifiers.
 */
final class PgTypes {

  enum ElementKind {
    INTEGER,
    DECIMAL,
    FLOAT,
    BOOLEAN,
    TEXT
  }

  private static final Set<String> INTEGER_TYPES = Set.of(
    "smallint", "int2", "integer", "int", "int4", "bigint", "int8");
  private static final Set<String> DECIMAL_TYPES = Set.of("numeric", "decimal");
  private static final Set<String> FLOAT_TYPES = Set.of(
    "real", "float4", "double precision", "float8");
  private static final Set<String> BOOLEAN_TYPES = Set.of("boolean", "bool");
  private static final Set<String> TEXT_TYPES = Set.of(
    "text", "varchar", "character varying", "char", "character", "bpchar", "name", "citext",
    "date", "time", "time without time zone", "timetz", "time with time zone",
    "timestamp", "timestamp without time zone", "timestamptz", "timestamp with time zone",
    "interval", "uuid");

  private static final Pattern TYPMOD = Pattern.compile("\\([^)]*\\)");
  private static final Pattern CASTABLE = Pattern.compile("[A-Za-z0-9_ .\"\\[\\](),]+");

  private PgTypes() {
  }

  /**
   * Lower-cased type with typmods removed, e.g. {@code character varying(20)[]} becomes
   * {@code character varying[]}.
   */
  static String normalize(String declaredType) {
    if (declaredType == null) {
      return "";
    }
    String type = TYPMOD.matcher(declaredType.trim().toLowerCase(Locale.ROOT)).replaceAll("");
    type = type.replaceAll("\\s+", " ").replace(" [", "[").trim();
    if (type.startsWith("pg_catalog.")) {
      type = type.substring("pg_catalog.".length());
    }
    if (type.startsWith("public.")) {
      type = type.substring("public.".length());
    }
    return type;
  }

  static boolean isArray(String declaredType) {
    String type = normalize(declaredType);
    return type.endsWith("[]") || type.startsWith("_");
  }

  /**
   * Element type of an array type, accepting both {@code integer[]} and the internal {@code _int4}.
   */
  static String elementType(String declaredType) {
    String type = normalize(declaredType);
    if (type.startsWith("_")) {
      return type.substring(1);
    }
    while (type.endsWith("[]")) {
      type = type.substring(0, type.length() - 2);
    }
    return type;
  }

  static boolean isHstore(String declaredType) {
    return "hstore".equals(normalize(declaredType));
  }

  static boolean isComposite(String declaredType) {
    return isArray(declaredType) || isHstore(declaredType);
  }

  /**
   * Fast-path classification of an array element type, or {@code null} when the element needs the
   * database to decode it.
   */
  static ElementKind fastElementKind(String elementType) {
    String type = normalize(elementType);
    if (INTEGER_TYPES.contains(type)) {
      return ElementKind.INTEGER;
    }
    if (DECIMAL_TYPES.contains(type)) {
      return ElementKind.DECIMAL;
    }
    if (FLOAT_TYPES.contains(type)) {
      return ElementKind.FLOAT;
    }
    if (BOOLEAN_TYPES.contains(type)) {
      return ElementKind.BOOLEAN;
    }
    if (TEXT_TYPES.contains(type)) {
      return ElementKind.TEXT;
    }
    return null;
  }

  /**
   * The declared type in a form safe to splice into a {@code CAST(? AS ...)}. Internal array names
   * such as {@code _int4} become {@code int4[]}.
   */
  static String castTarget(String declaredType) {
    if (declaredType == null || !CASTABLE.matcher(declaredType).matches()) {
      throw new IllegalArgumentException("Unsupported type name: " + declaredType);
    }
    String type = declaredType.trim();
    if (type.startsWith("_")) {
      return type.substring(1) + "[]";
    }
    return type;
  }

  static String quoteIdentifier(String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  static String qualifiedTable(String schema, String table) {
    return quoteIdentifier(schema) + '.' + quoteIdentifier(table);
  }
}
