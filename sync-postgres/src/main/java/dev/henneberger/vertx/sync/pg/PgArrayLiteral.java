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

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the PostgreSQL text form of arrays, e.g. {@code {1,2,NULL}} or
 * {@code {{"a b","c"},{d,NULL}}}.
 *
 * <p>Elements come back as {@link String}, {@code null}, or a nested {@link List} per dimension.
 * An unquoted {@code NULL} is SQL null; a quoted {@code "NULL"} is the string.
 */
final class PgArrayLiteral {

  private final String text;
  private int pos;

  private PgArrayLiteral(String text) {
    this.text = text;
  }

  static List<Object> parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("array literal is null");
    }
    PgArrayLiteral parser = new PgArrayLiteral(text.trim());
    parser.skipDimensions();
    List<Object> result = parser.parseArray();
    parser.skipWhitespace();
    if (parser.pos != parser.text.length()) {
      throw parser.error("unexpected trailing characters");
    }
    return result;
  }

  // Optional explicit bounds such as [0:2]={a,b,c}
  private void skipDimensions() {
    if (text.startsWith("[")) {
      int eq = text.indexOf('=');
      if (eq < 0) {
        throw error("dimension decoration without '='");
      }
      pos = eq + 1;
    }
  }

  private List<Object> parseArray() {
    skipWhitespace();
    expect('{');
    List<Object> elements = new ArrayList<>();
    skipWhitespace();
    if (peek() == '}') {
      pos++;
      return elements;
    }
    while (true) {
      skipWhitespace();
      char c = peek();
      if (c == '{') {
        elements.add(parseArray());
      } else if (c == '"') {
        elements.add(parseQuoted());
      } else {
        elements.add(parseUnquoted());
      }
      skipWhitespace();
      char next = peek();
      pos++;
      if (next == '}') {
        return elements;
      }
      if (next != ',') {
        throw error("expected ',' or '}'");
      }
    }
  }

  private String parseQuoted() {
    expect('"');
    StringBuilder value = new StringBuilder();
    while (true) {
      char c = peek();
      pos++;
      if (c == '\\') {
        value.append(peek());
        pos++;
      } else if (c == '"') {
        return value.toString();
      } else {
        value.append(c);
      }
    }
  }

  private String parseUnquoted() {
    int start = pos;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == ',' || c == '}') {
        break;
      }
      if (c == '{' || c == '"') {
        throw error("unexpected '" + c + "' in unquoted element");
      }
      pos++;
    }
    String value = text.substring(start, pos).trim();
    if (value.isEmpty()) {
      throw error("empty unquoted element");
    }
    return "NULL".equalsIgnoreCase(value) ? null : value;
  }

  private void expect(char expected) {
    if (peek() != expected) {
      throw error("expected '" + expected + "'");
    }
    pos++;
  }

  private char peek() {
    if (pos >= text.length()) {
      throw error("unexpected end of input");
    }
    return text.charAt(pos);
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }

  private IllegalArgumentException error(String message) {
    return new IllegalArgumentException("Malformed array literal at offset " + pos + ": " + message);
  }
}
