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
 * A composite column value could not be decoded.
 */
public class TypeDecodeException extends SyncException {

  private static final int MAX_RAW_LENGTH = 200;

  private final String column;
  private final String declaredType;
  private final String rawValue;

  public TypeDecodeException(String column, String declaredType, String rawValue, String message, Throwable cause) {
    super("Cannot decode column " + column + " of type " + declaredType + ": " + message
      + " (value " + abbreviate(rawValue) + ")", cause);
    this.column = column;
    this.declaredType = declaredType;
    this.rawValue = rawValue;
  }

  public String column() {
    return column;
  }

  public String declaredType() {
    return declaredType;
  }

  public String rawValue() {
    return rawValue;
  }

  private static String abbreviate(String raw) {
    if (raw == null || raw.length() <= MAX_RAW_LENGTH) {
      return raw;
    }
    return raw.substring(0, MAX_RAW_LENGTH) + "...";
  }
}
