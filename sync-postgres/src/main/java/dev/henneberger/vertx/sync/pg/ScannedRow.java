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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fetched row before type decoding, with the text forms needed for its bookmark.
 */
public final class ScannedRow {

  private final Map<String, Object> values;
  private final List<String> orderingValues;
  private final String replicationKeyValue;

  public ScannedRow(Map<String, Object> values, List<String> orderingValues, String replicationKeyValue) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.orderingValues = orderingValues == null ? List.of() : Collections.unmodifiableList(orderingValues);
    this.replicationKeyValue = replicationKeyValue;
  }

  public Map<String, Object> values() {
    return values;
  }

  /**
   * Text form of each ordering column, in {@link ScanRequest#orderingColumns()} order.
   */
  public List<String> orderingValues() {
    return orderingValues;
  }

  public String replicationKeyValue() {
    return replicationKeyValue;
  }
}
