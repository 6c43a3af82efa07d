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

import java.sql.SQLException;
import java.util.List;

/**
 * A server-side cursor read in fixed-size batches.
 */
public interface BatchCursor extends AutoCloseable {

  /**
   * @return up to {@code maxRows} rows; empty once the cursor is exhausted
   */
  List<ScannedRow> fetch(int maxRows) throws SQLException;

  @Override
  void close() throws SQLException;
}
