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

/**
 * What a composite value that cannot be decoded does to its row.
 */
public enum DecodeStrictness {
  /** The row fails with a {@link TypeDecodeException}. */
  STRICT,
  /** The offending value becomes {@code null} and a warning is logged. */
  PERMISSIVE
}
