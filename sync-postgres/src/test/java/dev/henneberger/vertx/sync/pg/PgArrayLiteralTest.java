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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class PgArrayLiteralTest {

  @Test
  void parsesFlatArrayWithNulls() {
    assertEquals(Arrays.asList("1", null, "3"), PgArrayLiteral.parse("{1,NULL,3}"));
    assertEquals(List.of(), PgArrayLiteral.parse("{}"));
  }

  @Test
  void quotedElementsKeepSpacesEscapesAndLiteralNull() {
    assertEquals(List.of("a b", "say \"hi\"", "NULL", "back\\slash"),
      PgArrayLiteral.parse("{\"a b\",\"say \\\"hi\\\"\",\"NULL\",\"back\\\\slash\"}"));
  }

  @Test
  void parsesMultidimensionalArrays() {
    assertEquals(List.of(List.of("1", "2"), Arrays.asList("3", null)),
      PgArrayLiteral.parse("{{1,2},{3,NULL}}"));
  }

  @Test
  void skipsExplicitBounds() {
    assertEquals(List.of("a", "b"), PgArrayLiteral.parse("[0:1]={a,b}"));
  }

  @Test
  void rejectsMalformedText() {
    assertThrows(IllegalArgumentException.class, () -> PgArrayLiteral.parse("{1,2"));
    assertThrows(IllegalArgumentException.class, () -> PgArrayLiteral.parse("1,2"));
    assertThrows(IllegalArgumentException.class, () -> PgArrayLiteral.parse("{1}x"));
  }
}
