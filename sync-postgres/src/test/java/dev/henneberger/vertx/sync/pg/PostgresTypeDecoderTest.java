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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.henneberger.vertx.sync.core.CapabilityCache;
import dev.henneberger.vertx.sync.core.ConnectionManager;
import dev.henneberger.vertx.sync.core.ErrorClassifier;
import dev.henneberger.vertx.sync.core.TargetIdentity;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PostgresTypeDecoderTest {

  private static final TargetIdentity TARGET = new TargetIdentity("localhost", 5432, "app");

  private Connection connection;
  private PreparedStatement arrayStatement;
  private ResultSet arrayResult;
  private ConnectionManager connections;
  private CapabilityCache capabilities;

  @BeforeEach
  void setUp() throws Exception {
    connection = mock(Connection.class);
    when(connection.isValid(anyInt())).thenReturn(true);
    arrayStatement = mock(PreparedStatement.class);
    arrayResult = mock(ResultSet.class);
    when(connection.prepareStatement(startsWith("SELECT array_to_json"))).thenReturn(arrayStatement);
    when(arrayStatement.executeQuery()).thenReturn(arrayResult);
    connections = new ConnectionManager(target -> connection);
    capabilities = new CapabilityCache();
  }

  private PostgresTypeDecoder decoder(DecodeStrictness strictness) {
    return new PostgresTypeDecoder(connections, capabilities, strictness, ErrorClassifier.defaults());
  }

  @Test
  void fastPathArraysNeedNoRoundTrip() throws Exception {
    PostgresTypeDecoder decoder = decoder(DecodeStrictness.STRICT);

    assertEquals(List.of(1L, 2L, 3L), decoder.decode(TARGET, "ids", "integer[]", "{1,2,3}"));
    assertEquals(List.of(), decoder.decode(TARGET, "ids", "integer[]", "{}"));
    assertEquals(Arrays.asList(new BigDecimal("1.50"), null), decoder.decode(TARGET, "prices", "_numeric", "{1.50,NULL}"));
    assertEquals(List.of(2.5d), decoder.decode(TARGET, "ratios", "double precision[]", "{2.5}"));
    assertEquals(List.of(true, false), decoder.decode(TARGET, "flags", "boolean[]", "{t,f}"));
    assertEquals(List.of("a b", "c"), decoder.decode(TARGET, "names", "character varying(20)[]", "{\"a b\",c}"));
    assertEquals(List.of(List.of("2024-01-01", "2024-01-02")),
      decoder.decode(TARGET, "days", "date[][]", "{{2024-01-01,2024-01-02}}"));
    assertEquals(List.of("6f1c1c1e-3d2b-4a35-9a55-1d1a5c0c9f10"),
      decoder.decode(TARGET, "refs", "uuid[]", "{6f1c1c1e-3d2b-4a35-9a55-1d1a5c0c9f10}"));

    assertEquals(0L, decoder.slowPathQueries());
    assertEquals(0L, connections.openedConnections());
  }

  @Test
  void scalarsAndNullsPassThrough() throws Exception {
    PostgresTypeDecoder decoder = decoder(DecodeStrictness.STRICT);

    assertEquals("plain", decoder.decode(TARGET, "name", "text", "plain"));
    assertEquals(5, decoder.decode(TARGET, "id", "integer", 5));
    assertNull(decoder.decode(TARGET, "tags", "json[]", null));
    assertNull(decoder.decode(TARGET, "attrs", "hstore", null));
    assertEquals(0L, decoder.slowPathQueries());
  }

  @Test
  void otherElementTypesTakeOneQueryPerValue() throws Exception {
    when(arrayResult.next()).thenReturn(true);
    when(arrayResult.getString(1)).thenReturn("[{\"a\":1},{\"b\":[2]}]");
    PostgresTypeDecoder decoder = decoder(DecodeStrictness.STRICT);

    Object decoded = decoder.decode(TARGET, "docs", "jsonb[]", "{\"{\\\"a\\\":1}\",\"{\\\"b\\\":[2]}\"}");

    assertEquals(List.of(Map.of("a", 1), Map.of("b", List.of(2))), decoded);
    assertEquals(1L, decoder.slowPathQueries());
    verify(connection).prepareStatement("SELECT array_to_json(CAST(? AS jsonb[]))::text");
  }

  @Test
  void hstoreIsProbedOnceAndDecodedByTheDatabase() throws Exception {
    PreparedStatement probe = mock(PreparedStatement.class);
    ResultSet probeResult = mock(ResultSet.class);
    when(connection.prepareStatement(startsWith("SELECT EXISTS"))).thenReturn(probe);
    when(probe.executeQuery()).thenReturn(probeResult);
    when(probeResult.next()).thenReturn(true);
    when(probeResult.getBoolean(1)).thenReturn(true);

    PreparedStatement hstore = mock(PreparedStatement.class);
    ResultSet hstoreResult = mock(ResultSet.class);
    when(connection.prepareStatement(startsWith("SELECT hstore_to_json"))).thenReturn(hstore);
    when(hstore.executeQuery()).thenReturn(hstoreResult);
    when(hstoreResult.next()).thenReturn(true);
    when(hstoreResult.getString(1)).thenReturn("{\"size\":\"L\",\"color\":null}");

    PostgresTypeDecoder decoder = decoder(DecodeStrictness.STRICT);
    Object first = decoder.decode(TARGET, "attrs", "hstore", "\"size\"=>\"L\", \"color\"=>NULL");
    decoder.decode(TARGET, "attrs", "public.hstore", "\"size\"=>\"M\"");

    Map<String, Object> expected = new java.util.LinkedHashMap<>();
    expected.put("size", "L");
    expected.put("color", null);
    assertEquals(expected, first);
    assertEquals(1L, capabilities.probesExecuted());
    assertEquals(2L, decoder.slowPathQueries());
  }

  @Test
  void missingHstoreExtensionFailsTheValue() throws Exception {
    PreparedStatement probe = mock(PreparedStatement.class);
    ResultSet probeResult = mock(ResultSet.class);
    when(connection.prepareStatement(startsWith("SELECT EXISTS"))).thenReturn(probe);
    when(probe.executeQuery()).thenReturn(probeResult);
    when(probeResult.next()).thenReturn(true);
    when(probeResult.getBoolean(1)).thenReturn(false);

    TypeDecodeException error = assertThrows(TypeDecodeException.class,
      () -> decoder(DecodeStrictness.STRICT).decode(TARGET, "attrs", "hstore", "\"a\"=>\"1\""));
    assertEquals("attrs", error.column());
    verify(connection, never()).prepareStatement(startsWith("SELECT hstore_to_json"));
  }

  @Test
  void strictModeFailsOnBadElement() {
    TypeDecodeException error = assertThrows(TypeDecodeException.class,
      () -> decoder(DecodeStrictness.STRICT).decode(TARGET, "ids", "integer[]", "{1,x}"));

    assertEquals("integer[]", error.declaredType());
    assertEquals("{1,x}", error.rawValue());
  }

  @Test
  void permissiveModeNullsWhatCannotBeDecoded() throws Exception {
    PostgresTypeDecoder decoder = decoder(DecodeStrictness.PERMISSIVE);

    assertEquals(Arrays.asList(1L, null), decoder.decode(TARGET, "ids", "integer[]", "{1,x}"));
    assertNull(decoder.decode(TARGET, "ids", "integer[]", "{1,2"));
  }

  @Test
  void castFailureInvalidatesConnection() throws Exception {
    when(arrayStatement.executeQuery()).thenThrow(new SQLException("malformed array literal", "22P02"));
    PostgresTypeDecoder decoder = decoder(DecodeStrictness.STRICT);

    assertThrows(TypeDecodeException.class, () -> decoder.decode(TARGET, "spans", "int4range[]", "{bad}"));
    verify(connection, times(1)).close();
    assertEquals(1L, connections.openedConnections());
  }

  @Test
  void transientFailureIsRethrownForRetry() throws Exception {
    SQLException reset = new SQLException("connection reset", "08006");
    when(arrayStatement.executeQuery()).thenThrow(reset);

    SQLException error = assertThrows(SQLException.class,
      () -> decoder(DecodeStrictness.PERMISSIVE).decode(TARGET, "spans", "int4range[]", "{\"[1,2)\"}"));
    assertSame(reset, error);
  }

  @Test
  void rejectsUnsafeTypeNames() throws Exception {
    assertThrows(TypeDecodeException.class,
      () -> decoder(DecodeStrictness.STRICT).decode(TARGET, "x", "foo;drop table t[]", "{1}"));
    verify(connection, never()).prepareStatement(anyString());
  }
}
