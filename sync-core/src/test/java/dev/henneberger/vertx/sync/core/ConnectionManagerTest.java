package dev.henneberger.vertx.sync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {

  private static final TargetIdentity PRIMARY = new TargetIdentity("db1", 5432, "app");
  private static final TargetIdentity REPLICA = new TargetIdentity("db2", 5432, "app");

  private final List<Connection> opened = new ArrayList<>();

  private Connection open(TargetIdentity target) throws SQLException {
    Connection connection = mock(Connection.class);
    when(connection.isValid(anyInt())).thenReturn(true);
    opened.add(connection);
    return connection;
  }

  @Test
  void reusesConnectionForSameTarget() throws Exception {
    ConnectionManager manager = new ConnectionManager(this::open);

    Connection first = manager.acquire(PRIMARY);
    Connection second = manager.acquire(new TargetIdentity("db1", 5432, "app"));

    assertSame(first, second);
    assertEquals(1, manager.openedConnections());
  }

  @Test
  void switchingTargetClosesPreviousConnection() throws Exception {
    ConnectionManager manager = new ConnectionManager(this::open);

    Connection primary = manager.acquire(PRIMARY);
    Connection replica = manager.acquire(REPLICA);

    verify(primary).close();
    verify(replica, never()).close();
    assertEquals(2, manager.openedConnections());
  }

  @Test
  void replacesClosedConnectionTransparently() throws Exception {
    ConnectionManager manager = new ConnectionManager(this::open);

    Connection first = manager.acquire(PRIMARY);
    when(first.isClosed()).thenReturn(true);
    Connection second = manager.acquire(PRIMARY);

    assertEquals(2, opened.size());
    assertSame(opened.get(1), second);
  }

  @Test
  void invalidateForcesReopen() throws Exception {
    ConnectionManager manager = new ConnectionManager(this::open);

    Connection first = manager.acquire(PRIMARY);
    manager.invalidate(REPLICA);
    assertSame(first, manager.acquire(PRIMARY));

    manager.invalidate(PRIMARY);
    verify(first).close();
    manager.acquire(PRIMARY);
    assertEquals(2, manager.openedConnections());
  }

  @Test
  void disposeClosesOnceAndRejectsFurtherUse() throws Exception {
    ConnectionManager manager = new ConnectionManager(this::open);
    Connection connection = manager.acquire(PRIMARY);

    manager.dispose();
    manager.dispose();

    verify(connection, times(1)).close();
    assertTrue(manager.isDisposed());
    assertThrows(IllegalStateException.class, () -> manager.acquire(PRIMARY));
  }
}
