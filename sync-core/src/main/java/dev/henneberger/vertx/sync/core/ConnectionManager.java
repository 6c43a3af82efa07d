package dev.henneberger.vertx.sync.core;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the auxiliary connection used for database-assisted decoding.
 *
 * <p>At most one physical connection is cached at a time. Acquiring a connection for a different
 * target closes the cached one first, and a cached connection found closed or broken is replaced
 * on the next {@link #acquire(TargetIdentity)}. Callers borrow connections and never close them;
 * {@link #dispose()} must be called once when the run ends, on success and on failure.
 *
 * <p>Instances are confined to the single thread driving a sync run.
 */
public final class ConnectionManager implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);
  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  private final ConnectionFactory factory;

  private TargetIdentity cachedTarget;
  private Connection cached;
  private long openedConnections;
  private boolean disposed;

  public ConnectionManager(ConnectionFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public Connection acquire(TargetIdentity target) throws SQLException {
    Objects.requireNonNull(target, "target");
    if (disposed) {
      throw new IllegalStateException("connection manager has been disposed");
    }

    if (cached != null) {
      if (cachedTarget.equals(target) && isUsable(cached)) {
        return cached;
      }
      if (!cachedTarget.equals(target)) {
        LOG.debug("Switching auxiliary connection from {} to {}", cachedTarget, target);
      } else {
        LOG.info("Auxiliary connection to {} is no longer usable, reopening", target);
      }
      closeCached();
    }

    Connection opened = factory.open(target);
    openedConnections++;
    cached = opened;
    cachedTarget = target;
    return opened;
  }

  /**
   * Drops the cached connection for {@code target}, if any. The next acquire opens a replacement.
   */
  public void invalidate(TargetIdentity target) {
    Objects.requireNonNull(target, "target");
    if (cached != null && cachedTarget.equals(target)) {
      closeCached();
    }
  }

  public void dispose() {
    if (disposed) {
      return;
    }
    disposed = true;
    closeCached();
  }

  @Override
  public void close() {
    dispose();
  }

  public long openedConnections() {
    return openedConnections;
  }

  public boolean isDisposed() {
    return disposed;
  }

  private void closeCached() {
    Connection connection = cached;
    TargetIdentity target = cachedTarget;
    cached = null;
    cachedTarget = null;
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.warn("Failed to close auxiliary connection to {}", target, e);
    }
  }

  private static boolean isUsable(Connection connection) {
    try {
      return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
    } catch (SQLException e) {
      return false;
    }
  }
}
