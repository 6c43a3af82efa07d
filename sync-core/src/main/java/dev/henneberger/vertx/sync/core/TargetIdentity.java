package dev.henneberger.vertx.sync.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one source database: the cache key for connections and capability probes.
 */
public final class TargetIdentity {

  private final String host;
  private final int port;
  private final String database;

  public TargetIdentity(String host, int port, String database) {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    this.host = host.toLowerCase(Locale.ROOT);
    this.port = port;
    this.database = database;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String database() {
    return database;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TargetIdentity)) {
      return false;
    }
    TargetIdentity other = (TargetIdentity) o;
    return port == other.port && host.equals(other.host) && database.equals(other.database);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, database);
  }

  @Override
  public String toString() {
    return host + ':' + port + '/' + database;
  }
}
