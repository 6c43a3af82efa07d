package dev.henneberger.vertx.sync.core;

import java.sql.Connection;
import java.sql.SQLException;

@FunctionalInterface
public interface ConnectionFactory {
  Connection open(TargetIdentity target) throws SQLException;
}
