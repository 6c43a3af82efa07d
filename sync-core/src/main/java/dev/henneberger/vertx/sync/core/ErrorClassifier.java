package dev.henneberger.vertx.sync.core;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides which failures are transient (worth reopening a connection) and which are fatal.
 *
 * <p>SQL errors are matched by SQLState prefix anywhere in the cause chain. A protocol violation
 * ({@code 08P01}) means message boundaries can no longer be trusted and is never transient.
 * Additional rules can be added with {@link #or(Predicate)}.
 */
public final class ErrorClassifier {

  /**
   * Connection exceptions, admin/crash shutdown, cannot-connect-now and too-many-connections.
   */
  public static final List<String> DEFAULT_TRANSIENT_SQL_STATES = List.of("08", "57P01", "57P02", "57P03", "53300");

  public static final String PROTOCOL_VIOLATION = "08P01";

  private final List<String> transientSqlStates;
  private final Predicate<Throwable> extra;

  private ErrorClassifier(List<String> transientSqlStates, Predicate<Throwable> extra) {
    this.transientSqlStates = List.copyOf(transientSqlStates);
    this.extra = extra;
  }

  public static ErrorClassifier defaults() {
    return sqlStates(DEFAULT_TRANSIENT_SQL_STATES);
  }

  public static ErrorClassifier sqlStates(List<String> transientSqlStates) {
    return new ErrorClassifier(Objects.requireNonNull(transientSqlStates, "transientSqlStates"), err -> false);
  }

  public ErrorClassifier or(Predicate<Throwable> transientWhen) {
    Objects.requireNonNull(transientWhen, "transientWhen");
    return new ErrorClassifier(transientSqlStates, extra.or(transientWhen));
  }

  public boolean isTransient(Throwable error) {
    if (error == null || isProtocolViolation(error)) {
      return false;
    }
    if (extra.test(error)) {
      return true;
    }
    for (Throwable current = error; current != null; current = current.getCause()) {
      if (current instanceof SQLException && matchesState(((SQLException) current).getSQLState())) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }

  public static boolean isProtocolViolation(Throwable error) {
    for (Throwable current = error; current != null; current = current.getCause()) {
      if (current instanceof SQLException && PROTOCOL_VIOLATION.equals(((SQLException) current).getSQLState())) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }

  public List<String> transientSqlStates() {
    return transientSqlStates;
  }

  private boolean matchesState(String sqlState) {
    if (sqlState == null) {
      return false;
    }
    for (String prefix : transientSqlStates) {
      if (sqlState.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
