package com.example.pgnamespaces.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * Opens transactional JDBC sessions against one namespace's {@link DataSource}.
 *
 * <p>Every session commits when the work returns, rolls back when it throws (including {@link
 * Error}s such as an interrupted worker's failure), and closes the connection on every path.
 */
public final class SyncSessionFactory {

  private static final Logger logger = System.getLogger(SyncSessionFactory.class.getName());

  private final String namespace;
  private final DataSource dataSource;
  private final Logger.Level activityLevel;

  /**
   * Binds a session factory to an engine.
   *
   * @param namespace namespace used in log messages
   * @param dataSource the namespace's synchronous engine
   * @param echo when true, session begin/commit/rollback is logged at INFO instead of DEBUG
   */
  public SyncSessionFactory(
      final String namespace, final DataSource dataSource, final boolean echo) {
    this.namespace = namespace;
    this.dataSource = dataSource;
    this.activityLevel = echo ? INFO : DEBUG;
  }

  /**
   * Runs {@code work} in a new session.
   *
   * @param work unit of work using the session's connection
   * @param <T> result type
   * @return the value returned by {@code work}
   * @throws SQLException if acquiring the connection, the work, or the commit fails
   */
  public <T> T withSession(final SessionWork<T> work) throws SQLException {
    try (final var connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      logger.log(activityLevel, "[{0}] sync session begin", namespace);
      try {
        final var result = work.execute(connection);
        connection.commit();
        logger.log(activityLevel, "[{0}] sync session commit", namespace);
        return result;
      } catch (final Throwable t) {
        rollback(connection, t);
        throw t;
      }
    }
  }

  public DataSource dataSource() {
    return dataSource;
  }

  private void rollback(final Connection connection, final Throwable cause) {
    try {
      connection.rollback();
      logger.log(activityLevel, "[{0}] sync session rollback", namespace);
    } catch (final SQLException e) {
      logger.log(WARNING, "[" + namespace + "] rollback failed", e);
      cause.addSuppressed(e);
    }
  }
}
