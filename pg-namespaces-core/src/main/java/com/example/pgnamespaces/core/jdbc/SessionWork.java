package com.example.pgnamespaces.core.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work executed inside a synchronous session.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SessionWork<T> {
  /**
   * Executes the work with the session's connection. The transaction is committed after this
   * returns and rolled back if it throws.
   *
   * @param connection an open JDBC connection with auto-commit disabled
   * @return work result
   * @throws SQLException on database errors
   */
  T execute(final Connection connection) throws SQLException;
}
