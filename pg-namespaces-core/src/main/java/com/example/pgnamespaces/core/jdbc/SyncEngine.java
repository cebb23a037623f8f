package com.example.pgnamespaces.core.jdbc;

import com.example.pgnamespaces.core.config.DatabaseConfig;
import javax.sql.DataSource;

/**
 * A namespace's synchronous engine together with the session factory bound to it. Both are created
 * and disposed as one unit.
 *
 * @param namespace owning namespace
 * @param dataSource pooled JDBC data source
 * @param sessions session factory bound to {@code dataSource}
 */
public record SyncEngine(String namespace, DataSource dataSource, SyncSessionFactory sessions) {

  /**
   * Builds the engine and its session factory.
   *
   * @param namespace owning namespace
   * @param config connection parameters
   * @param factory engine factory
   * @return the new engine
   */
  public static SyncEngine create(
      final String namespace, final DatabaseConfig config, final SyncEngineFactory factory) {
    final var dataSource = factory.create(namespace, config);
    if (dataSource == null)
      throw new IllegalStateException("SyncEngineFactory returned null for " + namespace);
    return new SyncEngine(
        namespace, dataSource, new SyncSessionFactory(namespace, dataSource, config.echo()));
  }

  /**
   * Closes the underlying pool when it is {@link AutoCloseable}.
   *
   * @throws Exception if the pool fails to close
   */
  public void dispose() throws Exception {
    if (dataSource instanceof AutoCloseable closeable) closeable.close();
  }
}
