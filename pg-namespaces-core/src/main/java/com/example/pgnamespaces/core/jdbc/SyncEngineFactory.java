package com.example.pgnamespaces.core.jdbc;

import com.example.pgnamespaces.core.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import javax.sql.DataSource;

/**
 * Factory that creates the synchronous engine (a pooled {@link DataSource}) for a namespace.
 *
 * <p>Implementations must not open a connection while building the engine; the first connection is
 * opened when a session is acquired.
 */
@FunctionalInterface
public interface SyncEngineFactory {

  /**
   * Creates a new pooled {@link DataSource} for the namespace.
   *
   * @param namespace namespace the engine belongs to
   * @param config connection parameters
   * @return a new {@link DataSource}; closed through {@link AutoCloseable} when the namespace is
   *     disposed
   */
  DataSource create(final String namespace, final DatabaseConfig config);

  /**
   * Returns the default factory backed by HikariCP.
   *
   * <p>The pool starts empty (minimum idle 0) and grows on demand to {@code poolSize +
   * maxOverflow}; idle connections are kept for ten minutes. {@code poolRecycleSeconds} becomes the
   * maximum connection lifetime and {@code poolPrePing} adds a {@code SELECT 1} test query.
   *
   * @return HikariCP backed factory
   */
  static SyncEngineFactory hikari() {
    return (namespace, config) -> {
      final var hikari = new HikariConfig();
      hikari.setPoolName("pg-namespaces-sync-" + namespace);
      hikari.setJdbcUrl(config.syncUrl());
      hikari.setSchema(config.schema());
      hikari.setMaximumPoolSize(config.maxPoolSize());
      hikari.setMinimumIdle(0);
      hikari.setIdleTimeout(Duration.ofMinutes(10).toMillis());
      hikari.setAutoCommit(false);
      hikari.setInitializationFailTimeout(-1);
      hikari.setConnectionTimeout(Duration.ofSeconds(30).toMillis());
      if (config.poolRecycleSeconds() > 0)
        hikari.setMaxLifetime(Duration.ofSeconds(config.poolRecycleSeconds()).toMillis());
      else hikari.setMaxLifetime(0L);
      if (config.poolPrePing()) hikari.setConnectionTestQuery("SELECT 1");
      return new HikariDataSource(hikari);
    };
  }
}
