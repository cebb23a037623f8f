package com.example.pgnamespaces.core.reactive;

import com.example.pgnamespaces.core.config.DatabaseConfig;
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionFactoryProvider;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;
import java.time.Duration;

/**
 * Factory that creates the asynchronous engine (a pooled R2DBC {@link ConnectionFactory}) for a
 * namespace.
 *
 * <p>Implementations must not open a connection while building the engine.
 */
@FunctionalInterface
public interface AsyncEngineFactory {

  /**
   * Creates a new pooled {@link ConnectionFactory} for the namespace.
   *
   * @param namespace namespace the engine belongs to
   * @param config connection parameters
   * @return a new {@link ConnectionFactory}
   */
  ConnectionFactory create(final String namespace, final DatabaseConfig config);

  /**
   * Returns the default factory: r2dbc-pool over the r2dbc-postgresql driver, discovered from
   * {@link DatabaseConfig#asyncUrl()}.
   *
   * <p>The pool starts empty and grows to {@code poolSize + maxOverflow}. {@code
   * poolRecycleSeconds} becomes the maximum connection lifetime and {@code poolPrePing} adds a
   * {@code SELECT 1} validation query on acquire.
   *
   * @return r2dbc-pool backed factory
   */
  static AsyncEngineFactory r2dbcPool() {
    return (namespace, config) -> {
      final var options =
          ConnectionFactoryOptions.parse(config.asyncUrl())
              .mutate()
              .option(PostgresqlConnectionFactoryProvider.SCHEMA, config.schema())
              .build();
      final var connectionFactory = ConnectionFactories.get(options);

      final var poolConfig =
          ConnectionPoolConfiguration.builder(connectionFactory)
              .name("pg-namespaces-async-" + namespace)
              .initialSize(0)
              .minIdle(0)
              .maxSize(config.maxPoolSize())
              .maxIdleTime(Duration.ofMinutes(30))
              .maxAcquireTime(Duration.ofSeconds(30));
      if (config.poolRecycleSeconds() > 0)
        poolConfig.maxLifeTime(Duration.ofSeconds(config.poolRecycleSeconds()));
      if (config.poolPrePing()) poolConfig.validationQuery("SELECT 1");

      return new ConnectionPool(poolConfig.build());
    };
  }
}
