package com.example.pgnamespaces.core.reactive;

import com.example.pgnamespaces.core.config.DatabaseConfig;
import io.r2dbc.spi.Closeable;
import io.r2dbc.spi.ConnectionFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * A namespace's asynchronous engine together with the session factory bound to it. Both are
 * created and disposed as one unit.
 *
 * @param namespace owning namespace
 * @param connectionFactory pooled R2DBC connection factory
 * @param sessions session factory bound to {@code connectionFactory}
 */
public record AsyncEngine(
    String namespace, ConnectionFactory connectionFactory, AsyncSessionFactory sessions) {

  /**
   * Builds the engine and its session factory.
   *
   * @param namespace owning namespace
   * @param config connection parameters
   * @param factory engine factory
   * @return the new engine
   */
  public static AsyncEngine create(
      final String namespace, final DatabaseConfig config, final AsyncEngineFactory factory) {
    final var connectionFactory = factory.create(namespace, config);
    if (connectionFactory == null)
      throw new IllegalStateException("AsyncEngineFactory returned null for " + namespace);
    return new AsyncEngine(
        namespace,
        connectionFactory,
        new AsyncSessionFactory(namespace, connectionFactory, config.echo()));
  }

  /**
   * Disposes the underlying pool.
   *
   * @return a Mono completing once the pool has released its connections
   */
  public Mono<Void> dispose() {
    if (connectionFactory instanceof Closeable closeable)
      return Mono.defer(() -> Mono.from(closeable.close()));
    if (connectionFactory instanceof Disposable disposable)
      return Mono.fromRunnable(disposable::dispose);
    return Mono.empty();
  }
}
