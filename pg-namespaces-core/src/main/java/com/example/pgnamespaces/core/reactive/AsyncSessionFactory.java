package com.example.pgnamespaces.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import java.lang.System.Logger;
import java.util.function.Function;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

/**
 * Opens transactional R2DBC sessions against one namespace's {@link ConnectionFactory}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Mono<Integer> one =
 *     sessions.withSession(
 *         conn ->
 *             Mono.from(conn.createStatement("SELECT 1").execute())
 *                 .flatMap(r -> Mono.from(r.map((row, md) -> row.get(0, Integer.class)))));
 * }</pre>
 *
 * <p>The transaction commits when the work completes, rolls back when it errors or when the
 * subscriber cancels, and the connection is released on every path.
 */
public final class AsyncSessionFactory {

  private static final Logger logger = System.getLogger(AsyncSessionFactory.class.getName());

  private final String namespace;
  private final ConnectionFactory connectionFactory;
  private final Logger.Level activityLevel;

  /**
   * Binds a session factory to an engine.
   *
   * @param namespace namespace used in log messages
   * @param connectionFactory the namespace's asynchronous engine
   * @param echo when true, session begin/commit/rollback is logged at INFO instead of DEBUG
   */
  public AsyncSessionFactory(
      final String namespace, final ConnectionFactory connectionFactory, final boolean echo) {
    this.namespace = namespace;
    this.connectionFactory = connectionFactory;
    this.activityLevel = echo ? INFO : DEBUG;
  }

  /**
   * Runs {@code work} in a new session. Nothing happens until the returned {@link Mono} is
   * subscribed.
   *
   * <p>Only the first element emitted by {@code work} is kept; collect multi-row results inside
   * the work.
   *
   * @param work function producing the session's result from its connection
   * @param <T> result type
   * @return a Mono emitting the work's result after the transaction committed
   */
  public <T> Mono<T> withSession(final Function<? super Connection, ? extends Publisher<T>> work) {
    return Mono.usingWhen(
        begin(),
        connection -> Mono.from(work.apply(connection)),
        this::commitAndClose,
        (connection, error) -> rollbackAndClose(connection, "error"),
        connection -> rollbackAndClose(connection, "cancel"));
  }

  public ConnectionFactory connectionFactory() {
    return connectionFactory;
  }

  private Mono<Connection> begin() {
    return Mono.<Connection>from(connectionFactory.create())
        .flatMap(
            connection ->
                Mono.defer(() -> Mono.from(connection.beginTransaction()))
                    .then(Mono.just(connection))
                    .onErrorResume(e -> close(connection).then(Mono.<Connection>error(e))))
        .doOnNext(__ -> logger.log(activityLevel, "[{0}] async session begin", namespace));
  }

  private Mono<Void> commitAndClose(final Connection connection) {
    return Mono.defer(() -> Mono.from(connection.commitTransaction()))
        .doOnSuccess(__ -> logger.log(activityLevel, "[{0}] async session commit", namespace))
        .onErrorResume(e -> close(connection).then(Mono.<Void>error(e)))
        .then(close(connection));
  }

  private Mono<Void> rollbackAndClose(final Connection connection, final String trigger) {
    return Mono.defer(() -> Mono.from(connection.rollbackTransaction()))
        .doOnSuccess(
            __ ->
                logger.log(
                    activityLevel, "[{0}] async session rollback on {1}", namespace, trigger))
        .onErrorResume(
            e -> {
              logger.log(WARNING, "[" + namespace + "] rollback failed", e);
              return Mono.empty();
            })
        .then(close(connection));
  }

  private Mono<Void> close(final Connection connection) {
    return Mono.defer(() -> Mono.from(connection.close()));
  }
}
