package com.example.pgnamespaces.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.pgnamespaces.core.config.DatabaseConfig;
import com.example.pgnamespaces.core.jdbc.SessionWork;
import com.example.pgnamespaces.core.jdbc.SyncEngine;
import com.example.pgnamespaces.core.jdbc.SyncEngineFactory;
import com.example.pgnamespaces.core.reactive.AsyncEngine;
import com.example.pgnamespaces.core.reactive.AsyncEngineFactory;
import io.r2dbc.spi.Connection;
import java.lang.System.Logger;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.function.Function;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

/**
 * Connection resources of a single namespace: at most one asynchronous (R2DBC) engine and at most
 * one synchronous (JDBC) engine, each paired with its session factory.
 *
 * <p>A new holder is unconnected. An engine is built the first time a session of its kind is
 * requested, or when {@link #initializeAsync()} / {@link #initializeSync()} is called explicitly.
 * The two paths are independent and may both be used concurrently against the same namespace.
 *
 * <h2>Scoped sessions</h2>
 *
 * <pre>{@code
 * // reactive request handler
 * Mono<Long> count =
 *     connection.withAsyncSession(
 *         conn ->
 *             Mono.from(conn.createStatement("SELECT count(*) FROM orders").execute())
 *                 .flatMap(r -> Mono.from(r.map((row, md) -> row.get(0, Long.class)))));
 *
 * // blocking worker
 * long total =
 *     connection.withSyncSession(
 *         conn -> {
 *           try (var st = conn.createStatement();
 *               var rs = st.executeQuery("SELECT count(*) FROM orders")) {
 *             rs.next();
 *             return rs.getLong(1);
 *           }
 *         });
 * }</pre>
 *
 * <p>Instances are created by {@link NamespaceRegistry#register(String, DatabaseConfig)}. Once the
 * registry drops a holder (close or replace) it is retired: its engines are disposed and it refuses
 * to build new ones, so a caller still holding it cannot leak a pool.
 */
public final class NamespaceConnection {

  private static final Logger logger = System.getLogger(NamespaceConnection.class.getName());

  private final String namespace;
  private final DatabaseConfig config;
  private final AsyncEngineFactory asyncEngineFactory;
  private final SyncEngineFactory syncEngineFactory;

  private final Object asyncLock = new Object();
  private final Object syncLock = new Object();
  private volatile AsyncEngine asyncEngine;
  private volatile SyncEngine syncEngine;
  private volatile boolean retired;

  NamespaceConnection(
      final String namespace,
      final DatabaseConfig config,
      final AsyncEngineFactory asyncEngineFactory,
      final SyncEngineFactory syncEngineFactory) {
    this.namespace = namespace;
    this.config = config;
    this.asyncEngineFactory = asyncEngineFactory;
    this.syncEngineFactory = syncEngineFactory;
  }

  public String namespace() {
    return namespace;
  }

  public DatabaseConfig config() {
    return config;
  }

  /**
   * Builds the asynchronous engine and its session factory unless they already exist.
   *
   * @throws DatabaseConnectionException if the engine cannot be built, a later call retries; or if
   *     the holder has been retired
   */
  public void initializeAsync() {
    asyncEngine();
  }

  /**
   * Builds the synchronous engine and its session factory unless they already exist.
   *
   * @throws DatabaseConnectionException if the engine cannot be built, a later call retries; or if
   *     the holder has been retired
   */
  public void initializeSync() {
    syncEngine();
  }

  /**
   * Runs {@code work} in a transactional R2DBC session, building the asynchronous engine first if
   * needed.
   *
   * <p>The transaction commits when the work completes and rolls back when it errors or the
   * subscriber cancels. The connection goes back to the pool on every path.
   *
   * @param work function producing a result from the session's connection
   * @param <T> result type
   * @return a Mono emitting the work's first element after commit
   */
  public <T> Mono<T> withAsyncSession(
      final Function<? super Connection, ? extends Publisher<T>> work) {
    return Mono.defer(() -> asyncEngine().sessions().withSession(work));
  }

  /**
   * Runs {@code work} in a transactional JDBC session, building the synchronous engine first if
   * needed.
   *
   * @param work unit of work using the session's connection
   * @param <T> result type
   * @return the value returned by {@code work} after commit
   * @throws SQLException if acquiring the connection, the work, or the commit fails
   * @throws DatabaseConnectionException if the engine cannot be built
   */
  public <T> T withSyncSession(final SessionWork<T> work) throws SQLException {
    return syncEngine().sessions().withSession(work);
  }

  /**
   * Disposes the asynchronous engine and returns that path to the unconnected state. Closing an
   * unconnected path completes immediately.
   *
   * @return a Mono completing once the pool is disposed
   */
  public Mono<Void> closeAsync() {
    return Mono.defer(
        () -> {
          final AsyncEngine engine;
          synchronized (asyncLock) {
            engine = asyncEngine;
            asyncEngine = null;
          }
          if (engine == null) {
            logger.log(DEBUG, "[{0}] async engine already closed", namespace);
            return Mono.empty();
          }
          return engine
              .dispose()
              .onErrorMap(
                  e ->
                      new DatabaseConnectionException(
                          namespace, "Failed to dispose async engine: " + redact(e), e))
              .doOnSuccess(__ -> logger.log(INFO, "[{0}] async engine closed", namespace));
        });
  }

  /**
   * Disposes the synchronous engine and returns that path to the unconnected state. Closing an
   * unconnected path is a no-op.
   *
   * @throws DatabaseConnectionException if the pool fails to close; the path is unconnected anyway
   */
  public void closeSync() {
    final SyncEngine engine;
    synchronized (syncLock) {
      engine = syncEngine;
      syncEngine = null;
    }
    if (engine == null) {
      logger.log(DEBUG, "[{0}] sync engine already closed", namespace);
      return;
    }
    try {
      engine.dispose();
      logger.log(INFO, "[{0}] sync engine closed", namespace);
    } catch (final Exception e) {
      throw new DatabaseConnectionException(
          namespace, "Failed to dispose sync engine: " + redact(e), e);
    }
  }

  /**
   * Disposes both engines. Both are attempted even if one fails; failures are reported once both
   * attempts finished.
   *
   * @return a Mono completing once both paths are unconnected
   */
  public Mono<Void> close() {
    return Mono.whenDelayError(closeAsync(), Mono.fromRunnable(this::closeSync));
  }

  /**
   * Whether the registry has dropped this holder. A retired holder never builds another engine.
   *
   * @return true once retired
   */
  public boolean isRetired() {
    return retired;
  }

  /**
   * Marks this holder as dropped by its registry. Called under the registry's mutation lock before
   * the engines are disposed; engine builds already in progress finish before {@link #close()}
   * detaches them.
   */
  void retire() {
    synchronized (asyncLock) {
      synchronized (syncLock) {
        retired = true;
      }
    }
  }

  public boolean isAsyncInitialized() {
    return asyncEngine != null;
  }

  public boolean isSyncInitialized() {
    return syncEngine != null;
  }

  public boolean isConnected() {
    return isAsyncInitialized() || isSyncInitialized();
  }

  /**
   * Takes a read-only snapshot of this namespace. Never builds an engine.
   *
   * @return current connection info with a masked config
   */
  public ConnectionInfo info() {
    return new ConnectionInfo(
        namespace, config.maskPassword(), isAsyncInitialized(), isSyncInitialized());
  }

  private AsyncEngine asyncEngine() {
    var engine = asyncEngine;
    if (engine != null) return engine;
    synchronized (asyncLock) {
      engine = asyncEngine;
      if (engine == null) {
        if (retired) throw new DatabaseConnectionException(namespace, "namespace closed");
        try {
          engine = AsyncEngine.create(namespace, config, asyncEngineFactory);
        } catch (final RuntimeException e) {
          throw new DatabaseConnectionException(
              namespace, "Failed to initialize async engine: " + redact(e), e);
        }
        asyncEngine = engine;
        logger.log(INFO, "[{0}] async engine initialized", namespace);
      }
      return engine;
    }
  }

  private SyncEngine syncEngine() {
    var engine = syncEngine;
    if (engine != null) return engine;
    synchronized (syncLock) {
      engine = syncEngine;
      if (engine == null) {
        if (retired) throw new DatabaseConnectionException(namespace, "namespace closed");
        try {
          engine = SyncEngine.create(namespace, config, syncEngineFactory);
        } catch (final RuntimeException e) {
          throw new DatabaseConnectionException(
              namespace, "Failed to initialize sync engine: " + redact(e), e);
        }
        syncEngine = engine;
        logger.log(INFO, "[{0}] sync engine initialized", namespace);
      }
      return engine;
    }
  }

  /** Driver messages may echo the connection URL; keep the password out of them. */
  private String redact(final Throwable error) {
    var message = String.valueOf(error.getMessage());
    final var password = config.password();
    if (password.isEmpty()) return message;
    final var masked = config.maskPassword().password();
    final var encoded = URLEncoder.encode(password, StandardCharsets.UTF_8).replace("+", "%20");
    message =
        message
            .replace("password=" + encoded, "password=" + masked)
            .replace(":" + encoded + "@", ":" + masked + "@");
    // short secrets are too likely to match ordinary words
    return password.length() > 4 ? message.replace(password, masked) : message;
  }

  @Override
  public String toString() {
    return "NamespaceConnection[namespace=%s, async=%s, sync=%s, retired=%s]"
        .formatted(namespace, isAsyncInitialized(), isSyncInitialized(), retired);
  }
}
