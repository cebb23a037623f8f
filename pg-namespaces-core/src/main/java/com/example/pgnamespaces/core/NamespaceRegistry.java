package com.example.pgnamespaces.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.pgnamespaces.core.config.DatabaseConfig;
import com.example.pgnamespaces.core.config.NamespaceConfigLoader;
import com.example.pgnamespaces.core.jdbc.SessionWork;
import com.example.pgnamespaces.core.jdbc.SyncEngineFactory;
import com.example.pgnamespaces.core.reactive.AsyncEngineFactory;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.Result;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Registry of named PostgreSQL connections.
 *
 * <p>One registry is built at process start and handed to every component that needs a database.
 * Registering a namespace never connects; engines are built on first use or by {@link
 * NamespaceLifecycle} when eager initialization is requested.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var registry = NamespaceRegistry.builder().defaultNamespace("app_db").build();
 * registry.register("app_db", appConfig);
 * registry.register("reports", reportsConfig);
 *
 * var rows =
 *     registry.withSyncSession("reports", conn -> {
 *       try (var st = conn.createStatement(); var rs = st.executeQuery("SELECT 1")) {
 *         rs.next();
 *         return rs.getInt(1);
 *       }
 *     });
 *
 * registry.closeAll().block();
 * }</pre>
 *
 * <h2>Health Checks</h2>
 *
 * <pre>{@code
 * registry.testConnection("reports")
 *     .doOnNext(r -> log(r.success(), r.errorMessage()))
 *     .block();
 * }</pre>
 *
 * <p>Mutations (register and close) are serialized; lookups are lock free.
 */
public final class NamespaceRegistry {

  private static final Logger logger = System.getLogger(NamespaceRegistry.class.getName());

  private final String defaultNamespace;
  private final AsyncEngineFactory asyncEngineFactory;
  private final SyncEngineFactory syncEngineFactory;
  private final Clock clock;

  private final ConcurrentHashMap<String, NamespaceConnection> connections =
      new ConcurrentHashMap<>();
  private final Object mutationLock = new Object();

  private NamespaceRegistry(final Builder builder) {
    this.defaultNamespace = builder.defaultNamespace;
    this.asyncEngineFactory = builder.asyncEngineFactory;
    this.syncEngineFactory = builder.syncEngineFactory;
    this.clock = builder.clock;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link NamespaceRegistry}.
   *
   * <p>Unless set explicitly, the default namespace is read once from {@code DB_DEFAULT_NAMESPACE}
   * (system property or environment variable) and falls back to {@code app_db}. Engines default to
   * HikariCP for JDBC and r2dbc-pool for R2DBC.
   */
  public static class Builder {
    private String defaultNamespace;
    private AsyncEngineFactory asyncEngineFactory = AsyncEngineFactory.r2dbcPool();
    private SyncEngineFactory syncEngineFactory = SyncEngineFactory.hikari();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the namespace used when a caller does not name one.
     *
     * @param defaultNamespace default namespace name
     * @return this builder
     */
    public Builder defaultNamespace(final String defaultNamespace) {
      this.defaultNamespace = defaultNamespace;
      return this;
    }

    /**
     * Sets the factory building asynchronous engines.
     *
     * <p>Default: {@link AsyncEngineFactory#r2dbcPool()}
     *
     * @param asyncEngineFactory engine factory
     * @return this builder
     */
    public Builder asyncEngineFactory(final AsyncEngineFactory asyncEngineFactory) {
      this.asyncEngineFactory = asyncEngineFactory;
      return this;
    }

    /**
     * Sets the factory building synchronous engines.
     *
     * <p>Default: {@link SyncEngineFactory#hikari()}
     *
     * @param syncEngineFactory engine factory
     * @return this builder
     */
    public Builder syncEngineFactory(final SyncEngineFactory syncEngineFactory) {
      this.syncEngineFactory = syncEngineFactory;
      return this;
    }

    /**
     * Sets the clock stamping connection test results.
     *
     * @param clock clock to use
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the registry.
     *
     * @return an empty registry
     * @throws IllegalStateException if a factory or the clock is null
     */
    public NamespaceRegistry build() {
      if (asyncEngineFactory == null)
        throw new IllegalStateException("asyncEngineFactory cannot be null");
      if (syncEngineFactory == null)
        throw new IllegalStateException("syncEngineFactory cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (defaultNamespace == null || defaultNamespace.isBlank())
        defaultNamespace =
            NamespaceConfigLoader.defaultNamespace(NamespaceConfigLoader.fromEnvironment());
      return new NamespaceRegistry(this);
    }
  }

  public String defaultNamespace() {
    return defaultNamespace;
  }

  /**
   * Registers a namespace, failing if the name is taken.
   *
   * @param name namespace name
   * @param config connection parameters
   * @return the new, unconnected holder
   * @throws NamespaceAlreadyExistsException if {@code name} is already registered
   */
  public NamespaceConnection register(final String name, final DatabaseConfig config) {
    return register(name, config, false);
  }

  /**
   * Registers a namespace. Nothing is connected until first use.
   *
   * <p>When {@code replace} is true and the name is taken, the previous holder is retired and its
   * engines are disposed in the background on {@link Schedulers#boundedElastic()}; callers holding
   * sessions from it see driver errors. Use {@link #replace(String, DatabaseConfig)} to wait for
   * the disposal without blocking.
   *
   * @param name namespace name
   * @param config connection parameters
   * @param replace whether an existing registration may be overwritten
   * @return the new, unconnected holder
   * @throws NamespaceAlreadyExistsException if {@code name} is taken and {@code replace} is false
   */
  public NamespaceConnection register(
      final String name, final DatabaseConfig config, final boolean replace) {
    final var swap = swap(name, config, replace);
    if (swap.previous() != null) disposeReplaced(swap.previous()).subscribe();
    return swap.current();
  }

  /**
   * Registers a namespace, replacing any previous registration, and completes once the previous
   * holder's engines are disposed. Disposal failures are logged, not propagated.
   *
   * @param name namespace name
   * @param config connection parameters
   * @return a Mono emitting the new, unconnected holder
   */
  public Mono<NamespaceConnection> replace(final String name, final DatabaseConfig config) {
    return Mono.defer(
        () -> {
          final var swap = swap(name, config, true);
          if (swap.previous() == null) return Mono.just(swap.current());
          return disposeReplaced(swap.previous()).thenReturn(swap.current());
        });
  }

  /**
   * Looks up the default namespace.
   *
   * @return the default namespace's holder
   * @throws NamespaceNotFoundException if the default namespace is not registered
   */
  public NamespaceConnection connection() {
    return connection(null);
  }

  /**
   * Looks up a namespace.
   *
   * @param name namespace name, or {@code null} for the default namespace
   * @return the namespace's holder
   * @throws NamespaceNotFoundException if the namespace is not registered
   */
  public NamespaceConnection connection(final String name) {
    final var resolved = resolve(name);
    final var connection = connections.get(resolved);
    if (connection == null) throw new NamespaceNotFoundException(resolved, sortedNamespaces());
    return connection;
  }

  /**
   * Returns the registered namespace names.
   *
   * @return immutable snapshot, in no particular order
   */
  public Set<String> namespaces() {
    return Set.copyOf(connections.keySet());
  }

  public boolean contains(final String name) {
    return name != null && connections.containsKey(name);
  }

  /**
   * Returns a snapshot of one namespace without building any engine.
   *
   * @param name namespace name, or {@code null} for the default namespace
   * @return connection info with a masked config
   * @throws NamespaceNotFoundException if the namespace is not registered
   */
  public ConnectionInfo connectionInfo(final String name) {
    return connection(name).info();
  }

  /**
   * Returns a snapshot of every namespace without building any engine.
   *
   * @return connection info keyed and sorted by namespace name
   */
  public Map<String, ConnectionInfo> allConnectionInfo() {
    final var infos = new TreeMap<String, ConnectionInfo>();
    connections.forEach((name, connection) -> infos.put(name, connection.info()));
    return infos;
  }

  /**
   * Runs {@code SELECT 1} against a namespace through an asynchronous session, building the
   * asynchronous engine when needed.
   *
   * <p>The returned Mono never errors: an unknown namespace, an engine that cannot be built or an
   * unreachable database all produce a result with {@code success == false} and a message.
   *
   * @param name namespace name, or {@code null} for the default namespace
   * @return a Mono emitting the test result
   */
  public Mono<ConnectionTestResult> testConnection(final String name) {
    return Mono.defer(
        () -> {
          final var resolved = resolve(name);
          final var testedAt = clock.instant();
          final var start = System.nanoTime();
          return Mono.fromCallable(() -> connection(resolved))
              .flatMap(connection -> connection.withAsyncSession(NamespaceRegistry::selectOne))
              .then(
                  Mono.fromCallable(
                      () ->
                          ConnectionTestResult.succeeded(
                              resolved, Duration.ofNanos(System.nanoTime() - start), testedAt)))
              .onErrorResume(
                  e -> {
                    logger.log(WARNING, "Connection test failed for namespace {0}", resolved);
                    return Mono.just(ConnectionTestResult.failed(resolved, describe(e), testedAt));
                  });
        });
  }

  /**
   * Tests every registered namespace independently; one failure does not affect the others.
   *
   * @return a Mono emitting results keyed and sorted by namespace name
   */
  public Mono<Map<String, ConnectionTestResult>> testAllConnections() {
    return Flux.fromIterable(sortedNamespaces())
        .flatMap(this::testConnection)
        .collectMap(ConnectionTestResult::namespace, Function.identity(), TreeMap::new);
  }

  /**
   * Runs {@code work} in an asynchronous session of a namespace. This is the per-request scoped
   * dependency for reactive handlers.
   *
   * @param name namespace name, or {@code null} for the default namespace
   * @param work function producing a result from the session's connection
   * @param <T> result type
   * @return a Mono emitting the work's first element after commit, or erroring with {@link
   *     NamespaceNotFoundException} if the namespace is not registered
   */
  public <T> Mono<T> withAsyncSession(
      final String name, final Function<? super Connection, ? extends Publisher<T>> work) {
    return Mono.defer(() -> connection(name).withAsyncSession(work));
  }

  /**
   * Runs {@code work} in a synchronous session of a namespace. This is the per-request scoped
   * dependency for blocking handlers.
   *
   * @param name namespace name, or {@code null} for the default namespace
   * @param work unit of work using the session's connection
   * @param <T> result type
   * @return the value returned by {@code work} after commit
   * @throws SQLException if acquiring the connection, the work, or the commit fails
   * @throws NamespaceNotFoundException if the namespace is not registered
   */
  public <T> T withSyncSession(final String name, final SessionWork<T> work) throws SQLException {
    return connection(name).withSyncSession(work);
  }

  /**
   * Returns session access bound to one namespace. The name is resolved on each call, so a
   * namespace registered later is picked up and a closed one fails with {@link
   * NamespaceNotFoundException}.
   *
   * @param name namespace name, or {@code null} for the default namespace
   * @return bound session access
   */
  public NamespaceSessions sessions(final String name) {
    return new NamespaceSessions(this, resolve(name));
  }

  /**
   * Disposes and unregisters a namespace. Unknown names are ignored.
   *
   * @param name namespace name
   * @return a Mono completing once the namespace's engines are disposed
   */
  public Mono<Void> closeNamespace(final String name) {
    return Mono.defer(
        () -> {
          final NamespaceConnection removed;
          synchronized (mutationLock) {
            removed = connections.remove(name);
            if (removed != null) removed.retire();
          }
          if (removed == null) {
            logger.log(DEBUG, "Namespace {0} not registered, nothing to close", name);
            return Mono.empty();
          }
          return removed
              .close()
              .doOnSuccess(__ -> logger.log(INFO, "Closed namespace {0}", name));
        });
  }

  /**
   * Disposes and unregisters every namespace.
   *
   * <p>The registry is empty as soon as the returned Mono is subscribed. A namespace that fails to
   * dispose is logged and skipped so the others still release their connections.
   *
   * @return a Mono completing once every namespace was attempted
   */
  public Mono<Void> closeAll() {
    return Mono.defer(
        () -> {
          final List<NamespaceConnection> removed;
          synchronized (mutationLock) {
            removed = new ArrayList<>(connections.values());
            connections.clear();
            removed.forEach(NamespaceConnection::retire);
          }
          if (removed.isEmpty()) return Mono.empty();
          return Flux.fromIterable(removed)
              .concatMap(
                  connection ->
                      connection
                          .close()
                          .onErrorResume(
                              e -> {
                                logger.log(
                                    WARNING,
                                    "Failed to close namespace " + connection.namespace(),
                                    e);
                                return Mono.empty();
                              }))
              .then()
              .doOnSuccess(
                  __ -> logger.log(INFO, "Closed {0} database namespace(s)", removed.size()));
        });
  }

  String resolve(final String name) {
    return name == null || name.isBlank() ? defaultNamespace : name;
  }

  private List<String> sortedNamespaces() {
    return connections.keySet().stream().sorted().toList();
  }

  private Swap swap(final String name, final DatabaseConfig config, final boolean replace) {
    if (name == null || name.isBlank())
      throw new IllegalArgumentException("namespace name must not be blank");
    Objects.requireNonNull(config, "config");

    final NamespaceConnection previous;
    final var connection =
        new NamespaceConnection(name, config, asyncEngineFactory, syncEngineFactory);
    synchronized (mutationLock) {
      previous = connections.get(name);
      if (previous != null && !replace) throw new NamespaceAlreadyExistsException(name);
      if (previous != null) previous.retire();
      connections.put(name, connection);
    }

    if (previous != null)
      logger.log(INFO, "Replaced namespace {0}, disposing previous connection", name);
    else logger.log(INFO, "Registered namespace {0}", name);
    return new Swap(connection, previous);
  }

  private Mono<Void> disposeReplaced(final NamespaceConnection previous) {
    return previous
        .close()
        .subscribeOn(Schedulers.boundedElastic())
        .onErrorResume(
            e -> {
              logger.log(
                  WARNING, "Failed to dispose replaced namespace " + previous.namespace(), e);
              return Mono.empty();
            });
  }

  private record Swap(NamespaceConnection current, NamespaceConnection previous) {}

  private static Publisher<Integer> selectOne(final Connection connection) {
    return Flux.<Result>from(connection.createStatement("SELECT 1").execute())
        .flatMap(result -> result.map((row, metadata) -> row.get(0, Integer.class)));
  }

  private static String describe(final Throwable error) {
    final var message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getName() : message;
  }
}
