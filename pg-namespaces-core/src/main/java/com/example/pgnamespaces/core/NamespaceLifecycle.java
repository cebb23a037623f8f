package com.example.pgnamespaces.core;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.pgnamespaces.core.config.DatabaseConfig;
import com.example.pgnamespaces.core.config.NamespaceConfigLoader;
import java.lang.System.Logger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import reactor.core.publisher.Mono;

/**
 * Startup and shutdown sequencing for the namespaces of a {@link NamespaceRegistry}.
 *
 * <h2>Explicit Configs</h2>
 *
 * <pre>{@code
 * try (var lifecycle =
 *     NamespaceLifecycle.builder()
 *         .registry(registry)
 *         .config("app_db", appConfig)
 *         .config("analytics_db", analyticsConfig)
 *         .build()) {
 *   lifecycle.start();
 *   serveRequests(registry);
 * }
 * }</pre>
 *
 * <h2>Namespaces From The Environment</h2>
 *
 * <pre>{@code
 * var lifecycle =
 *     NamespaceLifecycle.builder()
 *         .registry(registry)
 *         .namespaces(List.of("app_db", "reports"))
 *         .environment(ns -> secretsFor(ns))
 *         .eagerInitialize(false)
 *         .build()
 *         .registerShutdownHook();
 * lifecycle.start();
 * }</pre>
 *
 * <p>If any namespace fails during {@link #start()}, every namespace registered by that call is
 * closed before the failure propagates, so no half-open pool outlives a failed startup.
 */
public final class NamespaceLifecycle implements AutoCloseable {

  private static final Logger logger = System.getLogger(NamespaceLifecycle.class.getName());

  private final NamespaceRegistry registry;
  private final Map<String, DatabaseConfig> configs;
  private final List<String> namespaces;
  private final Function<String, Map<String, String>> environment;
  private final boolean eagerInitialize;
  private final Duration shutdownTimeout;

  private NamespaceLifecycle(final Builder builder) {
    this.registry = builder.registry;
    this.configs = new LinkedHashMap<>(builder.configs);
    this.namespaces = List.copyOf(builder.namespaces);
    this.environment = builder.environment;
    this.eagerInitialize = builder.eagerInitialize;
    this.shutdownTimeout = builder.shutdownTimeout;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link NamespaceLifecycle}. */
  public static class Builder {
    private NamespaceRegistry registry;
    private final Map<String, DatabaseConfig> configs = new LinkedHashMap<>();
    private final LinkedHashSet<String> namespaces = new LinkedHashSet<>();
    private Function<String, Map<String, String>> environment =
        namespace -> NamespaceConfigLoader.fromEnvironment();
    private boolean eagerInitialize = true;
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private Builder() {}

    /**
     * Sets the registry to populate (required).
     *
     * @param registry target registry
     * @return this builder
     */
    public Builder registry(final NamespaceRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Adds a namespace with an explicit config. Explicit configs are registered before namespaces
     * loaded from the environment.
     *
     * @param namespace namespace name
     * @param config connection parameters
     * @return this builder
     */
    public Builder config(final String namespace, final DatabaseConfig config) {
      this.configs.put(namespace, config);
      return this;
    }

    /**
     * Adds several namespaces with explicit configs, in iteration order.
     *
     * @param configs namespace name to config
     * @return this builder
     */
    public Builder configs(final Map<String, DatabaseConfig> configs) {
      this.configs.putAll(configs);
      return this;
    }

    /**
     * Adds namespaces whose configs are read from {@link #environment(Function)}.
     *
     * @param namespaces namespace names
     * @return this builder
     */
    public Builder namespaces(final List<String> namespaces) {
      this.namespaces.addAll(namespaces);
      return this;
    }

    /**
     * Sets the source of raw configuration values per namespace.
     *
     * <p>Default: the process environment overlaid with JVM system properties, the same map for
     * every namespace.
     *
     * @param environment function from namespace name to raw key-value configuration
     * @return this builder
     */
    public Builder environment(final Function<String, Map<String, String>> environment) {
      this.environment = environment;
      return this;
    }

    /**
     * Sets whether {@link #start()} builds each namespace's asynchronous engine immediately.
     *
     * <p>Default: true
     *
     * @param eagerInitialize true for eager, false for lazy initialization
     * @return this builder
     */
    public Builder eagerInitialize(final boolean eagerInitialize) {
      this.eagerInitialize = eagerInitialize;
      return this;
    }

    /**
     * Sets how long {@link #stop()} waits for pools to be disposed.
     *
     * <p>Default: 30 seconds
     *
     * @param shutdownTimeout maximum wait
     * @return this builder
     */
    public Builder shutdownTimeout(final Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * Builds the lifecycle.
     *
     * @return configured lifecycle
     * @throws IllegalStateException if required fields are not set
     */
    public NamespaceLifecycle build() {
      if (registry == null) throw new IllegalStateException("registry is required");
      if (environment == null) throw new IllegalStateException("environment cannot be null");
      if (shutdownTimeout == null || shutdownTimeout.isNegative() || shutdownTimeout.isZero())
        throw new IllegalArgumentException("shutdownTimeout must be positive");
      return new NamespaceLifecycle(this);
    }
  }

  /**
   * Registers every configured namespace, replacing stale registrations, and builds their
   * asynchronous engines when eager initialization is on. Like {@link #stop()} this is a blocking
   * call meant for the application's main thread; cleanup after a failure waits for disposal.
   *
   * @throws ConfigurationException if an environment-based namespace is misconfigured
   * @throws DatabaseConnectionException if eager initialization fails
   */
  public void start() {
    final var registered = new ArrayList<String>();
    try {
      for (var entry : configs.entrySet()) {
        registry.register(entry.getKey(), entry.getValue(), true);
        registered.add(entry.getKey());
      }
      for (var namespace : namespaces) {
        if (configs.containsKey(namespace)) continue;
        final var config = NamespaceConfigLoader.load(namespace, environment.apply(namespace));
        registry.register(namespace, config, true);
        registered.add(namespace);
      }

      if (eagerInitialize) {
        for (var namespace : registered) {
          registry.connection(namespace).initializeAsync();
          logger.log(INFO, "Initialized async connection for namespace {0}", namespace);
        }
      }

      logger.log(INFO, "Database namespaces initialized: {0}", String.join(", ", registered));
    } catch (final RuntimeException e) {
      logger.log(ERROR, "Error during database startup, closing registered namespaces", e);
      closeQuietly(registered);
      throw e;
    }
  }

  /**
   * Closes every namespace in the registry, blocking the calling thread for at most the shutdown
   * timeout. Call it from the application's main or shutdown thread. Never throws; per-namespace disposal failures are
   * logged and the remaining namespaces are still closed.
   */
  public void stop() {
    logger.log(INFO, "Closing database connections...");
    try {
      registry.closeAll().block(shutdownTimeout);
      logger.log(INFO, "Database connections closed");
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Database shutdown did not complete cleanly", e);
    }
  }

  /**
   * Loads one namespace on demand from the environment source, registers it (replacing and
   * disposing any previous registration) and builds its asynchronous engine. Nothing blocks, so the
   * returned Mono can be composed into a reactive request handler.
   *
   * @param namespace namespace name
   * @return a Mono emitting the initialized holder, or erroring with {@link
   *     ConfigurationException} if the namespace is misconfigured or {@link
   *     DatabaseConnectionException} if the engine cannot be built, in which case the namespace is
   *     closed first
   */
  public Mono<NamespaceConnection> loadNamespace(final String namespace) {
    return Mono.fromCallable(
            () -> NamespaceConfigLoader.load(namespace, environment.apply(namespace)))
        .flatMap(config -> registry.replace(namespace, config))
        .flatMap(
            connection ->
                Mono.fromCallable(
                        () -> {
                          connection.initializeAsync();
                          return connection;
                        })
                    .onErrorResume(
                        e ->
                            registry
                                .closeNamespace(namespace)
                                .onErrorResume(
                                    closeError -> {
                                      logger.log(
                                          WARNING,
                                          "Failed to close namespace " + namespace,
                                          closeError);
                                      return Mono.empty();
                                    })
                                .then(Mono.<NamespaceConnection>error(e))))
        .doOnNext(__ -> logger.log(INFO, "Loaded namespace {0} on demand", namespace));
  }

  /**
   * Registers a JVM shutdown hook that calls {@link #stop()}.
   *
   * @return this lifecycle
   */
  public NamespaceLifecycle registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "pg-namespaces-shutdown"));
    return this;
  }

  public NamespaceRegistry registry() {
    return registry;
  }

  @Override
  public void close() {
    stop();
  }

  private void closeQuietly(final List<String> registered) {
    for (var namespace : registered) {
      try {
        registry.closeNamespace(namespace).block(shutdownTimeout);
      } catch (final RuntimeException closeError) {
        logger.log(WARNING, "Failed to close namespace " + namespace, closeError);
      }
    }
  }
}
