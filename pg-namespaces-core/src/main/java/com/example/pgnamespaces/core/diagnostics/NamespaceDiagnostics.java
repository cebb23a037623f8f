package com.example.pgnamespaces.core.diagnostics;

import com.example.pgnamespaces.core.ConnectionInfo;
import com.example.pgnamespaces.core.ConnectionTestResult;
import com.example.pgnamespaces.core.NamespaceNotFoundException;
import com.example.pgnamespaces.core.NamespaceRegistry;
import com.example.pgnamespaces.core.config.DatabaseConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Read-only operations view over a {@link NamespaceRegistry}: namespace listing, masked
 * configuration, bulk health checks and JSON reports.
 *
 * <p>Every config exposed here has its password masked. Nothing in this class builds an engine
 * except the health checks, which need a live round trip.
 */
public final class NamespaceDiagnostics {

  private final NamespaceRegistry registry;
  private final Supplier<ObjectMapper> mapperSupplier;

  public NamespaceDiagnostics(final NamespaceRegistry registry) {
    this(registry, ObjectMapper::new);
  }

  /**
   * Creates a diagnostics view rendering JSON with the given mapper.
   *
   * @param registry registry to inspect
   * @param mapperSupplier supplier of the {@link ObjectMapper} used for reports
   */
  public NamespaceDiagnostics(
      final NamespaceRegistry registry, final Supplier<ObjectMapper> mapperSupplier) {
    this.registry = registry;
    this.mapperSupplier = mapperSupplier;
  }

  public NamespaceListing listing() {
    final var names = registry.namespaces().stream().sorted().toList();
    return new NamespaceListing(registry.defaultNamespace(), names, names.size());
  }

  /**
   * Returns a namespace's configuration with the password masked.
   *
   * @param namespace namespace name, or {@code null} for the default namespace
   * @return masked config
   * @throws NamespaceNotFoundException if the namespace is not registered
   */
  public DatabaseConfig maskedConfig(final String namespace) {
    return registry.connectionInfo(namespace).config();
  }

  public Map<String, ConnectionInfo> info() {
    return registry.allConnectionInfo();
  }

  /**
   * Tests every namespace. Never errors; failing namespaces are reported in their result.
   *
   * @return a Mono emitting results keyed by namespace
   */
  public Mono<Map<String, ConnectionTestResult>> healthCheck() {
    return registry.testAllConnections();
  }

  /**
   * Renders the default namespace, the namespace count and the masked state of every namespace as
   * JSON.
   *
   * @return JSON document
   */
  public String report() {
    final var mapper = mapperSupplier.get();
    final var root = mapper.createObjectNode();
    final var infos = registry.allConnectionInfo();
    root.put("default_namespace", registry.defaultNamespace());
    root.put("namespace_count", infos.size());
    final var namespaces = root.putObject("namespaces");
    infos.forEach((name, info) -> writeInfo(namespaces.putObject(name), info));
    return write(mapper, root);
  }

  /**
   * Runs {@link #healthCheck()} and renders the results as JSON.
   *
   * @return a Mono emitting the JSON document
   */
  public Mono<String> healthReport() {
    return healthCheck()
        .map(
            results -> {
              final var mapper = mapperSupplier.get();
              final var root = mapper.createObjectNode();
              results.forEach((name, result) -> writeResult(root.putObject(name), result));
              return write(mapper, root);
            });
  }

  private static void writeInfo(final ObjectNode node, final ConnectionInfo info) {
    node.put("namespace", info.namespace());
    node.put("is_connected", info.isConnected());
    node.put("async_engine_initialized", info.asyncEngineInitialized());
    node.put("sync_engine_initialized", info.syncEngineInitialized());
    final var config = info.config();
    final var configNode = node.putObject("config");
    configNode.put("host", config.host());
    configNode.put("port", config.port());
    configNode.put("user", config.user());
    configNode.put("password", config.password());
    configNode.put("database", config.database());
    configNode.put("schema", config.schema());
    configNode.put("pool_size", config.poolSize());
    configNode.put("max_overflow", config.maxOverflow());
    configNode.put("pool_pre_ping", config.poolPrePing());
  }

  private static void writeResult(final ObjectNode node, final ConnectionTestResult result) {
    node.put("namespace", result.namespace());
    node.put("success", result.success());
    result
        .latencyIfSucceeded()
        .ifPresentOrElse(
            latency -> node.put("latency_ms", latency.toNanos() / 1_000_000.0),
            () -> node.putNull("latency_ms"));
    result
        .errorMessage()
        .ifPresentOrElse(error -> node.put("error", error), () -> node.putNull("error"));
    node.put("timestamp", result.testedAt().toString());
  }

  private static String write(final ObjectMapper mapper, final ObjectNode root) {
    try {
      return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    } catch (final JsonProcessingException e) {
      throw new RuntimeException("Failed to render diagnostics report", e);
    }
  }
}
