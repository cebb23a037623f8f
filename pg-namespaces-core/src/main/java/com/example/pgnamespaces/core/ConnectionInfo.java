package com.example.pgnamespaces.core;

import com.example.pgnamespaces.core.config.DatabaseConfig;

/**
 * Read-only snapshot of a namespace's state, safe to display.
 *
 * @param namespace namespace name
 * @param config connection parameters with the password masked
 * @param asyncEngineInitialized whether the R2DBC engine currently exists
 * @param syncEngineInitialized whether the JDBC engine currently exists
 */
public record ConnectionInfo(
    String namespace,
    DatabaseConfig config,
    boolean asyncEngineInitialized,
    boolean syncEngineInitialized) {

  /** True when either engine is initialized. */
  public boolean isConnected() {
    return asyncEngineInitialized || syncEngineInitialized;
  }
}
