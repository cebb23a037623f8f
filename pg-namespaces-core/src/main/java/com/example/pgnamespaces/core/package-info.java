/**
 * Root package of the pg-namespaces library.
 *
 * <p>This package manages several independently configured PostgreSQL connections ("namespaces")
 * in one process. Each namespace lazily builds a JDBC pool and an R2DBC pool and hands out
 * transactional sessions that always commit or roll back and always release their connection.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.pgnamespaces.core.NamespaceRegistry} – registry of namespaces; lookup,
 *       registration, health checks and disposal.
 *   <li>{@link com.example.pgnamespaces.core.NamespaceConnection} – engines and session scopes of a
 *       single namespace.
 *   <li>{@link com.example.pgnamespaces.core.NamespaceLifecycle} – startup and shutdown across
 *       namespaces with cleanup after a partial startup.
 *   <li>{@link com.example.pgnamespaces.core.NamespaceSessions} – session access bound to one
 *       namespace.
 *   <li>{@link com.example.pgnamespaces.core.DatabaseNamespaceException} – root of the error
 *       taxonomy.
 *   <li>{@link com.example.pgnamespaces.core.config.DatabaseConfig} – immutable connection
 *       parameters and derived URLs.
 *   <li>{@link com.example.pgnamespaces.core.jdbc.SyncEngineFactory} – HikariCP engines.
 *   <li>{@link com.example.pgnamespaces.core.reactive.AsyncEngineFactory} – r2dbc-pool engines.
 *   <li>{@link com.example.pgnamespaces.core.diagnostics.NamespaceDiagnostics} – masked
 *       introspection for operators.
 * </ul>
 */
package com.example.pgnamespaces.core;
