package com.example.pgnamespaces.core;

import com.example.pgnamespaces.core.jdbc.SessionWork;
import io.r2dbc.spi.Connection;
import java.sql.SQLException;
import java.util.function.Function;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

/**
 * Session access bound to one namespace, handed to request handlers that always talk to the same
 * database.
 *
 * <pre>{@code
 * var analytics = registry.sessions("analytics_db");
 * analytics.withAsyncSession(conn -> Mono.from(conn.createStatement(sql).execute())).block();
 * }</pre>
 *
 * @param registry registry resolving the namespace on every call
 * @param namespace bound namespace name
 */
public record NamespaceSessions(NamespaceRegistry registry, String namespace) {

  public <T> Mono<T> withAsyncSession(
      final Function<? super Connection, ? extends Publisher<T>> work) {
    return registry.withAsyncSession(namespace, work);
  }

  public <T> T withSyncSession(final SessionWork<T> work) throws SQLException {
    return registry.withSyncSession(namespace, work);
  }

  public NamespaceConnection connection() {
    return registry.connection(namespace);
  }
}
