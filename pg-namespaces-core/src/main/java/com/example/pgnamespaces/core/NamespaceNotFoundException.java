package com.example.pgnamespaces.core;

import java.util.List;

/** Raised when a namespace name does not resolve to a registered connection. */
public class NamespaceNotFoundException extends DatabaseNamespaceException {

  private final List<String> availableNamespaces;

  public NamespaceNotFoundException(final String namespace, final List<String> available) {
    super(namespace, message(namespace, available));
    this.availableNamespaces = available == null ? List.of() : List.copyOf(available);
  }

  /**
   * Returns the namespaces that were registered when the lookup failed.
   *
   * @return immutable list of registered namespace names
   */
  public List<String> availableNamespaces() {
    return availableNamespaces;
  }

  private static String message(final String namespace, final List<String> available) {
    final var message = "Database namespace '%s' not found.".formatted(namespace);
    if (available == null || available.isEmpty()) return message;
    return message + " Available namespaces: " + String.join(", ", available);
  }
}
