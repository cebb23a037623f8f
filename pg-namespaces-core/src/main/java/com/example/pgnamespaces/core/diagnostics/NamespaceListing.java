package com.example.pgnamespaces.core.diagnostics;

import java.util.List;

/**
 * Registered namespaces as reported to operators.
 *
 * @param defaultNamespace namespace used when callers do not name one
 * @param namespaces registered names, sorted
 * @param namespaceCount number of registered namespaces
 */
public record NamespaceListing(String defaultNamespace, List<String> namespaces, int namespaceCount) {

  public NamespaceListing {
    namespaces = List.copyOf(namespaces);
  }
}
