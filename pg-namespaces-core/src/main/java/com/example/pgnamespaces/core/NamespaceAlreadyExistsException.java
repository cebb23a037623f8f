package com.example.pgnamespaces.core;

/** Raised when registering a namespace that exists without asking to replace it. */
public class NamespaceAlreadyExistsException extends DatabaseNamespaceException {

  public NamespaceAlreadyExistsException(final String namespace) {
    super(namespace, "Database namespace '%s' is already registered.".formatted(namespace));
  }
}
