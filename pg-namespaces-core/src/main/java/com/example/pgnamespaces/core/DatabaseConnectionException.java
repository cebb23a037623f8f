package com.example.pgnamespaces.core;

/** Raised when an engine for a namespace cannot be built or a live connection fails. */
public class DatabaseConnectionException extends DatabaseNamespaceException {

  private final String reason;

  public DatabaseConnectionException(final String namespace, final String reason) {
    this(namespace, reason, null);
  }

  public DatabaseConnectionException(
      final String namespace, final String reason, final Throwable cause) {
    super(
        namespace,
        "Failed to connect to database namespace '%s': %s".formatted(namespace, reason),
        cause);
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
