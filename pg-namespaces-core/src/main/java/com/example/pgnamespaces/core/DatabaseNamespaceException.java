package com.example.pgnamespaces.core;

/**
 * Base type for every failure raised by the namespace connection manager.
 *
 * <p>Callers that do not care about the specific kind can catch this single type.
 */
public class DatabaseNamespaceException extends RuntimeException {

  private final String namespace;

  protected DatabaseNamespaceException(final String namespace, final String message) {
    super(message);
    this.namespace = namespace;
  }

  protected DatabaseNamespaceException(
      final String namespace, final String message, final Throwable cause) {
    super(message, cause);
    this.namespace = namespace;
  }

  /**
   * Returns the namespace the failure relates to.
   *
   * @return namespace name, may be {@code null} when no namespace was known
   */
  public String namespace() {
    return namespace;
  }
}
