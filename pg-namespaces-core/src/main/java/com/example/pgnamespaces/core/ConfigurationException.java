package com.example.pgnamespaces.core;

import java.util.List;

/** Raised when a namespace configuration is missing required fields or holds invalid values. */
public class ConfigurationException extends DatabaseNamespaceException {

  private final List<String> missingFields;

  /**
   * Creates an exception listing the required fields that were absent.
   *
   * @param namespace namespace being configured
   * @param missingFields names of the missing configuration keys
   */
  public ConfigurationException(final String namespace, final List<String> missingFields) {
    super(
        namespace,
        "Invalid configuration for namespace '%s'. Missing required fields: %s"
            .formatted(namespace, String.join(", ", missingFields)));
    this.missingFields = List.copyOf(missingFields);
  }

  /**
   * Creates an exception for an invalid (rather than missing) value.
   *
   * @param namespace namespace being configured
   * @param message description of the problem
   * @param cause underlying parse or validation failure, may be {@code null}
   */
  public ConfigurationException(
      final String namespace, final String message, final Throwable cause) {
    super(namespace, message, cause);
    this.missingFields = List.of();
  }

  public List<String> missingFields() {
    return missingFields;
  }
}
