package com.example.pgnamespaces.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of a {@code SELECT 1} round trip against a namespace.
 *
 * @param namespace namespace that was tested
 * @param success whether the round trip succeeded
 * @param latency round-trip time, {@code null} when the test failed
 * @param error failure description, {@code null} when the test succeeded
 * @param testedAt when the test started
 */
public record ConnectionTestResult(
    String namespace, boolean success, Duration latency, String error, Instant testedAt) {

  static ConnectionTestResult succeeded(
      final String namespace, final Duration latency, final Instant testedAt) {
    return new ConnectionTestResult(namespace, true, latency, null, testedAt);
  }

  static ConnectionTestResult failed(
      final String namespace, final String error, final Instant testedAt) {
    return new ConnectionTestResult(namespace, false, null, error, testedAt);
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(error);
  }

  public Optional<Duration> latencyIfSucceeded() {
    return Optional.ofNullable(latency);
  }
}
