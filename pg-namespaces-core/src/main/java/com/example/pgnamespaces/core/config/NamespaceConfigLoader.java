package com.example.pgnamespaces.core.config;

import static com.example.pgnamespaces.core.config.ConfigKeys.*;

import com.example.pgnamespaces.core.ConfigurationException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns a raw key-value map (environment variables, a decoded secret, a properties file) into a
 * {@link DatabaseConfig}.
 *
 * <p>Keys and defaults:
 *
 * <ul>
 *   <li>POSTGRES_HOST, POSTGRES_USER, POSTGRES_PASSWORD, POSTGRES_DB (required)
 *   <li>POSTGRES_PORT (5432), POSTGRES_SCHEMA (public)
 *   <li>DB_POOL_SIZE (10), DB_MAX_OVERFLOW (0), DB_POOL_PRE_PING (true), DB_POOL_RECYCLE (3600),
 *       DB_ECHO (false)
 *   <li>DB_DEFAULT_NAMESPACE (app_db)
 * </ul>
 */
public final class NamespaceConfigLoader {
  private NamespaceConfigLoader() {}

  /**
   * Builds a config for {@code namespace} from {@code env}.
   *
   * @param namespace namespace the values belong to, used in error messages
   * @param env raw configuration values
   * @return validated config
   * @throws ConfigurationException if required keys are missing or a value cannot be parsed
   */
  public static DatabaseConfig load(final String namespace, final Map<String, String> env) {
    final var missing = REQUIRED.stream().filter(key -> value(env, key).isEmpty()).toList();
    if (!missing.isEmpty()) throw new ConfigurationException(namespace, missing);

    try {
      return DatabaseConfig.builder()
          .host(env.get(POSTGRES_HOST))
          .port(
              parse(namespace, env, POSTGRES_PORT, Integer::parseInt, DatabaseConfig.DEFAULT_PORT))
          .user(env.get(POSTGRES_USER))
          .password(env.get(POSTGRES_PASSWORD))
          .database(env.get(POSTGRES_DB))
          .schema(value(env, POSTGRES_SCHEMA).orElse(DatabaseConfig.DEFAULT_SCHEMA))
          .poolSize(
              parse(
                  namespace, env, DB_POOL_SIZE, Integer::parseInt, DatabaseConfig.DEFAULT_POOL_SIZE))
          .maxOverflow(
              parse(
                  namespace,
                  env,
                  DB_MAX_OVERFLOW,
                  Integer::parseInt,
                  DatabaseConfig.DEFAULT_MAX_OVERFLOW))
          .poolPrePing(
              parse(
                  namespace,
                  env,
                  DB_POOL_PRE_PING,
                  NamespaceConfigLoader::parseBoolean,
                  DatabaseConfig.DEFAULT_POOL_PRE_PING))
          .poolRecycleSeconds(
              parse(
                  namespace,
                  env,
                  DB_POOL_RECYCLE,
                  Long::parseLong,
                  DatabaseConfig.DEFAULT_POOL_RECYCLE_SECONDS))
          .echo(
              parse(
                  namespace,
                  env,
                  DB_ECHO,
                  NamespaceConfigLoader::parseBoolean,
                  DatabaseConfig.DEFAULT_ECHO))
          .build();
    } catch (final IllegalArgumentException e) {
      throw new ConfigurationException(
          namespace,
          "Invalid configuration for namespace '%s': %s".formatted(namespace, e.getMessage()),
          e);
    }
  }

  /**
   * Resolves the default namespace name.
   *
   * @param env raw configuration values
   * @return value of DB_DEFAULT_NAMESPACE, or {@code app_db} when absent or blank
   */
  public static String defaultNamespace(final Map<String, String> env) {
    return value(env, DB_DEFAULT_NAMESPACE).orElse(DEFAULT_NAMESPACE);
  }

  /**
   * Returns the process environment with JVM system properties of the same name layered on top.
   *
   * @return mutable snapshot of the effective configuration values
   */
  public static Map<String, String> fromEnvironment() {
    final var merged = new HashMap<>(System.getenv());
    for (var key : ConfigKeys.ALL)
      Optional.ofNullable(System.getProperty(key)).ifPresent(v -> merged.put(key, v));
    return merged;
  }

  private static Optional<String> value(final Map<String, String> env, final String key) {
    return Optional.ofNullable(env.get(key)).filter(v -> !v.isBlank());
  }

  private static <T> T parse(
      final String namespace,
      final Map<String, String> env,
      final String key,
      final Function<String, T> parser,
      final T fallback) {
    final var raw = value(env, key);
    if (raw.isEmpty()) return fallback;
    try {
      return parser.apply(raw.get().trim());
    } catch (final RuntimeException e) {
      throw new ConfigurationException(
          namespace,
          "Invalid value for %s in namespace '%s': %s".formatted(key, namespace, raw.get()),
          e);
    }
  }

  private static Boolean parseBoolean(final String raw) {
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "true", "1", "yes", "on" -> true;
      case "false", "0", "no", "off" -> false;
      default -> throw new IllegalArgumentException("not a boolean: " + raw);
    };
  }
}
