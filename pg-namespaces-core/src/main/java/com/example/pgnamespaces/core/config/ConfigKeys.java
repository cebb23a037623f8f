package com.example.pgnamespaces.core.config;

import java.util.List;

/** Names of the raw configuration keys read by {@link NamespaceConfigLoader}. */
public final class ConfigKeys {
  private ConfigKeys() {}

  public static final String POSTGRES_HOST = "POSTGRES_HOST";
  public static final String POSTGRES_PORT = "POSTGRES_PORT";
  public static final String POSTGRES_USER = "POSTGRES_USER";
  public static final String POSTGRES_PASSWORD = "POSTGRES_PASSWORD";
  public static final String POSTGRES_DB = "POSTGRES_DB";
  public static final String POSTGRES_SCHEMA = "POSTGRES_SCHEMA";

  public static final String DB_POOL_SIZE = "DB_POOL_SIZE";
  public static final String DB_MAX_OVERFLOW = "DB_MAX_OVERFLOW";
  public static final String DB_POOL_PRE_PING = "DB_POOL_PRE_PING";
  public static final String DB_POOL_RECYCLE = "DB_POOL_RECYCLE";
  public static final String DB_ECHO = "DB_ECHO";

  public static final String DB_DEFAULT_NAMESPACE = "DB_DEFAULT_NAMESPACE";
  public static final String DEFAULT_NAMESPACE = "app_db";

  /** Keys that must be present and non-blank. */
  public static final List<String> REQUIRED =
      List.of(POSTGRES_HOST, POSTGRES_USER, POSTGRES_PASSWORD, POSTGRES_DB);

  /** Every key that may be read, used when merging JVM system properties over the environment. */
  static final List<String> ALL =
      List.of(
          POSTGRES_HOST,
          POSTGRES_PORT,
          POSTGRES_USER,
          POSTGRES_PASSWORD,
          POSTGRES_DB,
          POSTGRES_SCHEMA,
          DB_POOL_SIZE,
          DB_MAX_OVERFLOW,
          DB_POOL_PRE_PING,
          DB_POOL_RECYCLE,
          DB_ECHO,
          DB_DEFAULT_NAMESPACE);
}
