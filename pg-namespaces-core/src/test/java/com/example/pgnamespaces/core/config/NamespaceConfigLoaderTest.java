package com.example.pgnamespaces.core.config;

import static org.junit.jupiter.api.Assertions.*;

import com.example.pgnamespaces.core.ConfigurationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NamespaceConfigLoaderTest {

  private static Map<String, String> required() {
    final var env = new HashMap<String, String>();
    env.put("POSTGRES_HOST", "db.internal");
    env.put("POSTGRES_USER", "app");
    env.put("POSTGRES_PASSWORD", "s3cret");
    env.put("POSTGRES_DB", "orders");
    return env;
  }

  @AfterEach
  void clearProperties() {
    System.clearProperty("POSTGRES_HOST");
    System.clearProperty("DB_DEFAULT_NAMESPACE");
  }

  @Test
  @DisplayName("required keys only: defaults fill the rest")
  void defaultsApplied() {
    final var config = NamespaceConfigLoader.load("app_db", required());

    assertEquals("db.internal", config.host());
    assertEquals(5432, config.port());
    assertEquals("public", config.schema());
    assertEquals(10, config.poolSize());
    assertEquals(0, config.maxOverflow());
    assertTrue(config.poolPrePing());
    assertEquals(3600L, config.poolRecycleSeconds());
    assertFalse(config.echo());
  }

  @Test
  @DisplayName("optional keys override defaults")
  void optionalKeys() {
    final var env = required();
    env.put("POSTGRES_PORT", "6543");
    env.put("POSTGRES_SCHEMA", "reporting");
    env.put("DB_POOL_SIZE", "4");
    env.put("DB_MAX_OVERFLOW", "2");
    env.put("DB_POOL_PRE_PING", "off");
    env.put("DB_POOL_RECYCLE", "-1");
    env.put("DB_ECHO", "YES");

    final var config = NamespaceConfigLoader.load("reports", env);

    assertEquals(6543, config.port());
    assertEquals("reporting", config.schema());
    assertEquals(4, config.poolSize());
    assertEquals(2, config.maxOverflow());
    assertFalse(config.poolPrePing());
    assertEquals(-1L, config.poolRecycleSeconds());
    assertTrue(config.echo());
  }

  @Test
  @DisplayName("every missing or blank required key is reported at once")
  void missingFields() {
    final var env = required();
    env.remove("POSTGRES_HOST");
    env.put("POSTGRES_PASSWORD", "  ");

    final var e =
        assertThrows(ConfigurationException.class, () -> NamespaceConfigLoader.load("billing", env));

    assertEquals("billing", e.namespace());
    assertEquals(List.of("POSTGRES_HOST", "POSTGRES_PASSWORD"), e.missingFields());
    assertTrue(e.getMessage().contains("POSTGRES_HOST"));
  }

  @Test
  @DisplayName("unparseable numbers and booleans are configuration errors")
  void invalidValues() {
    final var badPort = required();
    badPort.put("POSTGRES_PORT", "five");
    final var badBool = required();
    badBool.put("DB_ECHO", "maybe");

    final var portError =
        assertThrows(
            ConfigurationException.class, () -> NamespaceConfigLoader.load("app_db", badPort));
    assertTrue(portError.getMessage().contains("POSTGRES_PORT"));
    assertThrows(ConfigurationException.class, () -> NamespaceConfigLoader.load("app_db", badBool));
  }

  @Test
  @DisplayName("out-of-range values are configuration errors")
  void outOfRange() {
    final var env = required();
    env.put("POSTGRES_PORT", "70000");

    final var e =
        assertThrows(ConfigurationException.class, () -> NamespaceConfigLoader.load("app_db", env));

    assertTrue(e.getMessage().contains("70000"));
    assertInstanceOf(IllegalArgumentException.class, e.getCause());
  }

  @Test
  @DisplayName("default namespace falls back to app_db")
  void defaultNamespace() {
    assertEquals("app_db", NamespaceConfigLoader.defaultNamespace(Map.of()));
    assertEquals("app_db", NamespaceConfigLoader.defaultNamespace(Map.of("DB_DEFAULT_NAMESPACE", "")));
    assertEquals(
        "analytics_db",
        NamespaceConfigLoader.defaultNamespace(Map.of("DB_DEFAULT_NAMESPACE", "analytics_db")));
  }

  @Test
  @DisplayName("system properties override the process environment")
  void systemPropertiesWin() {
    System.setProperty("POSTGRES_HOST", "from-property");
    System.setProperty("DB_DEFAULT_NAMESPACE", "primary");

    final var env = NamespaceConfigLoader.fromEnvironment();

    assertEquals("from-property", env.get("POSTGRES_HOST"));
    assertEquals("primary", NamespaceConfigLoader.defaultNamespace(env));
  }
}
