package com.example.pgnamespaces.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.pgnamespaces.core.config.DatabaseConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SyncEngineTest {

  private static final DatabaseConfig CONFIG =
      DatabaseConfig.builder()
          .host("db.invalid")
          .user("app")
          .password("s3cret-pw")
          .database("orders")
          .poolSize(1)
          .maxOverflow(4)
          .poolRecycleSeconds(1800)
          .build();

  @Test
  @DisplayName("create pairs the engine with a session factory bound to it")
  void createPairsSessions() {
    final var dataSource = mock(DataSource.class);

    final var engine = SyncEngine.create("app_db", CONFIG, (ns, cfg) -> dataSource);

    assertSame(dataSource, engine.dataSource());
    assertSame(dataSource, engine.sessions().dataSource());
  }

  @Test
  @DisplayName("a factory returning null is rejected")
  void nullFactoryResult() {
    assertThrows(
        IllegalStateException.class, () -> SyncEngine.create("app_db", CONFIG, (ns, cfg) -> null));
  }

  @Test
  @DisplayName("dispose closes an AutoCloseable pool and ignores plain data sources")
  void disposeClosesPool() throws Exception {
    final var closeable = mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
    SyncEngine.create("app_db", CONFIG, (ns, cfg) -> closeable).dispose();
    verify((AutoCloseable) closeable).close();

    final var plain = mock(DataSource.class);
    assertDoesNotThrow(() -> SyncEngine.create("app_db", CONFIG, (ns, cfg) -> plain).dispose());
  }

  @Test
  @DisplayName("default factory maps the config onto HikariCP")
  void hikariMapping() throws Exception {
    final var dataSource = SyncEngineFactory.hikari().create("reports", CONFIG);
    final var hikari = assertInstanceOf(HikariDataSource.class, dataSource);
    try {
      assertEquals("pg-namespaces-sync-reports", hikari.getPoolName());
      assertEquals(CONFIG.syncUrl(), hikari.getJdbcUrl());
      assertEquals(5, hikari.getMaximumPoolSize());
      assertEquals(0, hikari.getMinimumIdle());
      assertEquals(600_000L, hikari.getIdleTimeout());
      assertFalse(hikari.isAutoCommit());
      assertEquals(1_800_000L, hikari.getMaxLifetime());
      assertEquals("SELECT 1", hikari.getConnectionTestQuery());
      assertEquals("public", hikari.getSchema());
    } finally {
      SyncEngine.create("reports", CONFIG, (ns, cfg) -> dataSource).dispose();
    }
    assertTrue(hikari.isClosed());
  }

  @Test
  @DisplayName("building the HikariCP engine opens no connection")
  void hikariBuildIsLazy() throws Exception {
    try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      final var config =
          CONFIG.toBuilder().host("127.0.0.1").port(server.getLocalPort()).poolSize(3).build();
      final var engine = SyncEngine.create("app_db", config, SyncEngineFactory.hikari());
      try {
        server.setSoTimeout(1000);
        assertThrows(SocketTimeoutException.class, server::accept);
      } finally {
        engine.dispose();
      }
    }
  }
}
