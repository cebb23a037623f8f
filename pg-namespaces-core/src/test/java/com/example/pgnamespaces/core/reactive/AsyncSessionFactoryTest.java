package com.example.pgnamespaces.core.reactive;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.r2dbc.spi.R2dbcNonTransientResourceException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class AsyncSessionFactoryTest {

  private FakeConnectionFactory pool;
  private AsyncSessionFactory sessions;

  @BeforeEach
  void setUp() {
    pool = new FakeConnectionFactory();
    sessions = new AsyncSessionFactory("app_db", pool, false);
  }

  @Test
  @DisplayName("successful work commits and releases the connection")
  void commitsOnSuccess() {
    final var value = sessions.withSession(conn -> Mono.just("ok")).block();

    assertEquals("ok", value);
    final var conn = pool.connection();
    verify(conn).beginTransaction();
    verify(conn).commitTransaction();
    verify(conn, never()).rollbackTransaction();
    verify(conn).close();
  }

  @Test
  @DisplayName("failing work rolls back, releases the connection and propagates the error")
  void rollsBackOnError() {
    final var boom = new IllegalStateException("boom");

    final var thrown =
        assertThrows(
            IllegalStateException.class,
            () -> sessions.withSession(conn -> Mono.<String>error(boom)).block());

    assertSame(boom, thrown);
    final var conn = pool.connection();
    verify(conn).rollbackTransaction();
    verify(conn, never()).commitTransaction();
    verify(conn).close();
  }

  @Test
  @DisplayName("cancelling the subscriber rolls back and releases the connection")
  void rollsBackOnCancel() {
    final var subscription =
        sessions.withSession(conn -> Mono.<String>never()).subscribe();

    subscription.dispose();

    final var conn = pool.connection();
    verify(conn, timeout(1000)).rollbackTransaction();
    verify(conn, timeout(1000)).close();
    verify(conn, never()).commitTransaction();
  }

  @Test
  @DisplayName("a failed rollback is logged and the work error still propagates")
  void rollbackFailureDoesNotMaskError() {
    doReturn(Mono.error(new RuntimeException("rollback failed")))
        .when(pool.connection())
        .rollbackTransaction();

    final var thrown =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                sessions
                    .withSession(conn -> Mono.<String>error(new IllegalArgumentException("work")))
                    .block());

    assertEquals("work", thrown.getMessage());
    verify(pool.connection()).close();
  }

  @Test
  @DisplayName("a failing commit closes the connection and surfaces the commit error")
  void commitFailureCloses() {
    doReturn(Mono.error(new R2dbcNonTransientResourceException("commit failed")))
        .when(pool.connection())
        .commitTransaction();

    assertThrows(
        R2dbcNonTransientResourceException.class,
        () -> sessions.withSession(conn -> Mono.just(1)).block());
    verify(pool.connection(), atLeastOnce()).close();
  }

  @Test
  @DisplayName("begin failure releases the acquired connection without running the work")
  void beginFailureCloses() {
    doReturn(Mono.error(new R2dbcNonTransientResourceException("begin failed")))
        .when(pool.connection())
        .beginTransaction();

    assertThrows(
        R2dbcNonTransientResourceException.class,
        () -> sessions.withSession(conn -> Mono.just(1)).block());
    verify(pool.connection()).close();
    verify(pool.connection(), never()).commitTransaction();
  }

  @Test
  @DisplayName("nothing is acquired until the session Mono is subscribed")
  void lazyUntilSubscribed() {
    final var session = sessions.withSession(conn -> Mono.just(1));

    assertEquals(0, pool.acquired());
    assertEquals(1, session.block(Duration.ofSeconds(5)));
    assertEquals(1, pool.acquired());
  }

  @Test
  @DisplayName("acquire failure propagates the driver error")
  void acquireFailurePropagates() {
    pool.failOnCreate(new R2dbcNonTransientResourceException("connection refused"));

    assertThrows(
        R2dbcNonTransientResourceException.class,
        () -> sessions.withSession(conn -> Mono.just(1)).block());
  }
}
