/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import static dev.trustnet.core.TestAccounts.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.OperationResult;
import dev.trustnet.api.RequestContext;
import dev.trustnet.api.RippleResult;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.TrustLineException;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the JDBC store against H2 in MariaDB compatibility mode. */
final class JdbcTrustLineStoreTest {
  private static final CanonicalPair AB = Canonicalizer.canonicalize(id(1), id(2));

  private JdbcDataSource ds;
  private JdbcTrustLineStore store;
  private EventBus events;

  @BeforeEach
  void setUp() {
    ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:trustnet-" + UUID.randomUUID() + ";MODE=MariaDB;DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    store = new JdbcTrustLineStore(ds);
    store.ensureSchema();
    events = new EventBus();
  }

  @AfterEach
  void tearDown() {
    events.close();
    store.close();
  }

  private static TrustLine line(CanonicalPair pair, long id) {
    return TrustLine.open(pair, id, 7, 1000, 500, true, 100L);
  }

  @Test
  void schemaIsIdempotent() {
    store.ensureSchema();
    assertEquals(0L, store.read(GlobalField.TRUST_LINE_COUNT));

    store.inTransaction(tx -> tx.increment(GlobalField.TRUST_LINE_COUNT));
    store.ensureSchema();
    assertEquals(1L, store.read(GlobalField.TRUST_LINE_COUNT));
  }

  @Test
  void concurrentFirstIncrementsGetDistinctIds() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      CountDownLatch start = new CountDownLatch(1);
      Callable<Long> bump =
          () -> {
            start.await();
            return store.inTransaction(tx -> tx.increment(GlobalField.TRUST_LINE_COUNT));
          };
      Future<Long> first = pool.submit(bump);
      Future<Long> second = pool.submit(bump);
      start.countDown();

      List<Long> ids =
          new ArrayList<>(
              List.of(first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS)));
      Collections.sort(ids);
      assertEquals(List.of(1L, 2L), ids);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void incrementOfUnseededCounterFailsInsteadOfInserting() throws Exception {
    try (Connection c = ds.getConnection();
        Statement st = c.createStatement()) {
      st.execute("DELETE FROM trustnet_globals");
    }

    StoreException e =
        assertThrows(
            StoreException.class,
            () -> store.inTransaction(tx -> tx.increment(GlobalField.TRUST_LINE_COUNT)));
    assertEquals(ErrorCode.STORAGE_FAILURE, e.errorCode());
    assertEquals(0L, store.read(GlobalField.TRUST_LINE_COUNT));
  }

  @Test
  void insertedLineReadsBackFieldForField() {
    TrustLine original = line(AB, 1).withQuality(990_000, 1_000_000, 120L);
    store.inTransaction(
        tx -> {
          tx.insert(original);
          return null;
        });

    assertEquals(original, store.find(AB).orElseThrow());
  }

  @Test
  void duplicateInsertMapsToExists() {
    store.inTransaction(
        tx -> {
          tx.insert(line(AB, 1));
          return null;
        });

    TrustLineException e =
        assertThrows(
            TrustLineException.class,
            () ->
                store.inTransaction(
                    tx -> {
                      tx.insert(line(AB, 2));
                      return null;
                    }));
    assertEquals(ErrorCode.TRUST_LINE_EXISTS, e.errorCode());
  }

  @Test
  void failedWorkRollsBackEveryWrite() {
    store.inTransaction(
        tx -> {
          tx.insert(line(AB, tx.increment(GlobalField.TRUST_LINE_COUNT)));
          return null;
        });

    assertThrows(
        TrustLineException.class,
        () ->
            store.inTransaction(
                tx -> {
                  tx.increment(GlobalField.TRUST_LINE_COUNT);
                  tx.update(tx.lockLine(AB).orElseThrow().withBalance(300, 200L));
                  throw new TrustLineException(ErrorCode.INSUFFICIENT_CREDIT, "later leg failed");
                }));

    assertEquals(0L, store.find(AB).orElseThrow().balance());
    assertEquals(1L, store.read(GlobalField.TRUST_LINE_COUNT));
  }

  @Test
  void updateOfMissingLineIsNotFound() {
    TrustLineException e =
        assertThrows(
            TrustLineException.class,
            () ->
                store.inTransaction(
                    tx -> {
                      tx.update(line(AB, 1));
                      return null;
                    }));
    assertEquals(ErrorCode.TRUST_LINE_NOT_FOUND, e.errorCode());
  }

  @Test
  void counterStartsAtOneAndIncrements() {
    long first = store.inTransaction(tx -> tx.increment(GlobalField.TRUST_LINE_COUNT));
    long second = store.inTransaction(tx -> tx.increment(GlobalField.TRUST_LINE_COUNT));

    assertEquals(1L, first);
    assertEquals(2L, second);
    assertEquals(2L, store.read(GlobalField.TRUST_LINE_COUNT));
  }

  @Test
  void linesOfFindsBothRolesInIdOrder() {
    AccountId a = id(1);
    store.inTransaction(
        tx -> {
          tx.insert(line(Canonicalizer.canonicalize(a, id(3)), 2));
          tx.insert(line(Canonicalizer.canonicalize(id(0), a), 1));
          tx.insert(line(Canonicalizer.canonicalize(id(5), id(6)), 3));
          return null;
        });

    List<TrustLine> page = store.linesOf(a, 0, 10);
    assertEquals(List.of(1L, 2L), page.stream().map(TrustLine::id).toList());
    assertEquals(List.of(2L), store.linesOf(a, 1, 10).stream().map(TrustLine::id).toList());
  }

  @Test
  void serviceRunsEndToEndOverJdbc() {
    TrustLinesImpl lines =
        new TrustLinesImpl(
            store,
            events,
            mock(Metrics.class),
            new Governance(id(99)),
            Clock.fixed(Instant.ofEpochSecond(1_000L), ZoneOffset.UTC));
    AccountId a = id(1);
    AccountId b = id(2);
    AccountId c = id(3);

    assertTrue(lines.create(RequestContext.of(a), b, 0, 5000, 5000, true).ok());
    assertTrue(lines.create(RequestContext.of(c), b, 0, 5000, 5000, true).ok());

    RippleResult ok = lines.ripple(RequestContext.of(a), c, List.of(b), 2000);
    assertTrue(ok.ok(), () -> "ripple failed: " + ok.result());
    assertEquals(2000L, lines.balance(a, b).value());
    assertEquals(1998L, lines.balance(b, c).value());

    RippleResult tooMuch = lines.ripple(RequestContext.of(a), c, List.of(b), 4000);
    assertFalse(tooMuch.ok());
    assertEquals(ErrorCode.INSUFFICIENT_CREDIT, tooMuch.code());
    assertEquals(2000L, lines.balance(a, b).value());

    OperationResult dup = lines.create(RequestContext.of(b), a, 0, 1, 1, false);
    assertEquals(ErrorCode.TRUST_LINE_EXISTS, dup.code());
    assertEquals(2L, lines.trustLineCount());

    assertTrue(lines.freeze(RequestContext.of(id(99)), a, b).ok());
    assertTrue(lines.trustLine(a, b).value().frozen());
    assertEquals(2000L, lines.trustLine(a, b).value().balance());
  }
}
