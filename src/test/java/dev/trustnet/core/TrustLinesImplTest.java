/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import static dev.trustnet.core.TestAccounts.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.AvailableCredit;
import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.Lookup;
import dev.trustnet.api.OperationResult;
import dev.trustnet.api.RequestContext;
import dev.trustnet.api.RippleResult;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.events.TrustLineEvents.BalanceChangedEvent;
import dev.trustnet.api.events.TrustLineEvents.Change;
import dev.trustnet.api.events.TrustLineEvents.LineUpdatedEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrustLinesImplTest {
  private static final AccountId ADMIN = id(900);
  private static final AccountId A = id(1);
  private static final AccountId B = id(2);
  private static final AccountId C = id(3);
  private static final AccountId D = id(4);
  private static final long NOW = 1_700_000_000L;

  private InMemoryTrustLineStore store;
  private EventBus events;
  private Metrics metrics;
  private TrustLinesImpl lines;

  @BeforeEach
  void setUp() {
    store = new InMemoryTrustLineStore();
    events = new EventBus();
    metrics = mock(Metrics.class);
    lines =
        new TrustLinesImpl(
            store,
            events,
            metrics,
            new Governance(ADMIN),
            Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
  }

  @AfterEach
  void tearDown() {
    events.close();
  }

  private void open(AccountId p, AccountId q, long limitLo, long limitHi, boolean rippling) {
    OperationResult r = lines.create(RequestContext.of(p), q, 0, limitLo, limitHi, rippling);
    assertTrue(r.ok(), () -> "create failed: " + r);
  }

  private long balance(AccountId caller, AccountId counterparty) {
    Lookup<Long> b = lines.balance(caller, counterparty);
    assertTrue(b.ok(), () -> "balance failed: " + b);
    return b.value();
  }

  @Test
  void createAssignsSequentialIdsAndParityQualities() {
    open(A, B, 1000, 500, false);
    open(C, A, 10, 10, true);

    TrustLine first = lines.trustLine(B, A).value();
    TrustLine second = lines.trustLine(A, C).value();
    assertEquals(1L, first.id());
    assertEquals(2L, second.id());
    assertEquals(TrustLine.QUALITY_SCALE, first.qualityIn());
    assertEquals(TrustLine.QUALITY_SCALE, first.qualityOut());
    assertEquals(0L, first.balance());
    assertEquals(NOW, first.createdAtS());
    assertEquals(2L, lines.trustLineCount());
  }

  @Test
  void createRejectsBadInput() {
    RequestContext a = RequestContext.of(A);
    assertEquals(ErrorCode.SELF_TRUST_LINE, lines.create(a, A, 0, 10, 10, false).code());
    assertEquals(ErrorCode.INVALID_LIMIT, lines.create(a, B, 0, 0, 10, false).code());
    assertEquals(ErrorCode.INVALID_LIMIT, lines.create(a, B, 0, 10, -1, false).code());
    assertEquals(ErrorCode.INVALID_LIMIT, lines.create(a, B, -1, 10, 10, false).code());
    assertEquals(ErrorCode.INVALID_ACCOUNT, lines.create(a, null, 0, 10, 10, false).code());
    assertEquals(0L, lines.trustLineCount());
  }

  @Test
  void duplicateCreateIsRejectedInEitherDirection() {
    open(A, B, 1000, 500, false);

    OperationResult again = lines.create(RequestContext.of(B), A, 7, 1, 1, true);
    assertEquals(ErrorCode.TRUST_LINE_EXISTS, again.code());
    assertEquals(1000L, lines.trustLine(A, B).value().limitLo());
    assertEquals(1L, lines.trustLineCount());
  }

  @Test
  void sendThenSendBackRestoresZero() {
    open(A, B, 1000, 500, false);

    assertTrue(lines.send(RequestContext.of(A), B, 40).ok());
    assertEquals(40L, balance(A, B));
    assertEquals(-40L, balance(B, A));

    assertTrue(lines.send(RequestContext.of(B), A, 40).ok());
    assertEquals(0L, balance(A, B));
  }

  @Test
  void failedSendLeavesBalanceUntouched() {
    open(A, B, 1000, 500, false);
    assertTrue(lines.send(RequestContext.of(A), B, 600).ok());

    OperationResult r = lines.send(RequestContext.of(A), B, 1200);
    assertFalse(r.ok());
    assertEquals(ErrorCode.INSUFFICIENT_CREDIT, r.code());
    assertEquals(600L, balance(A, B));
    verify(metrics).recordOperation(Operation.SEND, false, ErrorCode.INSUFFICIENT_CREDIT);
  }

  @Test
  void sendValidatesAmountAndLine() {
    open(A, B, 1000, 500, false);
    assertEquals(ErrorCode.INVALID_AMOUNT, lines.send(RequestContext.of(A), B, 0).code());
    assertEquals(ErrorCode.INVALID_AMOUNT, lines.send(RequestContext.of(A), B, -3).code());
    assertEquals(ErrorCode.TRUST_LINE_NOT_FOUND, lines.send(RequestContext.of(A), C, 1).code());
    assertEquals(ErrorCode.SELF_TRUST_LINE, lines.send(RequestContext.of(A), A, 1).code());
  }

  @Test
  void creditReportsRoomOnBothSides() {
    open(A, B, 1000, 500, false);
    lines.send(RequestContext.of(A), B, 300);

    assertEquals(new AvailableCredit(700, 800), lines.credit(A, B).value());
    assertEquals(new AvailableCredit(800, 700), lines.credit(B, A).value());
  }

  @Test
  void rippleAppliesDecayPerHop() {
    open(A, B, 10_000, 10_000, true);
    open(B, C, 10_000, 10_000, true);
    open(C, D, 10_000, 10_000, true);

    RippleResult r = lines.ripple(RequestContext.of(A), D, List.of(B, C), 1000);

    assertTrue(r.ok(), () -> "ripple failed: " + r.result());
    assertEquals(3, r.legs().size());
    assertEquals(998L, r.delivered());
    assertEquals(1000L, balance(A, B));
    assertEquals(999L, balance(B, C));
    assertEquals(998L, balance(C, D));
    verify(metrics).recordRippleLegs(3);
  }

  @Test
  void threeHopsForwardDecayedAmounts() {
    AccountId e = id(5);
    open(A, B, 10_000, 10_000, true);
    open(B, C, 10_000, 10_000, true);
    open(C, D, 10_000, 10_000, true);
    open(D, e, 10_000, 10_000, true);

    RippleResult r = lines.ripple(RequestContext.of(A), e, List.of(B, C, D), 1000);

    assertTrue(r.ok(), () -> "ripple failed: " + r.result());
    assertEquals(
        List.of(1000L, 999L, 998L, 997L),
        r.legs().stream().map(RippleResult.Leg::amount).toList());
    assertEquals(997L, balance(D, e));
  }

  @Test
  void rippleIsAllOrNothing() {
    open(A, B, 10_000, 10_000, true);
    open(B, C, 10_000, 10_000, true);
    open(C, D, 100, 100, true);

    RippleResult r = lines.ripple(RequestContext.of(A), D, List.of(B, C), 1000);

    assertFalse(r.ok());
    assertEquals(ErrorCode.INSUFFICIENT_CREDIT, r.code());
    assertEquals(0L, balance(A, B));
    assertEquals(0L, balance(B, C));
    assertEquals(0L, balance(C, D));
    verify(metrics, never()).recordRippleLegs(anyInt());
  }

  @Test
  void rippleNeedsRipplingOnIntermediateLegs() {
    open(A, B, 10_000, 10_000, true);
    open(B, C, 10_000, 10_000, false);
    open(C, D, 10_000, 10_000, true);

    RippleResult r = lines.ripple(RequestContext.of(A), D, List.of(B, C), 100);

    assertEquals(ErrorCode.RIPPLING_DISABLED, r.code());
    assertEquals(0L, balance(A, B));
    assertEquals(0L, balance(C, D));
  }

  @Test
  void endpointLinesMayRippleWithRipplingOff() {
    open(A, B, 10_000, 10_000, false);
    open(B, C, 10_000, 10_000, false);

    RippleResult single = lines.ripple(RequestContext.of(A), C, List.of(B), 1000);

    assertTrue(single.ok(), () -> "ripple failed: " + single.result());
    assertEquals(1000L, balance(A, B));
    assertEquals(999L, balance(B, C));

    open(C, D, 10_000, 10_000, false);
    assertTrue(lines.setRippling(RequestContext.of(B), C, true).ok());

    RippleResult twoHops = lines.ripple(RequestContext.of(A), D, List.of(B, C), 1000);
    assertTrue(twoHops.ok(), () -> "ripple failed: " + twoHops.result());
    assertEquals(998L, balance(C, D));
  }

  @Test
  void rippleRejectsMalformedPaths() {
    open(A, B, 10_000, 10_000, true);
    open(B, C, 10_000, 10_000, true);

    assertEquals(
        ErrorCode.INVALID_PATH, lines.ripple(RequestContext.of(A), C, List.of(), 10).code());
    assertEquals(
        ErrorCode.TRUST_LINE_NOT_FOUND,
        lines.ripple(RequestContext.of(A), D, List.of(B), 10).code());
    assertEquals(
        ErrorCode.INVALID_AMOUNT, lines.ripple(RequestContext.of(A), C, List.of(B), 1).code());
  }

  @Test
  void qualityUpdatesAreValidatedAndStored() {
    open(A, B, 1000, 500, false);

    assertEquals(
        ErrorCode.INVALID_QUALITY,
        lines.updateQuality(RequestContext.of(A), B, 0, 1_000_000).code());
    assertEquals(
        ErrorCode.INVALID_QUALITY,
        lines.updateQuality(RequestContext.of(A), B, 1_000_001, 1).code());
    assertTrue(lines.updateQuality(RequestContext.of(B), A, 990_000, 1_000_000).ok());

    TrustLine line = lines.trustLine(A, B).value();
    assertEquals(990_000L, line.qualityIn());
    assertEquals(1_000_000L, line.qualityOut());
  }

  @Test
  void limitChangesNeedBothSignatures() {
    open(A, B, 1000, 500, false);

    assertEquals(
        ErrorCode.MISSING_COSIGNATURE,
        lines.updateLimits(RequestContext.of(A), B, 2000, 2000).code());
    assertTrue(lines.updateLimits(RequestContext.cosigned(A, B), B, 2000, 1500).ok());

    TrustLine line = lines.trustLine(A, B).value();
    assertEquals(2000L, line.limitLo());
    assertEquals(1500L, line.limitHi());
  }

  @Test
  void limitsCannotDropBelowExposure() {
    open(A, B, 1000, 500, false);
    lines.send(RequestContext.of(A), B, 600);

    assertEquals(
        ErrorCode.LIMIT_BELOW_EXPOSURE,
        lines.updateLimits(RequestContext.cosigned(A, B), B, 599, 500).code());
    assertTrue(lines.updateLimits(RequestContext.cosigned(B, A), A, 600, 1).ok());
  }

  @Test
  void freezeIsAdminOnlyAndKeepsBalance() {
    open(A, B, 1000, 500, true);
    lines.send(RequestContext.of(A), B, 250);

    assertEquals(ErrorCode.UNAUTHORIZED, lines.freeze(RequestContext.of(A), A, B).code());
    assertTrue(lines.freeze(RequestContext.of(ADMIN), B, A).ok());

    TrustLine frozen = lines.trustLine(A, B).value();
    assertTrue(frozen.frozen());
    assertFalse(frozen.allowRippling());
    assertEquals(250L, frozen.balance());

    assertEquals(ErrorCode.TRUST_LINE_FROZEN, lines.send(RequestContext.of(B), A, 1).code());
    assertEquals(
        ErrorCode.TRUST_LINE_FROZEN, lines.setRippling(RequestContext.of(A), B, true).code());
    assertEquals(
        ErrorCode.TRUST_LINE_FROZEN,
        lines.updateLimits(RequestContext.cosigned(A, B), B, 10, 10).code());
    assertTrue(lines.setRippling(RequestContext.of(A), B, false).ok());
  }

  @Test
  void frozenLineReportsNoCredit() {
    open(A, B, 1000, 500, true);
    lines.send(RequestContext.of(A), B, 600);
    assertTrue(lines.freeze(RequestContext.of(ADMIN), A, B).ok());

    assertEquals(new AvailableCredit(0, 0), lines.credit(A, B).value());
    assertEquals(new AvailableCredit(0, 0), lines.credit(B, A).value());
    assertEquals(ErrorCode.TRUST_LINE_FROZEN, lines.send(RequestContext.of(B), A, 600).code());
    assertEquals(600L, lines.trustLine(A, B).value().balance());
  }

  @Test
  void creditorSettlesTowardsZero() {
    open(A, B, 1000, 500, false);
    lines.send(RequestContext.of(A), B, 400);

    assertTrue(lines.settle(RequestContext.of(A), B, 150).ok());
    assertEquals(250L, balance(A, B));
    assertEquals(-250L, balance(B, A));

    assertEquals(ErrorCode.INVALID_AMOUNT, lines.settle(RequestContext.of(A), B, 251).code());
    assertEquals(ErrorCode.INVALID_AMOUNT, lines.settle(RequestContext.of(B), A, 1).code());
    assertEquals(ErrorCode.INVALID_AMOUNT, lines.settle(RequestContext.of(A), B, 0).code());
    assertEquals(250L, balance(A, B));

    assertTrue(lines.settle(RequestContext.of(A), B, 250).ok());
    assertEquals(0L, balance(A, B));
    verify(metrics, times(2)).recordOperation(Operation.SETTLE, true, null);
  }

  @Test
  void settlementWindsDownAFrozenLine() {
    open(A, B, 1000, 500, true);
    lines.send(RequestContext.of(B), A, 300);
    assertTrue(lines.freeze(RequestContext.of(ADMIN), A, B).ok());

    assertTrue(lines.settle(RequestContext.of(B), A, 300).ok());

    TrustLine line = lines.trustLine(A, B).value();
    assertTrue(line.frozen());
    assertEquals(0L, line.balance());
  }

  @Test
  void settlementIsPublishedAsBalanceChange() throws Exception {
    List<BalanceChangedEvent> moved = new CopyOnWriteArrayList<>();
    CountDownLatch latch = new CountDownLatch(2);
    events.onBalanceChanged(
        e -> {
          moved.add(e);
          latch.countDown();
        });

    open(A, B, 1000, 500, false);
    lines.send(RequestContext.of(A), B, 40);
    lines.settle(RequestContext.of(A), B, 40);

    assertTrue(latch.await(5, TimeUnit.SECONDS));
    assertEquals("settle", moved.get(1).op());
    assertEquals(40L, moved.get(1).oldBalance());
    assertEquals(0L, moved.get(1).newBalance());
  }

  @Test
  void freezeOfMissingLineIsNotFound() {
    assertEquals(
        ErrorCode.TRUST_LINE_NOT_FOUND, lines.freeze(RequestContext.of(ADMIN), A, B).code());
  }

  @Test
  void readsNeverMutate() {
    open(A, B, 1000, 500, false);
    lines.send(RequestContext.of(A), B, 10);
    TrustLine before = lines.trustLine(A, B).value();

    lines.balance(A, B);
    lines.credit(B, A);
    lines.linesOf(A, 0, 10);
    lines.trustLineCount();

    assertEquals(before, lines.trustLine(A, B).value());
    assertEquals(1L, lines.trustLineCount());
    verify(metrics).recordOperation(Operation.BALANCE, true, null);
    verify(metrics, never()).recordOperation(Operation.SEND, false, null);
  }

  @Test
  void linesOfPagesByIdAndClampsLimit() {
    open(A, B, 10, 10, false);
    open(A, C, 10, 10, false);
    open(C, D, 10, 10, false);
    open(D, A, 10, 10, false);

    List<TrustLine> first = lines.linesOf(A, 0, 2).value();
    assertEquals(List.of(1L, 2L), first.stream().map(TrustLine::id).toList());

    List<TrustLine> rest = lines.linesOf(A, 2, 0).value();
    assertEquals(List.of(4L), rest.stream().map(TrustLine::id).toList());

    assertEquals(ErrorCode.INVALID_ACCOUNT, lines.linesOf(null, 0, 10).code());
  }

  @Test
  void lookupsOnMissingLinesFail() {
    assertEquals(ErrorCode.TRUST_LINE_NOT_FOUND, lines.balance(A, B).code());
    assertEquals(ErrorCode.TRUST_LINE_NOT_FOUND, lines.credit(A, B).code());
    assertEquals(ErrorCode.TRUST_LINE_NOT_FOUND, lines.trustLine(A, B).code());
    assertEquals(ErrorCode.SELF_TRUST_LINE, lines.balance(A, A).code());
  }

  @Test
  void eventsArePublishedAfterCommit() throws Exception {
    List<BalanceChangedEvent> moved = new CopyOnWriteArrayList<>();
    List<LineUpdatedEvent> updated = new CopyOnWriteArrayList<>();
    CountDownLatch latch = new CountDownLatch(3);
    events.onBalanceChanged(
        e -> {
          moved.add(e);
          latch.countDown();
        });
    events.onLineUpdated(
        e -> {
          updated.add(e);
          latch.countDown();
        });

    open(A, B, 1000, 500, true);
    lines.send(RequestContext.of(A), B, 5000);
    lines.send(RequestContext.of(A), B, 5);
    lines.send(RequestContext.of(B), A, 7);
    lines.setRippling(RequestContext.of(B), A, false);

    assertTrue(latch.await(5, TimeUnit.SECONDS));
    assertEquals(2, moved.size());
    assertEquals(0L, moved.get(0).oldBalance());
    assertEquals(5L, moved.get(0).newBalance());
    assertEquals(-2L, moved.get(1).newBalance());
    assertEquals("send", moved.get(1).op());
    assertEquals(Change.RIPPLING, updated.get(0).change());
  }
}
