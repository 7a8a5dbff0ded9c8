/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.AvailableCredit;
import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.Lookup;
import dev.trustnet.api.OperationResult;
import dev.trustnet.api.RequestContext;
import dev.trustnet.api.RippleResult;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.TrustLineException;
import dev.trustnet.api.TrustLines;
import dev.trustnet.api.events.TrustLineEvents.BalanceChangedEvent;
import dev.trustnet.api.events.TrustLineEvents.Change;
import dev.trustnet.api.events.TrustLineEvents.Event;
import dev.trustnet.api.events.TrustLineEvents.LineCreatedEvent;
import dev.trustnet.api.events.TrustLineEvents.LineUpdatedEvent;
import dev.trustnet.util.TokenBucketRateLimiter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TrustLines} over a {@link TrustLineStore}.
 *
 * <p>Each mutation runs inside one store unit of work: the line is locked, the engines compute
 * the new state, and the writes commit together. Any {@link TrustLineException} raised on the
 * way aborts the unit, so a failed request never leaves a trace in the store. Events are
 * published only after commit.
 */
public final class TrustLinesImpl implements TrustLines {
  private static final Logger LOG = LoggerFactory.getLogger("trustnet");
  private static final int MAX_PAGE = 100;

  private final TrustLineStore store;
  private final EventBus events;
  private final Metrics metrics;
  private final PaymentEngine payments;
  private final RipplingEngine rippling;
  private final AdminGovernor governor;
  private final Clock clock;
  private final TokenBucketRateLimiter<RejectionKey> rejectionLog =
      new TokenBucketRateLimiter<>(4, 0.5);

  /**
   * Creates the service.
   *
   * @param store trust line storage
   * @param events bus receiving committed changes
   * @param metrics operation counters
   * @param governance administrator identity captured at initialization
   * @param clock time source for audit timestamps
   */
  public TrustLinesImpl(
      TrustLineStore store, EventBus events, Metrics metrics, Governance governance, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.events = Objects.requireNonNull(events, "events");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.governor = new AdminGovernor(governance);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.payments = new PaymentEngine();
    this.rippling = new RipplingEngine(payments);
  }

  @Override
  public OperationResult create(
      RequestContext ctx,
      AccountId counterparty,
      long assetId,
      long limitLo,
      long limitHi,
      boolean allowRippling) {
    return mutate(
        Operation.CREATE,
        ctx,
        tx -> {
          CanonicalPair pair = Canonicalizer.canonicalize(ctx.caller(), counterparty);
          LineRules.checkOpening(assetId, limitLo, limitHi);
          if (tx.lockLine(pair).isPresent()) {
            throw new TrustLineException(
                ErrorCode.TRUST_LINE_EXISTS, "trust line already exists for " + pair);
          }
          long id = tx.increment(GlobalField.TRUST_LINE_COUNT);
          TrustLine line =
              TrustLine.open(pair, id, assetId, limitLo, limitHi, allowRippling, nowS());
          tx.insert(line);
          return List.of(
              new LineCreatedEvent(pair, id, assetId, limitLo, limitHi, allowRippling));
        });
  }

  @Override
  public OperationResult send(RequestContext ctx, AccountId recipient, long amount) {
    return mutate(
        Operation.SEND,
        ctx,
        tx -> {
          PaymentEngine.requirePositive(amount);
          TrustLine before = lockExisting(tx, ctx.caller(), recipient);
          TrustLine after = payments.apply(before, ctx.caller(), amount, nowS());
          tx.update(after);
          return List.of(
              new BalanceChangedEvent(
                  after.pair(), after.id(), before.balance(), after.balance(), "send"));
        });
  }

  @Override
  public OperationResult settle(RequestContext ctx, AccountId counterparty, long amount) {
    return mutate(
        Operation.SETTLE,
        ctx,
        tx -> {
          PaymentEngine.requirePositive(amount);
          TrustLine before = lockExisting(tx, ctx.caller(), counterparty);
          TrustLine after = payments.settle(before, ctx.caller(), amount, nowS());
          tx.update(after);
          return List.of(
              new BalanceChangedEvent(
                  after.pair(), after.id(), before.balance(), after.balance(), "settle"));
        });
  }

  @Override
  public RippleResult ripple(
      RequestContext ctx, AccountId recipient, List<AccountId> hops, long amount) {
    if (ctx == null) {
      return RippleResult.failure(ErrorCode.INVALID_ACCOUNT, "request context required");
    }
    try {
      RipplingEngine.Plan plan =
          store.inTransaction(
              tx -> {
                RipplingEngine.Plan p =
                    rippling.plan(tx, ctx.caller(), hops, recipient, amount, nowS());
                rippling.commit(tx, p);
                return p;
              });
      List<Event> published = new ArrayList<>(plan.legs().size());
      for (RipplingEngine.LegOutcome leg : plan.legs()) {
        published.add(
            new BalanceChangedEvent(
                leg.line().pair(), leg.line().id(), leg.oldBalance(), leg.newBalance(), "ripple"));
      }
      published.forEach(events::fire);
      metrics.recordRippleLegs(plan.legs().size());
      metrics.recordOperation(Operation.RIPPLE, true, null);
      LOG.debug(
          "(trustnet) op={} caller={} hops={} amount={} delivered={}",
          Operation.RIPPLE,
          ctx.caller(),
          hops.size(),
          amount,
          plan.legs().get(plan.legs().size() - 1).leg().amount());
      return RippleResult.success(plan.movedLegs());
    } catch (TrustLineException e) {
      rejected(Operation.RIPPLE, e);
      return RippleResult.failure(e.errorCode(), e.getMessage());
    } catch (StoreException e) {
      storageFailure(Operation.RIPPLE, e);
      return RippleResult.failure(e.errorCode(), "storage error");
    }
  }

  @Override
  public OperationResult updateQuality(
      RequestContext ctx, AccountId counterparty, long qualityIn, long qualityOut) {
    return mutate(
        Operation.QUALITY,
        ctx,
        tx -> {
          LineRules.checkQuality(qualityIn, qualityOut);
          TrustLine after =
              lockExisting(tx, ctx.caller(), counterparty)
                  .withQuality(qualityIn, qualityOut, nowS());
          tx.update(after);
          return List.of(new LineUpdatedEvent(after.pair(), Change.QUALITY, after));
        });
  }

  @Override
  public OperationResult setRippling(
      RequestContext ctx, AccountId counterparty, boolean allowRippling) {
    return mutate(
        Operation.RIPPLE_SET,
        ctx,
        tx -> {
          TrustLine after =
              LineRules.setRippling(
                  lockExisting(tx, ctx.caller(), counterparty), allowRippling, nowS());
          tx.update(after);
          return List.of(new LineUpdatedEvent(after.pair(), Change.RIPPLING, after));
        });
  }

  @Override
  public OperationResult updateLimits(
      RequestContext ctx, AccountId counterparty, long newLimitLo, long newLimitHi) {
    return mutate(
        Operation.LIMITS,
        ctx,
        tx -> {
          TrustLine after =
              LineRules.updateLimits(
                  ctx, lockExisting(tx, ctx.caller(), counterparty), newLimitLo, newLimitHi,
                  nowS());
          tx.update(after);
          return List.of(new LineUpdatedEvent(after.pair(), Change.LIMITS, after));
        });
  }

  @Override
  public OperationResult freeze(RequestContext ctx, AccountId p, AccountId q) {
    return mutate(
        Operation.FREEZE,
        ctx,
        tx -> {
          governor.requireAdmin(ctx);
          TrustLine before = lockExisting(tx, p, q);
          if (before.frozen() && !before.allowRippling()) {
            return List.of();
          }
          TrustLine after = governor.freeze(ctx, before, nowS());
          tx.update(after);
          LOG.info("(trustnet) op={} pair={} admin={}", Operation.FREEZE, after.pair(), ctx.caller());
          return List.of(new LineUpdatedEvent(after.pair(), Change.FREEZE, after));
        });
  }

  @Override
  public Lookup<Long> balance(AccountId caller, AccountId counterparty) {
    return query(
        Operation.BALANCE,
        () -> {
          TrustLine line = findExisting(caller, counterparty);
          return Canonicalizer.direction(line.pair(), caller) > 0
              ? line.balance()
              : Math.negateExact(line.balance());
        });
  }

  @Override
  public Lookup<AvailableCredit> credit(AccountId caller, AccountId counterparty) {
    return query(
        Operation.CREDIT,
        () -> {
          TrustLine line = findExisting(caller, counterparty);
          if (line.frozen()) {
            return new AvailableCredit(0L, 0L);
          }
          // Room for the balance to rise towards limitLo, and to fall towards -limitHi.
          long up = room(line.limitLo(), line.balance());
          long down = room(line.limitHi(), -line.balance());
          return Canonicalizer.direction(line.pair(), caller) > 0
              ? new AvailableCredit(up, down)
              : new AvailableCredit(down, up);
        });
  }

  @Override
  public Lookup<TrustLine> trustLine(AccountId p, AccountId q) {
    return query(Operation.GET, () -> findExisting(p, q));
  }

  @Override
  public Lookup<List<TrustLine>> linesOf(AccountId account, long afterId, int limit) {
    return query(
        Operation.LINES,
        () -> {
          if (account == null) {
            throw new TrustLineException(ErrorCode.INVALID_ACCOUNT, "account required");
          }
          int page = Math.max(1, Math.min(MAX_PAGE, limit));
          return store.linesOf(account, Math.max(0L, afterId), page);
        });
  }

  @Override
  public long trustLineCount() {
    return store.read(GlobalField.TRUST_LINE_COUNT);
  }

  private OperationResult mutate(Operation op, RequestContext ctx, Mutation work) {
    if (ctx == null) {
      metrics.recordOperation(op, false, ErrorCode.INVALID_ACCOUNT);
      return OperationResult.failure(ErrorCode.INVALID_ACCOUNT, "request context required");
    }
    try {
      List<Event> committed = store.inTransaction(work::run);
      committed.forEach(events::fire);
      metrics.recordOperation(op, true, null);
      return OperationResult.success();
    } catch (TrustLineException e) {
      rejected(op, e);
      return OperationResult.failure(e.errorCode(), e.getMessage());
    } catch (StoreException e) {
      storageFailure(op, e);
      return OperationResult.failure(e.errorCode(), "storage error");
    }
  }

  private <T> Lookup<T> query(Operation op, Read<T> read) {
    try {
      T value = read.run();
      metrics.recordOperation(op, true, null);
      return Lookup.found(value);
    } catch (TrustLineException e) {
      metrics.recordOperation(op, false, e.errorCode());
      return Lookup.failure(e.errorCode(), e.getMessage());
    } catch (ArithmeticException e) {
      metrics.recordOperation(op, false, ErrorCode.ARITHMETIC_OVERFLOW);
      return Lookup.failure(ErrorCode.ARITHMETIC_OVERFLOW, e.getMessage());
    } catch (StoreException e) {
      storageFailure(op, e);
      return Lookup.failure(e.errorCode(), "storage error");
    }
  }

  private TrustLine lockExisting(TrustLineStore.Transaction tx, AccountId p, AccountId q) {
    return existing(Canonicalizer.canonicalize(p, q), tx::lockLine);
  }

  private TrustLine findExisting(AccountId p, AccountId q) {
    return existing(Canonicalizer.canonicalize(p, q), store::find);
  }

  private static TrustLine existing(
      CanonicalPair pair, Function<CanonicalPair, Optional<TrustLine>> reader) {
    return reader
        .apply(pair)
        .orElseThrow(
            () -> new TrustLineException(ErrorCode.TRUST_LINE_NOT_FOUND, "no trust line for " + pair));
  }

  private static long room(long limit, long signedBalance) {
    try {
      return Math.max(0L, Math.subtractExact(limit, signedBalance));
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private long nowS() {
    return clock.instant().getEpochSecond();
  }

  private void rejected(Operation op, TrustLineException e) {
    metrics.recordOperation(op, false, e.errorCode());
    if (rejectionLog.tryAcquire(new RejectionKey(op, e.errorCode()))) {
      LOG.info(
          "(trustnet) code={} op={} message={}", e.errorCode(), op, e.getMessage());
    }
  }

  private void storageFailure(Operation op, StoreException e) {
    metrics.recordOperation(op, false, e.errorCode());
    LOG.warn(
        "(trustnet) code={} op={} store={} message={}",
        e.errorCode(),
        op,
        e.op(),
        e.getMessage(),
        e);
  }

  @FunctionalInterface
  private interface Mutation {
    List<Event> run(TrustLineStore.Transaction tx);
  }

  @FunctionalInterface
  private interface Read<T> {
    T run();
  }

  private record RejectionKey(Operation op, ErrorCode code) {}
}
