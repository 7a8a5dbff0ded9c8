/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.RippleResult.Leg;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.TrustLineException;
import dev.trustnet.api.TrustLines;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Multi-hop payments over a caller-supplied path.
 *
 * <p>The path is {@code [sender, hop1, ..., hopN, recipient]}; leg {@code k} is the trust line
 * between path entries {@code k} and {@code k + 1} and moves {@code forwarded[k]}, where {@code
 * forwarded[0] = amount} and each later entry keeps {@value #DECAY_NUMERATOR}/{@value
 * #DECAY_SCALE} of the previous one, rounded down.
 *
 * <p>Only legs strictly between two hops need {@code allowRippling}; see {@link
 * #isIntermediate}.
 *
 * <p>{@link #plan} is phase one: it locks every line on the path in canonical order and checks
 * all legs against a staged copy, writing nothing. {@link #commit} is phase two and is only
 * reachable with a plan whose every leg passed.
 */
public final class RipplingEngine {
  /** Share of the amount each hop forwards, scaled by {@link #DECAY_SCALE}. */
  public static final long DECAY_NUMERATOR = 999_000L;

  public static final long DECAY_SCALE = 1_000_000L;

  private final PaymentEngine payments;

  public RipplingEngine(PaymentEngine payments) {
    this.payments = Objects.requireNonNull(payments, "payments");
  }

  /**
   * Amount moved by each leg.
   *
   * @param amount amount leaving the sender
   * @param legs number of legs (hops + 1)
   * @return {@code legs} amounts, first one equal to {@code amount}
   * @throws TrustLineException {@link ErrorCode#ARITHMETIC_OVERFLOW} if the decay product
   *     overflows, {@link ErrorCode#INVALID_AMOUNT} if a leg decays to zero
   */
  public static List<Long> forwardedAmounts(long amount, int legs) {
    PaymentEngine.requirePositive(amount);
    List<Long> out = new ArrayList<>(legs);
    long current = amount;
    for (int k = 0; k < legs; k++) {
      if (k > 0) {
        try {
          current = Math.multiplyExact(current, DECAY_NUMERATOR) / DECAY_SCALE;
        } catch (ArithmeticException e) {
          throw new TrustLineException(
              ErrorCode.ARITHMETIC_OVERFLOW, "decay of " + current + " would overflow", e);
        }
        if (current <= 0) {
          throw new TrustLineException(
              ErrorCode.INVALID_AMOUNT, "amount decays to zero at leg " + k);
        }
      }
      out.add(current);
    }
    return out;
  }

  /**
   * Builds the full path and rejects malformed ones.
   *
   * @param sender paying party
   * @param hops intermediate participants
   * @param recipient final recipient
   * @return {@code [sender, hops..., recipient]}
   */
  public static List<AccountId> path(AccountId sender, List<AccountId> hops, AccountId recipient) {
    if (hops == null || hops.isEmpty() || hops.size() > TrustLines.MAX_HOPS) {
      throw new TrustLineException(
          ErrorCode.INVALID_PATH, "path needs 1 to " + TrustLines.MAX_HOPS + " hops");
    }
    List<AccountId> path = new ArrayList<>(hops.size() + 2);
    path.add(sender);
    path.addAll(hops);
    path.add(recipient);
    for (int i = 0; i < path.size(); i++) {
      if (path.get(i) == null) {
        throw new TrustLineException(ErrorCode.INVALID_ACCOUNT, "path entry " + i + " missing");
      }
      if (i > 0 && path.get(i).equals(path.get(i - 1))) {
        throw new TrustLineException(
            ErrorCode.INVALID_PATH, "path entry " + i + " repeats its predecessor");
      }
    }
    return path;
  }

  /**
   * Phase one: validates every leg without writing.
   *
   * <p>Legs that revisit a pair are checked against the balance left by the earlier leg, so the
   * plan is admissible as a whole and not only leg by leg.
   *
   * @param tx unit of work used to lock the lines
   * @param sender paying party
   * @param hops intermediate participants
   * @param recipient final recipient
   * @param amount amount leaving the sender
   * @param nowS mutation time, epoch seconds
   * @return admissible plan
   * @throws TrustLineException on the first leg that fails, with nothing written
   */
  public Plan plan(
      TrustLineStore.Transaction tx,
      AccountId sender,
      List<AccountId> hops,
      AccountId recipient,
      long amount,
      long nowS) {
    List<AccountId> path = path(sender, hops, recipient);
    int legCount = path.size() - 1;
    List<Long> amounts = forwardedAmounts(amount, legCount);

    List<CanonicalPair> pairs = new ArrayList<>(legCount);
    for (int k = 0; k < legCount; k++) {
      pairs.add(Canonicalizer.canonicalize(path.get(k), path.get(k + 1)));
    }

    Map<CanonicalPair, TrustLine> staged = new HashMap<>();
    for (CanonicalPair pair : new TreeSet<>(pairs)) {
      TrustLine line =
          tx.lockLine(pair)
              .orElseThrow(
                  () ->
                      new TrustLineException(
                          ErrorCode.TRUST_LINE_NOT_FOUND, "no trust line for " + pair));
      staged.put(pair, line);
    }

    List<LegOutcome> outcomes = new ArrayList<>(legCount);
    for (int k = 0; k < legCount; k++) {
      CanonicalPair pair = pairs.get(k);
      TrustLine before = staged.get(pair);
      if (isIntermediate(k, legCount) && !before.allowRippling()) {
        throw new TrustLineException(
            ErrorCode.RIPPLING_DISABLED, "rippling disabled on " + pair + " (leg " + k + ")");
      }
      TrustLine after;
      try {
        after = payments.apply(before, path.get(k), amounts.get(k), nowS);
      } catch (TrustLineException e) {
        throw new TrustLineException(
            e.errorCode(), "leg " + k + " on " + pair + ": " + e.getMessage(), e);
      }
      staged.put(pair, after);
      outcomes.add(
          new LegOutcome(
              new Leg(path.get(k), path.get(k + 1), amounts.get(k)),
              after,
              before.balance(),
              after.balance()));
    }
    return new Plan(outcomes, List.copyOf(staged.values()));
  }

  /**
   * Whether leg {@code k} runs between two hops. The sender's first line and the recipient's last
   * line carry the payment without rippling through either endpoint.
   */
  static boolean isIntermediate(int k, int legCount) {
    return k > 0 && k < legCount - 1;
  }

  /**
   * Phase two: writes every line of an admissible plan.
   *
   * @param tx the unit of work {@code plan} was built in
   * @param plan admissible plan
   */
  public void commit(TrustLineStore.Transaction tx, Plan plan) {
    for (TrustLine line : plan.lines()) {
      tx.update(line);
    }
  }

  /**
   * Validated multi-hop payment.
   *
   * @param legs per-leg outcome in path order
   * @param lines final state of every distinct line touched
   */
  public record Plan(List<LegOutcome> legs, List<TrustLine> lines) {
    public Plan {
      legs = List.copyOf(legs);
      lines = List.copyOf(lines);
    }

    public List<Leg> movedLegs() {
      List<Leg> out = new ArrayList<>(legs.size());
      for (LegOutcome outcome : legs) {
        out.add(outcome.leg());
      }
      return out;
    }
  }

  /**
   * One leg after validation.
   *
   * @param leg payer, payee and amount
   * @param line line state after this leg
   * @param oldBalance balance before this leg
   * @param newBalance balance after this leg
   */
  public record LegOutcome(Leg leg, TrustLine line, long oldBalance, long newBalance) {}
}
