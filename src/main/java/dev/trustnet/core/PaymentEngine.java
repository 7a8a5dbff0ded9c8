/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.TrustLineException;

/**
 * Single-hop balance mutation rules.
 *
 * <p>A payment of {@code amount} by {@code sender} moves the balance by {@code amount} towards
 * the sender's side: up when the sender is {@code lo}, down when it is {@code hi}. The move is
 * admissible only if the result stays within {@code [-limitHi, limitLo]}. Nothing here writes to
 * a store; callers persist the returned snapshot.
 */
public final class PaymentEngine {

  /**
   * Rejects non-positive amounts.
   *
   * @param amount amount to check
   * @throws TrustLineException {@link ErrorCode#INVALID_AMOUNT}
   */
  public static void requirePositive(long amount) {
    if (amount <= 0) {
      throw new TrustLineException(ErrorCode.INVALID_AMOUNT, "amount must be > 0");
    }
  }

  /**
   * Balance after {@code sender} pays {@code amount}, without checking the limits.
   *
   * @param line current line
   * @param sender paying party
   * @param amount positive amount
   * @return candidate balance
   * @throws TrustLineException {@link ErrorCode#ARITHMETIC_OVERFLOW} on signed overflow
   */
  public long resultingBalance(TrustLine line, AccountId sender, long amount) {
    int direction = Canonicalizer.direction(line.pair(), sender);
    try {
      return direction > 0
          ? Math.addExact(line.balance(), amount)
          : Math.subtractExact(line.balance(), amount);
    } catch (ArithmeticException e) {
      throw new TrustLineException(ErrorCode.ARITHMETIC_OVERFLOW, "balance would overflow", e);
    }
  }

  /**
   * Validates a payment and returns the line with the new balance.
   *
   * @param line current line
   * @param sender paying party, one of the line's two parties
   * @param amount amount to pay
   * @param nowS mutation time, epoch seconds
   * @return line after the payment
   * @throws TrustLineException {@link ErrorCode#INVALID_AMOUNT}, {@link
   *     ErrorCode#TRUST_LINE_FROZEN}, {@link ErrorCode#ARITHMETIC_OVERFLOW} or {@link
   *     ErrorCode#INSUFFICIENT_CREDIT}
   */
  public TrustLine apply(TrustLine line, AccountId sender, long amount, long nowS) {
    requirePositive(amount);
    if (line.frozen()) {
      throw new TrustLineException(ErrorCode.TRUST_LINE_FROZEN, "trust line is frozen");
    }
    long newBalance = resultingBalance(line, sender, amount);
    if (!line.admits(newBalance)) {
      throw new TrustLineException(
          ErrorCode.INSUFFICIENT_CREDIT,
          "balance " + newBalance + " outside [-" + line.limitHi() + ", " + line.limitLo() + "]");
    }
    return line.withBalance(newBalance, nowS);
  }

  /**
   * Records that the counterparty paid {@code creditor} back {@code amount} outside the ledger.
   *
   * <p>The creditor's claim shrinks by {@code amount} and may reach zero but never change sign,
   * so the balance only moves towards zero. Frozen lines accept settlements; this is how a frozen
   * line is wound down.
   *
   * @param line current line
   * @param creditor party owed money, one of the line's two parties
   * @param amount amount settled
   * @param nowS mutation time, epoch seconds
   * @return line after the settlement
   * @throws TrustLineException {@link ErrorCode#INVALID_AMOUNT} if {@code amount} is not
   *     positive or exceeds what the counterparty owes {@code creditor}
   */
  public TrustLine settle(TrustLine line, AccountId creditor, long amount, long nowS) {
    requirePositive(amount);
    int direction = Canonicalizer.direction(line.pair(), creditor);
    // Balance is bounded by the limits, so its negation cannot overflow.
    long claim = direction > 0 ? line.balance() : -line.balance();
    if (amount > claim) {
      throw new TrustLineException(
          ErrorCode.INVALID_AMOUNT,
          "settlement of " + amount + " exceeds outstanding claim " + Math.max(claim, 0L));
    }
    long newBalance = direction > 0 ? line.balance() - amount : line.balance() + amount;
    return line.withBalance(newBalance, nowS);
  }
}
