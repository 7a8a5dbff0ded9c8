/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import java.util.List;

/**
 * Operation catalog of the bilateral credit network.
 *
 * <p>Every mutation is one atomic transaction: either all preconditions hold and every write
 * commits, or nothing changes and the result carries an {@link ErrorCode}. The pair a mutation
 * touches is always {@code (ctx.caller(), counterparty)} in canonical order, except for the
 * administrator's {@link #freeze}.
 */
public interface TrustLines {
  /** Maximum number of intermediate hops accepted by {@link #ripple}. */
  int MAX_HOPS = 6;

  /**
   * Opens a trust line between the caller and {@code counterparty}.
   *
   * <p>{@code limitLo} and {@code limitHi} are interpreted in canonical roles, independent of
   * which side submits the request.
   *
   * @param ctx request identity
   * @param counterparty other party
   * @param assetId denominated asset (must be {@code >= 0})
   * @param limitLo maximum positive balance (must be {@code > 0})
   * @param limitHi maximum magnitude of a negative balance (must be {@code > 0})
   * @param allowRippling whether the line may carry multi-hop payments
   * @return outcome; {@link ErrorCode#TRUST_LINE_EXISTS} for a duplicate pair
   */
  OperationResult create(
      RequestContext ctx,
      AccountId counterparty,
      long assetId,
      long limitLo,
      long limitHi,
      boolean allowRippling);

  /**
   * Pays {@code amount} from the caller to {@code recipient} over their direct line.
   *
   * @param ctx request identity (the sender)
   * @param recipient receiving party
   * @param amount amount (must be {@code > 0})
   * @return outcome; {@link ErrorCode#INSUFFICIENT_CREDIT} if a limit would be exceeded
   */
  OperationResult send(RequestContext ctx, AccountId recipient, long amount);

  /**
   * Records that {@code counterparty} paid back {@code amount} of what it owes the caller
   * outside the ledger. The caller's claim shrinks and the balance moves towards zero without
   * crossing it. Allowed on frozen lines.
   *
   * @param ctx request identity (the creditor acknowledging the settlement)
   * @param counterparty debtor
   * @param amount amount settled (must be {@code > 0} and at most the outstanding claim)
   * @return outcome; {@link ErrorCode#INVALID_AMOUNT} if the claim is smaller than {@code amount}
   */
  OperationResult settle(RequestContext ctx, AccountId counterparty, long amount);

  /**
   * Pays through a caller-supplied chain of intermediate participants.
   *
   * <p>Each hop forwards {@code floor(previous * 999000 / 1000000)}. Every leg is validated
   * before any is written.
   *
   * @param ctx request identity (the sender)
   * @param recipient final recipient
   * @param hops intermediate participants, 1 to {@value #MAX_HOPS}
   * @param amount amount leaving the sender (must be {@code > 0})
   * @return outcome with the legs moved
   */
  RippleResult ripple(RequestContext ctx, AccountId recipient, List<AccountId> hops, long amount);

  /**
   * Overwrites both quality factors of the caller's line with {@code counterparty}.
   *
   * @param ctx request identity
   * @param counterparty other party
   * @param qualityIn inbound factor in {@code (0, 1_000_000]}
   * @param qualityOut outbound factor in {@code (0, 1_000_000]}
   * @return outcome
   */
  OperationResult updateQuality(
      RequestContext ctx, AccountId counterparty, long qualityIn, long qualityOut);

  /**
   * Toggles whether the line may carry rippled payments.
   *
   * @param ctx request identity
   * @param counterparty other party
   * @param allowRippling new flag
   * @return outcome
   */
  OperationResult setRippling(RequestContext ctx, AccountId counterparty, boolean allowRippling);

  /**
   * Replaces both limits; requires the signatures of both parties.
   *
   * @param ctx request identity; caller plus co-signers must include both parties
   * @param counterparty other party
   * @param newLimitLo new low-side limit (must be {@code > 0} and cover a positive balance)
   * @param newLimitHi new high-side limit (must be {@code > 0} and cover a negative balance)
   * @return outcome
   */
  OperationResult updateLimits(
      RequestContext ctx, AccountId counterparty, long newLimitLo, long newLimitHi);

  /**
   * Freezes the line between {@code p} and {@code q}. Administrator only, irreversible.
   *
   * @param ctx request identity; caller must be the administrator
   * @param p one party
   * @param q other party
   * @return outcome
   */
  OperationResult freeze(RequestContext ctx, AccountId p, AccountId q);

  /**
   * Net position of {@code caller} on the line with {@code counterparty}.
   *
   * @param caller querying party
   * @param counterparty other party
   * @return positive when the counterparty owes the caller
   */
  Lookup<Long> balance(AccountId caller, AccountId counterparty);

  /**
   * Remaining send/receive capacity of {@code caller} on the line with {@code counterparty}.
   * A frozen line reports none in either direction, since it accepts no payments.
   *
   * @param caller querying party
   * @param counterparty other party
   * @return available credit
   */
  Lookup<AvailableCredit> credit(AccountId caller, AccountId counterparty);

  /**
   * Full snapshot of the line between {@code p} and {@code q}.
   *
   * @param p one party
   * @param q other party
   * @return line snapshot
   */
  Lookup<TrustLine> trustLine(AccountId p, AccountId q);

  /**
   * Lines {@code account} participates in, ordered by creation id.
   *
   * @param account participant
   * @param afterId only lines with an id greater than this ({@code 0} for the first page)
   * @param limit page size, clamped to {@code [1, 100]}
   * @return page of lines
   */
  Lookup<List<TrustLine>> linesOf(AccountId account, long afterId, int limit);

  /**
   * Number of trust lines ever created.
   *
   * @return creation counter value
   */
  long trustLineCount();
}
