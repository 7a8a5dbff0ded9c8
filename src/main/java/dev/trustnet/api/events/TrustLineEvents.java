/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api.events;

import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.TrustLine;
import java.util.function.Consumer;

/**
 * Committed trust line changes. Handlers run asynchronously after commit, in order per pair.
 */
public interface TrustLineEvents {
  /**
   * Subscribes to line creation.
   *
   * @param handler callback
   * @return handle that unsubscribes on close
   */
  AutoCloseable onLineCreated(Consumer<LineCreatedEvent> handler);

  /**
   * Subscribes to balance changes (one event per leg for rippled payments).
   *
   * @param handler callback
   * @return handle that unsubscribes on close
   */
  AutoCloseable onBalanceChanged(Consumer<BalanceChangedEvent> handler);

  /**
   * Subscribes to settings changes (quality, rippling flag, limits, freeze).
   *
   * @param handler callback
   * @return handle that unsubscribes on close
   */
  AutoCloseable onLineUpdated(Consumer<LineUpdatedEvent> handler);

  /** Common shape of all events: the pair they concern. */
  interface Event {
    CanonicalPair pair();
  }

  /** A new line was opened. */
  record LineCreatedEvent(
      CanonicalPair pair,
      long id,
      long assetId,
      long limitLo,
      long limitHi,
      boolean allowRippling)
      implements Event {}

  /**
   * A line's balance moved.
   *
   * @param pair canonical pair
   * @param id line id
   * @param oldBalance balance before the operation
   * @param newBalance balance after the operation
   * @param op operation that moved it ({@code send}, {@code settle} or {@code ripple})
   */
  record BalanceChangedEvent(
      CanonicalPair pair, long id, long oldBalance, long newBalance, String op)
      implements Event {}

  /**
   * A line's settings changed.
   *
   * @param pair canonical pair
   * @param change which setting changed
   * @param line snapshot after the change
   */
  record LineUpdatedEvent(CanonicalPair pair, Change change, TrustLine line) implements Event {}

  /** Settings change kinds. */
  enum Change {
    QUALITY,
    RIPPLING,
    LIMITS,
    FREEZE
  }
}
