/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.TrustLine;
import java.util.List;
import java.util.Optional;

/**
 * Durable trust line records addressed by {@link CanonicalPair}, plus store-wide {@link
 * GlobalField} values.
 *
 * <p>All writes go through {@link #inTransaction}: the work sees its own writes, other readers
 * see none of them until the work returns, and an exception thrown by the work discards every
 * write it made. Implementations throw {@link StoreException} for backend failures.
 */
public interface TrustLineStore extends AutoCloseable {

  /**
   * Runs {@code work} as one atomic unit.
   *
   * @param work reads-for-update and writes
   * @param <T> result type
   * @return whatever {@code work} returns, after commit
   */
  <T> T inTransaction(Work<T> work);

  /**
   * Reads the committed record of {@code pair}.
   *
   * @param pair canonical pair
   * @return committed line, if any
   */
  Optional<TrustLine> find(CanonicalPair pair);

  /**
   * Committed lines {@code account} participates in, ordered by id.
   *
   * @param account participant
   * @param afterId exclusive lower bound on id
   * @param limit maximum rows
   * @return page of lines
   */
  List<TrustLine> linesOf(AccountId account, long afterId, int limit);

  /**
   * Reads a committed store-wide value.
   *
   * @param field value to read
   * @return current value ({@code 0} if never written)
   */
  long read(GlobalField field);

  @Override
  void close();

  /** Operations available inside a unit of work. */
  interface Transaction {
    /**
     * Reads {@code pair} and holds it against concurrent writers until the unit ends.
     *
     * @param pair canonical pair
     * @return current line as seen by this unit, if any
     */
    Optional<TrustLine> lockLine(CanonicalPair pair);

    /**
     * Stores a new line.
     *
     * @param line line to add
     * @throws dev.trustnet.api.TrustLineException {@code TRUST_LINE_EXISTS} if the pair is taken
     */
    void insert(TrustLine line);

    /**
     * Replaces an existing line.
     *
     * @param line new state, addressed by {@link TrustLine#pair()}
     */
    void update(TrustLine line);

    /**
     * Adds one to a store-wide counter.
     *
     * @param field counter to bump
     * @return value after the increment
     */
    long increment(GlobalField field);
  }

  /** Body of a unit of work. */
  @FunctionalInterface
  interface Work<T> {
    T run(Transaction tx);
  }
}
