/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.TrustLineException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local {@link TrustLineStore}.
 *
 * <p>Units of work run one at a time behind a single writer lock. Writes are staged per unit and
 * published under the write half of a read/write lock, so readers observe either none or all of
 * a unit's writes.
 */
public final class InMemoryTrustLineStore implements TrustLineStore {
  private final Map<CanonicalPair, TrustLine> lines = new HashMap<>();
  private final Map<GlobalField, Long> globals = new EnumMap<>(GlobalField.class);
  private final ReentrantLock writer = new ReentrantLock();
  private final ReentrantReadWriteLock visibility = new ReentrantReadWriteLock();

  @Override
  public <T> T inTransaction(Work<T> work) {
    Objects.requireNonNull(work, "work");
    writer.lock();
    try {
      Staged staged = new Staged();
      T result = work.run(staged);
      publish(staged);
      return result;
    } finally {
      writer.unlock();
    }
  }

  @Override
  public Optional<TrustLine> find(CanonicalPair pair) {
    visibility.readLock().lock();
    try {
      return Optional.ofNullable(lines.get(pair));
    } finally {
      visibility.readLock().unlock();
    }
  }

  @Override
  public List<TrustLine> linesOf(AccountId account, long afterId, int limit) {
    List<TrustLine> out = new ArrayList<>();
    visibility.readLock().lock();
    try {
      for (TrustLine line : lines.values()) {
        if (line.id() > afterId && line.pair().contains(account)) {
          out.add(line);
        }
      }
    } finally {
      visibility.readLock().unlock();
    }
    out.sort(Comparator.comparingLong(TrustLine::id));
    return out.size() > limit ? List.copyOf(out.subList(0, limit)) : List.copyOf(out);
  }

  @Override
  public long read(GlobalField field) {
    visibility.readLock().lock();
    try {
      return globals.getOrDefault(field, 0L);
    } finally {
      visibility.readLock().unlock();
    }
  }

  @Override
  public void close() {}

  private void publish(Staged staged) {
    if (staged.lines.isEmpty() && staged.globals.isEmpty()) {
      return;
    }
    visibility.writeLock().lock();
    try {
      lines.putAll(staged.lines);
      globals.putAll(staged.globals);
    } finally {
      visibility.writeLock().unlock();
    }
  }

  // Only touched by the thread holding the writer lock.
  private final class Staged implements Transaction {
    final Map<CanonicalPair, TrustLine> lines = new LinkedHashMap<>();
    final Map<GlobalField, Long> globals = new EnumMap<>(GlobalField.class);

    @Override
    public Optional<TrustLine> lockLine(CanonicalPair pair) {
      TrustLine staged = lines.get(pair);
      return staged != null ? Optional.of(staged) : find(pair);
    }

    @Override
    public void insert(TrustLine line) {
      if (lockLine(line.pair()).isPresent()) {
        throw new TrustLineException(
            ErrorCode.TRUST_LINE_EXISTS, "trust line already exists for " + line.pair());
      }
      lines.put(line.pair(), line);
    }

    @Override
    public void update(TrustLine line) {
      if (lockLine(line.pair()).isEmpty()) {
        throw new TrustLineException(
            ErrorCode.TRUST_LINE_NOT_FOUND, "no trust line for " + line.pair());
      }
      lines.put(line.pair(), line);
    }

    @Override
    public long increment(GlobalField field) {
      Long current = globals.get(field);
      long next = Math.addExact(current != null ? current : read(field), 1L);
      globals.put(field, next);
      return next;
    }
  }
}
