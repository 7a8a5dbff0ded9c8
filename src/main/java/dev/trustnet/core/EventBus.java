/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.events.TrustLineEvents;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous in-process event bus for committed trust line changes.
 *
 * <p>Each canonical pair has a dedicated serial queue, so events about one line arrive in commit
 * order while different lines dispatch concurrently. Queues are kept for the lifetime of the bus;
 * there is at most one per line.
 */
public final class EventBus implements TrustLineEvents, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("trustnet");
  private static final long CLOSE_GRACE_MS = 2_000L;

  private final List<Consumer<LineCreatedEvent>> created = new CopyOnWriteArrayList<>();
  private final List<Consumer<BalanceChangedEvent>> balance = new CopyOnWriteArrayList<>();
  private final List<Consumer<LineUpdatedEvent>> updated = new CopyOnWriteArrayList<>();
  private final Map<CanonicalPair, PairQueue> queues = new ConcurrentHashMap<>();
  private final ExecutorService executor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** Creates a new event bus with a daemon thread pool sized for the host. */
  public EventBus() {
    this.executor = createExecutor();
  }

  private static ExecutorService createExecutor() {
    int threads = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    ThreadFactory factory =
        r -> {
          Thread t = new Thread(r, "trustnet-events");
          t.setDaemon(true);
          return t;
        };
    return Executors.newFixedThreadPool(threads, factory);
  }

  @Override
  public AutoCloseable onLineCreated(Consumer<LineCreatedEvent> h) {
    created.add(h);
    return () -> created.remove(h);
  }

  @Override
  public AutoCloseable onBalanceChanged(Consumer<BalanceChangedEvent> h) {
    balance.add(h);
    return () -> balance.remove(h);
  }

  @Override
  public AutoCloseable onLineUpdated(Consumer<LineUpdatedEvent> h) {
    updated.add(h);
    return () -> updated.remove(h);
  }

  /**
   * Dispatches an event asynchronously to the handlers of its type.
   *
   * @param e committed event
   */
  public void fire(Event e) {
    if (e == null || closed.get()) {
      return;
    }
    if (e instanceof LineCreatedEvent c) {
      enqueue(e.pair(), () -> dispatch(created, c));
    } else if (e instanceof BalanceChangedEvent b) {
      enqueue(e.pair(), () -> dispatch(balance, b));
    } else if (e instanceof LineUpdatedEvent u) {
      enqueue(e.pair(), () -> dispatch(updated, u));
    } else {
      throw new IllegalArgumentException("unknown event type " + e.getClass().getName());
    }
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(CLOSE_GRACE_MS, TimeUnit.MILLISECONDS)) {
          LOG.debug("(trustnet) event bus: pending deliveries dropped on close");
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
      queues.clear();
      created.clear();
      balance.clear();
      updated.clear();
    }
  }

  private <T> void dispatch(List<Consumer<T>> handlers, T event) {
    for (Consumer<T> handler : handlers) {
      try {
        handler.accept(event);
      } catch (RuntimeException e) {
        LOG.warn("(trustnet) event handler failed for {}: {}", event, e.getMessage(), e);
      }
    }
  }

  private void enqueue(CanonicalPair pair, Runnable task) {
    PairQueue queue = queues.computeIfAbsent(pair, p -> new PairQueue());
    queue.tasks.add(task);
    if (queue.draining.compareAndSet(false, true)) {
      try {
        executor.execute(() -> drain(queue));
      } catch (RejectedExecutionException e) {
        queue.draining.set(false);
        LOG.debug("(trustnet) event bus closed; dropping event for {}", pair);
      }
    }
  }

  private void drain(PairQueue queue) {
    while (true) {
      Runnable next;
      while ((next = queue.tasks.poll()) != null) {
        next.run();
      }
      queue.draining.set(false);
      // A producer may have enqueued after the last poll but before the flag dropped.
      if (queue.tasks.isEmpty() || !queue.draining.compareAndSet(false, true)) {
        return;
      }
    }
  }

  private static final class PairQueue {
    final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    final AtomicBoolean draining = new AtomicBoolean(false);
  }
}
