/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.modules.journal;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.events.TrustLineEvents;
import dev.trustnet.api.events.TrustLineEvents.BalanceChangedEvent;
import dev.trustnet.api.events.TrustLineEvents.LineCreatedEvent;
import dev.trustnet.api.events.TrustLineEvents.LineUpdatedEvent;
import dev.trustnet.core.Config;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only JSONL mirror of committed trust line events.
 *
 * <p>One JSON object per line with an {@code event} discriminator ({@code line_created}, {@code
 * balance_changed}, {@code line_updated}), the pair in hex and the event's own fields. Write
 * failures are logged and skipped; the journal never affects the engine.
 */
public final class JournalService implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("trustnet");
  private static final Gson GSON = new Gson();

  private final Path path;
  private final Clock clock;
  private final List<AutoCloseable> subscriptions = new ArrayList<>(3);
  private final Object writeLock = new Object();
  private volatile boolean closed;

  private JournalService(Path path, Clock clock) {
    this.path = path;
    this.clock = clock;
  }

  /**
   * Subscribes the journal to {@code events} when the module is enabled.
   *
   * @param events event source
   * @param cfg journal block
   * @param clock timestamp source
   * @return running journal, or {@code null} when disabled or the path is unusable
   */
  public static JournalService install(
      TrustLineEvents events, Config.Journal cfg, Clock clock) {
    Objects.requireNonNull(events, "events");
    Objects.requireNonNull(cfg, "cfg");
    Objects.requireNonNull(clock, "clock");
    if (!cfg.enabled()) {
      LOG.info("(trustnet) journal: disabled by config");
      return null;
    }
    Path path;
    try {
      path = Path.of(cfg.path());
    } catch (InvalidPathException e) {
      LOG.warn("(trustnet) journal: invalid path {}; journal disabled", cfg.path(), e);
      return null;
    }

    JournalService journal = new JournalService(path, clock);
    journal.subscriptions.add(events.onLineCreated(journal::onCreated));
    journal.subscriptions.add(events.onBalanceChanged(journal::onBalanceChanged));
    journal.subscriptions.add(events.onLineUpdated(journal::onUpdated));
    LOG.info("(trustnet) journal: enabled (file={})", path);
    return journal;
  }

  Path path() {
    return path;
  }

  private void onCreated(LineCreatedEvent e) {
    JsonObject j = header("line_created", e.pair());
    j.addProperty("id", e.id());
    j.addProperty("assetId", e.assetId());
    j.addProperty("limitLo", e.limitLo());
    j.addProperty("limitHi", e.limitHi());
    j.addProperty("allowRippling", e.allowRippling());
    append(j);
  }

  private void onBalanceChanged(BalanceChangedEvent e) {
    JsonObject j = header("balance_changed", e.pair());
    j.addProperty("id", e.id());
    j.addProperty("op", e.op());
    j.addProperty("oldBalance", e.oldBalance());
    j.addProperty("newBalance", e.newBalance());
    append(j);
  }

  private void onUpdated(LineUpdatedEvent e) {
    TrustLine line = e.line();
    JsonObject j = header("line_updated", e.pair());
    j.addProperty("id", line.id());
    j.addProperty("change", e.change().name().toLowerCase(Locale.ROOT));
    j.addProperty("limitLo", line.limitLo());
    j.addProperty("limitHi", line.limitHi());
    j.addProperty("balance", line.balance());
    j.addProperty("qualityIn", line.qualityIn());
    j.addProperty("qualityOut", line.qualityOut());
    j.addProperty("allowRippling", line.allowRippling());
    append(j);
  }

  private JsonObject header(String event, CanonicalPair pair) {
    JsonObject j = new JsonObject();
    j.addProperty("ts", clock.instant().getEpochSecond());
    j.addProperty("event", event);
    j.addProperty("lo", pair.lo().toHex());
    j.addProperty("hi", pair.hi().toHex());
    return j;
  }

  private void append(JsonObject entry) {
    if (closed) {
      return;
    }
    String line = GSON.toJson(entry);
    synchronized (writeLock) {
      try {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
          Files.createDirectories(parent);
        }
        try (BufferedWriter w =
            Files.newBufferedWriter(
                path,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND)) {
          w.write(line);
          w.write("\n");
        }
      } catch (IOException ioe) {
        LOG.warn(
            "(trustnet) code={} op={} message={} path={}",
            "FILE_IO",
            "journal.append",
            ioe.getMessage(),
            path,
            ioe);
      }
    }
  }

  @Override
  public void close() {
    closed = true;
    for (AutoCloseable subscription : subscriptions) {
      try {
        subscription.close();
      } catch (Exception e) {
        LOG.debug("(trustnet) journal: unsubscribe failed", e);
      }
    }
    subscriptions.clear();
  }
}
