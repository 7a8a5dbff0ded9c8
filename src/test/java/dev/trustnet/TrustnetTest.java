/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.RequestContext;
import dev.trustnet.api.TrustLines;
import dev.trustnet.core.Services;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TrustnetTest {
  private static final String ADMIN = "aa".repeat(32);

  @Test
  void bootsInMemoryAndJournalsCommittedChanges(@TempDir Path tempDir) throws Exception {
    Path journal = tempDir.resolve("journal.jsonl");
    Path configPath = tempDir.resolve("trustnet.json5");
    Files.writeString(
        configPath,
        """
        {
          core: {
            admin: "%s",
            store: { backend: "memory" },
            log: { json: false, level: "WARN" }
          },
          modules: { journal: { enabled: true, path: "%s" } }
        }
        """
            .formatted(ADMIN, journal.toString().replace("\\", "/")),
        StandardCharsets.UTF_8);

    AccountId alice = AccountId.fromHex("01".repeat(32));
    AccountId bob = AccountId.fromHex("02".repeat(32));

    Services services = Trustnet.boot(configPath);
    try {
      assertEquals(AccountId.fromHex(ADMIN), services.governance().admin());
      TrustLines lines = services.trustLines();
      assertTrue(lines.create(RequestContext.of(alice), bob, 0, 100, 100, false).ok());
      assertTrue(lines.send(RequestContext.of(bob), alice, 30).ok());
      assertEquals(30L, lines.balance(bob, alice).value());
      assertTrue(lines.freeze(RequestContext.of(AccountId.fromHex(ADMIN)), alice, bob).ok());
    } finally {
      services.shutdown();
    }

    assertTrue(Files.exists(configPath.resolveSibling("trustnet.json5.example")));
    List<String> entries = Files.readAllLines(journal, StandardCharsets.UTF_8);
    assertEquals(3, entries.size());
    assertTrue(entries.get(0).contains("\"event\":\"line_created\""));
    assertTrue(entries.get(2).contains("\"change\":\"freeze\""));
  }
}
