/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.AccountId;
import java.util.Objects;

/**
 * Settings fixed when the system is initialized and never changed afterwards.
 *
 * @param admin identity allowed to run restricted operations
 */
public record Governance(AccountId admin) {
  public Governance {
    Objects.requireNonNull(admin, "admin");
  }

  /**
   * Whether {@code account} is the administrator.
   *
   * @param account identity to check
   * @return {@code true} for the administrator
   */
  public boolean isAdmin(AccountId account) {
    return admin.equals(account);
  }
}
