/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.RequestContext;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.TrustLineException;
import java.util.Objects;

/** Restricted operations gated on the administrator captured in {@link Governance}. */
public final class AdminGovernor {
  private final Governance governance;

  public AdminGovernor(Governance governance) {
    this.governance = Objects.requireNonNull(governance, "governance");
  }

  /**
   * Rejects callers other than the administrator.
   *
   * @param ctx request identity
   * @throws TrustLineException {@link ErrorCode#UNAUTHORIZED}
   */
  public void requireAdmin(RequestContext ctx) {
    if (ctx == null || !governance.isAdmin(ctx.caller())) {
      throw new TrustLineException(ErrorCode.UNAUTHORIZED, "administrator only");
    }
  }

  /**
   * Pins both limits to zero and disables rippling. There is no reverse operation.
   *
   * @param ctx request identity; must be the administrator
   * @param line current line
   * @param nowS mutation time, epoch seconds
   * @return frozen line; the balance is kept as-is for audit
   */
  public TrustLine freeze(RequestContext ctx, TrustLine line, long nowS) {
    requireAdmin(ctx);
    return line.withLimits(0L, 0L, nowS).withRippling(false, nowS);
  }
}
