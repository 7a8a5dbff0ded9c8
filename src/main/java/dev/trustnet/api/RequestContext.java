/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Identity information the host attaches to one request.
 *
 * @param caller participant submitting the request
 * @param cosigners additional participants whose signatures accompany the request
 */
public record RequestContext(AccountId caller, Set<AccountId> cosigners) {
  public RequestContext {
    Objects.requireNonNull(caller, "caller");
    cosigners = cosigners == null ? Set.of() : Set.copyOf(cosigners);
  }

  /**
   * Request signed by the caller alone.
   *
   * @param caller submitting participant
   * @return context without co-signers
   */
  public static RequestContext of(AccountId caller) {
    return new RequestContext(caller, Set.of());
  }

  /**
   * Request co-signed by additional participants. A signer listed more than once counts once.
   *
   * @param caller submitting participant
   * @param cosigners additional signers
   * @return context carrying the co-signer set
   * @throws NullPointerException if any co-signer is {@code null}
   */
  public static RequestContext cosigned(AccountId caller, AccountId... cosigners) {
    return new RequestContext(caller, Set.copyOf(Arrays.asList(cosigners)));
  }

  /**
   * Whether {@code account} signed this request, either as caller or co-signer.
   *
   * @param account participant to check
   * @return {@code true} if present
   */
  public boolean signedBy(AccountId account) {
    return caller.equals(account) || cosigners.contains(account);
  }
}
