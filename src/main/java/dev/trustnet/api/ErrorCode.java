/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

/**
 * Canonical error codes produced by the trust line engine.
 *
 * <p>Every failed request carries exactly one code. Codes are grouped into a coarse {@link
 * Category} so callers can react to a class of failure (validation, credit, authorization, ...)
 * without enumerating every reason.
 */
public enum ErrorCode {
  /** Amount is zero, negative, or decays to zero along a rippled path. */
  INVALID_AMOUNT(Category.VALIDATION),

  /** Participant identity is missing or not a well-formed 32-byte identifier. */
  INVALID_ACCOUNT(Category.VALIDATION),

  /** Both sides of the requested pair are the same participant. */
  SELF_TRUST_LINE(Category.VALIDATION),

  /** Credit limit is not strictly positive, or asset id is negative. */
  INVALID_LIMIT(Category.VALIDATION),

  /** Quality factor outside {@code (0, 1_000_000]}. */
  INVALID_QUALITY(Category.VALIDATION),

  /** Rippling path is empty, too long, or revisits a participant back to back. */
  INVALID_PATH(Category.VALIDATION),

  /** Balance or decay arithmetic would overflow a signed 64-bit value. */
  ARITHMETIC_OVERFLOW(Category.VALIDATION),

  /** New limit would sit below the exposure the line currently carries. */
  LIMIT_BELOW_EXPOSURE(Category.VALIDATION),

  /** Resulting balance would leave {@code [-limitHi, limitLo]}. */
  INSUFFICIENT_CREDIT(Category.INSUFFICIENT_CREDIT),

  /** Restricted operation invoked by someone other than the administrator. */
  UNAUTHORIZED(Category.AUTHORIZATION),

  /** Joint operation lacks the signature of one of the two parties. */
  MISSING_COSIGNATURE(Category.AUTHORIZATION),

  /** Line was frozen by the administrator and can no longer extend credit. */
  TRUST_LINE_FROZEN(Category.AUTHORIZATION),

  /** No trust line exists for the canonical pair. */
  TRUST_LINE_NOT_FOUND(Category.NOT_FOUND),

  /** A trust line already exists for the canonical pair. */
  TRUST_LINE_EXISTS(Category.ALREADY_EXISTS),

  /** A line on the rippling path does not allow pass-through payments. */
  RIPPLING_DISABLED(Category.RIPPLING_DISABLED),

  /** Storage backend is unreachable or the pool gave up waiting for a connection. */
  CONNECTION_LOST(Category.STORAGE),

  /** Storage backend chose this unit of work as a deadlock victim and rolled it back. */
  DEADLOCK_RETRY_EXHAUSTED(Category.STORAGE),

  /** A row lock on a trust line stayed held by another unit of work for too long. */
  LOCK_TIMEOUT(Category.STORAGE),

  /** Storage backend rejected a write on a unique key. */
  DUPLICATE_KEY(Category.STORAGE),

  /** Storage backend failed in a way none of the other storage codes describe. */
  STORAGE_FAILURE(Category.STORAGE);

  private final Category category;

  ErrorCode(Category category) {
    this.category = category;
  }

  /**
   * Coarse failure class of this code.
   *
   * @return category, never {@code null}
   */
  public Category category() {
    return category;
  }

  /** Failure classes. */
  public enum Category {
    VALIDATION,
    INSUFFICIENT_CREDIT,
    AUTHORIZATION,
    NOT_FOUND,
    ALREADY_EXISTS,
    RIPPLING_DISABLED,
    STORAGE
  }
}
