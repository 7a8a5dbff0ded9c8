/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

/** Store-wide values that are not attached to a trust line. */
public enum GlobalField {
  /** Number of trust lines ever created; also the id of the most recent one. */
  TRUST_LINE_COUNT
}
