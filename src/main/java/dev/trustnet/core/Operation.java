/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

/** Operation catalog entries, named as they appear in logs and metrics. */
public enum Operation {
  CREATE("create", true),
  SEND("send", true),
  SETTLE("settle", true),
  RIPPLE("ripple", true),
  QUALITY("quality", true),
  RIPPLE_SET("ripple_set", true),
  LIMITS("limits", true),
  FREEZE("freeze", true),
  BALANCE("balance", false),
  CREDIT("credit", false),
  GET("get", false),
  LINES("lines", false);

  private final String wireName;
  private final boolean mutating;

  Operation(String wireName, boolean mutating) {
    this.wireName = wireName;
    this.mutating = mutating;
  }

  public String wireName() {
    return wireName;
  }

  public boolean mutating() {
    return mutating;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
