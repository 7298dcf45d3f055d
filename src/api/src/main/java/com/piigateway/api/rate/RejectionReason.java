package com.piigateway.api.rate;

/**
 * Why an admission decision went against the client.
 */
public enum RejectionReason {
  /** The client is serving an earlier block. */
  BLOCKED("blocked", "IP address blocked due to rate limit violation"),
  /** The window reached the burst ceiling; a new block was imposed. */
  BURST("burst", "Too many requests - IP blocked"),
  /** The window holds the steady-state maximum. */
  RATE("rate", "Too many requests");

  private final String tag;
  private final String detail;

  RejectionReason(String tag, String detail) {
    this.tag = tag;
    this.detail = detail;
  }

  /** Short lowercase label, used for metric tags and logs. */
  public String tag() {
    return tag;
  }

  /** Client-facing message placed in the 429 body. */
  public String detail() {
    return detail;
  }
}
