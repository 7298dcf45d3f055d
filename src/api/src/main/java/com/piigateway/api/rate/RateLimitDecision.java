package com.piigateway.api.rate;

/**
 * Outcome of one admission evaluation.
 *
 * @param admitted whether the request may proceed
 * @param reason rejection cause, {@code null} when admitted
 * @param limit steady-state requests allowed per window
 * @param remaining requests left in the window after this one
 * @param resetSeconds whole seconds since the oldest request still in the window
 * @param retryAfterSeconds seconds the client should wait, {@code 0} when admitted
 */
public record RateLimitDecision(
    boolean admitted,
    RejectionReason reason,
    int limit,
    int remaining,
    long resetSeconds,
    long retryAfterSeconds) {

  public static RateLimitDecision admit(int limit, int remaining, long resetSeconds) {
    return new RateLimitDecision(true, null, limit, remaining, resetSeconds, 0L);
  }

  public static RateLimitDecision reject(RejectionReason reason, long retryAfterSeconds) {
    return new RateLimitDecision(false, reason, 0, 0, 0L, retryAfterSeconds);
  }
}
