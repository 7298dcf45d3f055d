package com.piigateway.api.rate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of a 429 response.
 *
 * @param detail client-facing message
 * @param retryAfter whole seconds before the client should retry
 */
public record RateLimitRejection(
    String detail,
    @JsonProperty("retry_after") long retryAfter) {

  static RateLimitRejection from(RateLimitDecision decision) {
    return new RateLimitRejection(decision.reason().detail(), decision.retryAfterSeconds());
  }
}
