package com.piigateway.api.rate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically evicts client windows with no recent traffic and no active block.
 *
 * <p>Bounds limiter memory by recent client cardinality instead of lifetime cardinality.
 */
@Component
public class IdleClientSweeper {
  private static final Logger log = LoggerFactory.getLogger(IdleClientSweeper.class);

  private final SlidingWindowRateLimiter limiter;

  public IdleClientSweeper(SlidingWindowRateLimiter limiter) {
    this.limiter = limiter;
  }

  @Scheduled(
      fixedDelayString = "${gateway.rate-limit.sweep.interval-ms:60000}",
      initialDelayString = "${gateway.rate-limit.sweep.interval-ms:60000}")
  public void sweep() {
    int evicted = limiter.sweepIdle(limiter.getClock().instant());
    if (evicted > 0) {
      log.debug("Evicted {} idle client windows, {} still tracked",
          evicted, limiter.trackedClients());
    }
  }
}
