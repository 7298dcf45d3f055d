package com.piigateway.api.config;

import com.piigateway.api.rate.SlidingWindowRateLimiter;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the admission-control components from {@link GatewayProperties}.
 */
@Configuration(proxyBeanMethods = false)
public class RateLimitConfig {
  private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SlidingWindowRateLimiter slidingWindowRateLimiter(
      GatewayProperties properties, Clock clock) {
    GatewayProperties.RateLimit rateLimit = properties.getRateLimit();
    if (rateLimit.getBurstLimit() < rateLimit.getRequestsPerMinute()) {
      log.warn(
          "Burst limit {} is below requests-per-minute {}; clients are blocked before the "
              + "steady-state cap applies",
          rateLimit.getBurstLimit(),
          rateLimit.getRequestsPerMinute());
    }
    log.info(
        "Rate limiting configured: enabled={}, requestsPerMinute={}, burstLimit={}, block={}",
        rateLimit.isEnabled(),
        rateLimit.getRequestsPerMinute(),
        rateLimit.getBurstLimit(),
        rateLimit.getBlockDuration());
    return new SlidingWindowRateLimiter(
        rateLimit.getRequestsPerMinute(),
        rateLimit.getBurstLimit(),
        rateLimit.getBlockDuration(),
        clock);
  }
}
