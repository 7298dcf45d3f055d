package com.piigateway.api.rate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piigateway.api.config.GatewayProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter applying per-client admission control to every inbound request.
 *
 * <p>Runs ahead of every other gateway filter. Rejected requests get HTTP 429 and never reach
 * downstream handlers; admitted requests carry {@code X-RateLimit-*} headers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RateLimitFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

  static final String LIMIT_HEADER = "X-RateLimit-Limit";
  static final String REMAINING_HEADER = "X-RateLimit-Remaining";
  static final String RESET_HEADER = "X-RateLimit-Reset";

  private final SlidingWindowRateLimiter limiter;
  private final ObjectMapper objectMapper;
  private final boolean enabled;
  private final boolean trustForwardedFor;
  private final Map<RejectionReason, Counter> rejectionCounters =
      new EnumMap<>(RejectionReason.class);

  /**
   * Creates the filter with configuration and limiter dependencies.
   *
   * @param properties typed gateway properties
   * @param limiter sliding-window limiter implementation
   * @param objectMapper serializer for rejection bodies
   * @param meterRegistry registry receiving rejection counters
   */
  public RateLimitFilter(
      GatewayProperties properties,
      SlidingWindowRateLimiter limiter,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.limiter = limiter;
    this.objectMapper = objectMapper;
    this.enabled = properties.getRateLimit().isEnabled();
    this.trustForwardedFor = properties.getRateLimit().isTrustForwardedFor();
    for (RejectionReason reason : RejectionReason.values()) {
      rejectionCounters.put(
          reason,
          Counter.builder("gateway.ratelimit.rejections")
              .tag("reason", reason.tag())
              .description("Requests rejected by admission control")
              .register(meterRegistry));
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !enabled;
  }

  /**
   * Admits or rejects the request for its client identifier.
   *
   * @param request current HTTP request
   * @param response current HTTP response
   * @param filterChain downstream filter chain
   * @throws ServletException if servlet processing fails
   * @throws IOException if response writing fails
   */
  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    String client = ClientIdentifiers.resolve(request, trustForwardedFor);
    RateLimitDecision decision = limiter.evaluate(client);

    if (!decision.admitted()) {
      reject(client, decision, response);
      return;
    }

    response.setHeader(LIMIT_HEADER, Integer.toString(decision.limit()));
    response.setHeader(REMAINING_HEADER, Integer.toString(decision.remaining()));
    response.setHeader(RESET_HEADER, Long.toString(decision.resetSeconds()));
    filterChain.doFilter(request, response);
  }

  private void reject(String client, RateLimitDecision decision, HttpServletResponse response)
      throws IOException {
    RejectionReason reason = decision.reason();
    rejectionCounters.get(reason).increment();
    if (reason == RejectionReason.BURST) {
      log.warn("Client {} blocked for {}s after burst limit violation",
          client, decision.retryAfterSeconds());
    } else {
      log.debug("Rejected request from {} ({}), retry after {}s",
          client, reason.tag(), decision.retryAfterSeconds());
    }

    response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
    response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(decision.retryAfterSeconds()));
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getWriter(), RateLimitRejection.from(decision));
  }
}
