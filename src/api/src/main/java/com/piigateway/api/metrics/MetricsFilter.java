package com.piigateway.api.metrics;

import com.piigateway.api.config.GatewayProperties;
import com.piigateway.api.rate.ClientIdentifiers;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Servlet filter timing every admitted request and feeding {@link MetricsCollector}.
 *
 * <p>Sits behind the rate limiter, so 429 rejections never reach it. Paths are recorded and
 * matched in decoded form, so every encoding of a path shares one counter.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 30)
public class MetricsFilter extends OncePerRequestFilter {
  // Decodes the path and strips ";jsessionid"-style parameters.
  private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

  private final MetricsCollector metricsCollector;
  private final boolean trustForwardedFor;

  public MetricsFilter(GatewayProperties properties, MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    this.trustForwardedFor = properties.getRateLimit().isTrustForwardedFor();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    ObservedRequest observed = new ObservedRequest(
        ClientIdentifiers.resolve(request, trustForwardedFor),
        PATH_HELPER.getPathWithinApplication(request),
        decodeQuery(request.getQueryString()));

    MetricsCollector.Observation observation = metricsCollector.start(observed);
    try {
      filterChain.doFilter(request, response);
    } catch (Throwable fault) {
      observation.fail(fault);
      throw fault;
    }
    observation.complete(response.getStatus());
  }

  static String decodeQuery(String rawQuery) {
    if (rawQuery == null) {
      return "";
    }
    try {
      return URLDecoder.decode(rawQuery, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      // Malformed escapes: match against the raw string.
      return rawQuery;
    }
  }
}
