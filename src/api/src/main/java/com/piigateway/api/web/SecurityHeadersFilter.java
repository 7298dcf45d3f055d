package com.piigateway.api.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Stamps static browser-hardening headers on every admitted response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class SecurityHeadersFilter extends OncePerRequestFilter {
  static final String CONTENT_SECURITY_POLICY =
      "default-src 'self'; "
          + "script-src 'self' https://cdn.jsdelivr.net 'unsafe-inline'; "
          + "style-src 'self' https://cdn.jsdelivr.net; "
          + "img-src 'self' data:; "
          + "font-src 'self'; "
          + "connect-src 'self';";

  static final Map<String, String> HEADERS = buildHeaders();

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    // Set before the chain runs; headers cannot be added once the body is committed.
    HEADERS.forEach(response::setHeader);
    filterChain.doFilter(request, response);
  }

  private static Map<String, String> buildHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("X-Content-Type-Options", "nosniff");
    headers.put("X-Frame-Options", "DENY");
    headers.put("X-XSS-Protection", "1; mode=block");
    headers.put("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
    headers.put("Content-Security-Policy", CONTENT_SECURITY_POLICY);
    headers.put("Referrer-Policy", "strict-origin-when-cross-origin");
    headers.put("Permissions-Policy", "geolocation=(), microphone=(), camera=()");
    return Map.copyOf(headers);
  }
}
