package com.piigateway.api.metrics;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Flags requests whose path or query contains a known attack signature.
 *
 * <p>Stateless and safe to call from any thread.
 */
@Component
public class SuspiciousPatternDetector {
  private static final List<String> PATTERNS = List.of(
      "../../",
      "../etc/passwd",
      "select",
      "<script");

  /**
   * Checks both inputs, case-insensitively, for any signature substring.
   *
   * @param path request path
   * @param query decoded query string, may be {@code null}
   * @return {@code true} when a signature is present
   */
  public boolean matches(String path, String query) {
    String normalizedPath = path == null ? "" : path.toLowerCase(Locale.ROOT);
    String normalizedQuery = query == null ? "" : query.toLowerCase(Locale.ROOT);
    for (String pattern : PATTERNS) {
      if (normalizedPath.contains(pattern) || normalizedQuery.contains(pattern)) {
        return true;
      }
    }
    return false;
  }
}
