package com.piigateway.api.rate;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

/**
 * Resolves the key used to partition per-client state.
 */
public final class ClientIdentifiers {
  /** Shared identifier for requests whose peer address is unavailable. */
  public static final String UNKNOWN_CLIENT = "unknown_client";

  private ClientIdentifiers() {}

  /**
   * Returns the connecting peer address, or {@link #UNKNOWN_CLIENT} when the transport does not
   * expose one.
   *
   * @param request current HTTP request
   * @param trustForwardedFor use the first {@code X-Forwarded-For} hop when present
   * @return client identifier, never {@code null}
   */
  public static String resolve(HttpServletRequest request, boolean trustForwardedFor) {
    if (trustForwardedFor) {
      String forwardedFor = request.getHeader("X-Forwarded-For");
      if (StringUtils.hasText(forwardedFor)) {
        String first = forwardedFor.split(",")[0].trim();
        if (!first.isEmpty()) {
          return first;
        }
      }
    }
    String remoteAddr = request.getRemoteAddr();
    return StringUtils.hasText(remoteAddr) ? remoteAddr : UNKNOWN_CLIENT;
  }
}
