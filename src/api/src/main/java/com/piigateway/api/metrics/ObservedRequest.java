package com.piigateway.api.metrics;

/**
 * The parts of an inbound request the metrics layer looks at.
 *
 * @param clientId client identifier (normally the peer address)
 * @param path request path, used as the per-path counter key
 * @param query decoded query string, empty when absent
 */
public record ObservedRequest(String clientId, String path, String query) {}
