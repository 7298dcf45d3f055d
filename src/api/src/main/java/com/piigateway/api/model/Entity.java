package com.piigateway.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Detected entity returned to API clients.
 *
 * @param entityType entity label
 * @param start inclusive start offset
 * @param end exclusive end offset
 * @param score confidence in {@code [0, 1]}
 * @param text matched substring
 */
public record Entity(
    @JsonProperty("entity_type") String entityType,
    int start,
    int end,
    double score,
    String text) {}
