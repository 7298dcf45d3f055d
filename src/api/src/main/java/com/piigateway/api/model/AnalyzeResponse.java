package com.piigateway.api.model;

import java.util.List;

/**
 * Response contract for single-text analysis.
 *
 * @param entities detected entities ordered by start offset
 */
public record AnalyzeResponse(List<Entity> entities) {}
