package com.piigateway.api.model;

import java.util.List;

/**
 * Response contract for {@code POST /api/v1/analyze/batch}; one result per input text, in order.
 *
 * @param results per-text analysis results
 */
public record BatchAnalyzeResponse(List<AnalyzeResponse> results) {}
