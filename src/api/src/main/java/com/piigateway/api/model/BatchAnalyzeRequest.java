package com.piigateway.api.model;

import java.util.List;

/**
 * Request contract for {@code POST /api/v1/analyze/batch}.
 *
 * @param texts texts to analyse independently
 * @param language ISO 639-1 code shared by all texts, defaults to {@code en}
 */
public record BatchAnalyzeRequest(List<String> texts, String language) {}
