package com.piigateway.api.model;

/**
 * Request contract for {@code POST /api/v1/analyze}.
 *
 * @param text text to analyse
 * @param language ISO 639-1 code, defaults to {@code en} when omitted
 */
public record AnalyzeRequest(String text, String language) {}
