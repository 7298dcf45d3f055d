package com.piigateway.api.analysis;

/**
 * One entity located by a {@link TextAnalyzer}.
 *
 * @param entityType entity label, for example {@code EMAIL_ADDRESS}
 * @param start inclusive start offset in the analysed text
 * @param end exclusive end offset in the analysed text
 * @param score confidence in {@code [0, 1]}
 */
public record RecognizedSpan(String entityType, int start, int end, double score) {}
