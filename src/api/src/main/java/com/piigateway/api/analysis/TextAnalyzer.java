package com.piigateway.api.analysis;

import java.util.List;

/**
 * Text-analysis engine that locates personally identifiable information.
 */
public interface TextAnalyzer {
  /**
   * Analyses one text.
   *
   * @param text input text
   * @param language ISO 639-1 language code
   * @return located spans, ordered by start offset
   * @throws IllegalArgumentException when the language is not supported
   */
  List<RecognizedSpan> analyze(String text, String language);
}
