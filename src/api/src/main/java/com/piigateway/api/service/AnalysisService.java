package com.piigateway.api.service;

import com.piigateway.api.analysis.RecognizedSpan;
import com.piigateway.api.analysis.TextAnalyzer;
import com.piigateway.api.api.AnalyzerUnavailableException;
import com.piigateway.api.api.BadRequestException;
import com.piigateway.api.config.GatewayProperties;
import com.piigateway.api.model.AnalyzeRequest;
import com.piigateway.api.model.AnalyzeResponse;
import com.piigateway.api.model.BatchAnalyzeRequest;
import com.piigateway.api.model.BatchAnalyzeResponse;
import com.piigateway.api.model.Entity;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates analysis requests, calls the {@link TextAnalyzer} and shapes its spans into API
 * entities.
 */
@Service
public class AnalysisService {
  private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);
  private static final Pattern LANGUAGE_PATTERN = Pattern.compile("^[a-z]{2}$");
  static final String DEFAULT_LANGUAGE = "en";

  private final TextAnalyzer textAnalyzer;
  private final MeterRegistry meterRegistry;
  private final int maxTextLength;

  public AnalysisService(
      TextAnalyzer textAnalyzer, GatewayProperties properties, MeterRegistry meterRegistry) {
    this.textAnalyzer = textAnalyzer;
    this.meterRegistry = meterRegistry;
    this.maxTextLength = properties.getAnalyzer().getMaxTextLength();
  }

  /**
   * Analyses one text.
   *
   * @param request text and optional language
   * @return detected entities
   * @throws BadRequestException when the text or language is invalid
   * @throws AnalyzerUnavailableException when the analyzer itself fails
   */
  public AnalyzeResponse analyze(AnalyzeRequest request) {
    if (request == null) {
      throw new BadRequestException("request body is required");
    }
    String language = resolveLanguage(request.language());
    validateText(request.text());

    log.info("Analyzing text in {}", language);
    List<Entity> entities = analyzeText(request.text(), language);
    log.info("Found {} entities", entities.size());
    return new AnalyzeResponse(entities);
  }

  /**
   * Analyses each text independently.
   *
   * <p>A text that is empty, too long or fails analysis yields an empty entity list; the rest
   * of the batch still completes.
   *
   * @param request texts and optional shared language
   * @return one result per text, in input order
   * @throws BadRequestException when the batch is empty, holds a null entry or its language is
   *     invalid
   */
  public BatchAnalyzeResponse analyzeBatch(BatchAnalyzeRequest request) {
    if (request == null || request.texts() == null || request.texts().isEmpty()) {
      throw new BadRequestException("texts must contain at least one entry");
    }
    if (request.texts().stream().anyMatch(Objects::isNull)) {
      throw new BadRequestException("texts must not contain null entries");
    }
    String language = resolveLanguage(request.language());

    List<AnalyzeResponse> results = new ArrayList<>(request.texts().size());
    for (String text : request.texts()) {
      List<Entity> entities;
      try {
        validateText(text);
        entities = analyzeText(text, language);
      } catch (RuntimeException ex) {
        log.error("Error analyzing text in batch", ex);
        entities = List.of();
      }
      results.add(new AnalyzeResponse(entities));
    }
    log.info("Processed {} texts in batch", results.size());
    return new BatchAnalyzeResponse(results);
  }

  private List<Entity> analyzeText(String text, String language) {
    List<RecognizedSpan> spans;
    try {
      spans = textAnalyzer.analyze(text, language);
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException(ex.getMessage());
    } catch (RuntimeException ex) {
      throw new AnalyzerUnavailableException("text analyzer failed", ex);
    }

    List<Entity> entities = new ArrayList<>(spans.size());
    for (RecognizedSpan span : spans) {
      entities.add(new Entity(
          span.entityType(),
          span.start(),
          span.end(),
          span.score(),
          text.substring(span.start(), span.end())));
      meterRegistry.counter(
              "gateway.pii.entities.detected",
              "entity_type", span.entityType(),
              "language", language)
          .increment();
    }
    return entities;
  }

  private String resolveLanguage(String raw) {
    if (raw == null) {
      return DEFAULT_LANGUAGE;
    }
    if (!LANGUAGE_PATTERN.matcher(raw).matches()) {
      throw new BadRequestException("language must be a two-letter ISO 639-1 code");
    }
    return raw;
  }

  private void validateText(String text) {
    if (text == null || text.isEmpty()) {
      throw new BadRequestException("text must not be empty");
    }
    if (text.length() > maxTextLength) {
      throw new BadRequestException("text exceeds maximum length of " + maxTextLength);
    }
  }
}
