package com.piigateway.api.api;

import com.piigateway.api.metrics.MetricsCollector;
import com.piigateway.api.metrics.MetricsSnapshot;
import com.piigateway.api.model.AnalyzeRequest;
import com.piigateway.api.model.AnalyzeResponse;
import com.piigateway.api.model.BatchAnalyzeRequest;
import com.piigateway.api.model.BatchAnalyzeResponse;
import com.piigateway.api.service.AnalysisService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing text analysis and service monitoring endpoints.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/v1/}: liveness status</li>
 *   <li>{@code GET /api/v1/health}: health status</li>
 *   <li>{@code POST /api/v1/analyze}: PII detection for one text</li>
 *   <li>{@code POST /api/v1/analyze/batch}: PII detection for several texts</li>
 *   <li>{@code GET /api/v1/metrics}: in-process request statistics</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1")
public class AnalyzerController {
  private static final Logger log = LoggerFactory.getLogger(AnalyzerController.class);

  private final AnalysisService analysisService;
  private final MetricsCollector metricsCollector;

  public AnalyzerController(AnalysisService analysisService, MetricsCollector metricsCollector) {
    this.analysisService = analysisService;
    this.metricsCollector = metricsCollector;
  }

  @GetMapping("/")
  public Map<String, String> root() {
    return Map.of("status", "ok");
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "healthy");
  }

  /**
   * Detects PII entities in a single text.
   *
   * @param request text and optional language
   * @return detected entities with matched substrings
   */
  @PostMapping("/analyze")
  public AnalyzeResponse analyze(@RequestBody AnalyzeRequest request) {
    return analysisService.analyze(request);
  }

  /**
   * Detects PII entities in several texts.
   *
   * @param request texts and optional shared language
   * @return one result per text
   */
  @PostMapping("/analyze/batch")
  public BatchAnalyzeResponse analyzeBatch(@RequestBody BatchAnalyzeRequest request) {
    return analysisService.analyzeBatch(request);
  }

  /**
   * Returns a consistent snapshot of request statistics.
   *
   * @return metrics snapshot
   */
  @GetMapping("/metrics")
  public MetricsSnapshot metrics() {
    MetricsSnapshot snapshot = metricsCollector.snapshot();
    log.info("GET /metrics - total_requests={}, requests_by_path={}",
        snapshot.totalRequests(), snapshot.requestsByPath());
    return snapshot;
  }
}
