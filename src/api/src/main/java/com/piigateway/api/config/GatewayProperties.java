package com.piigateway.api.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the gateway API service.
 *
 * <p>Values are bound from {@code gateway.*} in {@code application.yml} and environment
 * variables. Components read them once at construction.
 */
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {
  private final RateLimit rateLimit = new RateLimit();
  private final Metrics metrics = new Metrics();
  private final Analyzer analyzer = new Analyzer();
  private final Api api = new Api();

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Analyzer getAnalyzer() {
    return analyzer;
  }

  public Api getApi() {
    return api;
  }

  /** Per-client admission control applied to every inbound request. */
  public static class RateLimit {
    private boolean enabled = true;
    private int requestsPerMinute = 60;
    private int burstLimit = 100;
    private Duration blockDuration = Duration.ofSeconds(300);
    private boolean trustForwardedFor = false;
    private final Sweep sweep = new Sweep();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getRequestsPerMinute() {
      return requestsPerMinute;
    }

    public void setRequestsPerMinute(int requestsPerMinute) {
      this.requestsPerMinute = requestsPerMinute;
    }

    public int getBurstLimit() {
      return burstLimit;
    }

    public void setBurstLimit(int burstLimit) {
      this.burstLimit = burstLimit;
    }

    public Duration getBlockDuration() {
      return blockDuration;
    }

    public void setBlockDuration(Duration blockDuration) {
      this.blockDuration = blockDuration;
    }

    public boolean isTrustForwardedFor() {
      return trustForwardedFor;
    }

    public void setTrustForwardedFor(boolean trustForwardedFor) {
      this.trustForwardedFor = trustForwardedFor;
    }

    public Sweep getSweep() {
      return sweep;
    }
  }

  /** Periodic eviction of idle client windows. */
  public static class Sweep {
    private boolean enabled = true;
    private long intervalMs = 60_000L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }
  }

  /** In-process request statistics. */
  public static class Metrics {
    private int maxSamples = 1000;

    public int getMaxSamples() {
      return maxSamples;
    }

    public void setMaxSamples(int maxSamples) {
      this.maxSamples = maxSamples;
    }
  }

  /** Text-analysis request bounds and recognizer configuration. */
  public static class Analyzer {
    private int maxTextLength = 102400;
    private List<String> supportedLanguages = new ArrayList<>(List.of("en", "es"));
    private double minConfidenceScore = 0.5;
    private List<Recognizer> recognizers = new ArrayList<>();

    public int getMaxTextLength() {
      return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
      this.maxTextLength = maxTextLength;
    }

    public List<String> getSupportedLanguages() {
      return supportedLanguages;
    }

    public void setSupportedLanguages(List<String> supportedLanguages) {
      this.supportedLanguages = supportedLanguages;
    }

    public double getMinConfidenceScore() {
      return minConfidenceScore;
    }

    public void setMinConfidenceScore(double minConfidenceScore) {
      this.minConfidenceScore = minConfidenceScore;
    }

    public List<Recognizer> getRecognizers() {
      return recognizers;
    }

    public void setRecognizers(List<Recognizer> recognizers) {
      this.recognizers = recognizers;
    }
  }

  /** Custom pattern recognizer declared in configuration. */
  public static class Recognizer {
    private String entityType;
    private String regex;
    private double score = 0.5;

    public String getEntityType() {
      return entityType;
    }

    public void setEntityType(String entityType) {
      this.entityType = entityType;
    }

    public String getRegex() {
      return regex;
    }

    public void setRegex(String regex) {
      this.regex = regex;
    }

    public double getScore() {
      return score;
    }

    public void setScore(double score) {
      this.score = score;
    }
  }

  /** API-level behavior configuration. */
  public static class Api {
    private final Cors cors = new Cors();

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist configuration for frontend consumers. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }
}
