package com.piigateway.api.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SuspiciousPatternDetectorTest {
  private final SuspiciousPatternDetector detector = new SuspiciousPatternDetector();

  @Test
  void flagsPathTraversal() {
    assertThat(detector.matches("/x/../../etc/passwd", "")).isTrue();
    assertThat(detector.matches("/static/../etc/passwd", null)).isTrue();
  }

  @Test
  void flagsSqlAndScriptTokensInQueryRegardlessOfCase() {
    assertThat(detector.matches("/x", "q=SELECT * FROM t")).isTrue();
    assertThat(detector.matches("/x", "name=<ScRiPt>alert(1)</script>")).isTrue();
  }

  @Test
  void ignoresOrdinaryRequests() {
    assertThat(detector.matches("/api/health", "")).isFalse();
    assertThat(detector.matches("/api/v1/analyze", "lang=en&page=2")).isFalse();
    assertThat(detector.matches(null, null)).isFalse();
  }
}
