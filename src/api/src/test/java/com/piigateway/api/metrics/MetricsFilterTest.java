package com.piigateway.api.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.piigateway.api.config.GatewayProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class MetricsFilterTest {
  private MetricsCollector collector;
  private MetricsFilter filter;

  @BeforeEach
  void setUp() {
    GatewayProperties properties = new GatewayProperties();
    collector = new MetricsCollector(
        properties, new SuspiciousPatternDetector(), new SimpleMeterRegistry());
    filter = new MetricsFilter(properties, collector);
  }

  @Test
  void recordsPathAndErrorStatusOfHandledRequest() throws Exception {
    FilterChain chain = (req, res) -> ((HttpServletResponse) res).setStatus(404);

    filter.doFilter(request("/api/v1/missing", null), new MockHttpServletResponse(), chain);
    filter.doFilter(request("/api/v1/health", null), new MockHttpServletResponse(),
        new MockFilterChain());

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(snapshot.requestsByPath())
        .containsEntry("/api/v1/missing", 1L)
        .containsEntry("/api/v1/health", 1L);
    assertThat(snapshot.errorCounts()).containsOnlyKeys(404);
    assertThat(snapshot.responseTimes()).hasSize(2);
  }

  @Test
  void downstreamFaultIsRecordedAs500AndPropagated() {
    ServletException failure = new ServletException("handler failed");
    FilterChain chain = (req, res) -> {
      throw failure;
    };

    assertThatThrownBy(() ->
        filter.doFilter(request("/api/v1/analyze", null), new MockHttpServletResponse(), chain))
        .isSameAs(failure);

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(snapshot.errorCounts()).containsEntry(500, 1L);
    assertThat(snapshot.requestsByPath()).containsEntry("/api/v1/analyze", 1L);
  }

  @Test
  void encodedAttackInQueryIsCountedAgainstClient() throws Exception {
    filter.doFilter(request("/search", "q=1%20UNION%20SELECT%20password"),
        new MockHttpServletResponse(), new MockFilterChain());

    assertThat(collector.snapshot().suspiciousRequests()).containsEntry("10.2.2.2", 1L);
  }

  @Test
  void encodedPathIsDecodedBeforeMatchingAndCounting() throws Exception {
    filter.doFilter(request("/api/v1/%3Cscript%3Ealert(1)", null),
        new MockHttpServletResponse(), new MockFilterChain());
    filter.doFilter(request("/api/v1/%73elect", null),
        new MockHttpServletResponse(), new MockFilterChain());
    filter.doFilter(request("/api/v1/select", null),
        new MockHttpServletResponse(), new MockFilterChain());

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(snapshot.suspiciousRequests()).containsEntry("10.2.2.2", 3L);
    assertThat(snapshot.requestsByPath())
        .containsOnlyKeys("/api/v1/<script>alert(1)", "/api/v1/select")
        .containsEntry("/api/v1/select", 2L);
  }

  @Test
  void decodeQueryToleratesMissingAndMalformedInput() {
    assertThat(MetricsFilter.decodeQuery(null)).isEmpty();
    assertThat(MetricsFilter.decodeQuery("a=%3Cscript%3E")).isEqualTo("a=<script>");
    assertThat(MetricsFilter.decodeQuery("a=%zz")).isEqualTo("a=%zz");
  }

  private static MockHttpServletRequest request(String path, String query) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
    request.setRemoteAddr("10.2.2.2");
    request.setQueryString(query);
    return request;
  }
}
