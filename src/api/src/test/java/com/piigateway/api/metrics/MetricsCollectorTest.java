package com.piigateway.api.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.data.Offset.offset;

import com.piigateway.api.config.GatewayProperties;
import io.micrometer.core.instrument.MockClock;
import io.micrometer.core.instrument.simple.SimpleConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricsCollectorTest {
  private MockClock clock;
  private SimpleMeterRegistry meterRegistry;
  private MetricsCollector collector;

  @BeforeEach
  void setUp() {
    clock = new MockClock();
    meterRegistry = new SimpleMeterRegistry(SimpleConfig.DEFAULT, clock);
    collector = new MetricsCollector(
        new GatewayProperties(), new SuspiciousPatternDetector(), meterRegistry);
  }

  @Test
  void failingThirdCallIsRecordedAsServerErrorAndRethrown() {
    AtomicInteger calls = new AtomicInteger();
    IllegalStateException failure = new IllegalStateException("analyzer down");
    Downstream<RuntimeException> handler = () -> {
      clock.add(Duration.ofMillis(20));
      if (calls.incrementAndGet() == 3) {
        throw failure;
      }
      return 200;
    };

    collector.around(request("/api/v1/analyze"), handler);
    collector.around(request("/api/v1/analyze"), handler);
    assertThatThrownBy(() -> collector.around(request("/api/v1/analyze"), handler))
        .isSameAs(failure);

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(snapshot.errorCounts()).containsEntry(500, 1L);
    assertThat(snapshot.requestsByPath()).containsEntry("/api/v1/analyze", 3L);
    assertThat(snapshot.responseTimes()).hasSize(3);
    assertThat(snapshot.totalRequests()).isEqualTo(3L);
    assertThat(snapshot.errorRate()).isEqualTo(0.333);
  }

  @Test
  void checkedFaultsPropagateUnchanged() {
    IOException failure = new IOException("connection reset");

    assertThatThrownBy(() -> collector.<IOException>around(request("/a"), () -> {
      throw failure;
    })).isSameAs(failure);

    assertThat(collector.snapshot().errorCounts()).containsEntry(500, 1L);
  }

  @Test
  void errorsAreRecordedAndPropagatedUnchanged() {
    AssertionError failure = new AssertionError("handler crashed");

    assertThatThrownBy(() -> collector.around(request("/a"), () -> {
      throw failure;
    })).isSameAs(failure);

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(snapshot.errorCounts()).containsEntry(500, 1L);
    assertThat(snapshot.responseTimes()).hasSize(1);
  }

  @Test
  void totalsStayConsistentAcrossMixedOutcomes() {
    int[] statuses = {200, 201, 404, 200, 500, 429, 200, 400};
    String[] paths = {"/a", "/b", "/a", "/c"};
    for (int i = 0; i < statuses.length; i++) {
      int status = statuses[i];
      collector.around(request(paths[i % paths.length]), () -> status);
    }

    MetricsSnapshot snapshot = collector.snapshot();
    long pathSum = snapshot.requestsByPath().values().stream().mapToLong(Long::longValue).sum();
    long errorSum = snapshot.errorCounts().values().stream().mapToLong(Long::longValue).sum();
    assertThat(pathSum).isEqualTo(snapshot.totalRequests()).isEqualTo(8L);
    assertThat(errorSum).isLessThanOrEqualTo(snapshot.totalRequests()).isEqualTo(4L);
    assertThat(snapshot.errorCounts()).containsOnlyKeys(404, 500, 429, 400);
    assertThat(snapshot.errorRate()).isEqualTo(0.5);
  }

  @Test
  void keepsOnlyMostRecentThousandSamples() {
    for (int i = 1; i <= 1_005; i++) {
      long millis = i;
      collector.around(request("/a"), () -> {
        clock.add(Duration.ofMillis(millis));
        return 200;
      });
    }

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(snapshot.responseTimes()).hasSize(1_000);
    assertThat(snapshot.responseTimes().get(0)).isCloseTo(0.006, offset(1e-9));
    assertThat(snapshot.responseTimes().get(999)).isCloseTo(1.005, offset(1e-9));
    assertThat(snapshot.requestsInLastMinute()).isEqualTo(1_000);
    assertThat(snapshot.totalRequests()).isEqualTo(1_005L);
  }

  @Test
  void averageResponseTimeIsRoundedAndFloored() {
    assertThat(collector.snapshot().averageResponseTime()).isEqualTo(0.001);
    assertThat(collector.snapshot().errorRate()).isZero();

    collector.around(request("/a"), () -> 200);
    assertThat(collector.snapshot().averageResponseTime()).isEqualTo(0.001);

    collector.around(request("/a"), () -> {
      clock.add(Duration.ofMillis(250));
      return 200;
    });
    collector.around(request("/a"), () -> {
      clock.add(Duration.ofMillis(500));
      return 200;
    });
    assertThat(collector.snapshot().averageResponseTime()).isEqualTo(0.25);
  }

  @Test
  void countsSuspiciousRequestsPerClientEvenWhenDownstreamFails() {
    collector.around(new ObservedRequest("1.2.3.4", "/x/../../etc/passwd", ""), () -> 404);
    assertThatThrownBy(() -> collector.around(
        new ObservedRequest("1.2.3.4", "/search", "q=select * from users"), () -> {
          throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
    collector.around(new ObservedRequest("5.6.7.8", "/api/v1/health", ""), () -> 200);

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(snapshot.suspiciousRequests()).containsOnly(
        entry("1.2.3.4", 2L));
    assertThat(meterRegistry.get("gateway.requests.suspicious").counter().count()).isEqualTo(2.0);
  }

  @Test
  void snapshotIsDetachedFromCollectorState() {
    collector.around(request("/a"), () -> 503);
    MetricsSnapshot before = collector.snapshot();

    collector.around(request("/a"), () -> 200);

    assertThat(before.requestsByPath()).containsEntry("/a", 1L);
    assertThatThrownBy(() -> before.requestsByPath().put("/b", 1L))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> before.errorCounts().clear())
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> before.responseTimes().add(1.0))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThat(collector.snapshot().requestsByPath()).containsEntry("/a", 2L);
  }

  @Test
  void observationRecordsOnlyOnce() {
    MetricsCollector.Observation observation = collector.start(request("/a"));

    observation.complete(200);
    observation.fail(new IllegalStateException("late"));

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(snapshot.totalRequests()).isEqualTo(1L);
    assertThat(snapshot.errorCounts()).isEmpty();
  }

  @Test
  void concurrentUpdatesNeverProduceInconsistentSnapshots() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    AtomicBoolean writing = new AtomicBoolean(true);
    List<String> violations = Collections.synchronizedList(new ArrayList<>());
    try {
      List<Future<?>> writers = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        int worker = t;
        writers.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < 500; i++) {
            int status = (i % 5 == 0) ? 500 : 200;
            collector.around(request("/p" + ((worker + i) % 4)), () -> status);
          }
          return null;
        }));
      }
      Thread reader = new Thread(() -> {
        while (writing.get()) {
          MetricsSnapshot snapshot = collector.snapshot();
          long pathSum =
              snapshot.requestsByPath().values().stream().mapToLong(Long::longValue).sum();
          if (pathSum != snapshot.totalRequests()
              || snapshot.requestsInLastMinute() != Math.min(pathSum, 1_000L)) {
            violations.add("inconsistent snapshot at total=" + pathSum);
          }
        }
      });
      reader.start();
      start.countDown();
      for (Future<?> writer : writers) {
        writer.get(30, TimeUnit.SECONDS);
      }
      writing.set(false);
      reader.join();
    } finally {
      executor.shutdownNow();
    }

    MetricsSnapshot snapshot = collector.snapshot();
    assertThat(violations).isEmpty();
    assertThat(snapshot.totalRequests()).isEqualTo(4_000L);
    assertThat(snapshot.errorCounts()).containsEntry(500, 800L);
    assertThat(snapshot.responseTimes()).hasSize(1_000);
  }

  private static ObservedRequest request(String path) {
    return new ObservedRequest("10.0.0.1", path, "");
  }
}
