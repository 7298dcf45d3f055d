package com.piigateway.api.metrics;

import com.piigateway.api.config.GatewayProperties;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide request statistics: counts per path, latency samples, error tallies and
 * suspicious-request counts per client.
 *
 * <p>Every mutation and every snapshot runs under one monitor, so a snapshot never observes
 * half of an update. The monitor is never held while downstream work runs.
 */
@Component
public class MetricsCollector {
  private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

  static final double MIN_AVERAGE_RESPONSE_TIME = 0.001;
  static final int FAILURE_STATUS = 500;

  private final Object lock = new Object();
  private final Map<String, Long> requestsByPath = new HashMap<>();
  private final Deque<Double> responseTimes = new ArrayDeque<>();
  private final Map<Integer, Long> errorCounts = new HashMap<>();
  private final Map<String, Long> suspiciousRequests = new HashMap<>();
  private long totalRequests;

  private final int maxSamples;
  private final SuspiciousPatternDetector detector;
  private final Clock clock;
  private final Counter suspiciousCounter;

  /**
   * Creates the collector.
   *
   * @param properties typed gateway properties (sample cap)
   * @param detector attack-signature predicate
   * @param meterRegistry registry supplying the monotonic clock and receiving gauges
   */
  public MetricsCollector(
      GatewayProperties properties,
      SuspiciousPatternDetector detector,
      MeterRegistry meterRegistry) {
    this.maxSamples = Math.max(1, properties.getMetrics().getMaxSamples());
    this.detector = detector;
    this.clock = meterRegistry.config().clock();
    this.suspiciousCounter = meterRegistry.counter("gateway.requests.suspicious");
    meterRegistry.gauge("gateway.requests.total", this, c -> c.snapshot().totalRequests());
    meterRegistry.gauge("gateway.requests.error_rate", this, c -> c.snapshot().errorRate());
  }

  /**
   * Starts observing a request that passed admission control.
   *
   * <p>Suspicious requests are counted immediately, before any downstream work.
   *
   * @param request observed request attributes
   * @return handle that must be completed or failed exactly once
   */
  public Observation start(ObservedRequest request) {
    long startNanos = clock.monotonicTime();
    if (detector.matches(request.path(), request.query())) {
      synchronized (lock) {
        suspiciousRequests.merge(request.clientId(), 1L, Long::sum);
      }
      suspiciousCounter.increment();
      log.debug("Suspicious request from {} to {}", request.clientId(), request.path());
    }
    return new Observation(request.path(), startNanos);
  }

  /**
   * Runs {@code downstream} and records its outcome.
   *
   * <p>A fault is recorded as a 500 and rethrown unchanged.
   *
   * @param request observed request attributes
   * @param downstream stage producing the response status
   * @param <E> checked failure type of the stage
   * @return status returned by {@code downstream}
   * @throws E when the stage fails
   */
  public <E extends Exception> int around(ObservedRequest request, Downstream<E> downstream)
      throws E {
    Observation observation = start(request);
    int status;
    try {
      status = downstream.proceed();
    } catch (Throwable fault) {
      observation.fail(fault);
      throw fault;
    }
    observation.complete(status);
    return status;
  }

  /**
   * Returns a deep copy of the current state with derived aggregates.
   *
   * <p>{@code totalRequests} is recomputed from the per-path counts.
   *
   * @return immutable snapshot
   */
  public MetricsSnapshot snapshot() {
    synchronized (lock) {
      long total = 0L;
      for (long count : requestsByPath.values()) {
        total += count;
      }
      totalRequests = total;

      double averageResponseTime = MIN_AVERAGE_RESPONSE_TIME;
      if (!responseTimes.isEmpty()) {
        double sum = 0.0;
        for (double sample : responseTimes) {
          sum += sample;
        }
        averageResponseTime = Math.max(sum / responseTimes.size(), MIN_AVERAGE_RESPONSE_TIME);
      }

      long errors = 0L;
      for (long count : errorCounts.values()) {
        errors += count;
      }
      double errorRate = total == 0L ? 0.0 : (double) errors / total;

      return new MetricsSnapshot(
          total,
          Map.copyOf(requestsByPath),
          List.copyOf(responseTimes),
          round3(averageResponseTime),
          responseTimes.size(),
          round3(errorRate),
          Map.copyOf(errorCounts),
          Map.copyOf(suspiciousRequests));
    }
  }

  private void record(String path, long startNanos, int status) {
    double seconds = (clock.monotonicTime() - startNanos) / (double) TimeUnit.SECONDS.toNanos(1);
    long countForPath;
    synchronized (lock) {
      countForPath = requestsByPath.merge(path, 1L, Long::sum);
      totalRequests++;
      responseTimes.addLast(seconds);
      while (responseTimes.size() > maxSamples) {
        responseTimes.pollFirst();
      }
      if (status >= 400) {
        errorCounts.merge(status, 1L, Long::sum);
      }
    }
    log.debug("Recorded request: path={}, status={}, count_for_path={}",
        path, status, countForPath);
  }

  private static double round3(double value) {
    return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
  }

  /**
   * In-flight measurement of one request.
   */
  public final class Observation {
    private final String path;
    private final long startNanos;
    private final AtomicBoolean recorded = new AtomicBoolean();

    private Observation(String path, long startNanos) {
      this.path = path;
      this.startNanos = startNanos;
    }

    /**
     * Records a response produced by downstream; statuses of 400 and above count as errors.
     *
     * @param status HTTP status code
     */
    public void complete(int status) {
      if (recorded.compareAndSet(false, true)) {
        record(path, startNanos, status);
      }
    }

    /**
     * Records a downstream fault (including cancellation or timeout) as a 500.
     *
     * @param fault the failure, logged but not consumed
     */
    public void fail(Throwable fault) {
      if (recorded.compareAndSet(false, true)) {
        record(path, startNanos, FAILURE_STATUS);
        log.error("Error processing request to {}", path, fault);
      }
    }
  }
}
