package com.piigateway.api.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/**
 * Immutable, internally consistent copy of the collector state.
 *
 * @param totalRequests sum of {@code requestsByPath} values at snapshot time
 * @param requestsByPath request count per path
 * @param responseTimes retained latency samples in seconds, oldest first
 * @param averageResponseTime mean of the samples, rounded to 3 decimals, floored at 0.001
 * @param requestsInLastMinute number of retained samples
 * @param errorRate error count over total requests, rounded to 3 decimals
 * @param errorCounts occurrences per status code (400 and above)
 * @param suspiciousRequests suspicious request count per client identifier
 */
@JsonPropertyOrder({
  "total_requests",
  "requests_by_path",
  "average_response_time",
  "requests_in_last_minute",
  "error_rate",
  "error_counts",
  "suspicious_requests"
})
public record MetricsSnapshot(
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("requests_by_path") Map<String, Long> requestsByPath,
    @JsonIgnore List<Double> responseTimes,
    @JsonProperty("average_response_time") double averageResponseTime,
    @JsonProperty("requests_in_last_minute") int requestsInLastMinute,
    @JsonProperty("error_rate") double errorRate,
    @JsonProperty("error_counts") Map<Integer, Long> errorCounts,
    @JsonProperty("suspicious_requests") Map<String, Long> suspiciousRequests) {}
