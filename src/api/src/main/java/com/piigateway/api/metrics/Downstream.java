package com.piigateway.api.metrics;

/**
 * Downstream stage wrapped by {@link MetricsCollector#around}.
 *
 * @param <E> checked failure the stage may raise
 */
@FunctionalInterface
public interface Downstream<E extends Exception> {
  /**
   * Runs the stage.
   *
   * @return HTTP status code of the produced response
   * @throws E when the stage fails
   */
  int proceed() throws E;
}
