package com.piigateway.api;

import com.piigateway.api.config.GatewayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot entrypoint for the PII gateway API service.
 *
 * <p>Every request passes per-client admission control, then security-header stamping, then
 * metrics collection before reaching the analysis endpoints.
 */
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class PiiGatewayApplication {
  public static void main(String[] args) {
    SpringApplication.run(PiiGatewayApplication.class, args);
  }

  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "gateway.rate-limit.sweep",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SweepSchedulingConfiguration {}
}
