package com.piigateway.api.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration for API CORS defaults.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final GatewayProperties properties;

  public WebConfig(GatewayProperties properties) {
    this.properties = properties;
  }

  /**
   * Registers API CORS mappings when an allowlist is configured.
   *
   * @param registry Spring CORS registry
   */
  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> allowedOrigins = properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .map(String::trim)
        .toList();
    if (allowedOrigins.isEmpty()) {
      return;
    }

    registry
        .addMapping("/api/**")
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .exposedHeaders("X-RateLimit-Limit", "X-RateLimit-Remaining", "X-RateLimit-Reset")
        .allowedOrigins(allowedOrigins.toArray(String[]::new))
        .maxAge(600);
  }
}
