package com.sharecost.config;

import java.util.Arrays;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Browser access to the API. Group tokens travel in the {@code Authorization} header, never in
 * cookies, so an unset or {@code *} frontend URL opens the API to any origin.
 */
@Configuration
public class CorsConfig {
  private static final String WILDCARD = "*";

  private final AppProperties appProperties;

  public CorsConfig(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  @Bean
  public CorsConfigurationSource corsConfigurationSource() {
    CorsConfiguration config = new CorsConfiguration();
    List<String> origins = allowedOrigins(appProperties.frontendUrl());
    if (origins.isEmpty() || origins.contains(WILDCARD)) {
      config.addAllowedOriginPattern(WILDCARD);
    } else {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    config.addAllowedHeader(WILDCARD);
    config.setAllowCredentials(false);

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/api/**", config);
    return source;
  }

  static List<String> allowedOrigins(String frontendUrl) {
    if (frontendUrl == null) {
      return List.of();
    }
    return Arrays.stream(frontendUrl.split(","))
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .toList();
  }
}
