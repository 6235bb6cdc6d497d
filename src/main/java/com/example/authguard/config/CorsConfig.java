package com.example.authguard.config;

import static com.example.authguard.web.rest.ApiConstants.ApiHeader.*;

import com.example.authguard.properties.ApplicationProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Cross-origin policy for browser clients. Origins come from {@code app.security.cors}; the
 * session and CSRF headers may be sent, and the rate limit and CSRF headers may be read.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class CorsConfig {

  private static final List<String> ALLOWED_METHODS =
      List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS");

  private final ApplicationProperties properties;

  @Bean
  public CorsConfigurationSource corsConfigurationSource() {
    ApplicationProperties.SecurityProperties security = properties.security();
    ApplicationProperties.SecurityProperties.CorsProperties cors = security.cors();

    CorsConfiguration configuration = new CorsConfiguration();
    configuration.setAllowedOrigins(cors.allowedOrigins());
    configuration.setAllowedMethods(ALLOWED_METHODS);
    configuration.setAllowedHeaders(List.of(
        HttpHeaders.ORIGIN,
        HttpHeaders.CONTENT_TYPE,
        HttpHeaders.ACCEPT,
        HttpHeaders.AUTHORIZATION,
        "X-Requested-With",
        security.csrf().headerName(),
        security.session().headerName()));
    configuration.setExposedHeaders(List.of(
        RATE_LIMIT_LIMIT,
        RATE_LIMIT_REMAINING,
        RATE_LIMIT_RESET,
        RETRY_AFTER,
        AUTH_ATTEMPTS_REMAINING,
        security.csrf().headerName()));
    configuration.setAllowCredentials(cors.allowCredentials());
    configuration.setMaxAge(cors.maxAge());

    log.info("CORS enabled for {} origin(s)", cors.allowedOrigins().size());
    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", configuration);
    return source;
  }
}
