package com.example.authguard.web.rest.controller;

import com.example.authguard.adapter.redis.client.RedisHealthClient;
import com.example.authguard.adapter.redis.dto.RedisHealthResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Note: Health endpoints don't throw exceptions to GlobalErrorHandler
 * as they need to return specific status codes for monitoring tools.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final String IDENTITY_PROVIDER_BREAKER = "identityProvider";
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";

  private final RedisHealthClient redisHealthClient;
  private final CircuitBreakerRegistry circuitBreakerRegistry;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", clock.millis()
                                   ));
  }

  /**
   * Liveness probe - checks heap headroom only
   */
  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("memoryUsagePercent", Math.round(memoryUsagePercent * 100) / 100.0);

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_UP);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DOWN);
    return ResponseEntity.status(503).body(response);
  }

  /**
   * Readiness probe - the counter store must answer a PING
   */
  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    RedisHealthResponse redisHealth = redisHealthClient.checkHealth();

    Map<String, Object> redisStatus = new LinkedHashMap<>();
    redisStatus.put("status", redisHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    redisStatus.put("mode", redisHealth.mode());
    redisStatus.put("responseTimeMs", redisHealth.responseTimeMs());
    if (redisHealth.version() != null) {
      redisStatus.put("version", redisHealth.version());
    }
    if (redisHealth.error() != null) {
      redisStatus.put("error", redisHealth.error());
    }

    Map<String, Object> status = new LinkedHashMap<>();
    status.put("ready", redisHealth.healthy());
    status.put("redis", redisStatus);
    status.put("identityProvider", Map.of(
        "circuitBreaker", circuitBreakerRegistry.circuitBreaker(IDENTITY_PROVIDER_BREAKER).getState().name()));
    status.put("timestamp", clock.millis());

    if (!redisHealth.healthy()) {
      log.warn("Readiness check failed: {}", redisHealth.error());
    }
    return ResponseEntity.status(redisHealth.healthy() ? 200 : 503).body(status);
  }
}
