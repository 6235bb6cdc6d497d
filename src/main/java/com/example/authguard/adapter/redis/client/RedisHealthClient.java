package com.example.authguard.adapter.redis.client;

import com.example.authguard.adapter.redis.dto.RedisHealthResponse;
import com.example.authguard.properties.ApplicationProperties;
import java.time.Clock;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Pings the counter store for readiness probes.
 */
@Slf4j
@Component
public class RedisHealthClient {

  private final RedisTemplate<String, String> redisTemplate;
  private final Clock clock;
  private final String mode;

  public RedisHealthClient(RedisTemplate<String, String> redisTemplate, Clock clock,
                           ApplicationProperties properties) {
    this.redisTemplate = redisTemplate;
    this.clock = clock;
    this.mode = properties.redis().mode();
  }

  public RedisHealthResponse checkHealth() {
    long startTime = clock.millis();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      if (!"PONG".equalsIgnoreCase(pingResponse)) {
        return RedisHealthResponse.unhealthy(mode, "Invalid PING response: " + pingResponse);
      }
      long responseTime = clock.millis() - startTime;
      return RedisHealthResponse.healthy(responseTime, mode, serverVersion());

    } catch (DataAccessException e) {
      log.error("Redis health check failed", e);
      return RedisHealthResponse.unhealthy(mode, "Redis unreachable");
    }
  }

  private String serverVersion() {
    try {
      Properties info = redisTemplate.execute((RedisCallback<Properties>) connection ->
          connection.serverCommands().info("server"));
      return info != null ? info.getProperty("redis_version", "unknown") : "unknown";
    } catch (DataAccessException e) {
      log.debug("Redis INFO unavailable: {}", e.getMessage());
      return "unknown";
    }
  }
}
