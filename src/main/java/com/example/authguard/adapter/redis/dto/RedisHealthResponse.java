package com.example.authguard.adapter.redis.dto;

/**
 * Redis Health Check Response
 */
public record RedisHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String mode,
    String version,
    String error
) {
  public static RedisHealthResponse healthy(long responseTimeMs, String mode, String version) {
    return new RedisHealthResponse(true, responseTimeMs, mode, version, null);
  }

  public static RedisHealthResponse unhealthy(String mode, String error) {
    return new RedisHealthResponse(false, 0, mode, null, error);
  }
}
