package com.example.authguard.web.rest.controller;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.authguard.adapter.redis.client.RedisHealthClient;
import com.example.authguard.adapter.redis.dto.RedisHealthResponse;
import com.example.authguard.store.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController")
class HealthControllerTest {

  @Mock
  private RedisHealthClient redisHealthClient;

  private CircuitBreakerRegistry circuitBreakerRegistry;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
    HealthController controller = new HealthController(
        redisHealthClient, circuitBreakerRegistry, MutableClock.at(1_700_000_000_000L));
    mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
  }

  @Test
  @DisplayName("health always reports UP")
  void health() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"));
  }

  @Test
  @DisplayName("ready when Redis answers")
  void readyWhenRedisHealthy() throws Exception {
    // Given
    given(redisHealthClient.checkHealth()).willReturn(RedisHealthResponse.healthy(3, "standalone", "7.2.4"));

    // When / Then
    mockMvc.perform(get("/health/ready"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ready").value(true))
        .andExpect(jsonPath("$.redis.version").value("7.2.4"))
        .andExpect(jsonPath("$.identityProvider.circuitBreaker").value("CLOSED"));
  }

  @Test
  @DisplayName("not ready when Redis is down")
  void notReadyWhenRedisDown() throws Exception {
    given(redisHealthClient.checkHealth()).willReturn(RedisHealthResponse.unhealthy("standalone", "Redis unreachable"));

    mockMvc.perform(get("/health/ready"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.ready").value(false))
        .andExpect(jsonPath("$.redis.error").value("Redis unreachable"));
  }

  @Test
  @DisplayName("an open identity provider breaker does not fail readiness")
  void openBreakerStillReady() throws Exception {
    // Given
    given(redisHealthClient.checkHealth()).willReturn(RedisHealthResponse.healthy(3, "standalone", "7.2.4"));
    circuitBreakerRegistry.circuitBreaker("identityProvider").transitionToOpenState();

    // When / Then
    mockMvc.perform(get("/health/ready"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.identityProvider.circuitBreaker").value("OPEN"));
  }
}
