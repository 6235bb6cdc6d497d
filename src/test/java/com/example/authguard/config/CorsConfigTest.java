package com.example.authguard.config;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.authguard.properties.TestProperties;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

@DisplayName("CorsConfig")
class CorsConfigTest {

  private static final String ALLOWED_ORIGIN = "http://localhost:3000";

  private MockMvc mockMvc;

  @RestController
  static class SignInStub {
    @PostMapping("/auth/sign-in")
    void signIn(HttpServletResponse response) {
      response.setHeader("X-CSRF-Token", "token");
    }
  }

  @BeforeEach
  void setUp() {
    CorsConfigurationSource source = new CorsConfig(TestProperties.defaults()).corsConfigurationSource();
    mockMvc = MockMvcBuilders.standaloneSetup(new SignInStub())
        .addFilters(new CorsFilter(source))
        .build();
  }

  @Test
  @DisplayName("a preflight from an allowed origin may send the session and CSRF headers")
  void preflightFromAllowedOrigin() throws Exception {
    mockMvc.perform(options("/auth/sign-in")
            .header(HttpHeaders.ORIGIN, ALLOWED_ORIGIN)
            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "X-CSRF-Token, X-Session-ID"))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, ALLOWED_ORIGIN))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, containsString("X-CSRF-Token")))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, containsString("X-Session-ID")))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_MAX_AGE, "86400"));
  }

  @Test
  @DisplayName("a preflight from an unknown origin is refused")
  void preflightFromUnknownOrigin() throws Exception {
    mockMvc.perform(options("/auth/sign-in")
            .header(HttpHeaders.ORIGIN, "https://evil.example")
            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
        .andExpect(status().isForbidden())
        .andExpect(header().doesNotExist(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
  }

  @Test
  @DisplayName("cross-origin responses expose the rate limit and CSRF headers")
  void exposesDefenseHeaders() throws Exception {
    mockMvc.perform(post("/auth/sign-in").header(HttpHeaders.ORIGIN, ALLOWED_ORIGIN))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, ALLOWED_ORIGIN))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS, containsString("X-CSRF-Token")))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS, containsString("X-RateLimit-Remaining")))
        .andExpect(header().string("X-CSRF-Token", "token"));
  }
}
