package com.example.authguard.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasLength;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.authguard.adapter.idp.IdpClient;
import com.example.authguard.adapter.idp.dto.IdpSignInResult;
import com.example.authguard.adapter.idp.dto.IdpSignUpResult;
import com.example.authguard.exception.IdentityProviderException;
import com.example.authguard.properties.ApplicationProperties;
import com.example.authguard.properties.TestProperties;
import com.example.authguard.security.AuthenticationFailureTracker;
import com.example.authguard.security.LockoutIdentifier;
import com.example.authguard.security.SuspiciousActivityDetector;
import com.example.authguard.security.csrf.CsrfTokenStore;
import com.example.authguard.security.ratelimit.FixedWindowRateLimiter;
import com.example.authguard.security.ratelimit.RateLimitRules;
import com.example.authguard.service.ClientInfoResolver;
import com.example.authguard.service.SessionService;
import com.example.authguard.store.InMemoryCounterStore;
import com.example.authguard.store.MutableClock;
import com.example.authguard.web.rest.errors.ErrorResponseWriter;
import com.example.authguard.web.rest.errors.GlobalErrorHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.Cookie;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Drives the credential endpoints through MockMvc with the real defense components over an
 * in-memory store. Only the identity provider is mocked.
 */
@DisplayName("AuthController")
class AuthControllerTest {

  private static final String EMAIL = "alice@test.com";
  private static final String SIGN_IN_BODY = "{\"email\":\"alice@test.com\",\"password\":\"correct-horse\"}";
  private static final String WRONG_PASSWORD_BODY = "{\"email\":\"alice@test.com\",\"password\":\"wrong\"}";
  private static final String BROWSER = "Mozilla/5.0 (X11; Linux x86_64) Firefox/126.0";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MutableClock clock;
  private InMemoryCounterStore store;
  private IdpClient idpClient;
  private AuthenticationFailureTracker failureTracker;
  private SessionService sessionService;
  private CsrfTokenStore csrfTokenStore;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at(1_699_999_200_000L);
    store = new InMemoryCounterStore(clock);
    idpClient = mock(IdpClient.class);
    build(TestProperties.defaults());
  }

  private void build(ApplicationProperties properties) {
    failureTracker = new AuthenticationFailureTracker(store, clock, properties);
    sessionService = new SessionService(store, objectMapper, clock, properties);
    csrfTokenStore = new CsrfTokenStore(clock, properties);
    AuthController controller = new AuthController(
        new FixedWindowRateLimiter(store, new RateLimitRules(properties), clock, properties),
        failureTracker,
        new SuspiciousActivityDetector(store, clock),
        idpClient,
        sessionService,
        csrfTokenStore,
        new ClientInfoResolver(properties));

    mockMvc = MockMvcBuilders.standaloneSetup(controller)
        .setControllerAdvice(new GlobalErrorHandler(new ErrorResponseWriter(objectMapper, clock)))
        .build();
  }

  private void givenValidCredentials() {
    given(idpClient.signIn(EMAIL, "correct-horse"))
        .willReturn(IdpSignInResult.success("user-1", EMAIL, "user", "refresh-1"));
  }

  private void givenInvalidCredentials() {
    given(idpClient.signIn(EMAIL, "wrong")).willReturn(IdpSignInResult.rejected("Invalid login credentials"));
  }

  private MvcResult signIn(String body) throws Exception {
    return mockMvc.perform(post("/auth/sign-in")
            .contentType(MediaType.APPLICATION_JSON)
            .header("User-Agent", BROWSER)
            .content(body))
        .andReturn();
  }

  @Nested
  @DisplayName("sign-in")
  class SignIn {

    @Test
    @DisplayName("valid credentials create a session, set the cookie and issue a CSRF token")
    void signInSucceeds() throws Exception {
      // Given
      givenValidCredentials();

      // When / Then
      MvcResult result = mockMvc.perform(post("/auth/sign-in")
              .contentType(MediaType.APPLICATION_JSON)
              .header("User-Agent", BROWSER)
              .content(SIGN_IN_BODY))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true))
          .andExpect(jsonPath("$.user.userId").value("user-1"))
          .andExpect(jsonPath("$.csrfToken", hasLength(64)))
          .andExpect(header().string("X-RateLimit-Limit", "5"))
          .andExpect(header().string("X-RateLimit-Remaining", "4"))
          .andExpect(header().string("Set-Cookie", containsString("app_session=")))
          .andExpect(header().string("Set-Cookie", containsString("HttpOnly")))
          .andReturn();

      JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
      String sessionId = body.get("sessionId").asText();
      assertThat(sessionService.get(sessionId)).isPresent();
      assertThat(csrfTokenStore.verify(sessionId, body.get("csrfToken").asText())).isTrue();
    }

    @Test
    @DisplayName("wrong credentials return 401 with the attempts remaining")
    void wrongCredentials() throws Exception {
      // Given
      givenInvalidCredentials();

      // When / Then
      mockMvc.perform(post("/auth/sign-in")
              .contentType(MediaType.APPLICATION_JSON)
              .header("User-Agent", BROWSER)
              .content(WRONG_PASSWORD_BODY))
          .andExpect(status().isUnauthorized())
          .andExpect(jsonPath("$.error").value("invalid_credentials"))
          .andExpect(jsonPath("$.status").value(401))
          .andExpect(jsonPath("$.path").value("/auth/sign-in"))
          .andExpect(header().string("X-Auth-Attempts-Remaining", "4"));
    }

    @Test
    @DisplayName("the sixth attempt in a window is rate limited before the provider is called")
    void rateLimited() throws Exception {
      // Given
      givenValidCredentials();
      for (int i = 0; i < 5; i++) {
        assertThat(signIn(SIGN_IN_BODY).getResponse().getStatus()).isEqualTo(200);
      }

      // When / Then
      mockMvc.perform(post("/auth/sign-in")
              .contentType(MediaType.APPLICATION_JSON)
              .header("User-Agent", BROWSER)
              .content(SIGN_IN_BODY))
          .andExpect(status().isTooManyRequests())
          .andExpect(jsonPath("$.error").value("rate_limit_exceeded"))
          .andExpect(header().string("X-RateLimit-Remaining", "0"))
          .andExpect(header().exists("Retry-After"));
      verify(idpClient, times(5)).signIn(anyString(), anyString());
    }

    @Test
    @DisplayName("five failures lock the account and the provider is no longer called")
    void lockedAfterFailures() throws Exception {
      // Given: a generous sign-in rule so the lockout is what trips
      build(TestProperties.builder().rule(RateLimitRules.AUTH_SIGN_IN, 900_000, 100, "limited").build());
      givenInvalidCredentials();
      for (int i = 0; i < 5; i++) {
        signIn(WRONG_PASSWORD_BODY);
      }

      // When / Then
      mockMvc.perform(post("/auth/sign-in")
              .contentType(MediaType.APPLICATION_JSON)
              .header("User-Agent", BROWSER)
              .content(SIGN_IN_BODY))
          .andExpect(status().isTooManyRequests())
          .andExpect(jsonPath("$.error").value("account_locked"))
          .andExpect(header().string("Retry-After", "900"))
          .andExpect(header().string("X-Auth-Attempts-Remaining", "0"));
      verify(idpClient, never()).signIn(EMAIL, "correct-horse");
    }

    @Test
    @DisplayName("a successful sign-in clears earlier failures")
    void successClearsFailures() throws Exception {
      // Given
      givenInvalidCredentials();
      givenValidCredentials();
      signIn(WRONG_PASSWORD_BODY);
      signIn(WRONG_PASSWORD_BODY);

      // When
      signIn(SIGN_IN_BODY);

      // Then
      assertThat(failureTracker.isLocked(List.of(LockoutIdentifier.email(EMAIL))).attemptsRemaining())
          .isEqualTo(5);
    }

    @Test
    @DisplayName("provider outage returns 503 and is not counted as a failure")
    void providerOutage() throws Exception {
      // Given
      given(idpClient.signIn(anyString(), anyString()))
          .willThrow(new IdentityProviderException("Identity provider is temporarily unavailable"));

      // When / Then
      mockMvc.perform(post("/auth/sign-in")
              .contentType(MediaType.APPLICATION_JSON)
              .header("User-Agent", BROWSER)
              .content(SIGN_IN_BODY))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.error").value("service_unavailable"));
      assertThat(failureTracker.isLocked(List.of(LockoutIdentifier.email(EMAIL))).attemptsRemaining())
          .isEqualTo(5);
    }

    @Test
    @DisplayName("an invalid body is rejected before any defense counter moves")
    void invalidBody() throws Exception {
      mockMvc.perform(post("/auth/sign-in")
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"email\":\"not-an-email\",\"password\":\"\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error").value("validation_error"));

      assertThat(store.calls()).isZero();
    }

    @Test
    @DisplayName("sign-in still works when the store is down for the rate limiter and lockout")
    void storeOutageFailsOpenUntilSessionCreation() throws Exception {
      // Given
      givenValidCredentials();
      store.failing(true);

      // When / Then: session creation is the first step that cannot degrade
      mockMvc.perform(post("/auth/sign-in")
              .contentType(MediaType.APPLICATION_JSON)
              .header("User-Agent", BROWSER)
              .content(SIGN_IN_BODY))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.error").value("service_unavailable"));
      verify(idpClient).signIn(EMAIL, "correct-horse");
    }
  }

  @Nested
  @DisplayName("sign-up and password reset")
  class SignUpAndReset {

    @Test
    @DisplayName("a new account returns 201")
    void signUpCreated() throws Exception {
      given(idpClient.signUp("bob@test.com", "long-enough-password", "Bob"))
          .willReturn(IdpSignUpResult.created("user-2", "bob@test.com"));

      mockMvc.perform(post("/auth/sign-up")
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"email\":\"Bob@Test.com\",\"password\":\"long-enough-password\",\"displayName\":\"Bob\"}"))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.userId").value("user-2"));
    }

    @Test
    @DisplayName("a refused registration returns 400 and counts as a failure")
    void signUpRejected() throws Exception {
      // Given
      given(idpClient.signUp(anyString(), anyString(), any()))
          .willReturn(IdpSignUpResult.rejected("User already registered"));

      // When / Then
      mockMvc.perform(post("/auth/sign-up")
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"email\":\"bob@test.com\",\"password\":\"long-enough-password\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error").value("registration_rejected"))
          .andExpect(jsonPath("$.message").value("User already registered"));
      assertThat(failureTracker.isLocked(List.of(LockoutIdentifier.email("bob@test.com"))).attemptsRemaining())
          .isEqualTo(4);
    }

    @Test
    @DisplayName("a short password fails validation")
    void signUpShortPassword() throws Exception {
      mockMvc.perform(post("/auth/sign-up")
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"email\":\"bob@test.com\",\"password\":\"short\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Password must be between 8 and 128 characters"));
    }

    @Test
    @DisplayName("password reset always answers 202")
    void passwordResetAccepted() throws Exception {
      mockMvc.perform(post("/auth/reset-password")
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"email\":\"nobody@test.com\"}"))
          .andExpect(status().isAccepted())
          .andExpect(jsonPath("$.success").value(true));

      verify(idpClient).requestPasswordReset("nobody@test.com");
    }

    @Test
    @DisplayName("password reset is limited to three per hour")
    void passwordResetRateLimited() throws Exception {
      for (int i = 0; i < 3; i++) {
        mockMvc.perform(post("/auth/reset-password")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"nobody@test.com\"}"))
            .andExpect(status().isAccepted());
      }

      mockMvc.perform(post("/auth/reset-password")
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"email\":\"nobody@test.com\"}"))
          .andExpect(status().isTooManyRequests());
    }

    @Test
    @DisplayName("password reset surfaces provider outages as 503")
    void passwordResetOutage() throws Exception {
      willThrow(new IdentityProviderException("down")).given(idpClient).requestPasswordReset(anyString());

      mockMvc.perform(post("/auth/reset-password")
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"email\":\"nobody@test.com\"}"))
          .andExpect(status().isServiceUnavailable());
    }
  }

  @Nested
  @DisplayName("sign-out and status")
  class SignOutAndStatus {

    private String signedInSession() throws Exception {
      givenValidCredentials();
      MvcResult result = signIn(SIGN_IN_BODY);
      return objectMapper.readTree(result.getResponse().getContentAsString()).get("sessionId").asText();
    }

    @Test
    @DisplayName("status reports a valid session")
    void statusAuthenticated() throws Exception {
      String sessionId = signedInSession();

      mockMvc.perform(get("/auth/status").cookie(new Cookie("app_session", sessionId)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.authenticated").value(true))
          .andExpect(jsonPath("$.userId").value("user-1"));
    }

    @Test
    @DisplayName("status without a session is unauthenticated")
    void statusAnonymous() throws Exception {
      mockMvc.perform(get("/auth/status"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.authenticated").value(false));
    }

    @Test
    @DisplayName("sign-out deletes the session, drops the CSRF token and clears the cookie")
    void signOut() throws Exception {
      // Given
      String sessionId = signedInSession();
      String csrfToken = csrfTokenStore.issue(sessionId);

      // When / Then
      mockMvc.perform(post("/auth/sign-out").cookie(new Cookie("app_session", sessionId)))
          .andExpect(status().isOk())
          .andExpect(header().string("Set-Cookie", containsString("Max-Age=0")));

      assertThat(sessionService.get(sessionId)).isEmpty();
      assertThat(csrfTokenStore.verify(sessionId, csrfToken)).isFalse();
    }

    @Test
    @DisplayName("the session header works for non-browser clients")
    void sessionHeader() throws Exception {
      String sessionId = signedInSession();

      mockMvc.perform(get("/auth/status").header("X-Session-ID", sessionId))
          .andExpect(jsonPath("$.authenticated").value(true));
    }
  }
}
