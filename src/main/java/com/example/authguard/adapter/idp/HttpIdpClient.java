package com.example.authguard.adapter.idp;

import com.example.authguard.adapter.idp.dto.IdpSignInResult;
import com.example.authguard.adapter.idp.dto.IdpSignUpResult;
import com.example.authguard.adapter.idp.dto.IdpTokenResponse;
import com.example.authguard.adapter.idp.dto.IdpUserResponse;
import com.example.authguard.exception.IdentityProviderException;
import com.example.authguard.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

/**
 * Identity provider client speaking the GoTrue-style REST auth API over OkHttp.
 *
 * <p>4xx answers are credential or input rejections and are returned as results. Transport
 * failures and 5xx answers raise {@link IdentityProviderException}, which also trips the
 * {@code identityProvider} circuit breaker.
 */
@Slf4j
@Component
public class HttpIdpClient implements IdpClient {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final String API_KEY_HEADER = "apikey";

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties.IdpProperties idp;

  public HttpIdpClient(OkHttpClient defaultOkHttpClient, ObjectMapper objectMapper,
                       ApplicationProperties properties) {
    this.httpClient = defaultOkHttpClient;
    this.objectMapper = objectMapper;
    this.idp = properties.idp();
  }

  @Override
  @CircuitBreaker(name = "identityProvider", fallbackMethod = "signInFallback")
  public IdpSignInResult signIn(String email, String password) {
    log.debug("Verifying credentials with identity provider");

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("email", email);
    payload.put("password", password);

    try (Response response = httpClient.newCall(post(idp.signInPath(), payload)).execute()) {
      String body = bodyOf(response);
      failOnServerError(response, "sign-in");

      if (!response.isSuccessful()) {
        log.debug("Identity provider rejected sign-in with status {}", response.code());
        return IdpSignInResult.rejected(rejectionMessage(body, "Invalid credentials"));
      }

      IdpTokenResponse token = objectMapper.readValue(body, IdpTokenResponse.class);
      if (token.isError() || token.user() == null) {
        return IdpSignInResult.rejected(token.errorMessage() != null ? token.errorMessage() : "Invalid credentials");
      }

      IdpUserResponse user = token.user();
      return IdpSignInResult.success(user.id(), user.email(), user.applicationRole(), token.refreshToken());

    } catch (IOException e) {
      throw new IdentityProviderException("Sign-in failed due to network error", e);
    }
  }

  @Override
  @CircuitBreaker(name = "identityProvider", fallbackMethod = "signUpFallback")
  public IdpSignUpResult signUp(String email, String password, String displayName) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("email", email);
    payload.put("password", password);
    if (displayName != null && !displayName.isBlank()) {
      payload.put("data", Map.of("display_name", displayName));
    }

    try (Response response = httpClient.newCall(post(idp.signUpPath(), payload)).execute()) {
      String body = bodyOf(response);
      failOnServerError(response, "sign-up");

      if (!response.isSuccessful()) {
        return IdpSignUpResult.rejected(rejectionMessage(body, "Sign up failed"));
      }

      JsonNode node = body.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(body);

      // with email confirmation enabled the user comes back at the top level
      JsonNode userNode = node.has("user") ? node.get("user") : node;
      IdpUserResponse user = objectMapper.treeToValue(userNode, IdpUserResponse.class);
      return IdpSignUpResult.created(user.id(), user.email());

    } catch (IOException e) {
      throw new IdentityProviderException("Sign-up failed due to network error", e);
    }
  }

  @Override
  @CircuitBreaker(name = "identityProvider", fallbackMethod = "passwordResetFallback")
  public void requestPasswordReset(String email) {
    try (Response response = httpClient.newCall(post(idp.recoverPath(), Map.of("email", email))).execute()) {
      failOnServerError(response, "password reset");
      if (!response.isSuccessful()) {
        log.warn("Identity provider rejected password reset request with status {}", response.code());
      }
    } catch (IOException e) {
      throw new IdentityProviderException("Password reset failed due to network error", e);
    }
  }

  public IdpSignInResult signInFallback(String email, String password, Throwable ex) {
    throw unavailable("sign-in", ex);
  }

  public IdpSignUpResult signUpFallback(String email, String password, String displayName, Throwable ex) {
    throw unavailable("sign-up", ex);
  }

  public void passwordResetFallback(String email, Throwable ex) {
    throw unavailable("password reset", ex);
  }

  private IdentityProviderException unavailable(String operation, Throwable ex) {
    if (ex instanceof IdentityProviderException providerException) {
      return providerException;
    }
    log.error("Identity provider circuit breaker rejected {}", operation, ex);
    return new IdentityProviderException("Identity provider is temporarily unavailable", ex);
  }

  private Request post(String path, Map<String, Object> payload) throws IOException {
    Request.Builder builder = new Request.Builder()
        .url(idp.baseUrl() + path)
        .header("Accept", "application/json")
        .post(RequestBody.create(objectMapper.writeValueAsBytes(payload), JSON));
    if (idp.apiKey() != null && !idp.apiKey().isBlank()) {
      builder.header(API_KEY_HEADER, idp.apiKey());
    }
    return builder.build();
  }

  /**
   * Error message from a 4xx body. The body may be empty or not JSON at all.
   */
  private String rejectionMessage(String body, String defaultMessage) {
    if (body.isBlank()) {
      return defaultMessage;
    }
    try {
      IdpTokenResponse error = objectMapper.readValue(body, IdpTokenResponse.class);
      return error.errorMessage() != null ? error.errorMessage() : defaultMessage;
    } catch (JsonProcessingException e) {
      log.debug("Identity provider rejection body is not JSON");
      return defaultMessage;
    }
  }

  private static String bodyOf(Response response) throws IOException {
    ResponseBody body = response.body();
    return body != null ? body.string() : "";
  }

  private static void failOnServerError(Response response, String operation) {
    if (response.code() >= 500) {
      throw new IdentityProviderException(
          "Identity provider " + operation + " failed with status " + response.code());
    }
  }
}
