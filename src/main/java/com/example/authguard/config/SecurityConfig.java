package com.example.authguard.config;

import static com.example.authguard.security.ratelimit.RateLimitRules.API_GENERAL;
import static com.example.authguard.security.ratelimit.RateLimitRules.IP_GLOBAL;

import com.example.authguard.properties.ApplicationProperties;
import com.example.authguard.security.csrf.CsrfTokenStore;
import com.example.authguard.security.filter.CsrfProtectionFilter;
import com.example.authguard.security.filter.RateLimitFilter;
import com.example.authguard.security.filter.SessionAuthenticationFilter;
import com.example.authguard.security.ratelimit.FixedWindowRateLimiter;
import com.example.authguard.service.ClientInfoResolver;
import com.example.authguard.service.SessionService;
import com.example.authguard.web.rest.errors.DelegatedAuthenticationEntryPoint;
import com.example.authguard.web.rest.errors.ErrorResponseWriter;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.authentication.logout.LogoutFilter;
import org.springframework.security.web.csrf.CsrfFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.web.cors.CorsConfigurationSource;

/**
 * Security filter chains.
 * <p>
 * PROBE CHAIN (@Order(1)): health, actuator and API docs, open and unthrottled.
 * AUTH CHAIN (@Order(2)): credential endpoints, IP-throttled and CSRF-checked outside the exempt paths.
 * PROTECTED CHAIN (@Order(3)): session-authenticated endpoints, IP and per-user throttled.
 * DEFAULT CHAIN (@Order(4)): everything else is denied.
 * <p>
 * Defense filters are created here rather than declared as beans so the servlet container does
 * not also register them globally.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private static final Duration HSTS_MAX_AGE = Duration.ofDays(365);
  private static final String CONTENT_SECURITY_POLICY = "default-src 'none'; frame-ancestors 'none'";

  private final FixedWindowRateLimiter rateLimiter;
  private final CsrfTokenStore csrfTokenStore;
  private final SessionService sessionService;
  private final ClientInfoResolver clientInfoResolver;
  private final ErrorResponseWriter errorResponseWriter;
  private final ApplicationProperties properties;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;
  private final CorsConfigurationSource corsConfigurationSource;

  @Bean
  @Order(1)
  public SecurityFilterChain probeEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/health/**",
                         "/health",
                         "/actuator/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain authEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/auth/**")
        .addFilterBefore(rateLimitFilter(IP_GLOBAL, true), CsrfFilter.class)
        .addFilterBefore(csrfProtectionFilter(), LogoutFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/**",
                         "/internal/**")
        .addFilterBefore(rateLimitFilter(IP_GLOBAL, true), CsrfFilter.class)
        .addFilterBefore(csrfProtectionFilter(), LogoutFilter.class)
        .addFilterBefore(new SessionAuthenticationFilter(sessionService, clientInfoResolver),
                         UsernamePasswordAuthenticationFilter.class)
        // per-user limit runs once the principal is known
        .addFilterBefore(rateLimitFilter(API_GENERAL, false), AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize
            .requestMatchers("/internal/**").hasRole("ADMIN")
            .anyRequest().authenticated())
        .exceptionHandling(exceptions -> exceptions
            .authenticationEntryPoint(delegatedAuthenticationEntryPoint)
            .accessDeniedHandler((request, response, denied) -> errorResponseWriter.write(
                response, HttpStatus.FORBIDDEN, "forbidden", "Access denied", request.getRequestURI())));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(4)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  private RateLimitFilter rateLimitFilter(String ruleName, boolean ipOnly) {
    return new RateLimitFilter(rateLimiter, clientInfoResolver, errorResponseWriter, ruleName, ipOnly);
  }

  private CsrfProtectionFilter csrfProtectionFilter() {
    return new CsrfProtectionFilter(csrfTokenStore, clientInfoResolver, errorResponseWriter, properties);
  }

  /**
   * Stateless chains without browser login flows and with hardened response headers. Preflight requests are answered
   * by the CORS filter before any defense filter runs. The built-in CSRF support is
   * off because {@link CsrfProtectionFilter} binds tokens to the Redis-backed session instead.
   */
  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource))
        .csrf(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(headers -> headers
            .frameOptions(FrameOptionsConfig::deny)
            .referrerPolicy(referrer -> referrer.policy(ReferrerPolicy.NO_REFERRER))
            .httpStrictTransportSecurity(hsts -> hsts
                .maxAgeInSeconds(HSTS_MAX_AGE.toSeconds())
                .includeSubDomains(true))
            .contentSecurityPolicy(csp -> csp.policyDirectives(CONTENT_SECURITY_POLICY))
            .addHeaderWriter((request, response) ->
                response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store")));
  }
}
