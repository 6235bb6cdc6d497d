package com.example.authguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Authentication defense service
 *
 * Guards credential endpoints with:
 * - fixed-window rate limiting and brute-force lockout over Redis
 * - Redis-backed sessions with a per-user cap
 * - session-bound CSRF tokens
 */
@SpringBootApplication
@EnableScheduling
public class AuthGuardApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(AuthGuardApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
