package com.example.authguard.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.authguard.store.InMemoryCounterStore;
import com.example.authguard.store.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SuspiciousActivityDetector")
class SuspiciousActivityDetectorTest {

  private static final String IP = "203.0.113.7";
  private static final String BROWSER = "Mozilla/5.0 (X11; Linux x86_64) Firefox/126.0";

  private MutableClock clock;
  private InMemoryCounterStore store;
  private SuspiciousActivityDetector detector;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at(1_699_999_200_000L);
    store = new InMemoryCounterStore(clock);
    detector = new SuspiciousActivityDetector(store, clock);
  }

  @Test
  @DisplayName("an ordinary browser request is clean")
  void ordinaryRequestIsClean() {
    RiskAssessment assessment = detector.assess(IP, BROWSER, "alice@test.com");

    assertThat(assessment.suspicious()).isFalse();
    assertThat(assessment.riskScore()).isZero();
    assertThat(assessment.reasons()).isEmpty();
  }

  @Test
  @DisplayName("a bot user agent scores but is not suspicious on its own")
  void botUserAgentScores() {
    RiskAssessment assessment = detector.assess(IP, "Googlebot/2.1 (+http://www.google.com/bot.html)", null);

    assertThat(assessment.riskScore()).isEqualTo(SuspiciousActivityDetector.USER_AGENT_SCORE);
    assertThat(assessment.reasons()).containsExactly(SuspiciousActivityDetector.REASON_USER_AGENT);
    assertThat(assessment.suspicious()).isFalse();
  }

  @Test
  @DisplayName("missing and very short user agents count as suspicious agents")
  void missingOrShortUserAgent() {
    assertThat(detector.assess(IP, null, null).reasons())
        .containsExactly(SuspiciousActivityDetector.REASON_USER_AGENT);
    assertThat(detector.assess("198.51.100.1", "curl/8", null).reasons())
        .containsExactly(SuspiciousActivityDetector.REASON_USER_AGENT);
  }

  @Test
  @DisplayName("burst plus a bad user agent crosses the threshold")
  void burstAndUserAgentIsSuspicious() {
    // Given
    for (int i = 0; i < SuspiciousActivityDetector.BURST_THRESHOLD; i++) {
      detector.assess(IP, BROWSER, null);
    }

    // When
    RiskAssessment assessment = detector.assess(IP, "bot", null);

    // Then
    assertThat(assessment.reasons()).containsExactly(
        SuspiciousActivityDetector.REASON_BURST, SuspiciousActivityDetector.REASON_USER_AGENT);
    assertThat(assessment.riskScore()).isEqualTo(55);
    assertThat(assessment.suspicious()).isTrue();
  }

  @Test
  @DisplayName("the burst counter starts over in the next minute")
  void burstWindowRolls() {
    for (int i = 0; i < SuspiciousActivityDetector.BURST_THRESHOLD + 5; i++) {
      detector.assess(IP, BROWSER, null);
    }

    clock.advance(Duration.ofMinutes(1));

    assertThat(detector.assess(IP, BROWSER, null).riskScore()).isZero();
  }

  @Test
  @DisplayName("password spraying is flagged at the eleventh distinct email")
  void passwordSprayingFlagged() {
    // Given
    for (int i = 1; i <= SuspiciousActivityDetector.SPRAY_THRESHOLD; i++) {
      RiskAssessment assessment = detector.assess(IP, BROWSER, "user" + i + "@test.com");
      assertThat(assessment.suspicious()).isFalse();
    }

    // When
    RiskAssessment eleventh = detector.assess(IP, BROWSER, "user11@test.com");

    // Then
    assertThat(eleventh.suspicious()).isTrue();
    assertThat(eleventh.riskScore()).isEqualTo(SuspiciousActivityDetector.SPRAY_SCORE);
    assertThat(eleventh.reasons()).containsExactly(SuspiciousActivityDetector.REASON_SPRAY);
  }

  @Test
  @DisplayName("repeating the same email is not spraying")
  void sameEmailIsNotSpraying() {
    for (int i = 0; i < 20; i++) {
      detector.assess(IP, BROWSER, i % 2 == 0 ? "Alice@Test.com" : "alice@test.com");
    }

    assertThat(detector.assess(IP, BROWSER, "alice@test.com").suspicious()).isFalse();
  }

  @Test
  @DisplayName("store failure yields a clean assessment")
  void storeFailureIsClean() {
    store.failing(true);

    RiskAssessment assessment = detector.assess(IP, null, "alice@test.com");

    assertThat(assessment).isEqualTo(RiskAssessment.clean());
  }
}
