package com.example.authguard.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.authguard.properties.TestProperties;
import com.example.authguard.store.InMemoryCounterStore;
import com.example.authguard.store.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthenticationFailureTracker")
class AuthenticationFailureTrackerTest {

  private static final List<LockoutIdentifier> ALICE =
      List.of(LockoutIdentifier.email("alice@test.com"), LockoutIdentifier.ip("192.168.1.10"));

  private MutableClock clock;
  private InMemoryCounterStore store;
  private AuthenticationFailureTracker tracker;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at(1_700_000_000_000L);
    store = new InMemoryCounterStore(clock);
    tracker = new AuthenticationFailureTracker(store, clock, TestProperties.defaults());
  }

  @Test
  @DisplayName("counts down remaining attempts and locks at the threshold")
  void locksAfterMaxFailures() {
    for (int expected = 4; expected >= 1; expected--) {
      assertThat(tracker.recordFailure(ALICE)).isEqualTo(expected);
      assertThat(tracker.isLocked(ALICE).locked()).isFalse();
    }

    assertThat(tracker.recordFailure(ALICE)).isZero();

    LockoutStatus status = tracker.isLocked(ALICE);
    assertThat(status.locked()).isTrue();
    assertThat(status.attemptsRemaining()).isZero();
    assertThat(status.retryAfter()).isEqualTo(Duration.ofMinutes(15));
    assertThat(status.lockUntil()).isEqualTo(clock.instant().plus(Duration.ofMinutes(15)));
  }

  @Test
  @DisplayName("one locked identifier locks the whole set")
  void anyIdentifierLocks() {
    // Given: the IP fails five times under different emails
    for (int i = 0; i < 5; i++) {
      tracker.recordFailure(List.of(
          LockoutIdentifier.email("user" + i + "@test.com"), LockoutIdentifier.ip("192.168.1.10")));
    }

    // When
    LockoutStatus status = tracker.isLocked(ALICE);

    // Then
    assertThat(status.locked()).isTrue();
  }

  @Test
  @DisplayName("the lockout TTL is set on the first failure and not extended")
  void ttlNotExtendedByLaterFailures() {
    // Given
    tracker.recordFailure(ALICE);
    clock.advance(Duration.ofMinutes(10));

    // When
    tracker.recordFailure(ALICE);

    // Then
    assertThat(store.ttl("lockout:email:alice@test.com")).contains(Duration.ofMinutes(5));
  }

  @Test
  @DisplayName("the lock lifts when the counters expire")
  void unlocksAfterExpiry() {
    for (int i = 0; i < 5; i++) {
      tracker.recordFailure(ALICE);
    }
    assertThat(tracker.isLocked(ALICE).locked()).isTrue();

    clock.advance(Duration.ofMinutes(15));

    LockoutStatus status = tracker.isLocked(ALICE);
    assertThat(status.locked()).isFalse();
    assertThat(status.attemptsRemaining()).isEqualTo(5);
  }

  @Test
  @DisplayName("a counter left without expiry reports the lockout duration and gets its expiry back")
  void counterWithoutExpiryIsRepaired() {
    // Given: the first increment landed but its expire never did
    List<LockoutIdentifier> alice = List.of(LockoutIdentifier.email("alice@test.com"));
    store.increment("lockout:email:alice@test.com");
    for (int i = 0; i < 4; i++) {
      tracker.recordFailure(alice);
    }
    assertThat(store.ttl("lockout:email:alice@test.com")).isEmpty();
    clock.advance(Duration.ofDays(30));

    // When
    LockoutStatus status = tracker.isLocked(alice);

    // Then
    assertThat(status.locked()).isTrue();
    assertThat(status.retryAfter()).isEqualTo(Duration.ofMinutes(15));
    assertThat(status.lockUntil()).isEqualTo(clock.instant().plus(Duration.ofMinutes(15)));
    assertThat(store.ttl("lockout:email:alice@test.com")).contains(Duration.ofMinutes(15));

    clock.advance(Duration.ofMinutes(15));
    assertThat(tracker.isLocked(alice).locked()).isFalse();
  }

  @Test
  @DisplayName("an unlocked counter without expiry is repaired too")
  void unlockedCounterWithoutExpiryIsRepaired() {
    // Given
    store.put("lockout:ip:192.168.1.10", "2");

    // When
    LockoutStatus status = tracker.isLocked(ALICE);

    // Then
    assertThat(status.locked()).isFalse();
    assertThat(status.attemptsRemaining()).isEqualTo(3);
    assertThat(store.ttl("lockout:ip:192.168.1.10")).contains(Duration.ofMinutes(15));
  }

  @Test
  @DisplayName("clear resets the failure history")
  void clearResets() {
    // Given
    for (int i = 0; i < 3; i++) {
      tracker.recordFailure(ALICE);
    }

    // When
    tracker.clear(ALICE);

    // Then
    assertThat(tracker.isLocked(ALICE).attemptsRemaining()).isEqualTo(5);
    assertThat(store.exists("lockout:email:alice@test.com")).isFalse();
    assertThat(store.exists("lockout:ip:192.168.1.10")).isFalse();
  }

  @Test
  @DisplayName("emails are matched case-insensitively")
  void emailIsNormalized() {
    tracker.recordFailure(List.of(LockoutIdentifier.email("Alice@Test.com ")));

    assertThat(store.get("lockout:email:alice@test.com")).contains("1");
  }

  @Test
  @DisplayName("fails open when the store is down")
  void failsOpen() {
    // Given
    store.failing(true);

    // When / Then
    assertThat(tracker.recordFailure(ALICE)).isEqualTo(5);
    assertThat(tracker.isLocked(ALICE).locked()).isFalse();
    tracker.clear(ALICE);
    assertThat(tracker.topBlocked(10)).isEmpty();
  }

  @Test
  @DisplayName("disabled lockout never touches the store")
  void disabledSkipsStore() {
    AuthenticationFailureTracker disabled = new AuthenticationFailureTracker(
        store, clock, TestProperties.builder().lockoutEnabled(false).build());

    for (int i = 0; i < 10; i++) {
      disabled.recordFailure(ALICE);
    }

    assertThat(disabled.isLocked(ALICE).locked()).isFalse();
    assertThat(store.calls()).isZero();
  }

  @Test
  @DisplayName("top blocked lists only locked identifiers, highest first and masked")
  void topBlockedListsMaskedIdentifiers() {
    // Given
    for (int i = 0; i < 7; i++) {
      tracker.recordFailure(List.of(LockoutIdentifier.ip("10.1.2.3")));
    }
    for (int i = 0; i < 5; i++) {
      tracker.recordFailure(List.of(LockoutIdentifier.email("bob@test.com")));
    }
    tracker.recordFailure(List.of(LockoutIdentifier.email("carol@test.com")));

    // When
    List<BlockedIdentifier> blocked = tracker.topBlocked(10);

    // Then
    assertThat(blocked).containsExactly(
        new BlockedIdentifier("ip:10.1.***.3", 7),
        new BlockedIdentifier("email:b***@test.com", 5));
  }

  @Test
  @DisplayName("top blocked honours the limit")
  void topBlockedLimit() {
    for (int n = 0; n < 3; n++) {
      for (int i = 0; i < 5; i++) {
        tracker.recordFailure(List.of(LockoutIdentifier.ip("10.0.0." + n)));
      }
    }

    assertThat(tracker.topBlocked(2)).hasSize(2);
  }
}
