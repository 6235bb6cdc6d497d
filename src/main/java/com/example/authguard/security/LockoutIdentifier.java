package com.example.authguard.security;

import java.util.Locale;

/**
 * One dimension of a principal's failure budget, such as its email or its IP.
 * New dimensions only need a new namespace; callers pass whichever identifiers they have.
 */
public record LockoutIdentifier(String namespace, String value) {

  public static final String EMAIL = "email";
  public static final String IP = "ip";

  public LockoutIdentifier {
    if (namespace == null || namespace.isBlank() || namespace.contains(":")) {
      throw new IllegalArgumentException("Invalid lockout namespace: " + namespace);
    }
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Lockout identifier value must not be blank");
    }
  }

  public static LockoutIdentifier email(String email) {
    return new LockoutIdentifier(EMAIL, email.trim().toLowerCase(Locale.ROOT));
  }

  public static LockoutIdentifier ip(String ip) {
    return new LockoutIdentifier(IP, ip);
  }

  /**
   * Parses the {@code namespace:value} form, e.g. {@code email:a@test.com}.
   */
  public static LockoutIdentifier parse(String tagged) {
    int separator = tagged.indexOf(':');
    if (separator <= 0) {
      throw new IllegalArgumentException("Expected namespace:value but was: " + tagged);
    }
    String namespace = tagged.substring(0, separator);
    String value = tagged.substring(separator + 1);
    return EMAIL.equals(namespace) ? email(value) : new LockoutIdentifier(namespace, value);
  }

  @Override
  public String toString() {
    return namespace + ":" + value;
  }
}
