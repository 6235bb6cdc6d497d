package com.example.authguard.security;

/**
 * A locked identifier as reported to monitoring; {@code identifier} is masked.
 */
public record BlockedIdentifier(String identifier, long failures) {}
