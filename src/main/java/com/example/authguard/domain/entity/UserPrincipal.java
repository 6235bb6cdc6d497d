package com.example.authguard.domain.entity;

/**
 * User Principal - Minimal authenticated user identity
 */
public record UserPrincipal(
    String userId,
    String email,
    String role,
    String sessionId,
    Long loginTime
) {}
