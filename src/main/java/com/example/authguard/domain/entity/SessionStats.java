package com.example.authguard.domain.entity;

public record SessionStats(long totalSessions, long activeUsers) {}
