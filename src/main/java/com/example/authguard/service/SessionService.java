package com.example.authguard.service;

import com.example.authguard.domain.entity.SessionInfo;
import com.example.authguard.domain.entity.SessionMetadata;
import com.example.authguard.domain.entity.SessionRecord;
import com.example.authguard.domain.entity.SessionRequestMetadata;
import com.example.authguard.domain.entity.SessionStats;
import com.example.authguard.domain.entity.UserPrincipal;
import com.example.authguard.exception.SessionException;
import com.example.authguard.exception.StoreUnavailableException;
import com.example.authguard.properties.ApplicationProperties;
import com.example.authguard.store.CounterStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Service;

/**
 * Session registry backed by the shared counter store.
 *
 * <p>Each session owns three keys: the full record, a metadata copy used for listing and eviction,
 * and its membership in the owner's {@code user_sessions:{userId}} index. Expiry is checked on read
 * against the stored {@code expiresAt}; the store TTL is only a backstop.
 *
 * <p>Store failures on reads fail closed: the caller is treated as unauthenticated.
 */
@Service
@Slf4j
public class SessionService {

    public static final String SESSION_KEY_PREFIX = "session:";
    public static final String METADATA_KEY_PREFIX = "session:meta:";
    public static final String USER_SESSIONS_INDEX_PREFIX = "user_sessions:";
    private static final int SESSION_ID_ENTROPY_BYTES = 32;
    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{43}");
    private static final int STATS_SCAN_LIMIT = 100_000;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final CounterStore counterStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration sessionTtl;
    private final int maxSessionsPerUser;

    public SessionService(
            CounterStore counterStore,
            ObjectMapper objectMapper,
            Clock clock,
            ApplicationProperties properties) {
        ApplicationProperties.SecurityProperties.SessionProperties session = properties.security().session();
        this.counterStore = counterStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sessionTtl = Duration.ofSeconds(session.sessionDurationSeconds());
        this.maxSessionsPerUser = session.maxSessionsPerUser();
    }

    /**
     * Creates a session for a verified user. Oldest sessions are evicted first so that the new one
     * fits under the per-user cap.
     *
     * @return the new opaque session id
     * @throws SessionException if the session could not be stored
     */
    public String create(String userId, String email, String role, String refreshToken,
                         SessionRequestMetadata metadata) {
        SessionRequestMetadata client = metadata != null ? metadata : SessionRequestMetadata.empty();
        try {
            evictOldestSessions(userId);

            String sessionId = generateSecureSessionId();
            long now = clock.millis();
            SessionRecord record = new SessionRecord(sessionId, userId, email, role, refreshToken,
                    now, now + sessionTtl.toMillis(), now, client.ipAddress(), client.userAgent());

            write(record);
            log.info("Created session {} for user {}", maskSessionId(sessionId), userId);
            return sessionId;

        } catch (StoreUnavailableException e) {
            throw new SessionException("Failed to create session", e);
        }
    }

    /**
     * Reads a session. Expired sessions are deleted and reported absent; live ones have their
     * access time and TTL renewed.
     */
    public Optional<SessionRecord> get(String sessionId) {
        if (!isValidSessionId(sessionId)) {
            return Optional.empty();
        }

        try {
            Optional<SessionRecord> stored = readRecord(sessionId);
            if (stored.isEmpty()) {
                return Optional.empty();
            }

            SessionRecord record = stored.get();
            long now = clock.millis();
            if (record.isExpired(now)) {
                log.debug("Session {} expired, removing", maskSessionId(sessionId));
                removeKeys(sessionId, record.userId());
                return Optional.empty();
            }

            SessionRecord refreshed = record.touch(now, sessionTtl);
            write(refreshed);
            return Optional.of(refreshed);

        } catch (StoreUnavailableException | SessionException e) {
            log.error("Session lookup failed for session: {}", maskSessionId(sessionId), e);
            return Optional.empty();
        }
    }

    /**
     * Resolves a session into a Spring Security authentication.
     */
    public Optional<Authentication> authenticate(String sessionId) {
        return get(sessionId).map(record -> {
            UserPrincipal principal = new UserPrincipal(
                    record.userId(), record.email(), record.role(), record.sessionId(), record.createdAt());
            String role = record.role() != null ? record.role() : "user";
            return new UsernamePasswordAuthenticationToken(principal, null,
                    List.of(new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT))));
        });
    }

    /**
     * Replaces the refresh token of a live session without renewing it.
     */
    public boolean updateRefreshToken(String sessionId, String refreshToken) {
        if (!isValidSessionId(sessionId)) {
            return false;
        }
        try {
            Optional<SessionRecord> stored = readRecord(sessionId);
            long now = clock.millis();
            if (stored.isEmpty() || stored.get().expiresAt() <= now) {
                return false;
            }
            SessionRecord record = stored.get();
            Duration remaining = Duration.ofMillis(record.expiresAt() - now);
            counterStore.set(SESSION_KEY_PREFIX + sessionId, toJson(record.withRefreshToken(refreshToken)), remaining);
            return true;
        } catch (StoreUnavailableException | SessionException e) {
            log.error("Failed to update refresh token for session: {}", maskSessionId(sessionId), e);
            return false;
        }
    }

    /**
     * Deletes a session together with its metadata and index membership.
     *
     * @return true if a session record was removed
     */
    public boolean delete(String sessionId) {
        if (!isValidSessionId(sessionId)) {
            return false;
        }
        try {
            String userId = readRecord(sessionId)
                    .map(SessionRecord::userId)
                    .or(() -> readMetadata(sessionId).map(SessionMetadata::userId))
                    .orElse(null);
            boolean removed = removeKeys(sessionId, userId);
            if (removed) {
                log.info("Deleted session {}", maskSessionId(sessionId));
            }
            return removed;
        } catch (StoreUnavailableException | SessionException e) {
            log.error("Failed to delete session: {}", maskSessionId(sessionId), e);
            return false;
        }
    }

    /**
     * Deletes every session of a user and the index itself.
     *
     * @return number of session records removed
     */
    public int deleteAllForUser(String userId) {
        String indexKey = USER_SESSIONS_INDEX_PREFIX + userId;
        try {
            List<String> sessionIds = new ArrayList<>(counterStore.setMembers(indexKey));
            List<Object> results = counterStore.batch(batch -> {
                sessionIds.forEach(id -> {
                    batch.delete(SESSION_KEY_PREFIX + id);
                    batch.delete(METADATA_KEY_PREFIX + id);
                });
                batch.delete(indexKey);
            });

            int removed = 0;
            for (int i = 0; i < sessionIds.size(); i++) {
                if (isPositive(results.get(2 * i))) {
                    removed++;
                }
            }
            log.info("Deleted {} sessions for user {}", removed, userId);
            return removed;
        } catch (StoreUnavailableException e) {
            log.error("Failed to delete sessions for user {}", userId, e);
            return 0;
        }
    }

    /**
     * Lists a user's live sessions, most recently active first.
     *
     * @param currentSessionId session of the caller, flagged in the result; may be null
     */
    public List<SessionInfo> listForUser(String userId, String currentSessionId) {
        try {
            long now = clock.millis();
            return readIndex(userId).entrySet().stream()
                    .filter(entry -> entry.getValue() != null && entry.getValue().expiresAt() >= now)
                    .map(entry -> toInfo(entry.getKey(), entry.getValue(), currentSessionId))
                    .sorted(Comparator.comparingLong(SessionInfo::lastAccessedAt).reversed())
                    .toList();
        } catch (StoreUnavailableException e) {
            log.error("Failed to list sessions for user {}", userId, e);
            return List.of();
        }
    }

    /**
     * Counts stored sessions and users with at least one session
     */
    public SessionStats stats() {
        try {
            long sessions = counterStore.scan(SESSION_KEY_PREFIX + "*", STATS_SCAN_LIMIT).stream()
                    .filter(key -> !key.startsWith(METADATA_KEY_PREFIX))
                    .count();
            long users = counterStore.scan(USER_SESSIONS_INDEX_PREFIX + "*", STATS_SCAN_LIMIT).size();
            return new SessionStats(sessions, users);
        } catch (StoreUnavailableException e) {
            log.error("Failed to collect session statistics", e);
            return new SessionStats(0, 0);
        }
    }

    public Duration sessionTtl() {
        return sessionTtl;
    }

    /**
     * Makes room for one more session. Members without live metadata are stale: they are
     * removed from the index and do not count toward the cap.
     */
    private void evictOldestSessions(String userId) {
        Map<String, SessionMetadata> index = readIndex(userId);
        if (index.isEmpty()) {
            return;
        }

        long now = clock.millis();
        List<Map.Entry<String, SessionMetadata>> live = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        index.forEach((id, meta) -> {
            if (meta == null || meta.expiresAt() < now) {
                stale.add(id);
            } else {
                live.add(Map.entry(id, meta));
            }
        });

        if (!stale.isEmpty()) {
            String indexKey = USER_SESSIONS_INDEX_PREFIX + userId;
            counterStore.batch(batch -> stale.forEach(id -> {
                batch.delete(SESSION_KEY_PREFIX + id);
                batch.delete(METADATA_KEY_PREFIX + id);
                batch.setRemove(indexKey, id);
            }));
            log.debug("Pruned {} stale session entries for user {}", stale.size(), userId);
        }

        int excess = live.size() - (maxSessionsPerUser - 1);
        if (excess <= 0) {
            return;
        }

        live.sort(Comparator.comparingLong(entry -> entry.getValue().createdAt()));
        for (int i = 0; i < excess; i++) {
            String sessionId = live.get(i).getKey();
            removeKeys(sessionId, userId);
            log.info("Evicted session {} for user {} (limit: {})",
                    maskSessionId(sessionId), userId, maxSessionsPerUser);
        }
    }

    /**
     * Members of the user's index mapped to their metadata, null where the metadata is gone
     * or unreadable.
     */
    private Map<String, SessionMetadata> readIndex(String userId) {
        List<String> sessionIds = new ArrayList<>(counterStore.setMembers(USER_SESSIONS_INDEX_PREFIX + userId));
        if (sessionIds.isEmpty()) {
            return Map.of();
        }
        List<Object> results = counterStore.batch(batch ->
                sessionIds.forEach(id -> batch.get(METADATA_KEY_PREFIX + id)));

        Map<String, SessionMetadata> index = new LinkedHashMap<>();
        for (int i = 0; i < sessionIds.size(); i++) {
            Object json = results.get(i);
            index.put(sessionIds.get(i), json instanceof String text ? parseMetadata(text) : null);
        }
        return index;
    }

    private void write(SessionRecord record) {
        String sessionId = record.sessionId();
        String recordJson = toJson(record);
        String metadataJson = toJson(SessionMetadata.from(record));
        String indexKey = USER_SESSIONS_INDEX_PREFIX + record.userId();

        counterStore.batch(batch -> {
            batch.set(SESSION_KEY_PREFIX + sessionId, recordJson, sessionTtl);
            batch.set(METADATA_KEY_PREFIX + sessionId, metadataJson, sessionTtl);
            batch.setAdd(indexKey, sessionId);
            batch.expire(indexKey, sessionTtl);
        });
    }

    private boolean removeKeys(String sessionId, String userId) {
        List<Object> results = counterStore.batch(batch -> {
            batch.delete(SESSION_KEY_PREFIX + sessionId);
            batch.delete(METADATA_KEY_PREFIX + sessionId);
            if (userId != null) {
                batch.setRemove(USER_SESSIONS_INDEX_PREFIX + userId, sessionId);
            }
        });
        return !results.isEmpty() && isPositive(results.get(0));
    }

    private Optional<SessionRecord> readRecord(String sessionId) {
        return counterStore.get(SESSION_KEY_PREFIX + sessionId).map(json -> fromJson(json, SessionRecord.class));
    }

    private Optional<SessionMetadata> readMetadata(String sessionId) {
        return counterStore.get(METADATA_KEY_PREFIX + sessionId).map(this::parseMetadata);
    }

    private SessionMetadata parseMetadata(String json) {
        try {
            return objectMapper.readValue(json, SessionMetadata.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable session metadata");
            return null;
        }
    }

    private SessionInfo toInfo(String sessionId, SessionMetadata meta, String currentSessionId) {
        return new SessionInfo(sessionId, meta.createdAt(), meta.lastAccessedAt(), meta.expiresAt(),
                meta.ipAddress(), meta.userAgent(), Objects.equals(sessionId, currentSessionId));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SessionException("Failed to serialize session", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SessionException("Failed to read session", e);
        }
    }

    private static boolean isPositive(Object result) {
        return result instanceof Number number && number.longValue() > 0;
    }

    private String generateSecureSessionId() {
        byte[] randomBytes = new byte[SESSION_ID_ENTROPY_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    public static boolean isValidSessionId(String sessionId) {
        return sessionId != null && SESSION_ID_PATTERN.matcher(sessionId).matches();
    }

    public static String maskSessionId(String sessionId) {
        if (sessionId == null || sessionId.length() < 8) return "INVALID";
        return sessionId.substring(0, 8) + "...";
    }
}
