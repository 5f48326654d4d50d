package com.phillippitts.jobpipeline.service.session;

import com.phillippitts.jobpipeline.exception.NotFoundException;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.service.metrics.PipelineMetrics;
import com.phillippitts.jobpipeline.store.CoordinationStore;
import com.phillippitts.jobpipeline.store.StoreKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Session records keyed by an opaque, unguessable token.
 *
 * <p>A session is a hash at {@code session:{id}} holding {@code user_id},
 * {@code created_at} (epoch seconds) and any caller-supplied fields. Expiry is left to
 * the store; there is no sweep and no way to list sessions.
 *
 * <p>Reads fail open (a store failure looks like an unknown session). Creating and
 * updating propagate {@link StoreUnavailableException}: a session cannot be issued or
 * changed without the store.
 */
@Service
public class SessionStore {

    private static final Logger LOG = LogManager.getLogger(SessionStore.class);
    private static final String COMPONENT = "session-store";
    private static final int TOKEN_BYTES = 32;

    public static final String USER_ID_FIELD = "user_id";
    public static final String CREATED_AT_FIELD = "created_at";

    private final CoordinationStore store;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public SessionStore(CoordinationStore store, PipelineMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Creates a session owned by {@code ownerId}.
     *
     * @param ownerId owning user
     * @param fields  extra fields; may not override the owner or creation time
     * @param ttl     lifetime of the session, positive
     * @return the new session id (256 random bits, URL-safe base64)
     * @throws IllegalArgumentException  if {@code ttl} is null, zero or negative
     * @throws StoreUnavailableException if the session could not be written
     */
    public String create(String ownerId, Map<String, String> fields, Duration ttl) {
        Objects.requireNonNull(ownerId, "ownerId");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Session TTL must be positive, got: " + ttl);
        }
        String sessionId = newSessionId();

        Map<String, String> record = new LinkedHashMap<>();
        if (fields != null) {
            record.putAll(fields);
        }
        record.put(USER_ID_FIELD, ownerId);
        record.put(CREATED_AT_FIELD, Long.toString(clock.instant().getEpochSecond()));

        store.setHash(StoreKeys.session(sessionId), record, ttl);
        LOG.debug("Session created for user={}", ownerId);
        return sessionId;
    }

    /**
     * @return the session fields, or empty if unknown, expired or the store is unreachable
     */
    public Optional<Map<String, String>> get(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        try {
            return store.getHash(StoreKeys.session(sessionId));
        } catch (StoreUnavailableException e) {
            LOG.warn("Session lookup failed, treating session as absent: {}", e.getMessage());
            metrics.recordFailOpen(COMPONENT, "get");
            return Optional.empty();
        }
    }

    /**
     * Looks a session up without failing open, for callers that authenticate with it and
     * must not mistake an outage for an unknown session.
     *
     * @return the session fields, or empty if unknown or expired
     * @throws StoreUnavailableException if the store is unreachable
     */
    public Optional<Map<String, String>> lookup(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        return store.getHash(StoreKeys.session(sessionId));
    }

    /**
     * Merges {@code fields} into an existing session. Never creates one.
     *
     * @throws NotFoundException         if the session does not exist or has expired
     * @throws StoreUnavailableException if the store is unreachable
     */
    public void update(String sessionId, Map<String, String> fields) {
        Map<String, String> changes = new LinkedHashMap<>(fields);
        changes.remove(USER_ID_FIELD);
        changes.remove(CREATED_AT_FIELD);
        if (!store.updateHashIfPresent(StoreKeys.session(sessionId), changes)) {
            throw new NotFoundException("Session", sessionId);
        }
    }

    /**
     * @return true if a session was removed, false if it did not exist or the store is unreachable
     */
    public boolean delete(String sessionId) {
        try {
            return store.delete(StoreKeys.session(sessionId));
        } catch (StoreUnavailableException e) {
            LOG.warn("Session delete failed: {}", e.getMessage());
            metrics.recordFailOpen(COMPONENT, "delete");
            return false;
        }
    }

    private String newSessionId() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
