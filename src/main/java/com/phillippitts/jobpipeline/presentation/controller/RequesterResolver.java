package com.phillippitts.jobpipeline.presentation.controller;

import com.phillippitts.jobpipeline.exception.ForbiddenException;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.service.session.SessionStore;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Resolves the calling user of a request.
 *
 * <p>A session token in {@code X-Session-ID} takes precedence; otherwise the
 * {@code X-User-ID} header set by the upstream gateway is trusted.
 */
@Component
class RequesterResolver {

    static final String SESSION_HEADER = "X-Session-ID";
    static final String USER_HEADER = "X-User-ID";

    private final SessionStore sessionStore;

    RequesterResolver(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    /**
     * @throws ForbiddenException        if the request carries no usable identity
     * @throws StoreUnavailableException if a session id was sent but the store is unreachable
     */
    String resolve(HttpServletRequest request) {
        String sessionId = request.getHeader(SESSION_HEADER);
        if (sessionId != null && !sessionId.isBlank()) {
            return sessionStore.lookup(sessionId.trim())
                    .map(fields -> fields.get(SessionStore.USER_ID_FIELD))
                    .filter(userId -> !userId.isBlank())
                    .orElseThrow(() -> new ForbiddenException("Unknown or expired session", null));
        }
        String userId = request.getHeader(USER_HEADER);
        if (userId == null || userId.isBlank()) {
            throw new ForbiddenException("Caller identity required", null);
        }
        return userId.trim();
    }
}
