package com.phillippitts.jobpipeline.presentation.controller;

import com.phillippitts.jobpipeline.config.properties.SessionProperties;
import com.phillippitts.jobpipeline.exception.ForbiddenException;
import com.phillippitts.jobpipeline.exception.NotFoundException;
import com.phillippitts.jobpipeline.presentation.dto.CreateSessionRequest;
import com.phillippitts.jobpipeline.presentation.dto.SessionResponse;
import com.phillippitts.jobpipeline.service.session.SessionStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * Issues and revokes sessions for users already authenticated by the gateway.
 */
@RestController
@RequestMapping("/api/v1/sessions")
class SessionController {

    private final SessionStore sessionStore;
    private final SessionProperties sessionProperties;

    SessionController(SessionStore sessionStore, SessionProperties sessionProperties) {
        this.sessionStore = sessionStore;
        this.sessionProperties = sessionProperties;
    }

    @PostMapping
    ResponseEntity<SessionResponse> create(@RequestHeader(value = RequesterResolver.USER_HEADER, required = false) String userId,
                                           @RequestBody(required = false) CreateSessionRequest body) {
        if (userId == null || userId.isBlank()) {
            throw new ForbiddenException("Caller identity required", null);
        }
        Map<String, String> fields = body == null || body.fields() == null ? Map.of() : body.fields();
        Duration ttl = sessionProperties.getTtl();
        String sessionId = sessionStore.create(userId.trim(), fields, ttl);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SessionResponse(sessionId, ttl.toSeconds()));
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> delete(@PathVariable("id") String id) {
        if (!sessionStore.delete(id)) {
            throw new NotFoundException("Session", id);
        }
        return ResponseEntity.noContent().build();
    }
}
