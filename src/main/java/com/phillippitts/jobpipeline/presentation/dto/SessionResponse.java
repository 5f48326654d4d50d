package com.phillippitts.jobpipeline.presentation.dto;

public record SessionResponse(String sessionId, long expiresInSeconds) {
}
