package com.phillippitts.jobpipeline.presentation.dto;

import java.util.Map;

public record CreateSessionRequest(Map<String, String> fields) {
}
