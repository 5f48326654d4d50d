package com.phillippitts.jobpipeline.presentation.dto;

public record SubmitJobResponse(String jobId, String statusUrl) {
}
