package com.phillippitts.jobpipeline.presentation.dto;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/jobs/{kind}}.
 *
 * @param content base64 audio or document for voice and document jobs
 * @param params  kind-specific parameters
 * @param locale  BCP 47 tag for status messages, optional
 */
public record SubmitJobRequest(String content, Map<String, Object> params, String locale) {
}
