package com.phillippitts.jobpipeline.service.processing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport form of a job submission.
 *
 * @param content base64-encoded binary input (audio or document), null for kinds without one
 * @param params  structured parameters of the job kind
 */
public record SubmissionRequest(String content, Map<String, Object> params) {

    public SubmissionRequest {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
