package com.phillippitts.jobpipeline.domain.result;

import com.phillippitts.jobpipeline.domain.JobKind;

import java.util.Map;

/**
 * Fields extracted from a document, with a confidence score per field.
 */
public record DocumentResult(Map<String, String> extractedFields,
                             Map<String, Integer> confidenceScores,
                             long processingTimeMs) implements JobResult {

    public DocumentResult {
        extractedFields = extractedFields == null ? Map.of() : Map.copyOf(extractedFields);
        confidenceScores = confidenceScores == null ? Map.of() : Map.copyOf(confidenceScores);
    }

    @Override
    public JobKind kind() {
        return JobKind.DOCUMENT;
    }
}
