package com.phillippitts.jobpipeline.service.processing.placeholder;

import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.payload.DocumentPayload;
import com.phillippitts.jobpipeline.domain.result.DocumentResult;
import com.phillippitts.jobpipeline.service.job.ProgressReporter;
import com.phillippitts.jobpipeline.service.processing.ProcessingFunction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stand-in document extractor. Returns canned values for the requested fields it knows.
 */
public class PlaceholderDocumentFunction implements ProcessingFunction<DocumentPayload, DocumentResult> {

    private static final Map<String, String> SAMPLE_FIELDS = Map.of(
            "taxpayer_name", "Nguyễn Văn A",
            "taxpayer_id", "0123456789",
            "total_income", "120000000");

    private static final Map<String, Integer> SAMPLE_CONFIDENCE = Map.of(
            "taxpayer_name", 98,
            "taxpayer_id", 95,
            "total_income", 92);

    @Override
    public JobKind kind() {
        return JobKind.DOCUMENT;
    }

    @Override
    public Class<DocumentPayload> payloadType() {
        return DocumentPayload.class;
    }

    @Override
    public DocumentResult process(DocumentPayload payload, ProgressReporter reporter) {
        long start = System.nanoTime();
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, Integer> confidence = new LinkedHashMap<>();
        for (String name : payload.fieldSpecifications()) {
            String value = SAMPLE_FIELDS.get(name);
            if (value != null) {
                fields.put(name, value);
                confidence.put(name, SAMPLE_CONFIDENCE.get(name));
            }
        }
        return new DocumentResult(fields, confidence, (System.nanoTime() - start) / 1_000_000);
    }
}
