package com.phillippitts.jobpipeline.domain;

import com.phillippitts.jobpipeline.domain.payload.CalculatePayload;
import com.phillippitts.jobpipeline.domain.payload.DocumentPayload;
import com.phillippitts.jobpipeline.domain.payload.JobPayload;
import com.phillippitts.jobpipeline.domain.payload.ValidatePayload;
import com.phillippitts.jobpipeline.domain.payload.VoicePayload;
import com.phillippitts.jobpipeline.domain.result.CalculationResult;
import com.phillippitts.jobpipeline.domain.result.DocumentResult;
import com.phillippitts.jobpipeline.domain.result.JobResult;
import com.phillippitts.jobpipeline.domain.result.ValidationResult;
import com.phillippitts.jobpipeline.domain.result.VoiceResult;
import com.phillippitts.jobpipeline.exception.ValidationException;

import java.util.Locale;

/**
 * The kinds of asynchronous AI work the pipeline accepts.
 *
 * <p>Each kind is bound to exactly one payload type and one result type, which lets the
 * job record store payloads and results as JSON and restore them without type hints.
 */
public enum JobKind {

    VOICE("voice", VoicePayload.class, VoiceResult.class, 50),
    DOCUMENT("document", DocumentPayload.class, DocumentResult.class, 30),
    VALIDATE("validate", ValidatePayload.class, ValidationResult.class, 50),
    CALCULATE("calculate", CalculatePayload.class, CalculationResult.class, 50);

    private final String value;
    private final Class<? extends JobPayload> payloadType;
    private final Class<? extends JobResult> resultType;
    private final int processingCheckpoint;

    JobKind(String value,
            Class<? extends JobPayload> payloadType,
            Class<? extends JobResult> resultType,
            int processingCheckpoint) {
        this.value = value;
        this.payloadType = payloadType;
        this.resultType = resultType;
        this.processingCheckpoint = processingCheckpoint;
    }

    public String getValue() {
        return value;
    }

    public Class<? extends JobPayload> getPayloadType() {
        return payloadType;
    }

    public Class<? extends JobResult> getResultType() {
        return resultType;
    }

    /** Progress reported once the processing function starts working on this kind. */
    public int getProcessingCheckpoint() {
        return processingCheckpoint;
    }

    /**
     * Parses a job kind from its wire value ("voice", "document", ...), case-insensitively.
     *
     * @param value wire value
     * @return matching kind
     * @throws ValidationException if the value is blank or unknown
     */
    public static JobKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Job kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new ValidationException("Unsupported job kind: " + value);
    }
}
