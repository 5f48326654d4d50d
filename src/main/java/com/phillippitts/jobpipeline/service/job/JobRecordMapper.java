package com.phillippitts.jobpipeline.service.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.jobpipeline.domain.ErrorKind;
import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.domain.JobError;
import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.domain.payload.JobPayload;
import com.phillippitts.jobpipeline.domain.result.JobResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Converts jobs to and from the flat string hash stored at {@code job:{id}}.
 *
 * <p>Payloads and results are stored as JSON and restored through the type bound to
 * the job kind. Timestamps are epoch milliseconds; an empty value means "not set".
 */
@Component
public class JobRecordMapper {

    static final String ID = "id";
    static final String KIND = "kind";
    static final String OWNER_ID = "owner_id";
    static final String PAYLOAD = "payload";
    static final String LOCALE = "locale";
    static final String STATE = "state";
    static final String PROGRESS = "progress";
    static final String STATUS_MESSAGE = "status_message";
    static final String RESULT = "result";
    static final String ERROR_KIND = "error_kind";
    static final String ERROR_DETAIL = "error_detail";
    static final String ATTEMPTS = "attempts";
    static final String MAX_ATTEMPTS = "max_attempts";
    static final String RETRY_PENDING = "retry_pending";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";
    static final String STARTED_AT = "started_at";
    static final String NEXT_ATTEMPT_AT = "next_attempt_at";
    static final String SOFT_TIMEOUT_MS = "soft_timeout_ms";
    static final String HARD_TIMEOUT_MS = "hard_timeout_ms";

    private final ObjectMapper objectMapper;

    public JobRecordMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, String> toFields(Job job) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(ID, job.id());
        fields.put(KIND, job.kind().name());
        fields.put(OWNER_ID, job.ownerId());
        fields.put(PAYLOAD, job.payload() == null ? "" : writeJson(job.payload()));
        fields.put(LOCALE, job.locale().toLanguageTag());
        fields.put(STATE, job.state().name());
        fields.put(PROGRESS, Integer.toString(job.progress()));
        fields.put(STATUS_MESSAGE, job.statusMessage());
        fields.put(RESULT, job.result() == null ? "" : writeJson(job.result()));
        fields.put(ERROR_KIND, job.error() == null ? "" : job.error().kind().name());
        fields.put(ERROR_DETAIL, job.error() == null ? "" : job.error().detail());
        fields.put(ATTEMPTS, Integer.toString(job.attempts()));
        fields.put(MAX_ATTEMPTS, Integer.toString(job.maxAttempts()));
        fields.put(RETRY_PENDING, Boolean.toString(job.retryPending()));
        fields.put(CREATED_AT, millis(job.createdAt()));
        fields.put(UPDATED_AT, millis(job.updatedAt()));
        fields.put(STARTED_AT, millis(job.startedAt()));
        fields.put(NEXT_ATTEMPT_AT, millis(job.nextAttemptAt()));
        fields.put(SOFT_TIMEOUT_MS, Long.toString(job.softTimeout().toMillis()));
        fields.put(HARD_TIMEOUT_MS, Long.toString(job.hardTimeout().toMillis()));
        return fields;
    }

    /**
     * Encodes the fields of {@code update}, stamping {@code updated_at} with {@code now}.
     */
    public Map<String, String> toFields(JobUpdate update, Instant now) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (update.getState() != null) {
            fields.put(STATE, update.getState().name());
        }
        if (update.getProgress() != null) {
            fields.put(PROGRESS, Integer.toString(update.getProgress()));
        }
        if (update.getStatusMessage() != null) {
            fields.put(STATUS_MESSAGE, update.getStatusMessage());
        }
        if (update.getResult() != null) {
            fields.put(RESULT, writeJson(update.getResult()));
        }
        if (update.getError() != null) {
            fields.put(ERROR_KIND, update.getError().kind().name());
            fields.put(ERROR_DETAIL, update.getError().detail());
        } else if (update.isClearError()) {
            fields.put(ERROR_KIND, "");
            fields.put(ERROR_DETAIL, "");
        }
        if (update.getAttempts() != null) {
            fields.put(ATTEMPTS, Integer.toString(update.getAttempts()));
        }
        if (update.getRetryPending() != null) {
            fields.put(RETRY_PENDING, Boolean.toString(update.getRetryPending()));
        }
        if (update.getStartedAt() != null) {
            fields.put(STARTED_AT, millis(update.getStartedAt()));
        }
        if (update.getNextAttemptAt() != null) {
            fields.put(NEXT_ATTEMPT_AT, millis(update.getNextAttemptAt()));
        }
        fields.put(UPDATED_AT, millis(now));
        return fields;
    }

    /**
     * @throws IllegalStateException if the record is corrupt
     */
    public Job fromFields(Map<String, String> fields) {
        JobKind kind = JobKind.valueOf(required(fields, KIND));
        String errorKind = fields.getOrDefault(ERROR_KIND, "");
        JobError error = errorKind.isEmpty()
                ? null
                : new JobError(ErrorKind.valueOf(errorKind), fields.get(ERROR_DETAIL));
        String payload = fields.getOrDefault(PAYLOAD, "");
        String result = fields.getOrDefault(RESULT, "");

        return new Job(
                required(fields, ID),
                kind,
                required(fields, OWNER_ID),
                payload.isEmpty() ? null : readJson(payload, kind.getPayloadType()),
                Locale.forLanguageTag(fields.getOrDefault(LOCALE, "")),
                JobState.valueOf(required(fields, STATE)),
                Integer.parseInt(fields.getOrDefault(PROGRESS, "0")),
                fields.get(STATUS_MESSAGE),
                result.isEmpty() ? null : readJson(result, kind.getResultType()),
                error,
                Integer.parseInt(fields.getOrDefault(ATTEMPTS, "0")),
                Integer.parseInt(fields.getOrDefault(MAX_ATTEMPTS, "1")),
                Boolean.parseBoolean(fields.get(RETRY_PENDING)),
                instant(required(fields, CREATED_AT)),
                instant(fields.get(UPDATED_AT)),
                instant(fields.get(STARTED_AT)),
                instant(fields.get(NEXT_ATTEMPT_AT)),
                Duration.ofMillis(Long.parseLong(required(fields, SOFT_TIMEOUT_MS))),
                Duration.ofMillis(Long.parseLong(required(fields, HARD_TIMEOUT_MS)))
        );
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " in job record", e);
        }
    }

    private static String required(Map<String, String> fields, String name) {
        String value = fields.get(name);
        if (value == null || value.isEmpty()) {
            throw new IllegalStateException("Job record is missing field " + name);
        }
        return value;
    }

    private static String millis(Instant instant) {
        return instant == null ? "" : Long.toString(instant.toEpochMilli());
    }

    private static Instant instant(String millis) {
        return (millis == null || millis.isEmpty()) ? null : Instant.ofEpochMilli(Long.parseLong(millis));
    }
}
