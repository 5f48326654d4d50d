package com.phillippitts.jobpipeline.service.processing;

import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.payload.CalculatePayload;
import com.phillippitts.jobpipeline.domain.payload.DocumentPayload;
import com.phillippitts.jobpipeline.domain.payload.JobPayload;
import com.phillippitts.jobpipeline.domain.payload.ValidatePayload;
import com.phillippitts.jobpipeline.domain.payload.VoicePayload;
import com.phillippitts.jobpipeline.domain.result.JobResult;
import com.phillippitts.jobpipeline.exception.JobPipelineException;
import com.phillippitts.jobpipeline.exception.ProcessingException;
import com.phillippitts.jobpipeline.exception.UpstreamUnavailableException;
import com.phillippitts.jobpipeline.exception.ValidationException;
import com.phillippitts.jobpipeline.service.job.ProgressReporter;
import com.phillippitts.jobpipeline.service.job.StatusMessages;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Boundary between jobs and the processing functions that do the actual AI work.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Decoding the transport form of a submission into a typed payload, including
 *       base64 decoding and the payload size cap</li>
 *   <li>Dispatching a payload to the single function registered for its kind</li>
 *   <li>Reporting the standard checkpoints around each call</li>
 *   <li>Mapping arbitrary failures onto the pipeline's error taxonomy</li>
 * </ul>
 *
 * <p>The adapter never retries; that decision belongs to the worker pool.
 */
@Component
public class ProcessingAdapter {

    private static final Logger LOG = LogManager.getLogger(ProcessingAdapter.class);

    static final int INITIALIZING_PROGRESS = 10;
    static final int FINISHING_PROGRESS = 90;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<JobKind, ProcessingFunction<?, ?>> registry;
    private final int maxPayloadBytes;

    public ProcessingAdapter(Collection<ProcessingFunction<?, ?>> functions, JobProperties properties) {
        this.registry = buildRegistry(functions);
        this.maxPayloadBytes = properties.getMaxPayloadBytes();
        LOG.info("Initialized ProcessingAdapter with {} processing functions: {}", registry.size(), registry.keySet());
    }

    /**
     * Builds the kind-to-function registry.
     *
     * @throws IllegalStateException if two functions register for the same kind, or a
     *                               function's payload type does not match its kind
     */
    private static Map<JobKind, ProcessingFunction<?, ?>> buildRegistry(Collection<ProcessingFunction<?, ?>> functions) {
        Map<JobKind, ProcessingFunction<?, ?>> registry = new EnumMap<>(JobKind.class);
        for (ProcessingFunction<?, ?> function : functions) {
            if (!function.kind().getPayloadType().equals(function.payloadType())) {
                throw new IllegalStateException(function.getClass().getName() + " declares payload type "
                        + function.payloadType().getSimpleName() + " for JobKind." + function.kind());
            }
            ProcessingFunction<?, ?> existing = registry.putIfAbsent(function.kind(), function);
            if (existing != null) {
                throw new IllegalStateException("Duplicate processing functions registered for JobKind."
                        + function.kind() + ": " + existing.getClass().getName()
                        + " and " + function.getClass().getName());
            }
        }
        return registry;
    }

    public boolean supports(JobKind kind) {
        return registry.containsKey(kind);
    }

    /**
     * Converts a submission into the typed payload of {@code kind}.
     *
     * @throws ValidationException if content or parameters are missing, malformed or too large
     */
    public JobPayload decode(JobKind kind, SubmissionRequest request) {
        Map<String, Object> params = request.params();
        return switch (kind) {
            case VOICE -> new VoicePayload(
                    decodeContent(request.content()),
                    requireString(params, "targetField"),
                    requireString(params, "formType"),
                    optionalString(params, "language"));
            case DOCUMENT -> new DocumentPayload(
                    decodeContent(request.content()),
                    requireStringList(params, "fieldSpecifications"),
                    requireString(params, "documentType"),
                    requireString(params, "formType"));
            case VALIDATE -> new ValidatePayload(
                    requireMap(params, "formData"),
                    requireString(params, "formType"),
                    requireInt(params, "taxYear"));
            case CALCULATE -> new CalculatePayload(
                    requireMap(params, "formData"),
                    requireString(params, "formType"),
                    requireInt(params, "taxYear"));
        };
    }

    /**
     * Runs the processing function of {@code kind} between the standard checkpoints.
     *
     * @return result of the kind's result type
     * @throws JobPipelineException every failure, mapped onto the error taxonomy
     */
    public JobResult execute(JobKind kind, JobPayload payload, ProgressReporter reporter) {
        ProcessingFunction<?, ?> function = registry.get(kind);
        if (function == null) {
            throw new ProcessingException("No processing function registered for " + kind);
        }
        if (!kind.getPayloadType().isInstance(payload)) {
            throw new ValidationException("Payload " + (payload == null ? "null" : payload.getClass().getSimpleName())
                    + " does not match job kind " + kind);
        }

        try {
            reporter.checkpoint(INITIALIZING_PROGRESS, StatusMessages.INITIALIZING);
            reporter.checkpoint(kind.getProcessingCheckpoint(), StatusMessages.processingKey(kind));
            JobResult result = invoke(function, payload, reporter);
            if (!kind.getResultType().isInstance(result)) {
                throw new ProcessingException("Processing function for " + kind + " returned "
                        + (result == null ? "null" : result.getClass().getSimpleName()));
            }
            reporter.checkpoint(FINISHING_PROGRESS, StatusMessages.finishingKey(kind));
            return result;
        } catch (JobPipelineException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + kind.getValue() + " payload: " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new UpstreamUnavailableException("I/O failure in " + kind.getValue() + " processing", e);
        } catch (RuntimeException e) {
            throw new ProcessingException(kind.getValue() + " processing failed: " + e.getMessage(), e);
        }
    }

    private static <P extends JobPayload, R extends JobResult> JobResult invoke(
            ProcessingFunction<P, R> function, JobPayload payload, ProgressReporter reporter) {
        return function.process(function.payloadType().cast(payload), reporter);
    }

    private byte[] decodeContent(String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("content is required");
        }
        String compact = WHITESPACE.matcher(content).replaceAll("");
        // 4 base64 characters carry 3 bytes
        long estimated = (long) compact.length() / 4 * 3;
        if (estimated > (long) maxPayloadBytes + 3) {
            throw new ValidationException("Payload exceeds maximum size of " + maxPayloadBytes + " bytes");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(compact);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("content is not valid base64", e);
        }
        if (bytes.length == 0) {
            throw new ValidationException("content is empty");
        }
        if (bytes.length > maxPayloadBytes) {
            throw new ValidationException("Payload exceeds maximum size of " + maxPayloadBytes + " bytes");
        }
        return bytes;
    }

    private static String requireString(Map<String, Object> params, String name) {
        String value = optionalString(params, name);
        if (value == null) {
            throw new ValidationException(name + " is required");
        }
        return value;
    }

    private static String optionalString(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new ValidationException(name + " must be a string");
        }
        return s.isBlank() ? null : s.trim();
    }

    private static List<String> requireStringList(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value instanceof String s && !s.isBlank()) {
            List<String> fields = new ArrayList<>();
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    fields.add(part.trim());
                }
            }
            return fields;
        }
        if (value instanceof Collection<?> items && !items.isEmpty()) {
            List<String> fields = new ArrayList<>(items.size());
            for (Object item : items) {
                if (!(item instanceof String s) || s.isBlank()) {
                    throw new ValidationException(name + " must contain only non-blank strings");
                }
                fields.add(s.trim());
            }
            return fields;
        }
        throw new ValidationException(name + " is required");
    }

    private static Map<String, Object> requireMap(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (!(value instanceof Map<?, ?> map)) {
            throw new ValidationException(name + " is required");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new ValidationException(name + " keys must be strings");
            }
            copy.put(key, entry.getValue());
        }
        return copy;
    }

    private static int requireInt(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value instanceof Number n) {
            if (n.doubleValue() != Math.rint(n.doubleValue())) {
                throw new ValidationException(name + " must be an integer");
            }
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(name + " must be an integer", e);
            }
        }
        throw new ValidationException(name + " is required");
    }
}
