package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.domain.ErrorKind;
import com.phillippitts.jobpipeline.domain.JobKind;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Resolves the localized, human-readable status messages written to job records.
 * Keys live under {@code job.status.*} in {@code messages*.properties}.
 */
@Component
public class StatusMessages {

    public static final String QUEUED = "job.status.queued";
    public static final String INITIALIZING = "job.status.initializing";
    public static final String SUCCEEDED = "job.status.succeeded";
    public static final String RETRYING = "job.status.retrying";
    public static final String TIMEOUT = "job.status.timeout";
    public static final String CANCELLED = "job.status.cancelled";

    private final MessageSource messageSource;

    public StatusMessages(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public static String processingKey(JobKind kind) {
        return "job.status." + kind.getValue() + ".processing";
    }

    public static String finishingKey(JobKind kind) {
        return "job.status." + kind.getValue() + ".finishing";
    }

    public static String failedKey(JobKind kind) {
        return "job.status." + kind.getValue() + ".failed";
    }

    /**
     * Resolves {@code key}; an unknown key resolves to itself so a missing translation never
     * fails a job.
     */
    public String get(String key, Locale locale, Object... args) {
        return messageSource.getMessage(key, args, key, locale);
    }

    /**
     * Message for a terminal failure of {@code kind} caused by {@code errorKind}.
     */
    public String failure(JobKind kind, ErrorKind errorKind, Locale locale) {
        if (errorKind == ErrorKind.TIMEOUT) {
            return get(TIMEOUT, locale);
        }
        return get(failedKey(kind), locale);
    }
}
