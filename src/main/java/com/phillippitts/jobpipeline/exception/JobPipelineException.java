package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

import java.util.Objects;

/**
 * Base exception for all job pipeline errors.
 * Every subclass is bound to one {@link ErrorKind}, which drives retry decisions in the
 * worker pool and status codes at the REST boundary.
 */
public class JobPipelineException extends RuntimeException {

    private final ErrorKind kind;

    public JobPipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public JobPipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
