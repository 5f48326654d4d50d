package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

/**
 * Thrown when the coordination store is unreachable or a command times out.
 * Retryable: the worker pool requeues jobs that fail with it.
 */
public class StoreUnavailableException extends JobPipelineException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, "Coordination store unavailable during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
