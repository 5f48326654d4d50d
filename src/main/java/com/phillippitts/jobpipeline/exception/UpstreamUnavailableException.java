package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

/**
 * Thrown when a network dependency of a processing function is unreachable. Retryable.
 */
public class UpstreamUnavailableException extends JobPipelineException {

    public UpstreamUnavailableException(String message) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
