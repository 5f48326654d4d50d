package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

/**
 * Thrown when the requester is neither the owner of a resource nor an administrator.
 */
public class ForbiddenException extends JobPipelineException {

    private final String requesterId;

    public ForbiddenException(String message, String requesterId) {
        super(ErrorKind.FORBIDDEN, message);
        this.requesterId = requesterId;
    }

    public String getRequesterId() {
        return requesterId;
    }
}
