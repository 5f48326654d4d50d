package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

/**
 * Thrown when a processing function fails in a way that retrying will not fix.
 */
public class ProcessingException extends JobPipelineException {

    public ProcessingException(String message) {
        super(ErrorKind.PROCESSING, message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(ErrorKind.PROCESSING, message, cause);
    }
}
