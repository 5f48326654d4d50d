package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

import java.time.Duration;

/**
 * Thrown when an attempt exceeds its soft or hard deadline.
 */
public class JobTimeoutException extends JobPipelineException {

    private final Duration limit;
    private final boolean hard;

    public JobTimeoutException(Duration limit, boolean hard) {
        super(ErrorKind.TIMEOUT, (hard ? "Hard" : "Soft") + " time limit of " + limit + " exceeded");
        this.limit = limit;
        this.hard = hard;
    }

    public Duration getLimit() {
        return limit;
    }

    public boolean isHard() {
        return hard;
    }
}
