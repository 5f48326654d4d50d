package com.phillippitts.jobpipeline.domain;

import java.util.Objects;

/**
 * Failure recorded on a job: the taxonomy kind plus internal detail.
 *
 * <p>The detail is kept apart from the job's human-readable status message so pollers
 * never see raw internal errors in the message they display.
 *
 * @param kind   error kind
 * @param detail diagnostic detail (never null, may be empty)
 */
public record JobError(ErrorKind kind, String detail) {

    public JobError {
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }
}
