package com.phillippitts.jobpipeline.domain.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phillippitts.jobpipeline.domain.JobKind;

/**
 * Typed input of a job. Each implementation belongs to exactly one {@link JobKind}.
 */
public interface JobPayload {

    @JsonIgnore
    JobKind kind();
}
