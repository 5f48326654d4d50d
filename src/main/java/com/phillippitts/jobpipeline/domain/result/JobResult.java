package com.phillippitts.jobpipeline.domain.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phillippitts.jobpipeline.domain.JobKind;

/**
 * Typed output of a successful job.
 */
public interface JobResult {

    @JsonIgnore
    JobKind kind();
}
