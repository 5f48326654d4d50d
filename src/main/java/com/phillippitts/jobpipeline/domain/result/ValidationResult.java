package com.phillippitts.jobpipeline.domain.result;

import com.phillippitts.jobpipeline.domain.JobKind;

import java.util.List;

public record ValidationResult(boolean valid,
                               List<String> validationErrors,
                               List<String> suggestions,
                               int confidenceScore) implements JobResult {

    public ValidationResult {
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    @Override
    public JobKind kind() {
        return JobKind.VALIDATE;
    }
}
