package com.phillippitts.jobpipeline.domain.payload;

import com.phillippitts.jobpipeline.domain.JobKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Form data to validate against the rules of a tax year.
 */
public record ValidatePayload(Map<String, Object> formData, String formType, int taxYear)
        implements JobPayload {

    public ValidatePayload {
        Objects.requireNonNull(formType, "formType");
        formData = formData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(formData));
    }

    @Override
    public JobKind kind() {
        return JobKind.VALIDATE;
    }
}
