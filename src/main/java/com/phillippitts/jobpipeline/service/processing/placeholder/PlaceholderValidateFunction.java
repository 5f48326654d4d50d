package com.phillippitts.jobpipeline.service.processing.placeholder;

import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.payload.ValidatePayload;
import com.phillippitts.jobpipeline.domain.result.ValidationResult;
import com.phillippitts.jobpipeline.service.job.ProgressReporter;
import com.phillippitts.jobpipeline.service.processing.ProcessingFunction;

import java.util.List;

public class PlaceholderValidateFunction implements ProcessingFunction<ValidatePayload, ValidationResult> {

    @Override
    public JobKind kind() {
        return JobKind.VALIDATE;
    }

    @Override
    public Class<ValidatePayload> payloadType() {
        return ValidatePayload.class;
    }

    @Override
    public ValidationResult process(ValidatePayload payload, ProgressReporter reporter) {
        return new ValidationResult(true, List.of(),
                List.of("Kiểm tra lại số CMND/CCCD", "Xác nhận số tiền thuế đã nộp"), 88);
    }
}
