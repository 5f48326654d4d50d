package com.phillippitts.jobpipeline.testutil;

import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.payload.CalculatePayload;
import com.phillippitts.jobpipeline.domain.result.CalculationResult;
import com.phillippitts.jobpipeline.service.job.ProgressReporter;
import com.phillippitts.jobpipeline.service.processing.ProcessingFunction;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Calculate function whose behaviour is supplied by the test.
 */
public final class CalculateStub implements ProcessingFunction<CalculatePayload, CalculationResult> {

    private final BiFunction<CalculatePayload, ProgressReporter, CalculationResult> behaviour;
    private final AtomicInteger invocations = new AtomicInteger();

    public CalculateStub(BiFunction<CalculatePayload, ProgressReporter, CalculationResult> behaviour) {
        this.behaviour = behaviour;
    }

    public static CalculateStub succeeding() {
        return new CalculateStub((payload, reporter) -> result());
    }

    public static CalculationResult result() {
        return new CalculationResult(Map.of("tax_payable", new BigDecimal("2350000")), List.of(), 95);
    }

    public int invocations() {
        return invocations.get();
    }

    @Override
    public JobKind kind() {
        return JobKind.CALCULATE;
    }

    @Override
    public Class<CalculatePayload> payloadType() {
        return CalculatePayload.class;
    }

    @Override
    public CalculationResult process(CalculatePayload payload, ProgressReporter reporter) {
        invocations.incrementAndGet();
        return behaviour.apply(payload, reporter);
    }
}
