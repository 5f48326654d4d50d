package com.phillippitts.jobpipeline.service.processing.placeholder;

import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.payload.CalculatePayload;
import com.phillippitts.jobpipeline.domain.result.CalculationResult;
import com.phillippitts.jobpipeline.domain.result.CalculationResult.BreakdownItem;
import com.phillippitts.jobpipeline.service.job.ProgressReporter;
import com.phillippitts.jobpipeline.service.processing.ProcessingFunction;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stand-in tax calculator returning a fixed personal income tax computation.
 */
public class PlaceholderCalculateFunction implements ProcessingFunction<CalculatePayload, CalculationResult> {

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
        Map<String, BigDecimal> calculations = new LinkedHashMap<>();
        calculations.put("total_income", new BigDecimal("120000000"));
        calculations.put("taxable_income", new BigDecimal("109000000"));
        calculations.put("tax_amount", new BigDecimal("4350000"));
        calculations.put("tax_paid", new BigDecimal("2000000"));
        calculations.put("tax_payable", new BigDecimal("2350000"));

        List<BreakdownItem> breakdown = List.of(
                new BreakdownItem("Thu nhập chịu thuế", new BigDecimal("109000000")),
                new BreakdownItem("Giảm trừ gia cảnh", new BigDecimal("11000000")));
        return new CalculationResult(calculations, breakdown, 95);
    }
}
