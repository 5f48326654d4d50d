package com.phillippitts.jobpipeline.domain.result;

import com.phillippitts.jobpipeline.domain.JobKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Computed tax amounts plus a human-readable breakdown.
 *
 * @param calculations    named amounts, e.g. "taxable_income" or "tax_due"
 * @param breakdown       ordered explanation lines
 * @param confidenceScore 0-100
 */
public record CalculationResult(Map<String, BigDecimal> calculations,
                                List<BreakdownItem> breakdown,
                                int confidenceScore) implements JobResult {

    public CalculationResult {
        calculations = calculations == null ? Map.of() : Map.copyOf(calculations);
        breakdown = breakdown == null ? List.of() : List.copyOf(breakdown);
    }

    @Override
    public JobKind kind() {
        return JobKind.CALCULATE;
    }

    /**
     * One line of the calculation breakdown.
     */
    public record BreakdownItem(String description, BigDecimal amount) {
    }
}
