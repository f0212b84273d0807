package com.taxprep.fdg.scenario;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.taxprep.fdg.assembly.FilingSet;
import com.taxprep.fdg.model.FilingStatus;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one calculated return. The full {@link FilingSet} is kept for
 * callers that need line values but is not serialized.
 *
 * @param refundAmount     overpayment refunded, 0 when tax is owed
 * @param amountOwed       balance due, 0 when a refund is due
 * @param effectiveTaxRate total tax as a percentage of AGI, 2 decimals
 * @param marginalTaxRate  ordinary bracket rate at taxable income, percent
 * @param filedForms       form ids in filing order; copies carry a
 *                         {@code #n} suffix
 * @param errors           input consistency problems found for this return;
 *                         the numbers are still computed
 */
public record TaxCalculationResult(
        String scenarioId,
        String scenarioName,
        boolean baseline,
        int taxYear,
        FilingStatus filingStatus,
        double totalIncome,
        double wagesIncome,
        double otherIncome,
        double agi,
        double standardDeduction,
        Double itemizedDeduction,
        double deductionUsed,
        boolean itemized,
        double taxableIncome,
        double taxBeforeCredits,
        double totalCredits,
        double totalTax,
        double withholdings,
        double estimatedPayments,
        double totalPayments,
        double refundAmount,
        double amountOwed,
        double effectiveTaxRate,
        double marginalTaxRate,
        List<String> filedForms,
        List<String> errors,
        boolean calculatedSuccessfully,
        Instant calculatedAt,
        @JsonIgnore FilingSet filingSet) {

    public TaxCalculationResult {
        filedForms = filedForms == null ? List.of() : List.copyOf(filedForms);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** Refund as a positive number, amount owed as a negative one. */
    @JsonIgnore
    public double netRefund() {
        return refundAmount - amountOwed;
    }
}
