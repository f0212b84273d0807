package com.taxprep.fdg.scenario;

/**
 * One scenario measured against the baseline. Each difference is the
 * scenario's value minus the baseline's.
 */
public record ScenarioDifference(
        String scenarioId,
        String scenarioName,
        TaxCalculationResult result,
        double agiDiff,
        double taxableIncomeDiff,
        double totalTaxDiff,
        double refundDiff,
        double effectiveRateDiff) {

    static ScenarioDifference between(TaxCalculationResult baseline, TaxCalculationResult result) {
        return new ScenarioDifference(result.scenarioId(), result.scenarioName(), result,
                round(result.agi() - baseline.agi()),
                round(result.taxableIncome() - baseline.taxableIncome()),
                round(result.totalTax() - baseline.totalTax()),
                round(result.netRefund() - baseline.netRefund()),
                round(result.effectiveTaxRate() - baseline.effectiveTaxRate()));
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
