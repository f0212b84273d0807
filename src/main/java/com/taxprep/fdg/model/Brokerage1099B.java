package com.taxprep.fdg.model;

/** Summary totals of one broker statement. */
public record Brokerage1099B(String payer, PersonRole personRole, double shortTermProceeds,
        double shortTermCostBasis, double longTermProceeds, double longTermCostBasis) {

    public double shortTermGain() {
        return shortTermProceeds - shortTermCostBasis;
    }

    public double longTermGain() {
        return longTermProceeds - longTermCostBasis;
    }
}
