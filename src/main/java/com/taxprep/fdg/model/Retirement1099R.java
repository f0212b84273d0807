package com.taxprep.fdg.model;

public record Retirement1099R(String payer, PersonRole personRole, PlanType planType,
        double grossDistribution, double taxableAmount, double federalIncomeTaxWithheld) {

    public Retirement1099R {
        if (planType == null)
            planType = PlanType.PENSION;
    }
}
