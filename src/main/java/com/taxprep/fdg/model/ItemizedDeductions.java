package com.taxprep.fdg.model;

/**
 * Schedule A inputs.
 *
 * @param electItemized itemize even when the total is lower than the standard
 *                      deduction
 */
public record ItemizedDeductions(boolean electItemized, double medicalAndDental, double stateAndLocalTaxes,
        double stateAndLocalRealEstateTaxes, double stateAndLocalPropertyTaxes, double mortgageInterest,
        double investmentInterest, double charityCashCheck, double charityOther) {
}
