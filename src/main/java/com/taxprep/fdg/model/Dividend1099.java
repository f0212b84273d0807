package com.taxprep.fdg.model;

public record Dividend1099(String payer, PersonRole personRole, double ordinaryDividends,
        double qualifiedDividends, double totalCapitalGainsDistributions, double foreignTaxPaid,
        double federalIncomeTaxWithheld) {
}
