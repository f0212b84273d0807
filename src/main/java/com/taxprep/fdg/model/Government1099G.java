package com.taxprep.fdg.model;

/** Unemployment compensation statement. */
public record Government1099G(String payer, PersonRole personRole, double unemploymentCompensation,
        double federalIncomeTaxWithheld) {
}
