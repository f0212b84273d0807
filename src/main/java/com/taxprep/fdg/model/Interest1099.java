package com.taxprep.fdg.model;

public record Interest1099(String payer, PersonRole personRole, double income, double federalIncomeTaxWithheld) {
}
