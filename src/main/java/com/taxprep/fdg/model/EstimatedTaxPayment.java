package com.taxprep.fdg.model;

public record EstimatedTaxPayment(String label, double payment) {
}
