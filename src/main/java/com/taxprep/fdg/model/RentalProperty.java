package com.taxprep.fdg.model;

public record RentalProperty(String address, double rentsReceived, double totalExpenses, double depreciation) {

    public double netIncome() {
        return rentsReceived - totalExpenses - depreciation;
    }
}
