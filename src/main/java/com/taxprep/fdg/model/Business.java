package com.taxprep.fdg.model;

/** A sole proprietorship reported on its own Schedule C. */
public record Business(String name, String ein, String principalBusinessCode, PersonRole personRole,
        double grossReceipts, double returnsAndAllowances, double costOfGoodsSold, double totalExpenses) {

    public Business {
        if (personRole == null)
            personRole = PersonRole.PRIMARY;
    }

    /** Gross receipts less returns, cost of goods sold and expenses. */
    public double netProfit() {
        return grossReceipts - returnsAndAllowances - costOfGoodsSold - totalExpenses;
    }
}
