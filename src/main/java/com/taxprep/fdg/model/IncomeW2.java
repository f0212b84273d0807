package com.taxprep.fdg.model;

/**
 * Wage statement.
 *
 * @param box12D elective deferrals to a 401(k)
 * @param box12W employer contributions to an HSA
 */
public record IncomeW2(String employer, String occupation, PersonRole personRole, double income,
        double medicareIncome, double fedWithholding, double ssWages, double ssWithholding,
        double medicareWithholding, double box12D, double box12W) {

    public IncomeW2 {
        if (personRole == null)
            personRole = PersonRole.PRIMARY;
    }
}
