package com.taxprep.fdg.data;

import com.taxprep.fdg.model.FilingStatus;

/**
 * Federal parameters for tax year 2025.
 */
public final class Federal2025 {
    private Federal2025() {
        // Constants only
    }

    public static final int TAX_YEAR = 2025;

    // ── Ordinary income brackets ────────────────────────────────

    private static final double[] ORDINARY_RATES = { 0.10, 0.12, 0.22, 0.24, 0.32, 0.35, 0.37 };

    private static final double[] BRACKETS_SINGLE = { 11925, 48475, 103350, 197300, 250525, 626350 };
    private static final double[] BRACKETS_JOINT = { 23850, 96950, 206700, 394600, 501050, 751600 };
    private static final double[] BRACKETS_MFS = { 11925, 48475, 103350, 197300, 250525, 375800 };
    private static final double[] BRACKETS_HOH = { 17000, 64850, 103350, 197300, 250500, 626350 };

    // Upper bounds of the 0% and 15% long-term capital gain brackets
    private static final double[] LTCG_SINGLE = { 48350, 533400 };
    private static final double[] LTCG_JOINT = { 96700, 600050 };
    private static final double[] LTCG_MFS = { 48350, 300000 };
    private static final double[] LTCG_HOH = { 64750, 566700 };

    public static double[] ordinaryBrackets(FilingStatus status) {
        return switch (status) {
            case S -> BRACKETS_SINGLE;
            case MFJ, W -> BRACKETS_JOINT;
            case MFS -> BRACKETS_MFS;
            case HOH -> BRACKETS_HOH;
        };
    }

    public static double[] longTermGainBrackets(FilingStatus status) {
        return switch (status) {
            case S -> LTCG_SINGLE;
            case MFJ, W -> LTCG_JOINT;
            case MFS -> LTCG_MFS;
            case HOH -> LTCG_HOH;
        };
    }

    /** Tax on ordinary income using the bracket schedule. */
    public static double ordinaryTax(FilingStatus status, double taxableIncome) {
        if (taxableIncome <= 0)
            return 0;
        double[] brackets = ordinaryBrackets(status);
        double tax = 0;
        double lower = 0;
        for (int i = 0; i < ORDINARY_RATES.length; i++) {
            double upper = i < brackets.length ? brackets[i] : Double.POSITIVE_INFINITY;
            if (taxableIncome <= lower)
                break;
            tax += (Math.min(taxableIncome, upper) - lower) * ORDINARY_RATES[i];
            lower = upper;
        }
        return Math.round(tax * 100.0) / 100.0;
    }

    /** Marginal rate in percent for the given taxable income. */
    public static double marginalRate(FilingStatus status, double taxableIncome) {
        double[] brackets = ordinaryBrackets(status);
        for (int i = 0; i < brackets.length; i++)
            if (taxableIncome <= brackets[i])
                return ORDINARY_RATES[i] * 100;
        return ORDINARY_RATES[ORDINARY_RATES.length - 1] * 100;
    }

    // ── Standard deduction ──────────────────────────────────────

    public static double standardDeduction(FilingStatus status) {
        return switch (status) {
            case S, MFS -> 15750;
            case MFJ, W -> 31500;
            case HOH -> 23625;
        };
    }

    /** Additional amount per age-65 or blindness allowance. */
    public static double additionalStandardDeduction(FilingStatus status) {
        return status == FilingStatus.S || status == FilingStatus.HOH ? 2000 : 1600;
    }

    public static final double DEPENDENT_MIN_STANDARD_DEDUCTION = 1350;
    public static final double DEPENDENT_EARNED_INCOME_ADDITION = 450;

    public static final int SENIOR_AGE = 65;

    // ── Schedule A ─────────────────────────────────────────────

    public static final double MEDICAL_AGI_FLOOR = 0.075;
    public static final double SALT_PHASE_DOWN_RATE = 0.30;

    public static double saltCap(FilingStatus status) {
        return status == FilingStatus.MFS ? 20000 : 40000;
    }

    public static double saltFloor(FilingStatus status) {
        return status == FilingStatus.MFS ? 5000 : 10000;
    }

    public static double saltPhaseDownThreshold(FilingStatus status) {
        return status == FilingStatus.MFS ? 250000 : 500000;
    }

    // ── Schedules B and D ──────────────────────────────────────

    public static final double SCHEDULE_B_THRESHOLD = 1500;

    public static double capitalLossLimit(FilingStatus status) {
        return status == FilingStatus.MFS ? 1500 : 3000;
    }

    // ── Self-employment and Medicare ───────────────────────────

    public static final double SE_EARNINGS_FACTOR = 0.9235;
    public static final double SE_MINIMUM_EARNINGS = 400;
    public static final double SOCIAL_SECURITY_RATE = 0.124;
    public static final double MEDICARE_RATE = 0.029;
    public static final double SOCIAL_SECURITY_WAGE_BASE = 176100;
    public static final double ADDITIONAL_MEDICARE_RATE = 0.009;
    public static final double NET_INVESTMENT_INCOME_RATE = 0.038;

    public static double additionalMedicareThreshold(FilingStatus status) {
        return switch (status) {
            case MFJ -> 250000;
            case MFS -> 125000;
            default -> 200000;
        };
    }

    public static double netInvestmentIncomeThreshold(FilingStatus status) {
        return switch (status) {
            case MFJ, W -> 250000;
            case MFS -> 125000;
            default -> 200000;
        };
    }

    // ── Adjustments ─────────────────────────────────────────────

    public static final double HSA_LIMIT_SELF_ONLY = 4300;
    public static final double HSA_LIMIT_FAMILY = 8550;
    public static final double HSA_CATCH_UP = 1000;
    public static final int HSA_CATCH_UP_AGE = 55;
    public static final double HSA_ADDITIONAL_TAX_RATE = 0.20;

    public static final double IRA_LIMIT = 7000;
    public static final double IRA_CATCH_UP = 1000;
    public static final int IRA_CATCH_UP_AGE = 50;

    public static final double STUDENT_LOAN_INTEREST_CAP = 2500;

    public static final double ELECTIVE_DEFERRAL_LIMIT = 23500;

    // ── Credits ─────────────────────────────────────────────────

    public static final double CHILD_TAX_CREDIT = 2200;
    public static final double OTHER_DEPENDENT_CREDIT = 500;
    public static final double REFUNDABLE_CHILD_CREDIT_CAP = 1700;
    public static final int CHILD_TAX_CREDIT_AGE_LIMIT = 17;
    public static final double CHILD_CREDIT_PHASE_OUT_STEP = 1000;
    public static final double CHILD_CREDIT_PHASE_OUT_PER_STEP = 50;
    public static final double ADDITIONAL_CHILD_CREDIT_EARNED_FLOOR = 2500;
    public static final double ADDITIONAL_CHILD_CREDIT_RATE = 0.15;

    public static double childCreditPhaseOutThreshold(FilingStatus status) {
        return status == FilingStatus.MFJ ? 400000 : 200000;
    }

    /** Foreign tax that may be credited without Form 1116. */
    public static double foreignTaxCreditElectionLimit(FilingStatus status) {
        return status == FilingStatus.MFJ ? 600 : 300;
    }
}
