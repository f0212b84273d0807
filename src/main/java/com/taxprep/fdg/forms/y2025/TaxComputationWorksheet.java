package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.Dividend1099;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;
import com.taxprep.fdg.node.Lines;

import java.util.Arrays;
import java.util.List;

/**
 * Deduction, taxable income and regular tax (Form 1040 lines 12 through 16).
 * Tax uses the Qualified Dividends and Capital Gain Tax Worksheet when there
 * are qualified dividends or net long-term gains, the bracket schedule
 * otherwise.
 */
public final class TaxComputationWorksheet extends AbstractFormNode {
    private IncomeWorksheet income;
    private ScheduleA scheduleA;
    private StandardDeductionWorksheet standardDeduction;
    private ScheduleD scheduleD;

    public TaxComputationWorksheet(FormContext context, IncomeWorksheet income, ScheduleA scheduleA,
            StandardDeductionWorksheet standardDeduction, ScheduleD scheduleD) {
        super(context, FormTag.WORKSHEET_TAX_COMPUTATION, 0);
        this.income = income;
        this.scheduleA = scheduleA;
        this.standardDeduction = standardDeduction;
        this.scheduleD = scheduleD;
    }

    private final Line<Boolean> itemized = line("itemized", () -> this.scheduleA.isNeeded());

    private final Line<Double> l12 = line("l12",
            () -> itemized.get() ? this.scheduleA.l17() : this.standardDeduction.standardDeduction());

    // Qualified business income deduction is not computed
    private final Line<Double> l13 = line("l13", () -> null);

    private final Line<Double> l14 = line("l14", () -> l12.get() + Lines.orZero(l13.get()));

    private final Line<Double> l15 = line("l15", () -> Math.max(0, this.income.agi() - l14.get()));

    // Net capital gain eligible for the preferential rates
    private final Line<Double> preferentialGain = memo("preferentialGain", () -> {
        if (this.scheduleD.isNeeded())
            return this.scheduleD.useQualifiedGainWorksheet()
                    ? Math.max(0, Math.min(this.scheduleD.l15(), this.scheduleD.l16()))
                    : 0.0;
        return info.f1099Divs().stream().mapToDouble(Dividend1099::totalCapitalGainsDistributions).sum();
    });

    private final Line<Boolean> usesQualifiedGainWorksheet = line("usesQualifiedGainWorksheet",
            () -> this.income.l3a() > 0 || preferentialGain.get() > 0);

    private final Line<Double> l16 = line("l16", () -> usesQualifiedGainWorksheet.get()
            ? qualifiedGainTax(l15.get(), this.income.l3a() + preferentialGain.get())
            : Federal2025.ordinaryTax(info.filingStatus(), l15.get()));

    private final Line<Double> marginalRate = line("marginalRate",
            () -> Federal2025.marginalRate(info.filingStatus(), l15.get()));

    private double qualifiedGainTax(double taxable, double preferential) {
        FilingStatus status = info.filingStatus();
        double[] ltcg = Federal2025.longTermGainBrackets(status);
        double gains = Math.min(taxable, preferential);
        double ordinary = taxable - gains;
        double zeroBand = Math.min(taxable, ltcg[0]);
        double atZero = zeroBand - Math.min(ordinary, zeroBand);
        double remaining = gains - atZero;
        double fifteenBand = Math.max(0, Math.min(taxable, ltcg[1]) - (ordinary + atZero));
        double atFifteen = Math.min(remaining, fifteenBand);
        double atTwenty = gains - (atZero + atFifteen);
        double tax = atFifteen * 0.15 + atTwenty * 0.20 + Federal2025.ordinaryTax(status, ordinary);
        return Lines.cents(Math.min(tax, Federal2025.ordinaryTax(status, taxable)));
    }

    public boolean itemized() {
        return itemized.get();
    }

    public double deduction() {
        return l12.get();
    }

    public Double l13() {
        return l13.get();
    }

    public double l14() {
        return l14.get();
    }

    public double taxableIncome() {
        return l15.get();
    }

    public double tax() {
        return l16.get();
    }

    public double marginalRate() {
        return marginalRate.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(itemized.get(), l12.get(), l13.get(), l14.get(), l15.get(),
                usesQualifiedGainWorksheet.get(), l16.get(), marginalRate.get());
    }
}
