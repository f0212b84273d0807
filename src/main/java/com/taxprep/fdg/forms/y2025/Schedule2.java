package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;
import com.taxprep.fdg.node.Lines;

import java.util.Arrays;
import java.util.List;

/**
 * Schedule 2, Additional Taxes. Alternative minimum tax is not computed, so
 * Part I stays empty.
 */
public final class Schedule2 extends AbstractFormNode {
    private ScheduleSE scheduleSE;
    private F8889 f8889;
    private IncomeWorksheet income;
    private ScheduleE scheduleE;

    public Schedule2(FormContext context, ScheduleSE scheduleSE, F8889 f8889, IncomeWorksheet income,
            ScheduleE scheduleE) {
        super(context, FormTag.SCHEDULE_2, 2);
        this.scheduleSE = scheduleSE;
        this.f8889 = f8889;
        this.income = income;
        this.scheduleE = scheduleE;
    }

    private final Line<Double> l2 = line("l2", () -> null);
    private final Line<Double> l3 = line("l3", () -> Lines.sumPresent(l2.get()));

    private final Line<Double> l4 = line("l4", () -> this.scheduleSE.isNeeded() ? this.scheduleSE.totalTax() : null);

    // Form 8959: Medicare wages and self-employment earnings above the threshold
    private final Line<Double> l11 = line("l11", () -> {
        FilingStatus status = info.filingStatus();
        double medicareWages = info.w2s().stream().mapToDouble(IncomeW2::medicareIncome).sum();
        double seEarnings = Math.max(0, this.scheduleSE.totalNetEarnings());
        double excess = Math.max(0, medicareWages + seEarnings - Federal2025.additionalMedicareThreshold(status));
        return Lines.blankIfZero(Lines.cents(excess * Federal2025.ADDITIONAL_MEDICARE_RATE));
    });

    // Form 8960: smaller of net investment income and MAGI above the threshold
    private final Line<Double> l12 = line("l12", () -> {
        double investmentIncome = this.income.l2b() + this.income.l3b()
                + Math.max(0, Lines.orZero(this.income.l7()))
                + (this.scheduleE.isNeeded() ? Math.max(0, this.scheduleE.totalIncome()) : 0);
        double excess = Math.max(0, this.income.agi() - Federal2025.netInvestmentIncomeThreshold(info.filingStatus()));
        return Lines.blankIfZero(Lines.cents(Math.min(investmentIncome, excess)
                * Federal2025.NET_INVESTMENT_INCOME_RATE));
    });

    private final Line<Double> l17c = line("l17c",
            () -> this.f8889.isNeeded() ? Lines.blankIfZero(this.f8889.totalAdditionalTax()) : null);

    private final Line<Double> l18 = line("l18", () -> Lines.sumPresent(l17c.get()));

    private final Line<Double> l21 = line("l21", () -> Lines.sumPresent(l4.get(), l11.get(), l12.get(), l18.get()));

    @Override
    protected boolean computeIsNeeded() {
        return l3.get() != null || l21.get() != null;
    }

    public Double l3() {
        return l3.get();
    }

    public Double l21() {
        return l21.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.primaryName(info), Filers.primarySsn(info),
                l2.get(), l3.get(), l4.get(), l11.get(), l12.get(), l17c.get(), l18.get(), l21.get());
    }
}
