package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.Government1099G;
import com.taxprep.fdg.model.IraContribution;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;
import com.taxprep.fdg.node.Lines;

import java.util.Arrays;
import java.util.List;

/**
 * Schedule 1, Additional Income and Adjustments to Income.
 */
public final class Schedule1 extends AbstractFormNode {
    private ScheduleC scheduleC;
    private ScheduleE scheduleE;
    private ScheduleSE scheduleSE;
    private F8889 f8889;

    public Schedule1(FormContext context, ScheduleC scheduleC, ScheduleE scheduleE, ScheduleSE scheduleSE,
            F8889 f8889) {
        super(context, FormTag.SCHEDULE_1, 1);
        this.scheduleC = scheduleC;
        this.scheduleE = scheduleE;
        this.scheduleSE = scheduleSE;
        this.f8889 = f8889;
    }

    // Part I, additional income

    private final Line<Double> l3 = line("l3",
            () -> this.scheduleC.isNeeded() ? this.scheduleC.totalNetProfit() : null);

    private final Line<Double> l5 = line("l5", () -> this.scheduleE.isNeeded() ? this.scheduleE.totalIncome() : null);

    private final Line<Double> l7 = line("l7", () -> Lines.blankIfZero(
            info.f1099Gs().stream().mapToDouble(Government1099G::unemploymentCompensation).sum()));

    private final Line<Double> l8f = line("l8f",
            () -> this.f8889.isNeeded() ? Lines.blankIfZero(this.f8889.totalTaxableDistributions()) : null);

    private final Line<Double> l9 = line("l9", () -> Lines.sumPresent(l8f.get()));

    private final Line<Double> l10 = line("l10", () -> Lines.sumPresent(l3.get(), l5.get(), l7.get(), l9.get()));

    // Part II, adjustments to income

    private final Line<Double> l13 = line("l13",
            () -> this.f8889.isNeeded() ? Lines.blankIfZero(this.f8889.totalDeduction()) : null);

    private final Line<Double> l15 = line("l15",
            () -> this.scheduleSE.isNeeded() ? this.scheduleSE.totalDeduction() : null);

    private final Line<Double> l20 = line("l20", () -> {
        double total = 0;
        for (PersonRole role : Filers.roles(info)) {
            double contributed = info.iraContributions().stream()
                    .filter(c -> c.personRole() == role)
                    .mapToDouble(IraContribution::contributions)
                    .sum();
            double limit = Federal2025.IRA_LIMIT;
            if (Filers.age(Filers.person(info, role), info.taxYear()) >= Federal2025.IRA_CATCH_UP_AGE)
                limit += Federal2025.IRA_CATCH_UP;
            total += Math.min(contributed, limit);
        }
        return Lines.blankIfZero(total);
    });

    private final Line<Double> l21 = line("l21", () -> Lines.blankIfZero(
            Math.min(Math.max(0, info.studentLoanInterest()), Federal2025.STUDENT_LOAN_INTEREST_CAP)));

    private final Line<Double> l26 = line("l26",
            () -> Lines.sumPresent(l13.get(), l15.get(), l20.get(), l21.get()));

    @Override
    protected boolean computeIsNeeded() {
        return l10.get() != null || l26.get() != null;
    }

    public Double l3() {
        return l3.get();
    }

    public Double l10() {
        return l10.get();
    }

    public Double l15() {
        return l15.get();
    }

    public Double l26() {
        return l26.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.primaryName(info), Filers.primarySsn(info),
                l3.get(), l5.get(), l7.get(), l8f.get(), l9.get(), l10.get(),
                l13.get(), l15.get(), l20.get(), l21.get(), l26.get());
    }
}
