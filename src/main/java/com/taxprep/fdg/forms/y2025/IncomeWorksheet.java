package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.model.Dividend1099;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.Interest1099;
import com.taxprep.fdg.model.PlanType;
import com.taxprep.fdg.model.Retirement1099R;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;
import com.taxprep.fdg.node.Lines;

import java.util.Arrays;
import java.util.List;

/**
 * Total income and adjusted gross income (Form 1040 lines 1 through 11).
 *
 * <p>
 * Kept apart from Form 1040 so that Schedule A and Schedule 8812 can read AGI
 * without depending on the root form.
 */
public final class IncomeWorksheet extends AbstractFormNode {
    private ScheduleB scheduleB;
    private ScheduleD scheduleD;
    private Schedule1 schedule1;

    public IncomeWorksheet(FormContext context, ScheduleB scheduleB, ScheduleD scheduleD, Schedule1 schedule1) {
        super(context, FormTag.WORKSHEET_INCOME, 0);
        this.scheduleB = scheduleB;
        this.scheduleD = scheduleD;
        this.schedule1 = schedule1;
    }

    private final Line<Double> l1a = line("l1a", () -> info.w2s().stream().mapToDouble(IncomeW2::income).sum());
    private final Line<Double> l1z = line("l1z", l1a::get);

    private final Line<Double> l2b = line("l2b", () -> this.scheduleB.isNeeded() ? this.scheduleB.l4()
            : info.f1099Ints().stream().mapToDouble(Interest1099::income).sum());

    private final Line<Double> l3a = line("l3a",
            () -> info.f1099Divs().stream().mapToDouble(Dividend1099::qualifiedDividends).sum());

    private final Line<Double> l3b = line("l3b", () -> this.scheduleB.isNeeded() ? this.scheduleB.l6()
            : info.f1099Divs().stream().mapToDouble(Dividend1099::ordinaryDividends).sum());

    private final Line<Double> l4a = line("l4a", () -> Lines.blankIfZero(distributions(PlanType.IRA, true)));
    private final Line<Double> l4b = line("l4b", () -> l4a.get() == null ? null : distributions(PlanType.IRA, false));
    private final Line<Double> l5a = line("l5a", () -> Lines.blankIfZero(distributions(PlanType.PENSION, true)));
    private final Line<Double> l5b = line("l5b",
            () -> l5a.get() == null ? null : distributions(PlanType.PENSION, false));

    // Capital gain distributions go directly on line 7 when Schedule D is not filed
    private final Line<Double> l7 = line("l7",
            () -> this.scheduleD.isNeeded() ? Double.valueOf(this.scheduleD.toForm1040())
            : Lines.blankIfZero(info.f1099Divs().stream()
                    .mapToDouble(Dividend1099::totalCapitalGainsDistributions).sum()));

    private final Line<Double> l8 = line("l8", () -> this.schedule1.isNeeded() ? this.schedule1.l10() : null);

    private final Line<Double> l9 = line("l9", () -> Lines.sum(l1z.get(), l2b.get(), l3b.get(), l4b.get(),
            l5b.get(), l7.get(), l8.get()));

    private final Line<Double> l10 = line("l10", () -> this.schedule1.isNeeded() ? this.schedule1.l26() : null);

    private final Line<Double> l11 = line("l11", () -> l9.get() - Lines.orZero(l10.get()));

    private double distributions(PlanType type, boolean gross) {
        return info.f1099Rs().stream()
                .filter(r -> r.planType() == type)
                .mapToDouble(gross ? Retirement1099R::grossDistribution : Retirement1099R::taxableAmount)
                .sum();
    }

    public double wages() {
        return l1z.get();
    }

    public double l2b() {
        return l2b.get();
    }

    public double l3a() {
        return l3a.get();
    }

    public double l3b() {
        return l3b.get();
    }

    public Double l4a() {
        return l4a.get();
    }

    public Double l4b() {
        return l4b.get();
    }

    public Double l5a() {
        return l5a.get();
    }

    public Double l5b() {
        return l5b.get();
    }

    public Double l7() {
        return l7.get();
    }

    public Double l8() {
        return l8.get();
    }

    public double totalIncome() {
        return l9.get();
    }

    public Double adjustments() {
        return l10.get();
    }

    public double agi() {
        return l11.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(l1a.get(), l1z.get(), l2b.get(), l3a.get(), l3b.get(), l4a.get(), l4b.get(),
                l5a.get(), l5b.get(), l7.get(), l8.get(), l9.get(), l10.get(), l11.get());
    }
}
