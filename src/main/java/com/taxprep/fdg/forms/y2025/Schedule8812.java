package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.Dependent;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;
import com.taxprep.fdg.node.Lines;

import java.util.Arrays;
import java.util.List;

/**
 * Schedule 8812, Credits for Qualifying Children and Other Dependents.
 */
public final class Schedule8812 extends AbstractFormNode {
    private IncomeWorksheet income;
    private TaxComputationWorksheet taxComputation;
    private Schedule1 schedule1;
    private Schedule3 schedule3;

    public Schedule8812(FormContext context, IncomeWorksheet income, TaxComputationWorksheet taxComputation,
            Schedule1 schedule1, Schedule3 schedule3) {
        super(context, FormTag.SCHEDULE_8812, 47);
        this.income = income;
        this.taxComputation = taxComputation;
        this.schedule1 = schedule1;
        this.schedule3 = schedule3;
    }

    private boolean qualifyingChild(Dependent d) {
        int age = d.ageAtEndOf(info.taxYear());
        return d.hasSsn() && age >= 0 && age < Federal2025.CHILD_TAX_CREDIT_AGE_LIMIT;
    }

    private final Line<Double> l3 = line("l3", () -> this.income.agi());

    private final Line<Integer> l4 = line("l4",
            () -> (int) info.taxPayer().dependents().stream().filter(this::qualifyingChild).count());
    private final Line<Double> l5 = line("l5", () -> l4.get() * Federal2025.CHILD_TAX_CREDIT);

    private final Line<Integer> l6 = line("l6", () -> info.taxPayer().dependents().size() - l4.get());
    private final Line<Double> l7 = line("l7", () -> l6.get() * Federal2025.OTHER_DEPENDENT_CREDIT);

    private final Line<Double> l8 = line("l8", () -> l5.get() + l7.get());

    private final Line<Double> l9 = line("l9", () -> Federal2025.childCreditPhaseOutThreshold(info.filingStatus()));

    // Excess rounded up to the next multiple of 1,000
    private final Line<Double> l10 = line("l10", () -> {
        double excess = Math.max(0, l3.get() - l9.get());
        double step = Federal2025.CHILD_CREDIT_PHASE_OUT_STEP;
        return Math.ceil(excess / step) * step;
    });

    private final Line<Double> l11 = line("l11", () -> l10.get() / Federal2025.CHILD_CREDIT_PHASE_OUT_STEP
            * Federal2025.CHILD_CREDIT_PHASE_OUT_PER_STEP);

    private final Line<Double> l12 = line("l12", () -> Math.max(0, l8.get() - l11.get()));

    // Credit limit worksheet A
    private final Line<Double> l13 = line("l13",
            () -> Math.max(0, this.taxComputation.tax() - Lines.orZero(this.schedule3.l8())));

    private final Line<Double> l14 = line("l14", () -> Math.min(l12.get(), l13.get()));

    // Part II-A, additional child tax credit

    private final Line<Double> l16a = line("l16a", () -> l4.get() == 0 ? null : l12.get() - l14.get());
    private final Line<Double> l16b = line("l16b",
            () -> l4.get() == 0 ? null : l4.get() * Federal2025.REFUNDABLE_CHILD_CREDIT_CAP);
    private final Line<Double> l17 = line("l17", () -> l16a.get() == null ? null : Math.min(l16a.get(), l16b.get()));

    private final Line<Double> l18a = line("l18a", () -> l17.get() == null ? null
            : this.income.wages() + Lines.orZero(this.schedule1.l3()) - Lines.orZero(this.schedule1.l15()));
    private final Line<Double> l19 = line("l19", () -> l18a.get() == null ? null
            : Math.max(0, l18a.get() - Federal2025.ADDITIONAL_CHILD_CREDIT_EARNED_FLOOR));
    private final Line<Double> l20 = line("l20",
            () -> l19.get() == null ? null : l19.get() * Federal2025.ADDITIONAL_CHILD_CREDIT_RATE);
    private final Line<Double> l27 = line("l27",
            () -> l17.get() == null ? null : Lines.blankIfZero(Lines.cents(Math.min(l17.get(), l20.get()))));

    @Override
    protected boolean computeIsNeeded() {
        return l8.get() > 0;
    }

    /** Nonrefundable credit carried to Form 1040 line 19. */
    public double l14() {
        return l14.get();
    }

    /** Additional child tax credit carried to Form 1040 line 28. */
    public Double l27() {
        return l27.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.primaryName(info), Filers.primarySsn(info),
                l3.get(), l4.get(), l5.get(), l6.get(), l7.get(), l8.get(), l9.get(), l10.get(), l11.get(),
                l12.get(), l13.get(), l14.get(), l16a.get(), l16b.get(), l17.get(), l18a.get(), l19.get(),
                l20.get(), l27.get());
    }
}
