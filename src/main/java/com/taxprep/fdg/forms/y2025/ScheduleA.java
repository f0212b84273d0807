package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.ItemizedDeductions;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.Arrays;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Schedule A, Itemized Deductions. Every line is absent when the taxpayer
 * entered no itemized deductions.
 */
public final class ScheduleA extends AbstractFormNode {
    private IncomeWorksheet income;
    private final StandardDeductionWorksheet standardDeduction;

    public ScheduleA(FormContext context, IncomeWorksheet income, StandardDeductionWorksheet standardDeduction) {
        super(context, FormTag.SCHEDULE_A, 7);
        this.income = income;
        this.standardDeduction = standardDeduction;
    }

    private Double entered(ToDoubleFunction<ItemizedDeductions> field) {
        ItemizedDeductions d = info.itemizedDeductions();
        return d == null ? null : field.applyAsDouble(d);
    }

    // Medical and dental

    private final Line<Double> l1 = line("l1", () -> entered(ItemizedDeductions::medicalAndDental));
    private final Line<Double> l2 = line("l2", () -> l1.get() == null ? null : this.income.agi());
    private final Line<Double> l3 = line("l3", () -> l2.get() == null ? null : l2.get() * Federal2025.MEDICAL_AGI_FLOOR);
    private final Line<Double> l4 = line("l4", () -> l1.get() == null ? null : Math.max(0, l1.get() - l3.get()));

    // Taxes you paid

    private final Line<Double> l5a = line("l5a", () -> entered(ItemizedDeductions::stateAndLocalTaxes));
    private final Line<Double> l5b = line("l5b", () -> entered(ItemizedDeductions::stateAndLocalRealEstateTaxes));
    private final Line<Double> l5c = line("l5c", () -> entered(ItemizedDeductions::stateAndLocalPropertyTaxes));
    private final Line<Double> l5d = line("l5d",
            () -> l5a.get() == null ? null : l5a.get() + l5b.get() + l5c.get());

    // Cap reduced by 30% of modified AGI above the threshold, never below the floor
    private final Line<Double> saltCap = memo("saltCap", () -> {
        FilingStatus status = info.filingStatus();
        double excess = Math.max(0, this.income.agi() - Federal2025.saltPhaseDownThreshold(status));
        return Math.max(Federal2025.saltFloor(status),
                Federal2025.saltCap(status) - excess * Federal2025.SALT_PHASE_DOWN_RATE);
    });

    private final Line<Double> l5e = line("l5e", () -> l5d.get() == null ? null : Math.min(l5d.get(), saltCap.get()));
    private final Line<Double> l7 = line("l7", l5e::get);

    // Interest you paid

    private final Line<Double> l8a = line("l8a", () -> entered(ItemizedDeductions::mortgageInterest));
    private final Line<Double> l8e = line("l8e", l8a::get);
    private final Line<Double> l9 = line("l9", () -> entered(ItemizedDeductions::investmentInterest));
    private final Line<Double> l10 = line("l10", () -> l8e.get() == null ? null : l8e.get() + l9.get());

    // Gifts to charity

    private final Line<Double> l11 = line("l11", () -> entered(ItemizedDeductions::charityCashCheck));
    private final Line<Double> l12 = line("l12", () -> entered(ItemizedDeductions::charityOther));
    private final Line<Double> l14 = line("l14", () -> l11.get() == null ? null : l11.get() + l12.get());

    private final Line<Double> l17 = line("l17", () -> info.itemizedDeductions() == null ? null
            : l4.get() + l7.get() + l10.get() + l14.get());

    private final Line<Boolean> l18 = line("l18",
            () -> info.itemizedDeductions() != null && info.itemizedDeductions().electItemized());

    @Override
    protected boolean computeIsNeeded() {
        if (l17.get() == null)
            return false;
        return l18.get() || l17.get() > standardDeduction.standardDeduction();
    }

    public Double l17() {
        return l17.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.primaryName(info), Filers.primarySsn(info),
                l1.get(), l2.get(), l3.get(), l4.get(), l5a.get(), l5b.get(), l5c.get(), l5d.get(), l5e.get(),
                l7.get(), l8a.get(), l8e.get(), l9.get(), l10.get(), l11.get(), l12.get(), l14.get(), l17.get(),
                l18.get());
    }
}
