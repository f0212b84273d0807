package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.Brokerage1099B;
import com.taxprep.fdg.model.Dividend1099;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.Arrays;
import java.util.List;

/**
 * Schedule D, Capital Gains and Losses. Broker statements are reported as
 * summary totals on lines 1a and 8a.
 */
public final class ScheduleD extends AbstractFormNode {

    public ScheduleD(FormContext context) {
        super(context, FormTag.SCHEDULE_D, 12);
    }

    private final Line<Double> l1aProceeds = line("l1a.proceeds",
            () -> info.f1099Bs().stream().mapToDouble(Brokerage1099B::shortTermProceeds).sum());
    private final Line<Double> l1aCost = line("l1a.cost",
            () -> info.f1099Bs().stream().mapToDouble(Brokerage1099B::shortTermCostBasis).sum());
    private final Line<Double> l7 = line("l7", () -> l1aProceeds.get() - l1aCost.get());

    private final Line<Double> l8aProceeds = line("l8a.proceeds",
            () -> info.f1099Bs().stream().mapToDouble(Brokerage1099B::longTermProceeds).sum());
    private final Line<Double> l8aCost = line("l8a.cost",
            () -> info.f1099Bs().stream().mapToDouble(Brokerage1099B::longTermCostBasis).sum());
    private final Line<Double> l13 = line("l13",
            () -> info.f1099Divs().stream().mapToDouble(Dividend1099::totalCapitalGainsDistributions).sum());
    private final Line<Double> l15 = line("l15", () -> l8aProceeds.get() - l8aCost.get() + l13.get());

    private final Line<Double> l16 = line("l16", () -> l7.get() + l15.get());

    // Deductible loss, only when line 16 is a loss
    private final Line<Double> l21 = line("l21", () -> {
        if (l16.get() >= 0)
            return null;
        return Math.max(l16.get(), -Federal2025.capitalLossLimit(info.filingStatus()));
    });

    // Qualified dividends and capital gain tax worksheet applies
    private final Line<Boolean> l22 = line("l22", () -> l15.get() > 0 && l16.get() > 0);

    @Override
    protected boolean computeIsNeeded() {
        return !info.f1099Bs().isEmpty();
    }

    public double l15() {
        return l15.get();
    }

    public double l16() {
        return l16.get();
    }

    /** Amount carried to Form 1040 line 7: the gain, or the loss after the limit. */
    public double toForm1040() {
        return l21.get() != null ? l21.get() : l16.get();
    }

    public boolean useQualifiedGainWorksheet() {
        return l22.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.primaryName(info), Filers.primarySsn(info),
                l1aProceeds.get(), l1aCost.get(), l7.get(),
                l8aProceeds.get(), l8aCost.get(), l13.get(), l15.get(),
                l16.get(), l21.get(), l22.get(), !l22.get());
    }
}
