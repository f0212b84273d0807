package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.Dividend1099;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;
import com.taxprep.fdg.node.Lines;

import java.util.Arrays;
import java.util.List;

/**
 * Schedule 3, Additional Credits and Payments.
 */
public final class Schedule3 extends AbstractFormNode {
    private TaxComputationWorksheet taxComputation;

    public Schedule3(FormContext context, TaxComputationWorksheet taxComputation) {
        super(context, FormTag.SCHEDULE_3, 3);
        this.taxComputation = taxComputation;
    }

    // Foreign tax credit, limited to regular tax
    private final Line<Double> l1 = line("l1", () -> {
        double paid = info.f1099Divs().stream().mapToDouble(Dividend1099::foreignTaxPaid).sum();
        return Lines.blankIfZero(Math.min(paid, this.taxComputation.tax()));
    });

    private final Line<Double> l8 = line("l8", () -> Lines.sumPresent(l1.get()));

    // Social security withheld above the maximum by more than one employer
    private final Line<Double> l11 = line("l11", () -> {
        double maxTax = Federal2025.SOCIAL_SECURITY_WAGE_BASE * Federal2025.SOCIAL_SECURITY_RATE / 2;
        double excess = 0;
        for (PersonRole role : Filers.roles(info)) {
            List<IncomeW2> w2s = info.w2s().stream().filter(w -> Filers.belongsTo(w.personRole(), role)).toList();
            if (w2s.size() > 1)
                excess += Math.max(0, w2s.stream().mapToDouble(IncomeW2::ssWithholding).sum() - maxTax);
        }
        return Lines.blankIfZero(Lines.cents(excess));
    });

    private final Line<Double> l15 = line("l15", () -> Lines.sumPresent(l11.get()));

    @Override
    protected boolean computeIsNeeded() {
        return l8.get() != null || l15.get() != null;
    }

    public Double l8() {
        return l8.get();
    }

    public Double l15() {
        return l15.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.primaryName(info), Filers.primarySsn(info),
                l1.get(), l8.get(), l11.get(), l15.get());
    }
}
