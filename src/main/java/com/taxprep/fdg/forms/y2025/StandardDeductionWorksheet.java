package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.Person;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.Arrays;
import java.util.List;

/**
 * Standard deduction including the age/blindness allowances and the limit for
 * a taxpayer who can be claimed as someone else's dependent.
 */
public final class StandardDeductionWorksheet extends AbstractFormNode {

    public StandardDeductionWorksheet(FormContext context) {
        super(context, FormTag.WORKSHEET_STANDARD_DEDUCTION, 0);
    }

    private final Line<Double> l1 = line("l1", () -> Federal2025.standardDeduction(info.filingStatus()));

    private final Line<Double> earnedIncome = line("earnedIncome",
            () -> info.w2s().stream().mapToDouble(IncomeW2::income).sum());

    // Dependent filer limit: greater of the minimum or earned income plus the addition, capped at the base
    private final Line<Double> l4 = line("l4", () -> {
        Person primary = info.taxPayer().primaryPerson();
        if (primary == null || !primary.taxpayerDependent())
            return null;
        double limited = Math.max(Federal2025.DEPENDENT_MIN_STANDARD_DEDUCTION,
                earnedIncome.get() + Federal2025.DEPENDENT_EARNED_INCOME_ADDITION);
        return Math.min(l1.get(), limited);
    });

    private final Line<Integer> allowances = line("allowances", () -> {
        int year = info.taxYear();
        Person primary = info.taxPayer().primaryPerson();
        int count = 0;
        if (Filers.isSenior(primary, year))
            count++;
        if (primary != null && primary.blind())
            count++;
        FilingStatus status = info.filingStatus();
        if (status == FilingStatus.MFJ || status == FilingStatus.MFS) {
            Person spouse = info.taxPayer().spouse();
            if (Filers.isSenior(spouse, year))
                count++;
            if (spouse != null && spouse.blind())
                count++;
        }
        return count;
    });

    private final Line<Double> l6 = line("l6",
            () -> allowances.get() * Federal2025.additionalStandardDeduction(info.filingStatus()));

    private final Line<Double> l7 = line("l7", () -> (l4.get() != null ? l4.get() : l1.get()) + l6.get());

    public double standardDeduction() {
        return l7.get();
    }

    public int allowances() {
        return allowances.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(l1.get(), earnedIncome.get(), l4.get(), allowances.get(), l6.get(), l7.get());
    }
}
