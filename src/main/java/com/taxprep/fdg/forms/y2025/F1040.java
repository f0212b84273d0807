package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.BalanceDueSource;
import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.model.Dividend1099;
import com.taxprep.fdg.model.EstimatedTaxPayment;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.Government1099G;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.Interest1099;
import com.taxprep.fdg.model.Person;
import com.taxprep.fdg.model.Retirement1099R;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;
import com.taxprep.fdg.node.Lines;

import java.util.Arrays;
import java.util.List;

/**
 * Form 1040, U.S. Individual Income Tax Return. Root of the 2025 graph.
 */
public final class F1040 extends AbstractFormNode implements BalanceDueSource {
    private IncomeWorksheet income;
    private TaxComputationWorksheet taxComputation;
    private Schedule2 schedule2;
    private Schedule3 schedule3;
    private Schedule8812 schedule8812;

    public F1040(FormContext context, IncomeWorksheet income, TaxComputationWorksheet taxComputation,
            Schedule2 schedule2, Schedule3 schedule3, Schedule8812 schedule8812) {
        super(context, FormTag.F1040, 0);
        this.income = income;
        this.taxComputation = taxComputation;
        this.schedule2 = schedule2;
        this.schedule3 = schedule3;
        this.schedule8812 = schedule8812;
    }

    // Income

    private final Line<Double> l1z = line("l1z", () -> this.income.wages());
    private final Line<Double> l2b = line("l2b", () -> this.income.l2b());
    private final Line<Double> l3a = line("l3a", () -> this.income.l3a());
    private final Line<Double> l3b = line("l3b", () -> this.income.l3b());
    private final Line<Double> l4a = line("l4a", () -> this.income.l4a());
    private final Line<Double> l4b = line("l4b", () -> this.income.l4b());
    private final Line<Double> l5a = line("l5a", () -> this.income.l5a());
    private final Line<Double> l5b = line("l5b", () -> this.income.l5b());
    private final Line<Double> l7 = line("l7", () -> this.income.l7());
    private final Line<Double> l8 = line("l8", () -> this.income.l8());
    private final Line<Double> l9 = line("l9", () -> this.income.totalIncome());
    private final Line<Double> l10 = line("l10", () -> this.income.adjustments());
    private final Line<Double> l11 = line("l11", () -> this.income.agi());

    // Deductions and taxable income

    private final Line<Double> l12 = line("l12", () -> this.taxComputation.deduction());
    private final Line<Double> l13 = line("l13", () -> this.taxComputation.l13());
    private final Line<Double> l14 = line("l14", () -> this.taxComputation.l14());
    private final Line<Double> l15 = line("l15", () -> this.taxComputation.taxableIncome());

    // Tax and credits

    private final Line<Double> l16 = line("l16", () -> this.taxComputation.tax());
    private final Line<Double> l17 = line("l17", () -> this.schedule2.isNeeded() ? this.schedule2.l3() : null);
    private final Line<Double> l18 = line("l18", () -> l16.get() + Lines.orZero(l17.get()));
    private final Line<Double> l19 = line("l19",
            () -> this.schedule8812.isNeeded() ? Lines.blankIfZero(this.schedule8812.l14()) : null);
    private final Line<Double> l20 = line("l20", () -> this.schedule3.isNeeded() ? this.schedule3.l8() : null);
    private final Line<Double> l21 = line("l21", () -> Lines.sum(l19.get(), l20.get()));
    private final Line<Double> l22 = line("l22", () -> Math.max(0, l18.get() - l21.get()));
    private final Line<Double> l23 = line("l23", () -> this.schedule2.isNeeded() ? this.schedule2.l21() : null);
    private final Line<Double> l24 = line("l24", () -> l22.get() + Lines.orZero(l23.get()));

    // Payments

    private final Line<Double> l25a = line("l25a",
            () -> info.w2s().stream().mapToDouble(IncomeW2::fedWithholding).sum());
    private final Line<Double> l25b = line("l25b", () -> info.f1099Ints().stream()
            .mapToDouble(Interest1099::federalIncomeTaxWithheld).sum()
            + info.f1099Divs().stream().mapToDouble(Dividend1099::federalIncomeTaxWithheld).sum()
            + info.f1099Rs().stream().mapToDouble(Retirement1099R::federalIncomeTaxWithheld).sum()
            + info.f1099Gs().stream().mapToDouble(Government1099G::federalIncomeTaxWithheld).sum());
    private final Line<Double> l25d = line("l25d", () -> l25a.get() + l25b.get());
    private final Line<Double> l26 = line("l26",
            () -> info.estimatedTaxes().stream().mapToDouble(EstimatedTaxPayment::payment).sum());
    private final Line<Double> l28 = line("l28", () -> this.schedule8812.isNeeded() ? this.schedule8812.l27() : null);
    private final Line<Double> l31 = line("l31", () -> this.schedule3.isNeeded() ? this.schedule3.l15() : null);
    private final Line<Double> l32 = line("l32", () -> Lines.sumPresent(l28.get(), l31.get()));
    private final Line<Double> l33 = line("l33", () -> l25d.get() + l26.get() + Lines.orZero(l32.get()));

    // Refund or amount owed

    private final Line<Double> l34 = line("l34",
            () -> l33.get() > l24.get() ? Double.valueOf(Lines.cents(l33.get() - l24.get())) : null);
    private final Line<Double> l35a = line("l35a", l34::get);
    private final Line<Double> l37 = line("l37",
            () -> l24.get() > l33.get() ? Double.valueOf(Lines.cents(l24.get() - l33.get())) : null);

    @Override
    public double balanceDue() {
        return Lines.orZero(l37.get());
    }

    public double wages() {
        return l1z.get();
    }

    public double totalIncome() {
        return l9.get();
    }

    public double agi() {
        return l11.get();
    }

    public double deduction() {
        return l12.get();
    }

    public boolean itemized() {
        return taxComputation.itemized();
    }

    public double taxableIncome() {
        return l15.get();
    }

    public double taxBeforeCredits() {
        return l18.get();
    }

    public double nonrefundableCredits() {
        return l21.get();
    }

    public double totalTax() {
        return l24.get();
    }

    public double withholding() {
        return l25d.get();
    }

    public double estimatedPayments() {
        return l26.get();
    }

    public double totalPayments() {
        return l33.get();
    }

    public Double refund() {
        return l34.get();
    }

    public Double amountOwed() {
        return l37.get();
    }

    public double marginalRate() {
        return taxComputation.marginalRate();
    }

    /** Payment voucher for the amount on line 37. */
    public F1040V voucher() {
        return new F1040V(context(), this);
    }

    @Override
    public List<Object> fields() {
        Person primary = info.taxPayer().primaryPerson();
        Person spouse = info.taxPayer().spouse();
        FilingStatus status = info.filingStatus();
        return Arrays.asList(
                primary == null ? null : primary.firstName(), primary == null ? null : primary.lastName(),
                Filers.ssn(primary),
                spouse == null ? null : spouse.firstName(), spouse == null ? null : spouse.lastName(),
                spouse == null ? null : Filers.ssn(spouse),
                status == FilingStatus.S, status == FilingStatus.MFJ, status == FilingStatus.MFS,
                status == FilingStatus.HOH, status == FilingStatus.W,
                l1z.get(), l2b.get(), l3a.get(), l3b.get(), l4a.get(), l4b.get(), l5a.get(), l5b.get(),
                l7.get(), l8.get(), l9.get(), l10.get(), l11.get(),
                l12.get(), l13.get(), l14.get(), l15.get(),
                l16.get(), l17.get(), l18.get(), l19.get(), l20.get(), l21.get(), l22.get(), l23.get(), l24.get(),
                l25a.get(), l25b.get(), l25d.get(), l26.get(), l28.get(), l31.get(), l32.get(), l33.get(),
                l34.get(), l35a.get(), l37.get());
    }
}
