package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.api.MultiOccurrenceForm;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.CoverageType;
import com.taxprep.fdg.model.HealthSavingsAccount;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Form 8889, Health Savings Accounts. One instance per account holder.
 */
public final class F8889 extends AbstractFormNode implements MultiOccurrenceForm<F8889> {
    private PersonRole role;
    private List<HealthSavingsAccount> accounts;
    private List<F8889> copies = List.of();

    private F8889(FormContext context, int copyIndex, PersonRole role, List<HealthSavingsAccount> accounts) {
        super(context, FormTag.F8889, 52, copyIndex);
        this.role = role;
        this.accounts = accounts;
    }

    public static F8889 create(FormContext context) {
        List<F8889> holders = new ArrayList<>();
        for (PersonRole role : List.of(PersonRole.PRIMARY, PersonRole.SPOUSE)) {
            List<HealthSavingsAccount> owned = context.info().healthSavingsAccounts().stream()
                    .filter(h -> h.personRole() == role)
                    .toList();
            if (!owned.isEmpty())
                holders.add(new F8889(context, holders.size(), role, owned));
        }
        if (holders.isEmpty())
            return new F8889(context, 0, PersonRole.PRIMARY, List.of());
        F8889 primary = holders.get(0);
        primary.copies = List.copyOf(holders.subList(1, holders.size()));
        return primary;
    }

    private final Line<Boolean> family = line("l1", () -> this.accounts.stream()
            .anyMatch(h -> h.coverageType() == CoverageType.FAMILY));

    private final Line<Double> l2 = line("l2",
            () -> this.accounts.stream().mapToDouble(HealthSavingsAccount::contributions).sum());

    private final Line<Double> l3 = line("l3", () -> {
        double limit = family.get() ? Federal2025.HSA_LIMIT_FAMILY : Federal2025.HSA_LIMIT_SELF_ONLY;
        if (Filers.age(Filers.person(info, this.role), info.taxYear()) >= Federal2025.HSA_CATCH_UP_AGE)
            limit += Federal2025.HSA_CATCH_UP;
        return limit;
    });

    // Employer contributions reported in W-2 box 12 code W
    private final Line<Double> l9 = line("l9", () -> info.w2s().stream()
            .filter(w -> Filers.belongsTo(w.personRole(), this.role))
            .mapToDouble(IncomeW2::box12W)
            .sum());

    private final Line<Double> l11 = line("l11", l9::get);
    private final Line<Double> l12 = line("l12", () -> Math.max(0, l3.get() - l11.get()));
    private final Line<Double> l13 = line("l13", () -> Math.min(l2.get(), l12.get()));

    private final Line<Double> l14a = line("l14a",
            () -> this.accounts.stream().mapToDouble(HealthSavingsAccount::totalDistributions).sum());
    private final Line<Double> l15 = line("l15",
            () -> this.accounts.stream().mapToDouble(HealthSavingsAccount::qualifiedDistributions).sum());
    private final Line<Double> l16 = line("l16", () -> Math.max(0, l14a.get() - l15.get()));
    private final Line<Double> l17b = line("l17b", () -> l16.get() * Federal2025.HSA_ADDITIONAL_TAX_RATE);

    @Override
    protected boolean computeIsNeeded() {
        return !accounts.isEmpty();
    }

    @Override
    public List<F8889> copies() {
        return copies;
    }

    @Override
    public List<F8889> occurrences() {
        List<F8889> all = new ArrayList<>(copies.size() + 1);
        all.add(this);
        all.addAll(copies);
        return all;
    }

    public PersonRole personRole() {
        return role;
    }

    public double l13() {
        return l13.get();
    }

    public double l16() {
        return l16.get();
    }

    public double l17b() {
        return l17b.get();
    }

    public double totalDeduction() {
        return isNeeded() ? occurrences().stream().mapToDouble(F8889::l13).sum() : 0;
    }

    public double totalTaxableDistributions() {
        return isNeeded() ? occurrences().stream().mapToDouble(F8889::l16).sum() : 0;
    }

    public double totalAdditionalTax() {
        return isNeeded() ? occurrences().stream().mapToDouble(F8889::l17b).sum() : 0;
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.name(Filers.person(info, role)), Filers.ssn(Filers.person(info, role)),
                !family.get(), family.get(), l2.get(), l3.get(), l9.get(), l11.get(), l12.get(), l13.get(),
                l14a.get(), l14a.get(), l15.get(), l16.get(), l17b.get());
    }
}
