package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.api.MultiOccurrenceForm;
import com.taxprep.fdg.model.Business;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Schedule C, Profit or Loss From Business. One instance per business: the
 * first business is the primary instance and each further business a copy.
 */
public final class ScheduleC extends AbstractFormNode implements MultiOccurrenceForm<ScheduleC> {
    private Business business;
    private List<ScheduleC> copies = List.of();

    private ScheduleC(FormContext context, int copyIndex, Business business) {
        super(context, FormTag.SCHEDULE_C, 9, copyIndex);
        this.business = business;
    }

    public static ScheduleC create(FormContext context) {
        List<Business> businesses = context.info().businesses();
        ScheduleC primary = new ScheduleC(context, 0, businesses.isEmpty() ? null : businesses.get(0));
        List<ScheduleC> copies = new ArrayList<>();
        for (int i = 1; i < businesses.size(); i++)
            copies.add(new ScheduleC(context, i, businesses.get(i)));
        primary.copies = List.copyOf(copies);
        return primary;
    }

    private final Line<Double> l1 = line("l1", () -> this.business == null ? 0 : this.business.grossReceipts());
    private final Line<Double> l2 = line("l2",
            () -> this.business == null ? 0 : this.business.returnsAndAllowances());
    private final Line<Double> l3 = line("l3", () -> l1.get() - l2.get());
    private final Line<Double> l4 = line("l4", () -> this.business == null ? 0 : this.business.costOfGoodsSold());
    private final Line<Double> l5 = line("l5", () -> l3.get() - l4.get());
    private final Line<Double> l7 = line("l7", l5::get);
    private final Line<Double> l28 = line("l28", () -> this.business == null ? 0 : this.business.totalExpenses());
    private final Line<Double> l31 = line("l31", () -> l7.get() - l28.get());

    @Override
    protected boolean computeIsNeeded() {
        return business != null;
    }

    @Override
    public List<ScheduleC> copies() {
        return copies;
    }

    @Override
    public List<ScheduleC> occurrences() {
        List<ScheduleC> all = new ArrayList<>(copies.size() + 1);
        all.add(this);
        all.addAll(copies);
        return all;
    }

    public PersonRole personRole() {
        return business == null ? PersonRole.PRIMARY : business.personRole();
    }

    public double l31() {
        return l31.get();
    }

    /** Net profit of every business, across all occurrences. */
    public double totalNetProfit() {
        if (!isNeeded())
            return 0;
        return occurrences().stream().mapToDouble(ScheduleC::l31).sum();
    }

    /** Net profit of the businesses owned by one person. */
    public double netProfit(PersonRole role) {
        if (!isNeeded())
            return 0;
        return occurrences().stream()
                .filter(c -> c.personRole() == role)
                .mapToDouble(ScheduleC::l31)
                .sum();
    }

    @Override
    public List<Object> fields() {
        String proprietor = Filers.name(Filers.person(info, personRole()));
        String ssn = Filers.ssn(Filers.person(info, personRole()));
        return Arrays.asList(proprietor, ssn,
                business == null ? null : business.name(),
                business == null ? null : business.principalBusinessCode(),
                business == null ? null : business.ein(),
                l1.get(), l2.get(), l3.get(), l4.get(), l5.get(), l7.get(), l28.get(), l31.get());
    }
}
