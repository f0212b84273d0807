package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.api.MultiOccurrenceForm;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.Business;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Schedule SE, Self-Employment Tax. Filed once for each spouse with net
 * earnings from self-employment of at least $400.
 */
public final class ScheduleSE extends AbstractFormNode implements MultiOccurrenceForm<ScheduleSE> {
    private ScheduleC scheduleC;
    private PersonRole role;
    private List<ScheduleSE> copies = List.of();

    private ScheduleSE(FormContext context, int copyIndex, PersonRole role, ScheduleC scheduleC) {
        super(context, FormTag.SCHEDULE_SE, 17, copyIndex);
        this.role = role;
        this.scheduleC = scheduleC;
    }

    public static ScheduleSE create(FormContext context, ScheduleC scheduleC) {
        List<PersonRole> owing = new ArrayList<>();
        for (PersonRole role : Filers.roles(context.info())) {
            double profit = context.info().businesses().stream()
                    .filter(b -> b.personRole() == role)
                    .mapToDouble(Business::netProfit)
                    .sum();
            if (netEarnings(profit) >= Federal2025.SE_MINIMUM_EARNINGS)
                owing.add(role);
        }
        ScheduleSE primary = new ScheduleSE(context, 0, owing.isEmpty() ? PersonRole.PRIMARY : owing.get(0),
                scheduleC);
        List<ScheduleSE> copies = new ArrayList<>();
        for (int i = 1; i < owing.size(); i++)
            copies.add(new ScheduleSE(context, i, owing.get(i), scheduleC));
        primary.copies = List.copyOf(copies);
        return primary;
    }

    private static double netEarnings(double profit) {
        return profit > 0 ? profit * Federal2025.SE_EARNINGS_FACTOR : profit;
    }

    private final Line<Double> l2 = line("l2", () -> this.scheduleC.netProfit(this.role));
    private final Line<Double> l3 = line("l3", l2::get);
    private final Line<Double> l4a = line("l4a", () -> netEarnings(l3.get()));
    private final Line<Double> l6 = line("l6", l4a::get);
    private final Line<Double> l7 = line("l7", () -> Federal2025.SOCIAL_SECURITY_WAGE_BASE);
    private final Line<Double> l8a = line("l8a", () -> info.w2s().stream()
            .filter(w -> Filers.belongsTo(w.personRole(), this.role))
            .mapToDouble(IncomeW2::ssWages)
            .sum());
    private final Line<Double> l9 = line("l9", () -> Math.max(0, l7.get() - l8a.get()));
    private final Line<Double> l10 = line("l10",
            () -> Math.min(l6.get(), l9.get()) * Federal2025.SOCIAL_SECURITY_RATE);
    private final Line<Double> l11 = line("l11", () -> l6.get() * Federal2025.MEDICARE_RATE);
    private final Line<Double> l12 = line("l12", () -> l10.get() + l11.get());
    private final Line<Double> l13 = line("l13", () -> l12.get() * 0.5);

    @Override
    protected boolean computeIsNeeded() {
        return l4a.get() >= Federal2025.SE_MINIMUM_EARNINGS;
    }

    @Override
    public List<ScheduleSE> copies() {
        return copies;
    }

    @Override
    public List<ScheduleSE> occurrences() {
        List<ScheduleSE> all = new ArrayList<>(copies.size() + 1);
        all.add(this);
        all.addAll(copies);
        return all;
    }

    public PersonRole personRole() {
        return role;
    }

    public double l6() {
        return l6.get();
    }

    public double l12() {
        return l12.get();
    }

    public double l13() {
        return l13.get();
    }

    public double totalTax() {
        return isNeeded() ? occurrences().stream().mapToDouble(ScheduleSE::l12).sum() : 0;
    }

    public double totalDeduction() {
        return isNeeded() ? occurrences().stream().mapToDouble(ScheduleSE::l13).sum() : 0;
    }

    public double totalNetEarnings() {
        return isNeeded() ? occurrences().stream().mapToDouble(ScheduleSE::l6).sum() : 0;
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.name(Filers.person(info, role)), Filers.ssn(Filers.person(info, role)),
                l2.get(), l3.get(), l4a.get(), l6.get(), l7.get(), l8a.get(), l9.get(),
                l10.get(), l11.get(), l12.get(), l13.get());
    }
}
