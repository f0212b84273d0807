package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.api.MultiOccurrenceForm;
import com.taxprep.fdg.model.RentalProperty;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Schedule E, Supplemental Income and Loss, Part I. Each page holds three
 * properties; a return with more properties files one copy per extra page.
 */
public final class ScheduleE extends AbstractFormNode implements MultiOccurrenceForm<ScheduleE> {
    public static final int PROPERTIES_PER_PAGE = 3;

    private List<RentalProperty> properties;
    private List<ScheduleE> copies = List.of();

    private ScheduleE(FormContext context, int copyIndex, List<RentalProperty> properties) {
        super(context, FormTag.SCHEDULE_E, 13, copyIndex);
        this.properties = List.copyOf(properties);
    }

    public static ScheduleE create(FormContext context) {
        List<RentalProperty> all = context.info().realEstate();
        int pages = Math.max(1, (all.size() + PROPERTIES_PER_PAGE - 1) / PROPERTIES_PER_PAGE);
        ScheduleE primary = new ScheduleE(context, 0, page(all, 0));
        List<ScheduleE> copies = new ArrayList<>();
        for (int p = 1; p < pages; p++)
            copies.add(new ScheduleE(context, p, page(all, p)));
        primary.copies = List.copyOf(copies);
        return primary;
    }

    private static List<RentalProperty> page(List<RentalProperty> all, int page) {
        int from = page * PROPERTIES_PER_PAGE;
        return all.subList(Math.min(from, all.size()), Math.min(from + PROPERTIES_PER_PAGE, all.size()));
    }

    private final Line<Double> l23a = line("l23a",
            () -> this.properties.stream().mapToDouble(RentalProperty::rentsReceived).sum());

    private final Line<Double> l24 = line("l24",
            () -> this.properties.stream().mapToDouble(RentalProperty::netIncome).filter(v -> v > 0).sum());

    private final Line<Double> l25 = line("l25",
            () -> this.properties.stream().mapToDouble(RentalProperty::netIncome).filter(v -> v < 0).sum());

    private final Line<Double> l26 = line("l26", () -> l24.get() + l25.get());

    @Override
    protected boolean computeIsNeeded() {
        return !properties.isEmpty();
    }

    @Override
    public List<ScheduleE> copies() {
        return copies;
    }

    @Override
    public List<ScheduleE> occurrences() {
        List<ScheduleE> all = new ArrayList<>(copies.size() + 1);
        all.add(this);
        all.addAll(copies);
        return all;
    }

    public List<RentalProperty> properties() {
        return properties;
    }

    public double l26() {
        return l26.get();
    }

    /** Rental income or loss of every page. */
    public double totalIncome() {
        return occurrences().stream().mapToDouble(ScheduleE::l26).sum();
    }

    @Override
    public List<Object> fields() {
        List<Object> fields = new ArrayList<>(Arrays.asList(Filers.primaryName(info), Filers.primarySsn(info)));
        for (int i = 0; i < PROPERTIES_PER_PAGE; i++) {
            RentalProperty p = i < properties.size() ? properties.get(i) : null;
            fields.add(p == null ? null : p.address());
            fields.add(p == null ? null : p.rentsReceived());
            fields.add(p == null ? null : p.totalExpenses());
            fields.add(p == null ? null : p.depreciation());
            fields.add(p == null ? null : p.netIncome());
        }
        fields.addAll(Arrays.asList(l23a.get(), l24.get(), l25.get(), l26.get()));
        return fields;
    }
}
