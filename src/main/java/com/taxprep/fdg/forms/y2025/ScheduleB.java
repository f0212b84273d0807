package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.Dividend1099;
import com.taxprep.fdg.model.Interest1099;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.Arrays;
import java.util.List;

/** Schedule B, Interest and Ordinary Dividends. */
public final class ScheduleB extends AbstractFormNode {

    public ScheduleB(FormContext context) {
        super(context, FormTag.SCHEDULE_B, 8);
    }

    private final Line<Double> l2 = line("l2",
            () -> info.f1099Ints().stream().mapToDouble(Interest1099::income).sum());

    // No excludable savings bond interest
    private final Line<Double> l4 = line("l4", l2::get);

    private final Line<Double> l6 = line("l6",
            () -> info.f1099Divs().stream().mapToDouble(Dividend1099::ordinaryDividends).sum());

    @Override
    protected boolean computeIsNeeded() {
        return l4.get() > Federal2025.SCHEDULE_B_THRESHOLD || l6.get() > Federal2025.SCHEDULE_B_THRESHOLD;
    }

    public double l4() {
        return l4.get();
    }

    public double l6() {
        return l6.get();
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(Filers.primaryName(info), Filers.primarySsn(info),
                l2.get(), null, l4.get(), l6.get());
    }
}
