package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.model.Person;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.Arrays;
import java.util.List;

/** Form 1040-V, Payment Voucher. Filed last, only with a balance due. */
public final class F1040V extends AbstractFormNode {
    private F1040 f1040;

    F1040V(FormContext context, F1040 f1040) {
        super(context, FormTag.F1040V, Integer.MAX_VALUE);
        this.f1040 = f1040;
    }

    private final Line<Double> amount = line("amount", () -> this.f1040.balanceDue());

    @Override
    protected boolean computeIsNeeded() {
        return amount.get() > 0;
    }

    @Override
    public List<Object> fields() {
        Person primary = info.taxPayer().primaryPerson();
        Person spouse = info.taxPayer().spouse();
        return Arrays.asList(Filers.ssn(primary), spouse == null ? null : Filers.ssn(spouse), amount.get(),
                Filers.name(primary), spouse == null ? null : Filers.name(spouse));
    }
}
