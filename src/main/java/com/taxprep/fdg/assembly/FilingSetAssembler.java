package com.taxprep.fdg.assembly;

import com.taxprep.fdg.api.BalanceDueSource;
import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.engine.ReturnGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

import lombok.extern.log4j.Log4j2;

/**
 * Turns a built return into its {@link FilingSet}.
 *
 * <p>
 * Only forms whose primary instance is needed contribute, together with all
 * of their copies. The root comes first; the rest are sorted by sequence
 * index with a stable sort, so forms sharing an index keep catalog order. The
 * trailer is appended after sorting, only when the root reports a positive
 * balance due.
 */
@Log4j2
public final class FilingSetAssembler {
    private static final Comparator<FormNode> BY_SEQUENCE = Comparator.comparingInt(FormNode::sequenceIndex);

    private FilingSetAssembler() {
        // Utility class
    }

    public static FilingSet assemble(ReturnGraph graph) {
        return assemble(graph.root(), graph.attachments(), graph.trailerFactory());
    }

    /**
     * @param root           root form, filed first
     * @param attachments    candidate attachments in catalog order
     * @param trailerFactory builds the trailer from the root; may be null
     */
    public static FilingSet assemble(FormNode root, List<? extends FormNode> attachments,
            Function<FormNode, ? extends FormNode> trailerFactory) {
        List<FormNode> filed = new ArrayList<>();
        for (FormNode form : attachments) {
            if (!form.isNeeded())
                continue;
            filed.add(form);
            filed.addAll(form.copies());
        }
        filed.sort(BY_SEQUENCE);

        List<FormNode> forms = new ArrayList<>(filed.size() + 2);
        forms.add(root);
        forms.addAll(filed);

        FormNode trailer = null;
        if (trailerFactory != null && root instanceof BalanceDueSource due && due.balanceDue() > 0) {
            trailer = trailerFactory.apply(root);
            forms.add(trailer);
        }
        FilingSet set = new FilingSet(forms, trailer);
        log.debug("Assembled {}", set);
        return set;
    }
}
