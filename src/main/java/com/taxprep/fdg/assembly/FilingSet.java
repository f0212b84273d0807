package com.taxprep.fdg.assembly;

import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.FormTag;

import java.util.List;

/**
 * Ordered forms to file: the root first, then needed attachments with their
 * copies by sequence index, then the trailer when there is one.
 */
public final class FilingSet {
    private final List<FormNode> forms;
    private final FormNode trailer;

    FilingSet(List<FormNode> forms, FormNode trailer) {
        this.forms = List.copyOf(forms);
        this.trailer = trailer;
    }

    public List<FormNode> forms() {
        return forms;
    }

    public FormNode root() {
        return forms.get(0);
    }

    /** The trailer, or null when none was appended. */
    public FormNode trailer() {
        return trailer;
    }

    public boolean hasTrailer() {
        return trailer != null;
    }

    public int size() {
        return forms.size();
    }

    /** Tags in filing order; copies repeat their tag. */
    public List<FormTag> tags() {
        return forms.stream().map(FormNode::tag).toList();
    }

    /** Tag ids in filing order, with a {@code #n} suffix for copies. */
    public List<String> formIds() {
        return forms.stream().map(f -> f.tag().id() + (f.copyIndex() > 0 ? "#" + f.copyIndex() : "")).toList();
    }

    public boolean contains(FormTag tag) {
        return forms.stream().anyMatch(f -> f.tag() == tag);
    }

    public long count(FormTag tag) {
        return forms.stream().filter(f -> f.tag() == tag).count();
    }

    @Override
    public String toString() {
        return "FilingSet" + formIds();
    }
}
