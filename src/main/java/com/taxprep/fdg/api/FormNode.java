package com.taxprep.fdg.api;

import java.util.List;
import java.util.Set;

/**
 * A node in the form dependency graph.
 *
 * <p>
 * A FormNode represents one form, schedule or worksheet computed from a single
 * {@code ValidatedInformation} snapshot. It exposes named lines that are
 * evaluated lazily and memoized for the lifetime of the instance. Sibling
 * forms are wired in by direct reference when the graph is built, never looked
 * up by name at evaluation time.
 *
 * <p>
 * Line values use {@code null} for "not applicable", which is distinct from a
 * computed zero.
 */
public interface FormNode {

    /** Stable form identifier. Copies share the tag of their primary instance. */
    FormTag tag();

    /**
     * Attachment sequence number used to order the filing set. It plays no part
     * in dependency resolution.
     */
    int sequenceIndex();

    /**
     * 0 for the primary instance, 1..N-1 for copies.
     */
    default int copyIndex() {
        return 0;
    }

    /**
     * Whether the form must be filed this year. Pure and idempotent.
     */
    boolean isNeeded();

    /**
     * Additional instances of this form driven by list-valued input. Only
     * consulted when the primary instance {@link #isNeeded() is needed}. Returns
     * the same instances on every call.
     */
    List<? extends FormNode> copies();

    /**
     * Values for positional mapping onto the form's fillable fields. The size and
     * order must match the form's field template exactly.
     */
    List<Object> fields();

    /** Names of the lines exposed for display, in declaration order. */
    Set<String> lineNames();

    /**
     * Evaluates a line by name for display purposes.
     *
     * @throws IllegalArgumentException if the form declares no such line
     */
    Object lineValue(String lineName);
}
