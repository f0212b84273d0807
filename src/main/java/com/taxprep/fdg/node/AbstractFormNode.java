package com.taxprep.fdg.node;

import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.model.ValidatedInformation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Base class for forms, schedules and worksheets.
 *
 * <p>
 * Subclasses declare their lines as fields built with {@link #line}, and
 * expose typed accessors over them. Field initializers run before the
 * constructor body, so a line reads constructor-assigned siblings through
 * {@code this}:
 *
 * <pre>
 * private final Line&lt;Double&gt; l4 = line("l4", () -&gt; this.income.agi());
 *
 * public double l4() {
 *     return l4.get();
 * }
 * </pre>
 *
 * Sibling forms are constructor arguments. The {@link #isNeeded()} predicate is
 * memoized like any other line.
 */
public abstract class AbstractFormNode implements FormNode {
    private final FormContext context;
    private final FormTag tag;
    private final int sequenceIndex;
    private final int copyIndex;

    private final Map<String, Line<?>> lines = new LinkedHashMap<>();
    private final Line<Boolean> needed;

    protected final ValidatedInformation info;

    protected AbstractFormNode(FormContext context, FormTag tag, int sequenceIndex) {
        this(context, tag, sequenceIndex, 0);
    }

    protected AbstractFormNode(FormContext context, FormTag tag, int sequenceIndex, int copyIndex) {
        if (copyIndex < 0)
            throw new IllegalArgumentException("copyIndex must not be negative: " + copyIndex);
        this.context = context;
        this.tag = tag;
        this.sequenceIndex = sequenceIndex;
        this.copyIndex = copyIndex;
        this.info = context.info();
        this.needed = new Line<>(this, "isNeeded", this::computeIsNeeded);
    }

    /** Declares a named, memoized line visible through {@link #lineValue}. */
    protected final <T> Line<T> line(String name, Supplier<T> fn) {
        Line<T> line = new Line<>(this, name, fn);
        if (lines.putIfAbsent(name, line) != null)
            throw new IllegalStateException("Duplicate line " + name + " on " + tag.id());
        return line;
    }

    /** Declares a memoized helper value that is not exposed as a line. */
    protected final <T> Line<T> memo(String name, Supplier<T> fn) {
        return new Line<>(this, name, fn);
    }

    /** Inclusion predicate; the default includes the form unconditionally. */
    protected boolean computeIsNeeded() {
        return true;
    }

    protected final FormContext context() {
        return context;
    }

    @Override
    public final FormTag tag() {
        return tag;
    }

    @Override
    public final int sequenceIndex() {
        return sequenceIndex;
    }

    @Override
    public final int copyIndex() {
        return copyIndex;
    }

    @Override
    public final boolean isNeeded() {
        return needed.get();
    }

    @Override
    public List<? extends FormNode> copies() {
        return List.of();
    }

    @Override
    public final Set<String> lineNames() {
        return Collections.unmodifiableSet(lines.keySet());
    }

    @Override
    public final Object lineValue(String lineName) {
        Line<?> line = lines.get(lineName);
        if (line == null)
            throw new IllegalArgumentException("Unknown line " + lineName + " on " + tag.id());
        return line.get();
    }

    @Override
    public String toString() {
        return tag.id() + (copyIndex > 0 ? "#" + copyIndex : "");
    }
}
