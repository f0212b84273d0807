package com.taxprep.fdg.node;

import com.taxprep.fdg.api.CyclicDependencyException;
import com.taxprep.fdg.api.EvaluationListener;

import java.util.function.Supplier;

/**
 * Write-once memo cell for one computed line.
 *
 * <p>
 * The supplier runs at most once per cell. Its result, including {@code null}
 * for "not applicable", is kept for the lifetime of the owning node. A cell
 * that is asked for its value while it is still computing that value is part of
 * a dependency cycle and fails with {@link CyclicDependencyException}.
 *
 * @param <T> line value type
 */
public final class Line<T> implements Supplier<T> {
    private enum State {
        PENDING, EVALUATING, DONE
    }

    private final AbstractFormNode owner;
    private final String name;
    private final Supplier<T> fn;

    private State state = State.PENDING;
    private T value;

    Line(AbstractFormNode owner, String name, Supplier<T> fn) {
        this.owner = owner;
        this.name = name;
        this.fn = fn;
    }

    public String name() {
        return name;
    }

    public boolean isEvaluated() {
        return state == State.DONE;
    }

    @Override
    public T get() {
        if (state == State.DONE)
            return value;

        FormContext ctx = owner.context();
        String qualified = qualifiedName();
        if (state == State.EVALUATING)
            throw new CyclicDependencyException("Cycle detected: " + ctx.evaluationPath(qualified));

        EvaluationListener l = ctx.listener();
        ctx.enter(qualified);
        state = State.EVALUATING;
        long start = System.nanoTime();
        try {
            T v = fn.get();
            value = v;
            state = State.DONE;
            l.onLineEvaluated(owner.tag(), owner.copyIndex(), name, v, System.nanoTime() - start);
            return v;
        } catch (RuntimeException e) {
            state = State.PENDING;
            l.onLineError(owner.tag(), owner.copyIndex(), name, e);
            throw e;
        } finally {
            ctx.exit();
        }
    }

    String qualifiedName() {
        return owner.tag().id() + (owner.copyIndex() > 0 ? "#" + owner.copyIndex() : "") + "." + name;
    }

    @Override
    public String toString() {
        return qualifiedName() + (state == State.DONE ? "=" + value : " (" + state + ")");
    }
}
