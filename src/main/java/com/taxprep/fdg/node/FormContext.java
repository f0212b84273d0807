package com.taxprep.fdg.node;

import com.taxprep.fdg.api.CyclicDependencyException;
import com.taxprep.fdg.api.EvaluationListener;
import com.taxprep.fdg.model.ValidatedInformation;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * State shared by every node of one return graph: the input snapshot, the
 * evaluation listener and the recursion guard.
 *
 * <p>
 * Not thread-safe. A graph is evaluated on one thread at a time.
 */
public final class FormContext {
    public static final int DEFAULT_MAX_DEPTH = 256;

    private final ValidatedInformation info;
    private final EvaluationListener listener;
    private final int maxDepth;

    // Lines currently being evaluated, innermost last. Used for the cycle report.
    private final Deque<String> evaluating = new ArrayDeque<>();

    public FormContext(ValidatedInformation info, EvaluationListener listener, int maxDepth) {
        if (info == null)
            throw new IllegalArgumentException("info must not be null");
        if (maxDepth < 1)
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.info = info;
        this.listener = listener == null ? EvaluationListener.NONE : listener;
        this.maxDepth = maxDepth;
    }

    public static FormContext of(ValidatedInformation info) {
        return new FormContext(info, EvaluationListener.NONE, DEFAULT_MAX_DEPTH);
    }

    public ValidatedInformation info() {
        return info;
    }

    public EvaluationListener listener() {
        return listener;
    }

    void enter(String qualifiedLine) {
        if (evaluating.size() >= maxDepth) {
            throw new CyclicDependencyException("Evaluation depth exceeded " + maxDepth + " at " + qualifiedLine
                    + ", probable cycle through " + evaluating.peekLast());
        }
        evaluating.addLast(qualifiedLine);
    }

    void exit() {
        evaluating.pollLast();
    }

    String evaluationPath(String closing) {
        StringBuilder sb = new StringBuilder();
        boolean inCycle = false;
        for (String line : evaluating) {
            if (line.equals(closing))
                inCycle = true;
            if (inCycle)
                sb.append(line).append(" -> ");
        }
        return sb.append(closing).toString();
    }
}
