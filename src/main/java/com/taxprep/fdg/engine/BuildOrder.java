package com.taxprep.fdg.engine;

import com.taxprep.fdg.api.CyclicDependencyException;
import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.MissingDependencyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import lombok.extern.log4j.Log4j2;

/**
 * Construction order of a {@link FormCatalog}: every form appears after all of
 * the forms it declares as dependencies.
 *
 * <p>
 * Computed with Kahn's algorithm. Among forms that are ready at the same time
 * the one declared first in the catalog is built first, so the order is a pure
 * function of the catalog.
 */
@Log4j2
public final class BuildOrder {
    private final List<FormDefinition<?>> order;
    private final int[] parentCount;
    private final int[] childCount;

    private BuildOrder(List<FormDefinition<?>> order, int[] parentCount, int[] childCount) {
        this.order = Collections.unmodifiableList(order);
        this.parentCount = parentCount;
        this.childCount = childCount;
    }

    public List<FormDefinition<?>> definitions() {
        return order;
    }

    public int size() {
        return order.size();
    }

    public FormDefinition<?> definition(int i) {
        return order.get(i);
    }

    /** Number of declared dependencies of the i-th form. */
    public int parentCount(int i) {
        return parentCount[i];
    }

    /** Number of forms that declare the i-th form as a dependency. */
    public int childCount(int i) {
        return childCount[i];
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(order.size());
        for (FormDefinition<?> d : order)
            names.add(d.name());
        return names;
    }

    /**
     * @throws MissingDependencyException if a form depends on a type the catalog
     *                                    does not declare
     * @throws CyclicDependencyException  if the declared dependencies form a
     *                                    cycle
     */
    public static BuildOrder of(FormCatalog catalog) {
        List<FormDefinition<?>> defs = catalog.definitions();
        int n = defs.size();
        Map<Class<?>, Integer> index = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++)
            index.put(defs.get(i).type(), i);

        // 1. Forward edges (dependency -> dependent) and in-degrees
        List<List<Integer>> forwardEdges = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            forwardEdges.add(new ArrayList<>());
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) {
            for (Class<? extends FormNode> dep : defs.get(i).dependsOn()) {
                Integer from = index.get(dep);
                if (from == null)
                    throw new MissingDependencyException(defs.get(i).name() + " depends on "
                            + dep.getSimpleName() + ", which the catalog does not declare");
                forwardEdges.get(from).add(i);
                inDegree[i]++;
            }
        }
        int[] parents = inDegree.clone();

        // 2. Ready queue, lowest declaration index first
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                ready.add(i);

        // 3. Kahn's algorithm
        List<FormDefinition<?>> ordered = new ArrayList<>(n);
        int[] orderedParents = new int[n];
        int[] orderedChildren = new int[n];
        while (!ready.isEmpty()) {
            int curr = ready.poll();
            orderedParents[ordered.size()] = parents[curr];
            orderedChildren[ordered.size()] = forwardEdges.get(curr).size();
            ordered.add(defs.get(curr));
            for (int child : forwardEdges.get(curr))
                if (--inDegree[child] == 0)
                    ready.add(child);
        }
        if (ordered.size() != n) {
            List<String> stuck = new ArrayList<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] > 0)
                    stuck.add(defs.get(i).name());
            throw new CyclicDependencyException("Cycle detected! Ordered " + ordered.size() + " of " + n
                    + " forms; unresolved: " + stuck);
        }
        log.debug("Build order: {}", ordered.stream().map(FormDefinition::name).toList());
        return new BuildOrder(ordered, orderedParents, orderedChildren);
    }
}
