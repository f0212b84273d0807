package com.taxprep.fdg.scenario;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded set of scenario ids chosen for side-by-side comparison. When full,
 * selecting another id evicts the one selected first.
 */
public final class ScenarioSelection {
    public static final int DEFAULT_LIMIT = 3;

    private final int limit;
    private final Deque<String> selected = new ArrayDeque<>();

    public ScenarioSelection() {
        this(DEFAULT_LIMIT);
    }

    public ScenarioSelection(int limit) {
        if (limit < 1)
            throw new IllegalArgumentException("Selection limit must be positive: " + limit);
        this.limit = limit;
    }

    /**
     * Selects an id. Selecting an id that is already selected changes nothing.
     *
     * @return the evicted id, or null
     */
    public synchronized String select(String id) {
        if (selected.contains(id))
            return null;
        selected.addLast(id);
        return selected.size() > limit ? selected.pollFirst() : null;
    }

    public synchronized boolean deselect(String id) {
        return selected.remove(id);
    }

    public synchronized boolean contains(String id) {
        return selected.contains(id);
    }

    /** Selected ids, oldest first. */
    public synchronized List<String> selected() {
        return List.copyOf(selected);
    }

    public synchronized void clear() {
        selected.clear();
    }

    public int limit() {
        return limit;
    }
}
