package com.taxprep.fdg.scenario;

import java.util.EnumMap;
import java.util.Map;

import static com.taxprep.fdg.scenario.ScenarioState.DRAFT;
import static com.taxprep.fdg.scenario.ScenarioState.STALE;

/**
 * Everything that can happen to a scenario, with the single transition table
 * that drives its state and cache invalidation.
 */
public enum ScenarioEvent {
    MODIFICATION_ADDED(true),
    MODIFICATION_UPDATED(true),
    MODIFICATION_REMOVED(true),
    MODIFICATIONS_CLEARED(true),
    METADATA_UPDATED(true),
    CALCULATED(false),
    DELETED(true);

    private static final Map<ScenarioEvent, Map<ScenarioState, ScenarioState>> TABLE =
            new EnumMap<>(ScenarioEvent.class);

    static {
        Map<ScenarioState, ScenarioState> edit = new EnumMap<>(ScenarioState.class);
        edit.put(DRAFT, DRAFT);
        edit.put(ScenarioState.CALCULATED, STALE);
        edit.put(STALE, STALE);

        Map<ScenarioState, ScenarioState> calc = new EnumMap<>(ScenarioState.class);
        calc.put(DRAFT, ScenarioState.CALCULATED);
        calc.put(ScenarioState.CALCULATED, ScenarioState.CALCULATED);
        calc.put(STALE, ScenarioState.CALCULATED);

        Map<ScenarioState, ScenarioState> delete = new EnumMap<>(ScenarioState.class);
        delete.put(DRAFT, ScenarioState.DELETED);
        delete.put(ScenarioState.CALCULATED, ScenarioState.DELETED);
        delete.put(STALE, ScenarioState.DELETED);

        for (ScenarioEvent e : values()) {
            if (e == CALCULATED)
                TABLE.put(e, calc);
            else if (e == DELETED)
                TABLE.put(e, delete);
            else
                TABLE.put(e, edit);
        }
    }

    private final boolean invalidatesResult;

    ScenarioEvent(boolean invalidatesResult) {
        this.invalidatesResult = invalidatesResult;
    }

    /** True when the cached result must be dropped on this event. */
    public boolean invalidatesResult() {
        return invalidatesResult;
    }

    /**
     * @throws IllegalStateException if the event is not allowed in that state
     */
    public ScenarioState next(ScenarioState from) {
        ScenarioState to = TABLE.get(this).get(from);
        if (to == null)
            throw new IllegalStateException(this + " not allowed in state " + from);
        return to;
    }
}
