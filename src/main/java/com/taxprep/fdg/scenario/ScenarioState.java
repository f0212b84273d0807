package com.taxprep.fdg.scenario;

/** Lifecycle of a scenario's cached result. */
public enum ScenarioState {
    /** Never calculated since creation. */
    DRAFT,
    /** A cached result matches the current modifications. */
    CALCULATED,
    /** Edited after the last calculation; no cached result. */
    STALE,
    /** Removed; terminal. */
    DELETED
}
