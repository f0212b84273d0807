package com.taxprep.fdg.scenario;

/** How a modification changes the value at its path. */
public enum ModificationType {
    /** Replace the value. */
    SET,
    /** Add a numeric delta to the current value. */
    ADJUST,
    /** Add an element to a list. */
    APPEND
}
