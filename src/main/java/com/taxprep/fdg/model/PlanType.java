package com.taxprep.fdg.model;

/** Plan type reported on a 1099-R. */
public enum PlanType {
    IRA,
    PENSION
}
