package com.taxprep.fdg.model;

/** HDHP coverage type used for the HSA contribution limit. */
public enum CoverageType {
    SELF_ONLY,
    FAMILY
}
