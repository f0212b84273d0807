package com.taxprep.fdg.model;

/** Federal filing status. */
public enum FilingStatus {
    /** Single. */
    S,
    /** Married filing jointly. */
    MFJ,
    /** Married filing separately. */
    MFS,
    /** Head of household. */
    HOH,
    /** Qualifying surviving spouse. */
    W;

    public boolean isJoint() {
        return this == MFJ || this == W;
    }
}
