package com.taxprep.fdg.model;

public enum PersonRole {
    PRIMARY,
    SPOUSE,
    DEPENDENT
}
