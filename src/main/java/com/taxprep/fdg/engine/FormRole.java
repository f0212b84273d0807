package com.taxprep.fdg.engine;

/** How a catalog entry takes part in the filing set. */
public enum FormRole {
    /** The one root form; always filed first. */
    ROOT,
    /** Filed when needed, together with its copies. */
    ATTACHMENT,
    /** Computed for other forms but never filed. */
    WORKSHEET
}
