package com.taxprep.fdg.api;

/**
 * A programming defect in the form graph. Never recovered: a graph that raised
 * one must be discarded.
 */
public class GraphDefectException extends IllegalStateException {

    public GraphDefectException(String message) {
        super(message);
    }

    public GraphDefectException(String message, Throwable cause) {
        super(message, cause);
    }
}
