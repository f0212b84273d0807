package com.taxprep.fdg.api;

/**
 * A form asked for a sibling that was never declared as its dependency or has
 * not been constructed yet.
 */
public class MissingDependencyException extends GraphDefectException {

    public MissingDependencyException(String message) {
        super(message);
    }
}
