package com.taxprep.fdg.api;

/**
 * Raised when the declared catalog contains a cycle, or when a line re-enters
 * itself (directly or through siblings) during evaluation.
 */
public class CyclicDependencyException extends GraphDefectException {

    public CyclicDependencyException(String message) {
        super(message);
    }
}
