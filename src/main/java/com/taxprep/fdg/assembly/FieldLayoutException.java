package com.taxprep.fdg.assembly;

import com.taxprep.fdg.api.GraphDefectException;

/** A form produced a field array that does not match its template. */
public class FieldLayoutException extends GraphDefectException {

    public FieldLayoutException(String message) {
        super(message);
    }

    public FieldLayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
