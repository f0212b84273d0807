package com.taxprep.fdg.api;

import java.util.List;

/**
 * Role of a form whose occurrences are driven by list-valued input, such as one
 * Schedule C per business.
 *
 * @param <T> concrete form type
 */
public interface MultiOccurrenceForm<T extends FormNode> extends FormNode {

    @Override
    List<T> copies();

    /** The primary instance followed by its copies. */
    List<T> occurrences();
}
