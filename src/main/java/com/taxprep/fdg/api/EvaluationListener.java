package com.taxprep.fdg.api;

/**
 * Observability hook for line evaluation.
 *
 * <p>
 * Called synchronously on the evaluating thread, once per memo cell when the
 * cell is first computed. Implementations must stay lightweight.
 */
public interface EvaluationListener {

    EvaluationListener NONE = new EvaluationListener() {
        @Override
        public void onLineEvaluated(FormTag tag, int copyIndex, String line, Object value, long durationNanos) {
        }
    };

    /**
     * @param tag           form that owns the line
     * @param copyIndex     copy index of the owning instance
     * @param line          line name
     * @param value         computed value, null when not applicable
     * @param durationNanos wall time including nested sibling evaluations
     */
    void onLineEvaluated(FormTag tag, int copyIndex, String line, Object value, long durationNanos);

    /** Called when a line fails with a defect before the error propagates. */
    default void onLineError(FormTag tag, int copyIndex, String line, Throwable error) {
    }
}
