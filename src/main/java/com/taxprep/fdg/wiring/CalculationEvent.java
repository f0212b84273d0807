package com.taxprep.fdg.wiring;

import com.taxprep.fdg.scenario.TaxCalculationResult;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable ring buffer slot carrying one calculation request.
 *
 * <p>
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every request; the consumer clears the slot once the request is answered.
 */
public final class CalculationEvent {
    private String scenarioId;
    private CompletableFuture<TaxCalculationResult> future;
    private long sequenceId;

    public void set(String scenarioId, CompletableFuture<TaxCalculationResult> future, long seqId) {
        this.scenarioId = scenarioId;
        this.future = future;
        this.sequenceId = seqId;
    }

    public String scenarioId() {
        return scenarioId;
    }

    public CompletableFuture<TaxCalculationResult> future() {
        return future;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        scenarioId = null;
        future = null;
        sequenceId = 0;
    }
}
