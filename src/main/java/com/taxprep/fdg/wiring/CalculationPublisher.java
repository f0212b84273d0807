package com.taxprep.fdg.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.taxprep.fdg.scenario.ScenarioEngine;
import com.taxprep.fdg.scenario.TaxCalculationResult;

import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Funnels scenario calculation requests from any number of threads through a
 * ring buffer to one consumer thread.
 *
 * <p>
 * Each request gets a future. The consumer completes it with the result, or
 * exceptionally with whatever the calculation threw, and stays alive either
 * way.
 */
public final class CalculationPublisher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(CalculationPublisher.class);

    private final ScenarioEngine engine;
    private final Disruptor<CalculationEvent> disruptor;
    private final RingBuffer<CalculationEvent> ringBuffer;
    private long processed;

    /**
     * @param ringBufferSize slots in the ring buffer, a power of two
     */
    public CalculationPublisher(ScenarioEngine engine, int ringBufferSize) {
        this.engine = engine;
        this.disruptor = new Disruptor<>(
                CalculationEvent::new, ringBufferSize, DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI, new BlockingWaitStrategy());
        this.disruptor.handleEventsWith((event, sequence, endOfBatch) -> onEvent(event, sequence, endOfBatch));
        this.ringBuffer = disruptor.start();
        log.info("Calculation publisher started, ring buffer size {}", ringBufferSize);
    }

    /**
     * Queues a calculation. {@link ScenarioEngine#BASELINE_ID} requests the
     * baseline.
     */
    public CompletableFuture<TaxCalculationResult> submit(String scenarioId) {
        CompletableFuture<TaxCalculationResult> future = new CompletableFuture<>();
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).set(scenarioId, future, seq);
        } finally {
            ringBuffer.publish(seq);
        }
        return future;
    }

    void onEvent(CalculationEvent event, long sequence, boolean endOfBatch) {
        CompletableFuture<TaxCalculationResult> future = event.future();
        String id = event.scenarioId();
        try {
            TaxCalculationResult result = ScenarioEngine.BASELINE_ID.equals(id)
                    ? engine.baseline()
                    : engine.calculate(id);
            future.complete(result);
        } catch (Exception e) {
            log.error("Calculation of scenario {} failed: {}", id, e.getMessage(), e);
            future.completeExceptionally(e);
        } finally {
            event.clear();
            processed++;
        }
        if (endOfBatch)
            log.debug("Batch done at sequence {}, {} calculations so far", sequence, processed);
    }

    /** Free slots; a low number means calculations are backing up. */
    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    @Override
    public void close() {
        disruptor.shutdown();
        log.info("Calculation publisher stopped");
    }
}
