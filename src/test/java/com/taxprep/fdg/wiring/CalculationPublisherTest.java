package com.taxprep.fdg.wiring;

import com.taxprep.fdg.FormGraph;
import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.assembly.FieldTemplates;
import com.taxprep.fdg.scenario.Modification;
import com.taxprep.fdg.scenario.Scenario;
import com.taxprep.fdg.scenario.ScenarioCalculator;
import com.taxprep.fdg.scenario.ScenarioEngine;
import com.taxprep.fdg.scenario.ScenarioState;
import com.taxprep.fdg.scenario.TaxCalculationResult;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class CalculationPublisherTest {
    private ScenarioEngine engine;
    private CalculationPublisher publisher;

    @Before
    public void setUp() {
        engine = new ScenarioEngine(SampleReturns.singleFiler(50000, 5000),
                new ScenarioCalculator(FormGraph.builder(2025), FieldTemplates.load()));
        publisher = new CalculationPublisher(engine, 64);
    }

    @After
    public void tearDown() {
        publisher.close();
    }

    @Test
    public void testCalculatesThroughRingBuffer() throws Exception {
        Scenario s = engine.create("Raise", null);
        engine.addModification(s.id(), Modification.adjust("Raise", "w2s[0].income", 10000));

        TaxCalculationResult result = publisher.submit(s.id()).get(10, TimeUnit.SECONDS);
        assertEquals(60000.0, result.agi(), 0.0);
        assertEquals(ScenarioState.CALCULATED, engine.state(s.id()));
        assertSame(result, engine.cachedResult(s.id()).get());
    }

    @Test
    public void testBaselineRequest() throws Exception {
        TaxCalculationResult result = publisher.submit(ScenarioEngine.BASELINE_ID).get(10, TimeUnit.SECONDS);
        assertTrue(result.baseline());
        assertSame(engine.baseline(), result);
    }

    @Test
    public void testFailureCompletesExceptionallyAndConsumerSurvives() throws Exception {
        CompletableFuture<TaxCalculationResult> bad = publisher.submit("missing");
        try {
            bad.get(10, TimeUnit.SECONDS);
            fail("Expected failure");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }

        Scenario s = engine.create("After failure", null);
        assertEquals(50000.0, publisher.submit(s.id()).get(10, TimeUnit.SECONDS).agi(), 0.0);
    }

    @Test
    public void testManyProducers() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Scenario s = engine.create("S" + i, null);
            engine.addModification(s.id(), Modification.adjust("Raise", "w2s[0].income", 1000 * i));
            ids.add(s.id());
        }
        List<CompletableFuture<TaxCalculationResult>> futures = new ArrayList<>();
        List<Thread> threads = new ArrayList<>();
        for (String id : ids) {
            CompletableFuture<TaxCalculationResult> f = new CompletableFuture<>();
            futures.add(f);
            Thread t = new Thread(() -> publisher.submit(id).whenComplete((r, e) -> {
                if (e != null)
                    f.completeExceptionally(e);
                else
                    f.complete(r);
            }));
            threads.add(t);
            t.start();
        }
        for (Thread t : threads)
            t.join();
        for (int i = 0; i < ids.size(); i++)
            assertEquals(50000.0 + 1000 * i, futures.get(i).get(10, TimeUnit.SECONDS).agi(), 0.0);
        assertTrue(publisher.remainingCapacity() > 0);
    }
}
