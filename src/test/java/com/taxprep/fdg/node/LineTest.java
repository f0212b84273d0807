package com.taxprep.fdg.node;

import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.api.CyclicDependencyException;
import com.taxprep.fdg.api.EvaluationListener;
import com.taxprep.fdg.api.FormTag;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class LineTest {

    private static final class Probe extends AbstractFormNode {
        int calls;
        boolean fail = true;

        Probe(FormContext context) {
            super(context, FormTag.WORKSHEET_INCOME, 0);
        }

        final Line<Double> a = line("a", () -> {
            calls++;
            return 2.0;
        });
        final Line<Double> b = line("b", () -> a.get() * 3);
        final Line<Double> absent = line("absent", () -> null);
        final Line<Double> flaky = line("flaky", () -> {
            if (fail)
                throw new IllegalStateException("not yet");
            return 1.0;
        });

        // x -> y -> x
        final Line<Double> x = line("x", () -> this.y.get() + 1);
        final Line<Double> y = line("y", () -> x.get() + 1);

        final Line<Double> c1 = line("c1", () -> 1.0);
        final Line<Double> c2 = line("c2", () -> c1.get() + 1);
        final Line<Double> c3 = line("c3", () -> c2.get() + 1);

        @Override
        public List<Object> fields() {
            return List.of();
        }
    }

    private static FormContext context() {
        return FormContext.of(SampleReturns.singleFiler(50000, 0));
    }

    @Test
    public void testMemoIdempotence() {
        Probe p = new Probe(context());
        assertFalse(p.a.isEvaluated());
        assertEquals(6.0, p.b.get(), 0.0);
        assertEquals(6.0, p.b.get(), 0.0);
        assertEquals(2.0, p.a.get(), 0.0);
        assertEquals(1, p.calls);
        assertTrue(p.a.isEvaluated());
    }

    @Test
    public void testNullIsMemoizedAsNotApplicable() {
        Probe p = new Probe(context());
        assertNull(p.absent.get());
        assertTrue(p.absent.isEvaluated());
        assertNull(p.lineValue("absent"));
    }

    @Test
    public void testCycleDetected() {
        Probe p = new Probe(context());
        try {
            p.x.get();
            fail("Expected CyclicDependencyException");
        } catch (CyclicDependencyException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("ws-income.x -> ws-income.y -> ws-income.x"));
        }
    }

    @Test
    public void testDepthGuard() {
        Probe p = new Probe(new FormContext(SampleReturns.singleFiler(1, 0), EvaluationListener.NONE, 2));
        assertEquals(2.0, p.c2.get(), 0.0);
        Probe deep = new Probe(new FormContext(SampleReturns.singleFiler(1, 0), EvaluationListener.NONE, 2));
        try {
            deep.c3.get();
            fail("Expected depth guard to trip");
        } catch (CyclicDependencyException e) {
            assertTrue(e.getMessage().contains("depth exceeded 2"));
        }
    }

    @Test
    public void testFailureLeavesLineRetryable() {
        List<String> errors = new ArrayList<>();
        EvaluationListener listener = new EvaluationListener() {
            @Override
            public void onLineEvaluated(FormTag tag, int copyIndex, String line, Object value, long durationNanos) {
            }

            @Override
            public void onLineError(FormTag tag, int copyIndex, String line, Throwable error) {
                errors.add(line);
            }
        };
        Probe p = new Probe(new FormContext(SampleReturns.singleFiler(1, 0), listener, 16));
        try {
            p.flaky.get();
            fail("Expected failure");
        } catch (IllegalStateException expected) {
            // retried below
        }
        assertFalse(p.flaky.isEvaluated());
        assertEquals(List.of("flaky"), errors);
        p.fail = false;
        assertEquals(1.0, p.flaky.get(), 0.0);
    }

    @Test
    public void testListenerSeesEachLineOnce() {
        List<String> seen = new ArrayList<>();
        EvaluationListener listener = (tag, copyIndex, line, value, durationNanos) -> seen.add(tag.id() + "." + line);
        Probe p = new Probe(new FormContext(SampleReturns.singleFiler(1, 0), listener, 16));
        p.b.get();
        p.b.get();
        assertEquals(List.of("ws-income.a", "ws-income.b"), seen);
    }

    @Test
    public void testLineNamesInDeclarationOrder() {
        Probe p = new Probe(context());
        assertEquals(List.of("a", "b", "absent", "flaky", "x", "y", "c1", "c2", "c3"), new ArrayList<>(p.lineNames()));
        try {
            p.lineValue("nope");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("nope"));
        }
    }
}
