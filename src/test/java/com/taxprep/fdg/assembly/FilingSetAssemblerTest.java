package com.taxprep.fdg.assembly;

import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.api.BalanceDueSource;
import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import org.junit.Test;

import java.util.List;
import java.util.function.Function;

import static org.junit.Assert.*;

public class FilingSetAssemblerTest {
    private static final FormContext CTX = FormContext.of(SampleReturns.singleFiler(1, 0));

    private static class Stub extends AbstractFormNode {
        private final boolean needed;
        private final List<Stub> copies;

        Stub(FormTag tag, int sequence, int copyIndex, boolean needed, List<Stub> copies) {
            super(CTX, tag, sequence, copyIndex);
            this.needed = needed;
            this.copies = copies;
        }

        Stub(FormTag tag, int sequence, boolean needed) {
            this(tag, sequence, 0, needed, List.of());
        }

        @Override
        protected boolean computeIsNeeded() {
            return needed;
        }

        @Override
        public List<Stub> copies() {
            return copies;
        }

        @Override
        public List<Object> fields() {
            return List.of();
        }
    }

    private static final class RootStub extends Stub implements BalanceDueSource {
        private final double due;

        RootStub(double due) {
            super(FormTag.F1040, 0, true);
            this.due = due;
        }

        @Override
        public double balanceDue() {
            return due;
        }
    }

    // Lowest index of all, so only the append rule can put it last
    private static final Function<FormNode, FormNode> VOUCHER =
            root -> new Stub(FormTag.F1040V, -1, true);

    @Test
    public void testSortedBySequenceIndexStable() {
        Stub d = new Stub(FormTag.SCHEDULE_D, 12, true);
        Stub a = new Stub(FormTag.SCHEDULE_A, 7, true);
        Stub b = new Stub(FormTag.SCHEDULE_B, 7, true);
        Stub s1 = new Stub(FormTag.SCHEDULE_1, 1, true);

        FilingSet set = FilingSetAssembler.assemble(new RootStub(0), List.of(d, a, b, s1), VOUCHER);
        assertEquals(List.of(FormTag.F1040, FormTag.SCHEDULE_1, FormTag.SCHEDULE_A, FormTag.SCHEDULE_B,
                FormTag.SCHEDULE_D), set.tags());

        // equal indices keep input order
        FilingSet swapped = FilingSetAssembler.assemble(new RootStub(0), List.of(b, a), VOUCHER);
        assertEquals(List.of(FormTag.F1040, FormTag.SCHEDULE_B, FormTag.SCHEDULE_A), swapped.tags());
    }

    @Test
    public void testUnneededFormsAndTheirCopiesDropped() {
        Stub copy = new Stub(FormTag.SCHEDULE_C, 9, 1, true, List.of());
        Stub c = new Stub(FormTag.SCHEDULE_C, 9, 0, false, List.of(copy));
        FilingSet set = FilingSetAssembler.assemble(new RootStub(0), List.of(c), VOUCHER);
        assertEquals(1, set.size());
        assertFalse(set.contains(FormTag.SCHEDULE_C));
    }

    @Test
    public void testCopiesFollowPrimary() {
        Stub copy1 = new Stub(FormTag.SCHEDULE_C, 9, 1, true, List.of());
        Stub copy2 = new Stub(FormTag.SCHEDULE_C, 9, 2, true, List.of());
        Stub c = new Stub(FormTag.SCHEDULE_C, 9, 0, true, List.of(copy1, copy2));
        Stub se = new Stub(FormTag.SCHEDULE_SE, 17, true);
        FilingSet set = FilingSetAssembler.assemble(new RootStub(0), List.of(se, c), VOUCHER);
        assertEquals(List.of("f1040", "f1040sc", "f1040sc#1", "f1040sc#2", "f1040sse"), set.formIds());
        assertEquals(3, set.count(FormTag.SCHEDULE_C));
    }

    @Test
    public void testTrailerOnlyWithBalanceDue() {
        assertFalse(FilingSetAssembler.assemble(new RootStub(0), List.of(), VOUCHER).hasTrailer());
        assertFalse(FilingSetAssembler.assemble(new RootStub(-5), List.of(), VOUCHER).hasTrailer());
        assertFalse(FilingSetAssembler.assemble(new RootStub(10), List.of(), null).hasTrailer());

        Stub s1 = new Stub(FormTag.SCHEDULE_1, 1, true);
        FilingSet set = FilingSetAssembler.assemble(new RootStub(0.01), List.of(s1), VOUCHER);
        assertTrue(set.hasTrailer());
        assertEquals(FormTag.F1040V, set.forms().get(set.size() - 1).tag());
        assertSame(set.trailer(), set.forms().get(2));
    }

    @Test
    public void testTrailerAppendedAfterSorting() {
        Stub d = new Stub(FormTag.SCHEDULE_D, 12, true);
        Stub a = new Stub(FormTag.SCHEDULE_A, 7, true);
        FilingSet set = FilingSetAssembler.assemble(new RootStub(250), List.of(d, a), VOUCHER);
        assertEquals(List.of(FormTag.F1040, FormTag.SCHEDULE_A, FormTag.SCHEDULE_D, FormTag.F1040V), set.tags());
        assertEquals(-1, set.trailer().sequenceIndex());
    }

    @Test
    public void testRootAlwaysFirst() {
        Stub early = new Stub(FormTag.SCHEDULE_1, -1, true);
        FilingSet set = FilingSetAssembler.assemble(new RootStub(0), List.of(early), VOUCHER);
        assertEquals(FormTag.F1040, set.root().tag());
    }
}
